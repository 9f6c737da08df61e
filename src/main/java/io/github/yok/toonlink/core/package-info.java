/**
 * Conversion workflows between TOON and CSV files, and TOON file inspection.
 */
package io.github.yok.toonlink.core;
