/**
 * TOON file access.
 */
package io.github.yok.toonlink.io;
