/**
 * TOON serializer package.
 */
package io.github.yok.toonlink.serializer;
