/**
 * Data model shared by the parser and the serializer: {@code Document} and the five-kind
 * {@code Value}.
 */
package io.github.yok.toonlink.model;
