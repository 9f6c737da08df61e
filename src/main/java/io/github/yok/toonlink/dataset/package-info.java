/**
 * DBUnit binding package for ToonLink.
 *
 * <p>
 * Converts documents to and from DBUnit {@code ITable}s and loads TOON or CSV table files from a
 * directory. Parsers are made available through an explicit {@code DataParserRegistry}; format
 * detection and file resolution are handled by {@code DataLoaderFactory} and {@code DataFormat}.
 * </p>
 */
package io.github.yok.toonlink.dataset;
