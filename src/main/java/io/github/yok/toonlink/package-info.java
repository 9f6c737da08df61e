/**
 * Root package of ToonLink.
 *
 * <p>
 * Provides a CLI/library to convert tables between TOON, a compact line-based text notation, and
 * CSV or DBUnit data sets.
 * </p>
 *
 * <p>
 * Main responsibilities are separated into the following subpackages:
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.toonlink.model}: documents and typed values</li>
 * <li>{@code io.github.yok.toonlink.parser}: TOON grammar, parsing and value inference</li>
 * <li>{@code io.github.yok.toonlink.serializer}: TOON rendering</li>
 * <li>{@code io.github.yok.toonlink.io}: file and stream access</li>
 * <li>{@code io.github.yok.toonlink.dataset}: DBUnit table binding</li>
 * <li>{@code io.github.yok.toonlink.core}: conversion workflow</li>
 * <li>{@code io.github.yok.toonlink.config}: configuration models</li>
 * </ul>
 */
package io.github.yok.toonlink;
