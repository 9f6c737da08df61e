/**
 * TOON parser package.
 *
 * <p>
 * {@code ToonParser} splits TOON text into an optional table name, a header and data rows;
 * {@code ValueInference} types each field. Lexical constants live in {@code ToonSyntax} and are
 * shared with the serializer.
 * </p>
 *
 * <p>
 * Parsing fails only for an empty input, a missing header, or, under the strict arity policy, a
 * ragged row. Individual fields never fail.
 * </p>
 */
package io.github.yok.toonlink.parser;
