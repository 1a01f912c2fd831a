/**
 * Data parser package for FlexPanel.
 *
 * <p>
 * Defines the {@code DataParser} abstraction, the whitespace-delimited implementation, the column
 * kinds and the date formats accepted in raw files. Parsers produce DBUnit tables.
 * </p>
 */
package io.github.yok.flexpanel.parser;
