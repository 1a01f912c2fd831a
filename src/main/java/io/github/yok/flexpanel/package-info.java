/**
 * FlexPanel: builds a monthly security panel from whitespace-delimited market data files.
 *
 * <p>
 * {@link io.github.yok.flexpanel.Main} is the batch entry point; the reading and merging logic
 * lives in {@code io.github.yok.flexpanel.core}.
 * </p>
 */
package io.github.yok.flexpanel;
