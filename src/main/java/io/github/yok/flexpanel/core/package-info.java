/**
 * Core processing package for FlexPanel.
 *
 * <p>
 * Contains the dataset reader, the monthly panel builder with its join and industry resolution
 * rules, the panel summary and the CSV export of the result.
 * </p>
 */
package io.github.yok.flexpanel.core;
