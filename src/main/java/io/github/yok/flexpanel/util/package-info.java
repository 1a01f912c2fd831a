/**
 * Utility package for FlexPanel.
 *
 * <p>
 * Provides CSV writing helpers, log-path rendering and fatal error reporting.
 * </p>
 */
package io.github.yok.flexpanel.util;
