/**
 * Configuration package for FlexPanel.
 *
 * <p>
 * Holds the Spring Boot {@code @ConfigurationProperties} classes bound from
 * {@code application.yml}: the data and output paths, and the dataset reading options.
 * </p>
 */
package io.github.yok.flexpanel.config;
