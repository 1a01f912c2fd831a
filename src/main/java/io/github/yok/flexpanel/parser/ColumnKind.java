package io.github.yok.flexpanel.parser;

import java.util.Arrays;
import java.util.Locale;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.dbunit.dataset.datatype.DataType;

/**
 * Enumeration of the column kinds a dataset column can be declared with.
 *
 * <p>
 * Each kind is mapped to the DBUnit {@link DataType} recorded in the table metadata. The Java type
 * of the cell values is fixed per kind:
 * </p>
 * <ul>
 * <li>{@link #STRING} → {@link String}, kept verbatim (leading zeros survive)</li>
 * <li>{@link #INTEGER} → {@link Long}</li>
 * <li>{@link #NUMERIC} → {@link java.math.BigDecimal}</li>
 * <li>{@link #DATE} → {@link java.time.LocalDate}</li>
 * <li>{@link #YEAR_MONTH} → {@link java.time.LocalDate} on the first day of the month</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum ColumnKind {

    // Raw token, never coerced.
    STRING(DataType.VARCHAR),

    // Whole number.
    INTEGER(DataType.BIGINT),

    // Decimal number.
    NUMERIC(DataType.NUMERIC),

    // Full calendar date.
    DATE(DataType.DATE),

    // Calendar month, normalized to the first day.
    YEAR_MONTH(DataType.DATE);

    private final DataType dataType;

    /**
     * Resolves a kind from its configuration name (case-insensitive, {@code -} and {@code _} are
     * interchangeable).
     *
     * @param name configuration value such as {@code numeric} or {@code year-month}
     * @return the matching kind
     * @throws IllegalArgumentException if {@code name} does not name a kind
     */
    public static ColumnKind fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Column kind must not be null");
        }
        String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(k -> k.name().equals(normalized)).findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown column kind: " + name
                        + " (expected one of " + Arrays.toString(values()) + ")"));
    }
}
