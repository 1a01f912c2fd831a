package io.github.yok.flexpanel.core;

import io.github.yok.flexpanel.parser.FlexibleDateParsers;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import lombok.Generated;

/**
 * Normalizes cell values used as join or sort keys.
 *
 * <p>
 * Tables supplied by callers do not have to come from the reader, so identifiers and months are
 * accepted in a few common Java representations and reduced to {@link String} and
 * {@link YearMonth}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
final class KeyValues {

    /** Strings in natural order, {@code null} last. */
    static final Comparator<String> IDENTIFIER_ORDER =
            Comparator.nullsLast(Comparator.naturalOrder());

    /** Months in calendar order, {@code null} last. */
    static final Comparator<YearMonth> MONTH_ORDER =
            Comparator.nullsLast(Comparator.naturalOrder());

    @Generated
    private KeyValues() {}

    /**
     * Returns an identifier as a string. Strings are returned untouched so leading zeros survive.
     *
     * @param value cell value
     * @return identifier string, or {@code null}
     */
    static String identifier(Object value) {
        if (value == null) {
            return null;
        }
        return value instanceof String ? (String) value : value.toString();
    }

    /**
     * Reduces a month or date value to its calendar month.
     *
     * @param dataset dataset key, for error messages
     * @param column column name, for error messages
     * @param value cell value
     * @return the month, or {@code null}
     * @throws SchemaException if the value is not a recognizable month or date
     */
    static YearMonth month(String dataset, String column, Object value) throws SchemaException {
        if (value == null) {
            return null;
        }
        if (value instanceof YearMonth) {
            return (YearMonth) value;
        }
        LocalDate date = date(dataset, column, value);
        return YearMonth.from(date);
    }

    /**
     * Converts a date value to {@link LocalDate}.
     *
     * @param dataset dataset key, for error messages
     * @param column column name, for error messages
     * @param value cell value
     * @return the date, or {@code null}
     * @throws SchemaException if the value is not a recognizable date
     */
    static LocalDate date(String dataset, String column, Object value) throws SchemaException {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toLocalDate();
        }
        if (value instanceof YearMonth) {
            return ((YearMonth) value).atDay(1);
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate();
        }
        if (value instanceof java.sql.Timestamp) {
            return ((java.sql.Timestamp) value).toLocalDateTime().toLocalDate();
        }
        if (value instanceof String) {
            String token = ((String) value).trim();
            try {
                return FlexibleDateParsers.parseDate(token);
            } catch (DateTimeParseException notADate) {
                // fall through to month forms such as 2023-01
            }
            try {
                return FlexibleDateParsers.parseYearMonth(token);
            } catch (DateTimeParseException e) {
                throw new SchemaException("Column '" + column + "' of dataset '" + dataset
                        + "' holds a non-date value: " + value, e);
            }
        }
        throw new SchemaException("Column '" + column + "' of dataset '" + dataset
                + "' holds an unsupported date type: " + value.getClass().getName());
    }
}
