package io.github.yok.flexpanel.parser;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import lombok.Generated;

/**
 * Shared {@link DateTimeFormatter} constants and helpers used to parse the date and year-month
 * columns of the raw dataset files.
 *
 * <p>
 * Formatters are tried in declaration order; the first one that accepts the whole token wins.
 * All of them resolve strictly, so a day or month outside the calendar is an error whatever the
 * separator.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class FlexibleDateParsers {

    /**
     * Date-only formatters tried in order.
     * <ol>
     * <li>{@code yyyy-MM-dd} (ISO)</li>
     * <li>{@code yyyy/MM/dd}</li>
     * <li>{@code yyyyMMdd} (basic ISO)</li>
     * <li>{@code yyyy.MM.dd}</li>
     * </ol>
     */
    public static final DateTimeFormatter[] DATE_ONLY_FORMATTERS =
            {DateTimeFormatter.ISO_LOCAL_DATE, strict("uuuu/MM/dd"),
                    DateTimeFormatter.BASIC_ISO_DATE, strict("uuuu.MM.dd")};

    /**
     * Year-month formatters tried in order.
     * <ol>
     * <li>{@code yyyy-MM}</li>
     * <li>{@code yyyy/MM}</li>
     * <li>{@code yyyyMM}</li>
     * <li>{@code yyyy.MM}</li>
     * </ol>
     */
    public static final DateTimeFormatter[] YEAR_MONTH_FORMATTERS = {strict("uuuu-MM"),
            strict("uuuu/MM"), strict("uuuuMM"), strict("uuuu.MM")};

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private FlexibleDateParsers() {}

    // Calendar-invalid values such as 2023/02/30 are rejected, not adjusted.
    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * Parses a full calendar date.
     *
     * @param token raw token
     * @return the parsed date
     * @throws DateTimeParseException if no formatter accepts the token
     */
    public static LocalDate parseDate(String token) {
        for (DateTimeFormatter formatter : DATE_ONLY_FORMATTERS) {
            try {
                return LocalDate.parse(token, formatter);
            } catch (DateTimeParseException ignored) {
                // next formatter
            }
        }
        throw new DateTimeParseException("Unparseable date: " + token, token, 0);
    }

    /**
     * Parses a year-month and returns the first day of that month.
     *
     * <p>
     * Full dates are accepted as well and truncated to their month.
     * </p>
     *
     * @param token raw token such as {@code 2023-01} or {@code 2023-01-31}
     * @return the first day of the parsed month
     * @throws DateTimeParseException if neither a year-month nor a date formatter accepts the token
     */
    public static LocalDate parseYearMonth(String token) {
        for (DateTimeFormatter formatter : YEAR_MONTH_FORMATTERS) {
            try {
                return YearMonth.parse(token, formatter).atDay(1);
            } catch (DateTimeParseException ignored) {
                // next formatter
            }
        }
        try {
            return parseDate(token).withDayOfMonth(1);
        } catch (DateTimeParseException e) {
            throw new DateTimeParseException("Unparseable year-month: " + token, token, 0, e);
        }
    }
}
