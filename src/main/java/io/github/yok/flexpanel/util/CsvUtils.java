package io.github.yok.flexpanel.util;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;
import org.apache.commons.io.FileUtils;

/**
 * CSV helpers for the panel export.
 *
 * <p>
 * Files are UTF-8, minimally quoted, use {@code \} as escape character and the platform line
 * separator.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class CsvUtils {

    private static final DateTimeFormatter YEAR_MONTH = DateTimeFormatter.ofPattern("uuuu-MM");

    private CsvUtils() {
        // Utility class; do not instantiate.
    }

    /**
     * Renders a cell value as CSV text.
     *
     * <ul>
     * <li>{@code null} → empty string</li>
     * <li>{@link BigDecimal} → plain notation (no exponent)</li>
     * <li>{@link LocalDate} → {@code yyyy-MM} when {@code yearMonth} is set, ISO date
     * otherwise</li>
     * <li>anything else → {@link String#valueOf(Object)}</li>
     * </ul>
     *
     * @param value cell value
     * @param yearMonth whether the column holds months normalized to their first day
     * @return CSV text
     */
    public static String toCell(Object value, boolean yearMonth) {
        if (value == null) {
            return "";
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof LocalDate) {
            LocalDate date = (LocalDate) value;
            return yearMonth ? YEAR_MONTH.format(date) : date.toString();
        }
        return String.valueOf(value);
    }

    /**
     * Opens a UTF-8 CSV printer whose header record is already written. Missing parent
     * directories are created and an existing file is overwritten.
     *
     * @param csvFile destination file
     * @param headers header columns
     * @return printer positioned after the header; the caller closes it
     * @throws IOException if the file cannot be created
     */
    public static CSVPrinter openUtf8(File csvFile, String... headers) throws IOException {
        FileUtils.forceMkdirParent(csvFile.getAbsoluteFile());
        CSVFormat fmt = CSVFormat.DEFAULT.builder().setHeader(headers)
                .setQuoteMode(QuoteMode.MINIMAL).setEscape('\\')
                .setRecordSeparator(System.lineSeparator()).get();
        Writer writer = Files.newBufferedWriter(csvFile.toPath(), StandardCharsets.UTF_8);
        try {
            return new CSVPrinter(writer, fmt);
        } catch (IOException | RuntimeException e) {
            writer.close();
            throw e;
        }
    }
}
