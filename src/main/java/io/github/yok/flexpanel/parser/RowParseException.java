package io.github.yok.flexpanel.parser;

import lombok.Getter;
import org.dbunit.dataset.DataSetException;

/**
 * Thrown when a data row of a raw dataset file cannot be decoded per its column type contract.
 *
 * <p>
 * Covers rows whose field count differs from the header and tokens that do not parse as the
 * declared {@link ColumnKind}. The location is kept for diagnostics.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class RowParseException extends DataSetException {

    private static final long serialVersionUID = 1L;

    // Dataset name, e.g. monthly_trade
    private final String dataset;

    // One-based physical line number in the file
    private final int lineNumber;

    // Offending column, or null for field-count mismatches
    private final String column;

    // Offending token, or null for field-count mismatches
    private final String token;

    /**
     * Creates an exception for a row whose field count does not match the header.
     *
     * @param dataset dataset name
     * @param lineNumber one-based line number
     * @param expected number of header columns
     * @param actual number of fields found
     */
    public RowParseException(String dataset, int lineNumber, int expected, int actual) {
        super(String.format("[%s] line %d: expected %d fields, found %d", dataset, lineNumber,
                expected, actual));
        this.dataset = dataset;
        this.lineNumber = lineNumber;
        this.column = null;
        this.token = null;
    }

    /**
     * Creates an exception for a token that does not parse as its column kind.
     *
     * @param dataset dataset name
     * @param lineNumber one-based line number
     * @param column column name
     * @param kind declared column kind
     * @param token offending token
     * @param cause underlying parse failure
     */
    public RowParseException(String dataset, int lineNumber, String column, ColumnKind kind,
            String token, Throwable cause) {
        super(String.format("[%s] line %d: column %s expects %s but was '%s'", dataset,
                lineNumber, column, kind, token), cause);
        this.dataset = dataset;
        this.lineNumber = lineNumber;
        this.column = column;
        this.token = token;
    }
}
