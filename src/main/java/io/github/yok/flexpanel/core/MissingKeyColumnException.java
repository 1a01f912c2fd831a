package io.github.yok.flexpanel.core;

import lombok.Getter;

/**
 * Thrown when a join key column ({@code Stkcd} or {@code Trdmnt}) is absent from an input table.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class MissingKeyColumnException extends SchemaException {

    private static final long serialVersionUID = 1L;

    private final String dataset;

    private final String column;

    /**
     * Creates an exception for the given dataset and key column.
     *
     * @param dataset dataset key
     * @param column missing key column
     */
    public MissingKeyColumnException(String dataset, String column) {
        super("Key column '" + column + "' is missing from dataset '" + dataset + "'");
        this.dataset = dataset;
        this.column = column;
    }
}
