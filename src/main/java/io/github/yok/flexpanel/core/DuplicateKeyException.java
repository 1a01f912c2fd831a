package io.github.yok.flexpanel.core;

import java.util.List;
import lombok.Getter;
import org.dbunit.dataset.DataSetException;

/**
 * Thrown when the right-hand table of a left join has more than one row for the same key.
 *
 * <p>
 * Joining such a table would fan out the anchor rows, so the build is refused instead.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class DuplicateKeyException extends DataSetException {

    private static final long serialVersionUID = 1L;

    private final String dataset;

    private final List<Object> key;

    /**
     * Creates an exception for a duplicated key.
     *
     * @param dataset dataset key
     * @param key duplicated key values
     * @param firstRow row index of the first occurrence
     * @param secondRow row index of the duplicate
     */
    public DuplicateKeyException(String dataset, List<Object> key, int firstRow, int secondRow) {
        super(String.format("Duplicate key %s in dataset '%s' (rows %d and %d)", key, dataset,
                firstRow, secondRow));
        this.dataset = dataset;
        this.key = key;
    }
}
