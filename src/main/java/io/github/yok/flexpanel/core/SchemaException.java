package io.github.yok.flexpanel.core;

import org.dbunit.dataset.DataSetException;

/**
 * Thrown when a dataset or a column that the panel build projects is absent from its input.
 *
 * <p>
 * Indicates a contract mismatch between the supplied tables and what {@link PanelBuilder}
 * expects; nothing is built when this is raised.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class SchemaException extends DataSetException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public SchemaException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and a cause.
     *
     * @param message detail message
     * @param cause underlying failure
     */
    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
