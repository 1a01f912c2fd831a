package io.github.yok.flexpanel.parser;

import java.io.File;
import java.io.IOException;
import java.nio.charset.Charset;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;

/**
 * Interface for parsing one raw dataset file into a typed DBUnit {@link ITable}.
 *
 * @author Yasuharu.Okawauchi
 */
public interface DataParser {

    /**
     * Parses the specified file according to the given schema.
     *
     * @param file dataset file
     * @param charset file encoding
     * @param schema column type contract
     * @return the parsed table
     * @throws IOException if the file cannot be read
     * @throws DataSetException if a row violates the column type contract
     */
    ITable parse(File file, Charset charset, TableSchema schema)
            throws IOException, DataSetException;
}
