package io.github.yok.flexpanel.core;

import io.github.yok.flexpanel.config.DatasetConfig;
import io.github.yok.flexpanel.config.PathsConfig;
import io.github.yok.flexpanel.parser.ColumnKind;
import io.github.yok.flexpanel.parser.DataParser;
import io.github.yok.flexpanel.parser.TableSchema;
import io.github.yok.flexpanel.parser.WhitespaceDataParser;
import io.github.yok.flexpanel.util.LogPathUtil;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;

/**
 * Reads the five raw dataset files of one data directory into typed DBUnit tables.
 *
 * <p>
 * <strong>Contract:</strong>
 * </p>
 * <ul>
 * <li>All five files must exist; otherwise {@link FileNotFoundException} is thrown before any file
 * is parsed.</li>
 * <li>Identifier and industry-code columns stay strings; date columns become
 * {@link java.time.LocalDate}; month columns are normalized to the first day of the month.</li>
 * <li>A row that violates its column types aborts the whole load.</li>
 * <li>The result maps each {@link Dataset#getKey() dataset key} to its table, in
 * {@link Dataset} order.</li>
 * </ul>
 *
 * <p>
 * The reader only keeps its configuration between calls; each {@link #loadAll()} reads the files
 * afresh.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DataSourceReader {

    // Directory holding the raw files
    private final Path dataDir;

    // Reading options
    private final DatasetConfig datasetConfig;

    // Parser for one file
    private final DataParser parser;

    /**
     * Creates a reader for the directory configured in {@code pathsConfig}.
     *
     * @param pathsConfig path settings
     * @param datasetConfig reading options
     */
    public DataSourceReader(PathsConfig pathsConfig, DatasetConfig datasetConfig) {
        this(pathsConfig.getRawDataDir(), datasetConfig, new WhitespaceDataParser());
    }

    /**
     * Creates a reader with an explicit directory and parser.
     *
     * @param dataDir directory holding the raw files
     * @param datasetConfig reading options
     * @param parser file parser
     */
    DataSourceReader(Path dataDir, DatasetConfig datasetConfig, DataParser parser) {
        this.dataDir = dataDir;
        this.datasetConfig = datasetConfig;
        this.parser = parser;
    }

    /**
     * Loads every dataset.
     *
     * @return unmodifiable map of dataset key → table, in {@link Dataset} order
     * @throws FileNotFoundException if any expected file is absent
     * @throws IOException if a file cannot be read
     * @throws DataSetException if a row cannot be decoded per its column types
     */
    public Map<String, ITable> loadAll() throws IOException, DataSetException {
        log.info("Loading datasets from {}", LogPathUtil.render(dataDir));

        Map<Dataset, File> files = resolveFiles();
        Charset charset = datasetConfig.resolveCharset();

        Map<Dataset, ITable> tables = datasetConfig.isParallelLoad()
                ? loadParallel(files, charset)
                : loadSequential(files, charset);

        Map<String, ITable> result = new LinkedHashMap<>();
        for (Dataset dataset : Dataset.values()) {
            ITable table = tables.get(dataset);
            log.info("  {}: {} rows x {} columns", dataset.getKey(), table.getRowCount(),
                    table.getTableMetaData().getColumns().length);
            result.put(dataset.getKey(), table);
        }
        log.info("All datasets loaded.");
        return Collections.unmodifiableMap(result);
    }

    /**
     * Builds the column type contract of one dataset: declared defaults overlaid with configured
     * overrides.
     *
     * @param dataset dataset
     * @return schema for the parser
     */
    TableSchema schemaFor(Dataset dataset) {
        Map<String, ColumnKind> declared = new LinkedHashMap<>(dataset.getDeclaredColumns());
        Map<String, ColumnKind> overrides = datasetConfig.getColumnKinds(dataset.getKey());
        overrides.forEach((column, kind) -> {
            declared.keySet().removeIf(existing -> existing.equalsIgnoreCase(column));
            declared.put(column, kind);
        });
        return new TableSchema(dataset.getKey(), declared, datasetConfig.isInferTypes(),
                new LinkedHashSet<>(datasetConfig.getNullTokens()));
    }

    private Map<Dataset, File> resolveFiles() throws FileNotFoundException {
        Map<Dataset, File> files = new EnumMap<>(Dataset.class);
        List<String> missing = new ArrayList<>();
        for (Dataset dataset : Dataset.values()) {
            String fileName = datasetConfig.getFileName(dataset.getKey())
                    .orElse(dataset.getDefaultFileName());
            File file = dataDir.resolve(fileName).toFile();
            if (!file.isFile()) {
                missing.add(dataset.getKey() + " (" + LogPathUtil.render(file.toPath()) + ")");
            }
            files.put(dataset, file);
        }
        if (!missing.isEmpty()) {
            throw new FileNotFoundException(
                    "Dataset file(s) not found: " + String.join(", ", missing));
        }
        return files;
    }

    private ITable load(Dataset dataset, File file, Charset charset)
            throws IOException, DataSetException {
        log.info("Loading {} from {}", dataset.getKey(), file.getName());
        return parser.parse(file, charset, schemaFor(dataset));
    }

    private Map<Dataset, ITable> loadSequential(Map<Dataset, File> files, Charset charset)
            throws IOException, DataSetException {
        Map<Dataset, ITable> tables = new EnumMap<>(Dataset.class);
        for (Map.Entry<Dataset, File> entry : files.entrySet()) {
            tables.put(entry.getKey(), load(entry.getKey(), entry.getValue(), charset));
        }
        return tables;
    }

    private Map<Dataset, ITable> loadParallel(Map<Dataset, File> files, Charset charset)
            throws IOException, DataSetException {
        ExecutorService executor = Executors.newFixedThreadPool(files.size());
        try {
            Map<Dataset, Future<ITable>> futures = new EnumMap<>(Dataset.class);
            files.forEach((dataset, file) -> futures.put(dataset,
                    executor.submit(() -> load(dataset, file, charset))));

            Map<Dataset, ITable> tables = new EnumMap<>(Dataset.class);
            for (Map.Entry<Dataset, Future<ITable>> entry : futures.entrySet()) {
                tables.put(entry.getKey(), await(entry.getValue()));
            }
            return tables;
        } finally {
            executor.shutdownNow();
        }
    }

    private static ITable await(Future<ITable> future) throws IOException, DataSetException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException ex = new InterruptedIOException("Dataset load interrupted");
            ex.initCause(e);
            throw ex;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            if (cause instanceof DataSetException) {
                throw (DataSetException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new DataSetException("Dataset load failed", cause);
        }
    }
}
