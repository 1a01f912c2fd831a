package io.github.yok.flexpanel;

import io.github.yok.flexpanel.config.DatasetConfig;
import io.github.yok.flexpanel.config.PathsConfig;
import io.github.yok.flexpanel.core.DataSourceReader;
import io.github.yok.flexpanel.core.PanelBuilder;
import io.github.yok.flexpanel.core.PanelCsvExporter;
import io.github.yok.flexpanel.core.PanelSummary;
import io.github.yok.flexpanel.util.ErrorHandler;
import java.io.File;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Reads the raw datasets with {@link DataSourceReader}, builds the merged monthly panel with
 * {@link PanelBuilder}, logs a {@link PanelSummary} and a short preview, and writes the panel with
 * {@link PanelCsvExporter} when an output file is given.
 * </p>
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --output <file>} or {@code -o <file>} writes the panel as CSV. Overrides
 * {@code output-path} in {@code application.yml}.</li>
 * <li>{@code --preview <n>} or {@code -n <n>} number of panel rows to log (default 5).</li>
 * </ul>
 *
 * <p>
 * Spring Boot binds {@link PathsConfig} and {@link DatasetConfig} from {@code application.yml}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see PathsConfig
 * @see DatasetConfig
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({PathsConfig.class, DatasetConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    static final int DEFAULT_PREVIEW_ROWS = 5;

    private final PathsConfig pathsConfig;
    private final DatasetConfig datasetConfig;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        File output = pathsConfig.getOutputFile();
        int preview = DEFAULT_PREVIEW_ROWS;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--output":
                case "-o":
                    if (i + 1 < args.length) {
                        output = new File(args[++i]);
                    } else {
                        ErrorHandler.errorAndExit("Option " + args[i] + " requires a file path.");
                        return;
                    }
                    break;
                case "--preview":
                case "-n":
                    if (i + 1 < args.length) {
                        String value = args[++i];
                        try {
                            preview = Math.max(0, Integer.parseInt(value));
                        } catch (NumberFormatException e) {
                            log.warn("Invalid preview row count '{}', using {}", value,
                                    DEFAULT_PREVIEW_ROWS);
                        }
                    } else {
                        ErrorHandler.errorAndExit("Option " + args[i] + " requires a row count.");
                        return;
                    }
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        try {
            Map<String, ITable> tables = new DataSourceReader(pathsConfig, datasetConfig).loadAll();
            ITable panel = new PanelBuilder().buildMonthlyPanel(tables);

            PanelSummary summary = PanelSummary.of(panel);
            log.info("Panel: {} rows x {} columns", summary.getRowCount(),
                    summary.getColumnCount());
            log.info("Columns: {}", summary.getColumnNames());
            log.info("Months: {} to {}", summary.getFirstMonth(), summary.getLastMonth());
            log.info("Securities: {}, industries: {}", summary.getSecurityCount(),
                    summary.getIndustryCount());
            logPreview(panel, summary.getColumnNames(), preview);

            if (output != null) {
                new PanelCsvExporter().export(panel, output);
            }
            log.info("Monthly panel build completed.");
        } catch (Exception e) {
            log.error("Fatal error occurred: {}", e.getMessage(), e);
            ErrorHandler.errorAndExit("Monthly panel build failed: " + e.getMessage(), e);
        }
    }

    private static void logPreview(ITable panel, List<String> columns, int rows)
            throws DataSetException {
        int limit = Math.min(rows, panel.getRowCount());
        for (int r = 0; r < limit; r++) {
            StringJoiner line = new StringJoiner(", ", "[", "]");
            for (String column : columns) {
                line.add(column + "=" + panel.getValue(r, column));
            }
            log.info("  row {}: {}", r, line);
        }
    }
}
