package io.github.yok.flexpanel.config;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that reads the {@code data-path} and {@code output-path} properties from
 * the application root configuration.
 *
 * <p>
 * The {@code data-path} must point to the directory that holds the raw dataset files
 * ({@code basic_info.txt}, {@code monthly_trade.txt}, ...). A relative value is resolved against
 * the working directory of the process.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties
@Data
public class PathsConfig {

    // Directory holding the raw input files
    private String dataPath = "data/raw";

    // Optional CSV destination for the merged panel
    private String outputPath;

    /**
     * Returns the absolute, normalized directory of the raw input files.
     *
     * @return the raw data directory
     * @throws IllegalStateException if {@code dataPath} is blank
     */
    public Path getRawDataDir() {
        if (StringUtils.isBlank(dataPath)) {
            throw new IllegalStateException(
                    "data-path is not configured. Please set 'data-path' in application.yml.");
        }
        return Paths.get(dataPath.trim()).toAbsolutePath().normalize();
    }

    /**
     * Returns the configured CSV output file, if any.
     *
     * @return the output file, or {@code null} when {@code outputPath} is blank
     */
    public File getOutputFile() {
        if (StringUtils.isBlank(outputPath)) {
            return null;
        }
        return new File(outputPath.trim());
    }
}
