package io.github.yok.flexpanel.config;

import io.github.yok.flexpanel.parser.ColumnKind;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class for the {@code dataset.*} properties that control how the raw files are
 * read.
 *
 * <p>
 * Typical usage is to bind YAML like:
 * </p>
 *
 * <pre>
 * dataset:
 *   charset: UTF-8
 *   parallel-load: false
 *   infer-types: true
 *   null-tokens: [NA, NaN, nan, NULL, "null", None]
 *   file-names:
 *     industry: csrc2012_industry.txt
 *   column-types:
 *     monthly_trade:
 *       Mretwd: NUMERIC
 * </pre>
 *
 * <p>
 * Dataset keys in {@code file-names} and {@code column-types} are matched case-insensitively.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "dataset")
@Data
public class DatasetConfig {

    // Encoding of the raw files
    private String charset = StandardCharsets.UTF_8.name();

    // Parse the files concurrently
    private boolean parallelLoad = false;

    // Infer kinds of undeclared columns from their values
    private boolean inferTypes = true;

    // Tokens read as missing values
    private List<String> nullTokens =
            new ArrayList<>(List.of("NA", "NaN", "nan", "NULL", "null", "None"));

    // Dataset key → file name override
    private Map<String, String> fileNames = new HashMap<>();

    // Dataset key → (column name → kind name) override
    private Map<String, Map<String, String>> columnTypes = new HashMap<>();

    /**
     * Returns the configured charset.
     *
     * @return charset used to read the raw files
     * @throws java.nio.charset.UnsupportedCharsetException if the name is not supported
     */
    public Charset resolveCharset() {
        return StringUtils.isBlank(charset) ? StandardCharsets.UTF_8
                : Charset.forName(charset.trim());
    }

    /**
     * Returns the file name override for a dataset.
     *
     * @param datasetKey dataset key such as {@code turnover}
     * @return the configured file name, or empty if none is configured
     */
    public Optional<String> getFileName(String datasetKey) {
        return Optional.ofNullable(findByKey(fileNames, datasetKey)).filter(StringUtils::isNotBlank)
                .map(String::trim);
    }

    /**
     * Returns the column kind overrides for a dataset.
     *
     * @param datasetKey dataset key
     * @return an unmodifiable map of column name → kind; empty when nothing is configured
     * @throws IllegalArgumentException if a configured kind name is unknown
     */
    public Map<String, ColumnKind> getColumnKinds(String datasetKey) {
        Map<String, String> configured = findByKey(columnTypes, datasetKey);
        if (configured == null) {
            return Collections.emptyMap();
        }
        Map<String, ColumnKind> kinds = new LinkedHashMap<>();
        configured.forEach((column, kind) -> kinds.put(column, ColumnKind.fromName(kind)));
        return Collections.unmodifiableMap(kinds);
    }

    private static <V> V findByKey(Map<String, V> map, String key) {
        V value = map.get(key);
        if (value != null) {
            return value;
        }
        for (Map.Entry<String, V> entry : map.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(key)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
