package io.github.yok.flexpanel.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.Getter;

/**
 * Column type contract applied while parsing one dataset file.
 *
 * <p>
 * Declared columns are looked up case-insensitively. Columns found in the file header without a
 * declaration are either inferred from their values or kept as {@link ColumnKind#STRING},
 * depending on {@link #isInferTypes()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class TableSchema {

    // Dataset name used as the DBUnit table name
    private final String tableName;

    // Column name → declared kind, in declaration order
    private final Map<String, ColumnKind> declaredColumns;

    // Whether undeclared columns are inferred from their values
    private final boolean inferTypes;

    // Tokens that stand for a missing value
    private final Set<String> nullTokens;

    /**
     * Creates a schema.
     *
     * @param tableName dataset name
     * @param declaredColumns column name → kind
     * @param inferTypes whether undeclared columns are inferred
     * @param nullTokens tokens read as {@code null}
     */
    public TableSchema(String tableName, Map<String, ColumnKind> declaredColumns,
            boolean inferTypes, Set<String> nullTokens) {
        this.tableName = tableName;
        this.declaredColumns = Collections.unmodifiableMap(new LinkedHashMap<>(declaredColumns));
        this.inferTypes = inferTypes;
        this.nullTokens = Collections.unmodifiableSet(new LinkedHashSet<>(nullTokens));
    }

    /**
     * Returns the declared kind of a column.
     *
     * @param columnName header name
     * @return the declared kind, or empty when the column is undeclared
     */
    public Optional<ColumnKind> declaredKind(String columnName) {
        ColumnKind kind = declaredColumns.get(columnName);
        if (kind != null) {
            return Optional.of(kind);
        }
        for (Map.Entry<String, ColumnKind> entry : declaredColumns.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(columnName)) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    /**
     * Returns whether a token stands for a missing value.
     *
     * @param token raw token
     * @return {@code true} if the token is one of the configured null tokens
     */
    public boolean isNullToken(String token) {
        return nullTokens.contains(token);
    }
}
