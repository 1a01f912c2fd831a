package io.github.yok.flexpanel.parser;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.DefaultTable;
import org.dbunit.dataset.DefaultTableMetaData;
import org.dbunit.dataset.ITable;

/**
 * Implementation of {@link DataParser} for text files whose fields are separated by runs of
 * whitespace.
 *
 * <p>
 * The first non-blank line is the header. Blank lines are skipped. Every data row must have
 * exactly as many fields as the header. Tokens are converted according to the declared
 * {@link ColumnKind}; undeclared columns are inferred when the schema allows it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class WhitespaceDataParser implements DataParser {

    private static final char BOM = '\uFEFF';

    /**
     * {@inheritDoc}
     */
    @Override
    public ITable parse(File file, Charset charset, TableSchema schema)
            throws IOException, DataSetException {
        String dataset = schema.getTableName();
        String[] header = null;
        List<String[]> rows = new ArrayList<>();
        List<Integer> lineNumbers = new ArrayList<>();

        try (BufferedReader reader = Files.newBufferedReader(file.toPath(), charset)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (lineNumber == 1 && !line.isEmpty() && line.charAt(0) == BOM) {
                    line = line.substring(1);
                }
                if (StringUtils.isBlank(line)) {
                    continue;
                }
                String[] fields = StringUtils.split(line);
                if (header == null) {
                    header = fields;
                    checkDistinct(dataset, header);
                    continue;
                }
                if (fields.length != header.length) {
                    throw new RowParseException(dataset, lineNumber, header.length,
                            fields.length);
                }
                rows.add(fields);
                lineNumbers.add(lineNumber);
            }
        }
        if (header == null) {
            throw new DataSetException("[" + dataset + "] file has no header line: " + file);
        }

        ColumnKind[] kinds = new ColumnKind[header.length];
        Column[] columns = new Column[header.length];
        for (int c = 0; c < header.length; c++) {
            kinds[c] = resolveKind(schema, header[c], rows, c);
            columns[c] = new Column(header[c], kinds[c].getDataType());
        }
        log.debug("[{}] Column kinds resolved: header={}, kinds={}", dataset, header, kinds);
        warnMissingDeclarations(schema, header);

        DefaultTable table = new DefaultTable(new DefaultTableMetaData(dataset, columns));
        for (int r = 0; r < rows.size(); r++) {
            String[] fields = rows.get(r);
            Object[] values = new Object[fields.length];
            for (int c = 0; c < fields.length; c++) {
                String token = fields[c];
                if (schema.isNullToken(token)) {
                    continue;
                }
                try {
                    values[c] = convert(kinds[c], token);
                } catch (NumberFormatException | DateTimeParseException e) {
                    throw new RowParseException(dataset, lineNumbers.get(r), header[c], kinds[c],
                            token, e);
                }
            }
            table.addRow(values);
        }
        return table;
    }

    /**
     * Converts a non-null token to the Java value of the given kind.
     *
     * @param kind column kind
     * @param token raw token
     * @return converted value
     * @throws NumberFormatException if a numeric token is malformed
     * @throws DateTimeParseException if a temporal token is malformed
     */
    static Object convert(ColumnKind kind, String token) {
        switch (kind) {
            case INTEGER:
                return Long.valueOf(token);
            case NUMERIC:
                return new BigDecimal(token);
            case DATE:
                return FlexibleDateParsers.parseDate(token);
            case YEAR_MONTH:
                return FlexibleDateParsers.parseYearMonth(token);
            case STRING:
            default:
                return token;
        }
    }

    /**
     * Determines the kind of a column: the declared kind if any, otherwise inferred from the
     * values (or {@link ColumnKind#STRING} when inference is disabled).
     */
    private ColumnKind resolveKind(TableSchema schema, String columnName, List<String[]> rows,
            int index) {
        return schema.declaredKind(columnName).orElseGet(() -> schema.isInferTypes()
                ? inferKind(schema, rows, index)
                : ColumnKind.STRING);
    }

    /**
     * Infers {@link ColumnKind#INTEGER}, {@link ColumnKind#NUMERIC} or {@link ColumnKind#STRING}
     * from the non-null tokens of a column. An all-null column is a string column.
     */
    static ColumnKind inferKind(TableSchema schema, List<String[]> rows, int index) {
        boolean seen = false;
        boolean integral = true;
        for (String[] row : rows) {
            String token = row[index];
            if (schema.isNullToken(token)) {
                continue;
            }
            seen = true;
            if (integral) {
                try {
                    Long.parseLong(token);
                    continue;
                } catch (NumberFormatException e) {
                    integral = false;
                }
            }
            try {
                new BigDecimal(token);
            } catch (NumberFormatException e) {
                return ColumnKind.STRING;
            }
        }
        if (!seen) {
            return ColumnKind.STRING;
        }
        return integral ? ColumnKind.INTEGER : ColumnKind.NUMERIC;
    }

    private static void warnMissingDeclarations(TableSchema schema, String[] header) {
        Set<String> present = new HashSet<>();
        for (String name : header) {
            present.add(name.toUpperCase(Locale.ROOT));
        }
        for (String declared : schema.getDeclaredColumns().keySet()) {
            if (!present.contains(declared.toUpperCase(Locale.ROOT))) {
                log.warn("[{}] Declared column {} is not in the file header; skipped",
                        schema.getTableName(), declared);
            }
        }
    }

    private static void checkDistinct(String dataset, String[] header) throws DataSetException {
        Set<String> seen = new HashSet<>();
        for (String name : header) {
            if (!seen.add(name.toUpperCase(Locale.ROOT))) {
                throw new DataSetException(
                        "[" + dataset + "] duplicate column in header: " + name);
            }
        }
    }
}
