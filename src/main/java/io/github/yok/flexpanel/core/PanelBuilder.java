package io.github.yok.flexpanel.core;

import static io.github.yok.flexpanel.core.PanelColumns.LISTDT;
import static io.github.yok.flexpanel.core.PanelColumns.MARKETTYPE;
import static io.github.yok.flexpanel.core.PanelColumns.MSMVOSD;
import static io.github.yok.flexpanel.core.PanelColumns.NNINDCD;
import static io.github.yok.flexpanel.core.PanelColumns.NNINDNME;
import static io.github.yok.flexpanel.core.PanelColumns.STKCD;
import static io.github.yok.flexpanel.core.PanelColumns.TOVEROSM;
import static io.github.yok.flexpanel.core.PanelColumns.TRDDT;
import static io.github.yok.flexpanel.core.PanelColumns.TRDMNT;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.Columns;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.DefaultTable;
import org.dbunit.dataset.DefaultTableMetaData;
import org.dbunit.dataset.ITable;
import org.dbunit.dataset.ITableMetaData;

/**
 * Builds the merged monthly panel from the raw dataset tables.
 *
 * <p>
 * <strong>Steps:</strong>
 * </p>
 * <ol>
 * <li>Left join {@code monthly_trade} with {@code turnover} on ({@code Stkcd}, {@code Trdmnt}),
 * adding {@code ToverOsM}.</li>
 * <li>Left join the current industry classification (see {@link LatestIndustryResolver}) on
 * {@code Stkcd}, adding {@code Nnindcd} and {@code Nnindnme}.</li>
 * <li>Left join {@code basic_info} on {@code Stkcd}, adding {@code Markettype} and
 * {@code Listdt}.</li>
 * <li>Stable sort by ({@code Stkcd}, {@code Trdmnt}) ascending, {@code null} last.</li>
 * <li>Multiply {@code Msmvosd} by 1000 (thousands → base currency units) on the final table.</li>
 * </ol>
 *
 * <p>
 * Every join is a left join anchored on {@code monthly_trade}, so the panel has exactly one row
 * per monthly trade row. Right-hand tables must be unique on their join key; a duplicate raises
 * {@link DuplicateKeyException} rather than fanning out rows. The input tables are never modified
 * and nothing is returned unless every step succeeds.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class PanelBuilder {

    /** Table name of the merged panel. */
    public static final String PANEL_TABLE_NAME = "monthly_panel";

    /** Factor from thousands to base currency units. */
    static final BigDecimal MARKET_VALUE_SCALE = BigDecimal.valueOf(1000);

    // Suffix appended to a right-hand column whose name is already taken
    static final String COLLISION_SUFFIX = "_y";

    private final LatestIndustryResolver industryResolver;

    /**
     * Creates a builder.
     */
    public PanelBuilder() {
        this(new LatestIndustryResolver());
    }

    PanelBuilder(LatestIndustryResolver industryResolver) {
        this.industryResolver = industryResolver;
    }

    /**
     * Builds the merged monthly panel.
     *
     * @param tables dataset key → table; needs {@code monthly_trade}, {@code turnover},
     *        {@code industry} and {@code basic_info}; {@code daily_trade} is optional and only
     *        checked for its key columns
     * @return the panel, one row per monthly trade row, sorted by ({@code Stkcd}, {@code Trdmnt})
     * @throws MissingKeyColumnException if a join key column is absent
     * @throws SchemaException if a dataset or a projected column is absent, or a market value is
     *         not numeric
     * @throws DuplicateKeyException if turnover or basic info repeats a join key
     * @throws DataSetException if a table cannot be read
     */
    public ITable buildMonthlyPanel(Map<String, ITable> tables) throws DataSetException {
        ITable monthly = requireTable(tables, Dataset.MONTHLY_TRADE);
        ITable turnover = requireTable(tables, Dataset.TURNOVER);
        ITable industry = requireTable(tables, Dataset.INDUSTRY);
        ITable basic = requireTable(tables, Dataset.BASIC_INFO);

        requireKeyColumns(Dataset.MONTHLY_TRADE, monthly, STKCD, TRDMNT);
        requireKeyColumns(Dataset.TURNOVER, turnover, STKCD, TRDMNT);
        requireKeyColumns(Dataset.INDUSTRY, industry, STKCD);
        requireKeyColumns(Dataset.BASIC_INFO, basic, STKCD);
        ITable daily = tables.get(Dataset.DAILY_TRADE.getKey());
        if (daily != null) {
            // not joined; key columns only
            requireKeyColumns(Dataset.DAILY_TRADE, daily, STKCD, TRDDT);
        }
        requireColumns(Dataset.MONTHLY_TRADE, monthly, MSMVOSD);
        Column turnoverCol = requireColumns(Dataset.TURNOVER, turnover, TOVEROSM)[0];
        Column[] industryCols =
                requireColumns(Dataset.INDUSTRY, industry, NNINDCD, NNINDNME, LISTDT);
        Column[] basicCols = requireColumns(Dataset.BASIC_INFO, basic, MARKETTYPE, LISTDT);

        log.info("Creating merged monthly panel from {} monthly trade rows", monthly.getRowCount());

        // Step 1: turnover
        Map<List<Object>, Integer> turnoverIndex =
                uniqueIndex(Dataset.TURNOVER, turnover, row -> Arrays.asList(
                        KeyValues.identifier(turnover.getValue(row, STKCD)),
                        month(Dataset.TURNOVER, turnover.getValue(row, TRDMNT))));

        // Step 2: current industry
        Map<String, Integer> industryIndex = industryResolver.resolve(industry);

        // Step 3: basic info
        Map<List<Object>, Integer> basicIndex = uniqueIndex(Dataset.BASIC_INFO, basic,
                row -> Arrays.asList(KeyValues.identifier(basic.getValue(row, STKCD))));

        Column[] monthlyCols = monthly.getTableMetaData().getColumns();
        List<Column> panelCols = new ArrayList<>(Arrays.asList(monthlyCols));
        appendColumn(panelCols, turnoverCol);
        appendColumn(panelCols, industryCols[0]);
        appendColumn(panelCols, industryCols[1]);
        appendColumn(panelCols, basicCols[0]);
        appendColumn(panelCols, basicCols[1]);

        List<PanelRow> rows = new ArrayList<>(monthly.getRowCount());
        int turnoverHits = 0;
        int industryHits = 0;
        int basicHits = 0;
        for (int r = 0; r < monthly.getRowCount(); r++) {
            String id = KeyValues.identifier(monthly.getValue(r, STKCD));
            YearMonth month = month(Dataset.MONTHLY_TRADE, monthly.getValue(r, TRDMNT));

            Object[] values = new Object[panelCols.size()];
            int c = 0;
            for (Column col : monthlyCols) {
                values[c++] = monthly.getValue(r, col.getColumnName());
            }

            Integer t = id == null ? null : turnoverIndex.get(Arrays.asList(id, month));
            values[c++] = t == null ? null : turnover.getValue(t, TOVEROSM);
            turnoverHits += t == null ? 0 : 1;

            Integer i = id == null ? null : industryIndex.get(id);
            values[c++] = i == null ? null : industry.getValue(i, NNINDCD);
            values[c++] = i == null ? null : industry.getValue(i, NNINDNME);
            industryHits += i == null ? 0 : 1;

            Integer b = id == null ? null : basicIndex.get(Arrays.asList((Object) id));
            values[c++] = b == null ? null : basic.getValue(b, MARKETTYPE);
            values[c] = b == null ? null : basic.getValue(b, LISTDT);
            basicHits += b == null ? 0 : 1;

            rows.add(new PanelRow(id, month, values));
        }
        log.info("Matched rows: turnover={}, industry={}, basic_info={}", turnoverHits,
                industryHits, basicHits);

        // Step 4: stable sort
        rows.sort(Comparator.comparing(PanelRow::getId, KeyValues.IDENTIFIER_ORDER)
                .thenComparing(PanelRow::getMonth, KeyValues.MONTH_ORDER));

        DefaultTable panel = new DefaultTable(new DefaultTableMetaData(PANEL_TABLE_NAME,
                panelCols.toArray(new Column[0])));
        for (PanelRow row : rows) {
            panel.addRow(row.getValues());
        }

        // Step 5: thousands → base currency, once, on the final table
        rescaleMarketValue(panel);

        log.info("Merged monthly panel created: {} rows x {} columns", panel.getRowCount(),
                panelCols.size());
        return panel;
    }

    /**
     * Multiplies every non-null {@code Msmvosd} value of the panel by {@link #MARKET_VALUE_SCALE}.
     *
     * @param panel the freshly built panel (not yet visible to callers)
     * @throws SchemaException if a value is not numeric
     * @throws DataSetException if the table cannot be read or written
     */
    void rescaleMarketValue(DefaultTable panel) throws DataSetException {
        for (int r = 0; r < panel.getRowCount(); r++) {
            Object value = panel.getValue(r, MSMVOSD);
            if (value != null) {
                panel.setValue(r, MSMVOSD, toDecimal(value).multiply(MARKET_VALUE_SCALE));
            }
        }
    }

    private static BigDecimal toDecimal(Object value) throws SchemaException {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new SchemaException("Column '" + MSMVOSD + "' of dataset '"
                    + Dataset.MONTHLY_TRADE.getKey() + "' holds a non-numeric value: " + value, e);
        }
    }

    private static YearMonth month(Dataset dataset, Object value) throws SchemaException {
        return KeyValues.month(dataset.getKey(), TRDMNT, value);
    }

    private static ITable requireTable(Map<String, ITable> tables, Dataset dataset)
            throws SchemaException {
        ITable table = tables == null ? null : tables.get(dataset.getKey());
        if (table == null) {
            throw new SchemaException("Dataset '" + dataset.getKey() + "' was not supplied");
        }
        return table;
    }

    private static void requireKeyColumns(Dataset dataset, ITable table, String... names)
            throws DataSetException {
        Column[] columns = table.getTableMetaData().getColumns();
        for (String name : names) {
            if (Columns.getColumn(name, columns) == null) {
                throw new MissingKeyColumnException(dataset.getKey(), name);
            }
        }
    }

    private static Column[] requireColumns(Dataset dataset, ITable table, String... names)
            throws DataSetException {
        ITableMetaData metaData = table.getTableMetaData();
        Column[] found = new Column[names.length];
        for (int i = 0; i < names.length; i++) {
            found[i] = Columns.getColumn(names[i], metaData.getColumns());
            if (found[i] == null) {
                throw new SchemaException("Column '" + names[i] + "' is missing from dataset '"
                        + dataset.getKey() + "'");
            }
        }
        return found;
    }

    // Adds a right-hand column, renaming it with COLLISION_SUFFIX while the name is taken.
    private static void appendColumn(List<Column> columns, Column column) {
        String name = column.getColumnName();
        Column[] current = columns.toArray(new Column[0]);
        while (Columns.getColumn(name, current) != null) {
            name = name + COLLISION_SUFFIX;
        }
        columns.add(name.equals(column.getColumnName()) ? column
                : new Column(name, column.getDataType()));
    }

    /**
     * Indexes a right-hand table by key, refusing duplicates. Rows whose key contains
     * {@code null} cannot match and are left out.
     */
    private static Map<List<Object>, Integer> uniqueIndex(Dataset dataset, ITable table,
            RowKey rowKey) throws DataSetException {
        Map<List<Object>, Integer> index = new HashMap<>();
        for (int row = 0; row < table.getRowCount(); row++) {
            List<Object> key = rowKey.of(row);
            if (key.contains(null)) {
                continue;
            }
            Integer previous = index.putIfAbsent(key, row);
            if (previous != null) {
                throw new DuplicateKeyException(dataset.getKey(), key, previous, row);
            }
        }
        return index;
    }

    @FunctionalInterface
    private interface RowKey {
        List<Object> of(int row) throws DataSetException;
    }

    @Value
    private static class PanelRow {
        String id;
        YearMonth month;
        Object[] values;
    }
}
