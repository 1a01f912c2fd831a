package io.github.yok.flexpanel.core;

import static io.github.yok.flexpanel.core.PanelColumns.NNINDCD;
import static io.github.yok.flexpanel.core.PanelColumns.STKCD;
import static io.github.yok.flexpanel.core.PanelColumns.TRDMNT;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.Columns;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;

/**
 * Shape and coverage figures of a merged monthly panel: size, column names, month range and the
 * number of distinct securities and industries.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PanelSummary {

    private final int rowCount;

    private final List<String> columnNames;

    // null when the panel is empty or has no dated rows
    private final YearMonth firstMonth;

    private final YearMonth lastMonth;

    private final int securityCount;

    private final int industryCount;

    /**
     * Computes the summary of a panel.
     *
     * @param panel merged panel
     * @return the summary
     * @throws DataSetException if the panel cannot be read
     */
    public static PanelSummary of(ITable panel) throws DataSetException {
        Column[] columns = panel.getTableMetaData().getColumns();
        List<String> names = new ArrayList<>(columns.length);
        for (Column column : columns) {
            names.add(column.getColumnName());
        }
        boolean hasIndustry = Columns.getColumn(NNINDCD, columns) != null;

        YearMonth first = null;
        YearMonth last = null;
        Set<String> securities = new HashSet<>();
        Set<String> industries = new HashSet<>();
        for (int row = 0; row < panel.getRowCount(); row++) {
            String id = KeyValues.identifier(panel.getValue(row, STKCD));
            if (id != null) {
                securities.add(id);
            }
            YearMonth month = KeyValues.month(PanelBuilder.PANEL_TABLE_NAME, TRDMNT,
                    panel.getValue(row, TRDMNT));
            if (month != null) {
                first = first == null || month.isBefore(first) ? month : first;
                last = last == null || month.isAfter(last) ? month : last;
            }
            if (hasIndustry) {
                String code = KeyValues.identifier(panel.getValue(row, NNINDCD));
                if (code != null) {
                    industries.add(code);
                }
            }
        }
        return new PanelSummary(panel.getRowCount(), Collections.unmodifiableList(names), first,
                last, securities.size(), industries.size());
    }

    /**
     * Returns the number of columns.
     *
     * @return column count
     */
    public int getColumnCount() {
        return columnNames.size();
    }
}
