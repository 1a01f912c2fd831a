package io.github.yok.flexpanel.core;

import io.github.yok.flexpanel.util.CsvUtils;
import io.github.yok.flexpanel.util.LogPathUtil;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVPrinter;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;

/**
 * Writes a panel table to a UTF-8 CSV file.
 *
 * <p>
 * The header row holds the column names in table order. {@code Trdmnt} is written as
 * {@code yyyy-MM}; other dates as ISO dates; decimals in plain notation; {@code null} as an empty
 * cell.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class PanelCsvExporter {

    /**
     * Exports the table, creating parent directories as needed and overwriting an existing file.
     *
     * @param panel table to write
     * @param csvFile destination file
     * @throws IOException on file I/O error
     * @throws DataSetException if the table cannot be read
     */
    public void export(ITable panel, File csvFile) throws IOException, DataSetException {
        Column[] columns = panel.getTableMetaData().getColumns();
        String[] headers = new String[columns.length];
        boolean[] yearMonth = new boolean[columns.length];
        for (int c = 0; c < columns.length; c++) {
            headers[c] = columns[c].getColumnName();
            yearMonth[c] = PanelColumns.TRDMNT.equalsIgnoreCase(headers[c]);
        }

        int rowCount = panel.getRowCount();
        try (CSVPrinter printer = CsvUtils.openUtf8(csvFile, headers)) {
            List<String> cells = new ArrayList<>(columns.length);
            for (int r = 0; r < rowCount; r++) {
                cells.clear();
                for (int c = 0; c < columns.length; c++) {
                    cells.add(CsvUtils.toCell(panel.getValue(r, headers[c]), yearMonth[c]));
                }
                printer.printRecord(cells);
            }
        }
        log.info("Panel written: {} rows -> {}", rowCount, LogPathUtil.render(csvFile.toPath()));
    }
}
