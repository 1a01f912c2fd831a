package io.github.yok.flexpanel.core;

import static io.github.yok.flexpanel.core.PanelColumns.LISTDT;
import static io.github.yok.flexpanel.core.PanelColumns.NNINDCD;
import static io.github.yok.flexpanel.core.PanelColumns.STKCD;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;

/**
 * Selects the current industry classification row of every identifier.
 *
 * <p>
 * The current row is the one with the latest effective date ({@code Listdt}). Ties are broken
 * deterministically:
 * </p>
 * <ol>
 * <li>a dated row beats an undated one;</li>
 * <li>on equal dates the higher industry code ({@code Nnindcd}, string order, {@code null} lowest)
 * wins;</li>
 * <li>if date and code are equal, the later row in table order wins.</li>
 * </ol>
 *
 * <p>
 * Rows without an identifier are ignored.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
class LatestIndustryResolver {

    private static final Comparator<LocalDate> DATE_ORDER =
            Comparator.nullsFirst(Comparator.naturalOrder());

    private static final Comparator<String> CODE_ORDER =
            Comparator.nullsFirst(Comparator.naturalOrder());

    /**
     * Resolves the current classification row per identifier.
     *
     * @param industry industry classification table
     * @return map of identifier → row index of its current classification, in first-seen order
     * @throws DataSetException if the table cannot be read or holds non-date effective dates
     */
    Map<String, Integer> resolve(ITable industry) throws DataSetException {
        String dataset = Dataset.INDUSTRY.getKey();
        Map<String, Integer> latestRow = new LinkedHashMap<>();
        Map<String, LocalDate> latestDate = new LinkedHashMap<>();
        Map<String, String> latestCode = new LinkedHashMap<>();

        for (int row = 0; row < industry.getRowCount(); row++) {
            String id = KeyValues.identifier(industry.getValue(row, STKCD));
            if (id == null) {
                continue;
            }
            LocalDate date = KeyValues.date(dataset, LISTDT, industry.getValue(row, LISTDT));
            String code = KeyValues.identifier(industry.getValue(row, NNINDCD));

            if (!latestRow.containsKey(id) || outranks(date, code, latestDate.get(id),
                    latestCode.get(id))) {
                latestRow.put(id, row);
                latestDate.put(id, date);
                latestCode.put(id, code);
            }
        }
        log.debug("Resolved current industry for {} identifiers from {} rows", latestRow.size(),
                industry.getRowCount());
        return latestRow;
    }

    // True if the candidate replaces the current choice; equality replaces (later row wins).
    private static boolean outranks(LocalDate date, String code, LocalDate currentDate,
            String currentCode) {
        int cmp = DATE_ORDER.compare(date, currentDate);
        if (cmp != 0) {
            return cmp > 0;
        }
        return CODE_ORDER.compare(code, currentCode) >= 0;
    }
}
