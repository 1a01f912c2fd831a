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
import io.github.yok.flexpanel.parser.ColumnKind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * The five raw datasets, each with its mapping key, default file name and declared columns.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum Dataset {

    BASIC_INFO("basic_info", "basic_info.txt",
            columns(STKCD, ColumnKind.STRING, MARKETTYPE, ColumnKind.INTEGER, LISTDT,
                    ColumnKind.DATE)),

    INDUSTRY("industry", "csrc2012_industry.txt",
            columns(STKCD, ColumnKind.STRING, NNINDCD, ColumnKind.STRING, NNINDNME,
                    ColumnKind.STRING, LISTDT, ColumnKind.DATE)),

    DAILY_TRADE("daily_trade", "daily_trade.txt",
            columns(STKCD, ColumnKind.STRING, TRDDT, ColumnKind.DATE)),

    MONTHLY_TRADE("monthly_trade", "monthly_trade.txt",
            columns(STKCD, ColumnKind.STRING, TRDMNT, ColumnKind.YEAR_MONTH, MSMVOSD,
                    ColumnKind.NUMERIC)),

    TURNOVER("turnover", "turnover_monthly.txt",
            columns(STKCD, ColumnKind.STRING, TRDMNT, ColumnKind.YEAR_MONTH, TOVEROSM,
                    ColumnKind.NUMERIC));

    // Key in the dataset mapping
    private final String key;

    // File name under the data directory
    private final String defaultFileName;

    // Column name → declared kind
    private final Map<String, ColumnKind> declaredColumns;

    Dataset(String key, String defaultFileName, Map<String, ColumnKind> declaredColumns) {
        this.key = key;
        this.defaultFileName = defaultFileName;
        this.declaredColumns = Collections.unmodifiableMap(declaredColumns);
    }

    private static Map<String, ColumnKind> columns(Object... nameKindPairs) {
        Map<String, ColumnKind> map = new LinkedHashMap<>();
        for (int i = 0; i < nameKindPairs.length; i += 2) {
            map.put((String) nameKindPairs[i], (ColumnKind) nameKindPairs[i + 1]);
        }
        return map;
    }
}
