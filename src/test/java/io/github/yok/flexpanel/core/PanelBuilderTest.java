package io.github.yok.flexpanel.core;

import static io.github.yok.flexpanel.core.TestTables.cols;
import static io.github.yok.flexpanel.core.TestTables.row;
import static io.github.yok.flexpanel.core.TestTables.table;
import static io.github.yok.flexpanel.core.TestTables.tables;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.DefaultTable;
import org.dbunit.dataset.ITable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PanelBuilderTest {

    private PanelBuilder builder;

    private DefaultTable basic;
    private DefaultTable industry;
    private DefaultTable monthly;
    private DefaultTable turnover;

    @BeforeEach
    void setup() throws Exception {
        builder = new PanelBuilder();

        basic = table("basic_info", cols("Stkcd", "Markettype", "Listdt"),
                row("000001", 4L, LocalDate.of(1991, 4, 3)),
                row("600000", 1L, LocalDate.of(1999, 11, 10)));
        industry = table("industry", cols("Stkcd", "Nnindcd", "Nnindnme", "Listdt"),
                row("000001", "J66", "Banking", LocalDate.of(2010, 1, 1)),
                row("000001", "J67", "Finance", LocalDate.of(2020, 1, 1)),
                row("600000", "J66", "Banking", LocalDate.of(2012, 6, 30)));
        monthly = table("monthly_trade", cols("Stkcd", "Trdmnt", "Msmvosd", "Mretwd"),
                row("600000", LocalDate.of(2023, 2, 1), new BigDecimal("21000"),
                        new BigDecimal("0.012")),
                row("000001", LocalDate.of(2023, 2, 1), new BigDecimal("27000.5"),
                        new BigDecimal("0.020")),
                row("000001", LocalDate.of(2023, 1, 1), new BigDecimal("26000"),
                        new BigDecimal("-0.031")),
                row("600000", LocalDate.of(2023, 1, 1), new BigDecimal("20500"), null));
        turnover = table("turnover", cols("Stkcd", "Trdmnt", "ToverOsM"),
                row("000001", LocalDate.of(2023, 1, 1), new BigDecimal("0.95")),
                row("000001", LocalDate.of(2023, 2, 1), new BigDecimal("1.10")),
                row("600000", LocalDate.of(2023, 2, 1), new BigDecimal("0.40")));
    }

    private ITable build() throws DataSetException {
        return builder.buildMonthlyPanel(tables(basic, industry, monthly, turnover));
    }

    private static List<String> columnNames(ITable table) throws DataSetException {
        List<String> names = new ArrayList<>();
        for (Column column : table.getTableMetaData().getColumns()) {
            names.add(column.getColumnName());
        }
        return names;
    }

    @Test
    void buildMonthlyPanel_正常ケース_基本シナリオ_期待どおりの1行が返ること() throws Exception {
        ITable panel = builder.buildMonthlyPanel(tables(
                table("basic_info", cols("Stkcd", "Markettype", "Listdt"),
                        row("A1", 1L, LocalDate.of(2000, 1, 1))),
                table("industry", cols("Stkcd", "Nnindcd", "Nnindnme", "Listdt"),
                        row("A1", "10", "Old", LocalDate.of(2005, 1, 1)),
                        row("A1", "20", "New", LocalDate.of(2015, 1, 1))),
                table("monthly_trade", cols("Stkcd", "Trdmnt", "Msmvosd"),
                        row("A1", LocalDate.of(2021, 3, 1), new BigDecimal("500"))),
                table("turnover", cols("Stkcd", "Trdmnt", "ToverOsM"),
                        row("A1", LocalDate.of(2021, 3, 1), new BigDecimal("0.05")))));

        assertEquals(1, panel.getRowCount());
        assertEquals("A1", panel.getValue(0, "Stkcd"));
        assertEquals(LocalDate.of(2021, 3, 1), panel.getValue(0, "Trdmnt"));
        assertEquals(new BigDecimal("500000"), panel.getValue(0, "Msmvosd"));
        assertEquals(new BigDecimal("0.05"), panel.getValue(0, "ToverOsM"));
        assertEquals("20", panel.getValue(0, "Nnindcd"));
        assertEquals("New", panel.getValue(0, "Nnindnme"));
        assertEquals(1L, panel.getValue(0, "Markettype"));
        assertEquals(LocalDate.of(2000, 1, 1), panel.getValue(0, "Listdt"));
    }

    @Test
    void buildMonthlyPanel_正常ケース_列構成_月次取引列の後に結合列が並ぶこと() throws Exception {
        ITable panel = build();

        assertEquals(List.of("Stkcd", "Trdmnt", "Msmvosd", "Mretwd", "ToverOsM", "Nnindcd",
                "Nnindnme", "Markettype", "Listdt"), columnNames(panel));
        assertEquals(PanelBuilder.PANEL_TABLE_NAME, panel.getTableMetaData().getTableName());
    }

    @Test
    void buildMonthlyPanel_正常ケース_行数_月次取引の行数と一致すること() throws Exception {
        ITable panel = build();
        assertEquals(monthly.getRowCount(), panel.getRowCount());
    }

    @Test
    void buildMonthlyPanel_正常ケース_証券コード_先頭ゼロが保持されること() throws Exception {
        ITable panel = build();
        assertEquals("000001", panel.getValue(0, "Stkcd"));
        assertEquals("000001", panel.getValue(1, "Stkcd"));
    }

    @Test
    void buildMonthlyPanel_正常ケース_並び順_証券コードと年月の昇順になること() throws Exception {
        ITable panel = build();

        assertEquals("000001", panel.getValue(0, "Stkcd"));
        assertEquals(LocalDate.of(2023, 1, 1), panel.getValue(0, "Trdmnt"));
        assertEquals("000001", panel.getValue(1, "Stkcd"));
        assertEquals(LocalDate.of(2023, 2, 1), panel.getValue(1, "Trdmnt"));
        assertEquals("600000", panel.getValue(2, "Stkcd"));
        assertEquals(LocalDate.of(2023, 1, 1), panel.getValue(2, "Trdmnt"));
        assertEquals("600000", panel.getValue(3, "Stkcd"));
        assertEquals(LocalDate.of(2023, 2, 1), panel.getValue(3, "Trdmnt"));
    }

    @Test
    void buildMonthlyPanel_正常ケース_同一キー行_入力順が保持されること() throws Exception {
        monthly = table("monthly_trade", cols("Stkcd", "Trdmnt", "Msmvosd", "Seq"),
                row("B", LocalDate.of(2023, 1, 1), BigDecimal.ONE, "first"),
                row("A", LocalDate.of(2023, 1, 1), BigDecimal.ONE, "a"),
                row("B", LocalDate.of(2023, 1, 1), BigDecimal.ONE, "second"),
                row("B", LocalDate.of(2023, 1, 1), BigDecimal.ONE, "third"));

        ITable panel = build();

        assertEquals("a", panel.getValue(0, "Seq"));
        assertEquals("first", panel.getValue(1, "Seq"));
        assertEquals("second", panel.getValue(2, "Seq"));
        assertEquals("third", panel.getValue(3, "Seq"));
    }

    @Test
    void buildMonthlyPanel_正常ケース_コードなし行_末尾に残ること() throws Exception {
        monthly = table("monthly_trade", cols("Stkcd", "Trdmnt", "Msmvosd"),
                row(null, LocalDate.of(2023, 1, 1), BigDecimal.TEN),
                row("000001", null, BigDecimal.ONE),
                row("000001", LocalDate.of(2023, 1, 1), BigDecimal.ONE));

        ITable panel = build();

        assertEquals(3, panel.getRowCount());
        assertEquals(LocalDate.of(2023, 1, 1), panel.getValue(0, "Trdmnt"));
        assertNull(panel.getValue(1, "Trdmnt"));
        assertNull(panel.getValue(2, "Stkcd"));
        assertNull(panel.getValue(2, "Nnindcd"));
        assertEquals(new BigDecimal("10000"), panel.getValue(2, "Msmvosd"));
    }

    @Test
    void buildMonthlyPanel_正常ケース_時価総額_全行で1000倍されること() throws Exception {
        ITable panel = build();

        assertEquals(new BigDecimal("26000000"), panel.getValue(0, "Msmvosd"));
        assertEquals(new BigDecimal("27000500.0"), panel.getValue(1, "Msmvosd"));
        assertEquals(new BigDecimal("20500000"), panel.getValue(2, "Msmvosd"));
        assertEquals(new BigDecimal("21000000"), panel.getValue(3, "Msmvosd"));
    }

    @Test
    void buildMonthlyPanel_正常ケース_再実行_入力が変更されず倍率が一度だけ適用されること() throws Exception {
        ITable first = build();
        ITable second = build();

        assertEquals(new BigDecimal("21000"), monthly.getValue(0, "Msmvosd"));
        for (int r = 0; r < first.getRowCount(); r++) {
            assertEquals(first.getValue(r, "Msmvosd"), second.getValue(r, "Msmvosd"));
        }
    }

    @Test
    void buildMonthlyPanel_正常ケース_時価総額の型_数値型や文字列が変換されnullは維持されること()
            throws Exception {
        monthly = table("monthly_trade", cols("Stkcd", "Trdmnt", "Msmvosd"),
                row("000001", LocalDate.of(2023, 1, 1), 1.5d),
                row("000001", LocalDate.of(2023, 2, 1), "2"),
                row("600000", LocalDate.of(2023, 1, 1), null));

        ITable panel = build();

        BigDecimal scaled = (BigDecimal) panel.getValue(0, "Msmvosd");
        assertEquals(0, new BigDecimal("1500").compareTo(scaled));
        assertEquals(new BigDecimal("2000"), panel.getValue(1, "Msmvosd"));
        assertNull(panel.getValue(2, "Msmvosd"));
    }

    @Test
    void buildMonthlyPanel_異常ケース_時価総額が数値でない_SchemaExceptionが送出されること()
            throws Exception {
        monthly = table("monthly_trade", cols("Stkcd", "Trdmnt", "Msmvosd"),
                row("000001", LocalDate.of(2023, 1, 1), "n/a"));

        SchemaException ex = assertThrows(SchemaException.class, this::build);
        assertTrue(ex.getMessage().contains("Msmvosd"));
    }

    @Test
    void buildMonthlyPanel_正常ケース_最新業種_最も新しい業種が全行に付与されること() throws Exception {
        ITable panel = build();

        for (int r = 0; r < 2; r++) {
            assertEquals("000001", panel.getValue(r, "Stkcd"));
            assertEquals("J67", panel.getValue(r, "Nnindcd"));
            assertEquals("Finance", panel.getValue(r, "Nnindnme"));
        }
    }

    @Test
    void buildMonthlyPanel_正常ケース_換手率なし_nullで行が残ること() throws Exception {
        ITable panel = build();

        assertEquals("600000", panel.getValue(2, "Stkcd"));
        assertEquals(LocalDate.of(2023, 1, 1), panel.getValue(2, "Trdmnt"));
        assertNull(panel.getValue(2, "ToverOsM"));
        assertEquals(new BigDecimal("0.40"), panel.getValue(3, "ToverOsM"));
    }

    @Test
    void buildMonthlyPanel_正常ケース_業種と基本情報なし_null列で行が残ること() throws Exception {
        monthly = table("monthly_trade", cols("Stkcd", "Trdmnt", "Msmvosd"),
                row("999999", LocalDate.of(2023, 1, 1), BigDecimal.ONE));

        ITable panel = build();

        assertEquals(1, panel.getRowCount());
        assertNull(panel.getValue(0, "ToverOsM"));
        assertNull(panel.getValue(0, "Nnindcd"));
        assertNull(panel.getValue(0, "Nnindnme"));
        assertNull(panel.getValue(0, "Markettype"));
        assertNull(panel.getValue(0, "Listdt"));
    }

    @Test
    void buildMonthlyPanel_正常ケース_年月の表現差異_同じ月として結合されること() throws Exception {
        turnover = table("turnover", cols("Stkcd", "Trdmnt", "ToverOsM"),
                row("000001", YearMonth.of(2023, 1), new BigDecimal("0.95")),
                row("600000", "2023-01", new BigDecimal("0.30")),
                row("600000", LocalDate.of(2023, 2, 15), new BigDecimal("0.40")));

        ITable panel = build();

        assertEquals(new BigDecimal("0.95"), panel.getValue(0, "ToverOsM"));
        assertNull(panel.getValue(1, "ToverOsM"));
        assertEquals(new BigDecimal("0.30"), panel.getValue(2, "ToverOsM"));
        assertEquals(new BigDecimal("0.40"), panel.getValue(3, "ToverOsM"));
    }

    @Test
    void buildMonthlyPanel_正常ケース_列名の重複_右側列に接尾辞が付くこと() throws Exception {
        monthly = table("monthly_trade", cols("Stkcd", "Trdmnt", "Msmvosd", "Markettype"),
                row("000001", LocalDate.of(2023, 1, 1), BigDecimal.ONE, "own"));

        ITable panel = build();

        assertTrue(columnNames(panel).contains("Markettype_y"));
        assertEquals("own", panel.getValue(0, "Markettype"));
        assertEquals(4L, panel.getValue(0, "Markettype_y"));
    }

    @Test
    void buildMonthlyPanel_異常ケース_換手率キー重複_DuplicateKeyExceptionが送出されること()
            throws Exception {
        turnover.addRow(row("000001", LocalDate.of(2023, 1, 1), new BigDecimal("0.99")));

        DuplicateKeyException ex = assertThrows(DuplicateKeyException.class, this::build);
        assertEquals("turnover", ex.getDataset());
        assertEquals(List.of("000001", YearMonth.of(2023, 1)), ex.getKey());
    }

    @Test
    void buildMonthlyPanel_異常ケース_基本情報キー重複_DuplicateKeyExceptionが送出されること()
            throws Exception {
        basic.addRow(row("600000", 2L, LocalDate.of(2001, 1, 1)));

        DuplicateKeyException ex = assertThrows(DuplicateKeyException.class, this::build);
        assertEquals("basic_info", ex.getDataset());
    }

    @Test
    void buildMonthlyPanel_異常ケース_データセット欠落_SchemaExceptionが送出されること()
            throws Exception {
        Map<String, ITable> map = tables(basic, industry, monthly, turnover);
        map.remove("turnover");

        SchemaException ex =
                assertThrows(SchemaException.class, () -> builder.buildMonthlyPanel(map));
        assertTrue(ex.getMessage().contains("turnover"));
    }

    @Test
    void buildMonthlyPanel_異常ケース_キー列欠落_MissingKeyColumnExceptionが送出されること()
            throws Exception {
        turnover = table("turnover", cols("Code", "Trdmnt", "ToverOsM"));

        MissingKeyColumnException ex =
                assertThrows(MissingKeyColumnException.class, this::build);
        assertEquals("turnover", ex.getDataset());
        assertEquals("Stkcd", ex.getColumn());
    }

    @Test
    void buildMonthlyPanel_異常ケース_年月列欠落_MissingKeyColumnExceptionが送出されること()
            throws Exception {
        monthly = table("monthly_trade", cols("Stkcd", "Msmvosd"));

        MissingKeyColumnException ex =
                assertThrows(MissingKeyColumnException.class, this::build);
        assertEquals("monthly_trade", ex.getDataset());
        assertEquals("Trdmnt", ex.getColumn());
    }

    @Test
    void buildMonthlyPanel_異常ケース_日次取引の日付列欠落_MissingKeyColumnExceptionが送出されること()
            throws Exception {
        Map<String, ITable> map = tables(basic, industry, monthly, turnover);
        map.put("daily_trade", table("daily_trade", cols("Stkcd", "Clsprc")));

        MissingKeyColumnException ex = assertThrows(MissingKeyColumnException.class,
                () -> builder.buildMonthlyPanel(map));
        assertEquals("daily_trade", ex.getDataset());
        assertEquals("Trddt", ex.getColumn());
    }

    @Test
    void buildMonthlyPanel_正常ケース_日次取引あり_結合されずパネルに影響しないこと() throws Exception {
        Map<String, ITable> map = tables(basic, industry, monthly, turnover);
        map.put("daily_trade", table("daily_trade", cols("Stkcd", "Trddt", "Clsprc"),
                row("000001", LocalDate.of(2023, 1, 3), new BigDecimal("13.77"))));

        ITable panel = builder.buildMonthlyPanel(map);

        assertEquals(monthly.getRowCount(), panel.getRowCount());
        assertEquals(columnNames(build()), columnNames(panel));
    }

    @Test
    void buildMonthlyPanel_異常ケース_射影列欠落_SchemaExceptionが送出されること() throws Exception {
        industry = table("industry", cols("Stkcd", "Nnindcd", "Listdt"));

        SchemaException ex = assertThrows(SchemaException.class, this::build);
        assertTrue(!(ex instanceof MissingKeyColumnException));
        assertTrue(ex.getMessage().contains("Nnindnme"));
    }

    @Test
    void buildMonthlyPanel_異常ケース_入力がnull_SchemaExceptionが送出されること() {
        DataSetException ex =
                assertThrows(DataSetException.class, () -> builder.buildMonthlyPanel(null));
        assertInstanceOf(SchemaException.class, ex);
    }
}
