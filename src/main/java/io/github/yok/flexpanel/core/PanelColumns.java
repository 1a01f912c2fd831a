package io.github.yok.flexpanel.core;

import lombok.Generated;

/**
 * Column names shared by the raw datasets and the merged monthly panel.
 *
 * @author Yasuharu.Okawauchi
 */
public final class PanelColumns {

    /** Security identifier (string, zero-padded). */
    public static final String STKCD = "Stkcd";

    /** Trading month of monthly trade and turnover records. */
    public static final String TRDMNT = "Trdmnt";

    /** Trading date of daily trade records. */
    public static final String TRDDT = "Trddt";

    /** Month-end tradable market value, in thousands in the raw file. */
    public static final String MSMVOSD = "Msmvosd";

    /** Monthly turnover ratio of tradable shares. */
    public static final String TOVEROSM = "ToverOsM";

    /** Industry code. */
    public static final String NNINDCD = "Nnindcd";

    /** Industry name. */
    public static final String NNINDNME = "Nnindnme";

    /** Market type code. */
    public static final String MARKETTYPE = "Markettype";

    /** Listing date (basic info) or classification effective date (industry). */
    public static final String LISTDT = "Listdt";

    @Generated
    private PanelColumns() {}
}
