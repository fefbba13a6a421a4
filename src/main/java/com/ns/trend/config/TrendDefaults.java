package com.ns.trend.config;

/**
 * Builder defaults applied when a trend does not configure them explicitly.
 */
public class TrendDefaults {
    public static final String DEFAULT_GRANULARITY = "day";
    public static final String DEFAULT_DATE_COLUMN = "CreatedAt";

    private String granularity = DEFAULT_GRANULARITY;
    private String dateColumn = DEFAULT_DATE_COLUMN;
    private String dialect; // null = detect from the source's backend name

    public String getGranularity() { return granularity; }
    public void setGranularity(String granularity) { this.granularity = granularity; }
    public String getDateColumn() { return dateColumn; }
    public void setDateColumn(String dateColumn) { this.dateColumn = dateColumn; }
    public String getDialect() { return dialect; }
    public void setDialect(String dialect) { this.dialect = dialect; }

    @Override
    public String toString() {
        return "granularity=" + granularity + ", dateColumn=" + dateColumn + ", dialect=" + (dialect != null ? dialect : "<detect>");
    }
}
