package com.ns.trend.dialect;

import com.ns.trend.exception.UnsupportedGranularityException;
import com.ns.trend.model.Granularity;
import io.trino.sql.tree.Expression;

import static com.ns.trend.dialect.SqlFunctions.call;
import static com.ns.trend.dialect.SqlFunctions.checkArguments;
import static com.ns.trend.dialect.SqlFunctions.literal;

/**
 * PostgreSQL: {@code TO_CHAR(col, pattern)}.
 */
public final class PostgresDialect implements SqlDialect {

    public static final PostgresDialect INSTANCE = new PostgresDialect();

    private static final String TO_CHAR = "to_char";

    private PostgresDialect() {
        // Singleton
    }

    @Override
    public String name() {
        return "PostgreSQL";
    }

    @Override
    public Expression formatTruncation(Expression dateField, Granularity granularity) {
        checkArguments(dateField, granularity);
        return call(TO_CHAR, dateField, literal(pattern(granularity)));
    }

    static String pattern(Granularity granularity) {
        switch (granularity) {
            case MINUTE: return "YYYY-MM-DD HH24:MI:00";
            case HOUR: return "YYYY-MM-DD HH24:00";
            case DAY: return "YYYY-MM-DD";
            // IYYY, not YYYY: the ISO year differs from the calendar year around New Year
            case WEEK: return "IYYY-IW";
            case MONTH: return "YYYY-MM";
            case YEAR: return "YYYY";
            default:
                throw new UnsupportedGranularityException(granularity.getUnitName());
        }
    }
}
