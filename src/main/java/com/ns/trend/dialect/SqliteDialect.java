package com.ns.trend.dialect;

import com.ns.trend.exception.UnsupportedGranularityException;
import com.ns.trend.model.Granularity;
import io.trino.sql.tree.Expression;

import static com.ns.trend.dialect.SqlFunctions.call;
import static com.ns.trend.dialect.SqlFunctions.checkArguments;
import static com.ns.trend.dialect.SqlFunctions.literal;

/**
 * SQLite: {@code strftime(pattern, col)}, pattern first.
 * The ISO week tokens {@code %G} and {@code %V} need SQLite 3.46 or later.
 */
public final class SqliteDialect implements SqlDialect {

    public static final SqliteDialect INSTANCE = new SqliteDialect();

    private static final String STRFTIME = "strftime";

    private SqliteDialect() {
        // Singleton
    }

    @Override
    public String name() {
        return "SQLite";
    }

    @Override
    public Expression formatTruncation(Expression dateField, Granularity granularity) {
        checkArguments(dateField, granularity);
        return call(STRFTIME, literal(pattern(granularity)), dateField);
    }

    static String pattern(Granularity granularity) {
        switch (granularity) {
            case MINUTE: return "%Y-%m-%d %H:%M:00";
            case HOUR: return "%Y-%m-%d %H:00";
            case DAY: return "%Y-%m-%d";
            case WEEK: return "%G-%V";
            case MONTH: return "%Y-%m";
            case YEAR: return "%Y";
            default:
                throw new UnsupportedGranularityException(granularity.getUnitName());
        }
    }
}
