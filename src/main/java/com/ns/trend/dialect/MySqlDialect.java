package com.ns.trend.dialect;

import com.ns.trend.exception.UnsupportedGranularityException;
import com.ns.trend.model.Granularity;
import io.trino.sql.tree.Expression;

import static com.ns.trend.dialect.SqlFunctions.call;
import static com.ns.trend.dialect.SqlFunctions.checkArguments;
import static com.ns.trend.dialect.SqlFunctions.literal;

/**
 * MySQL / MariaDB: {@code DATE_FORMAT(col, pattern)}.
 * Weeks use {@code %x-%v}, the ISO week-based year and Monday-start ISO week.
 */
public final class MySqlDialect implements SqlDialect {

    public static final MySqlDialect INSTANCE = new MySqlDialect();

    private static final String DATE_FORMAT = "date_format";

    private MySqlDialect() {
        // Singleton
    }

    @Override
    public String name() {
        return "MySQL";
    }

    @Override
    public Expression formatTruncation(Expression dateField, Granularity granularity) {
        checkArguments(dateField, granularity);
        return call(DATE_FORMAT, dateField, literal(pattern(granularity)));
    }

    static String pattern(Granularity granularity) {
        switch (granularity) {
            case MINUTE: return "%Y-%m-%d %H:%i:00";
            case HOUR: return "%Y-%m-%d %H:00";
            case DAY: return "%Y-%m-%d";
            case WEEK: return "%x-%v";
            case MONTH: return "%Y-%m";
            case YEAR: return "%Y";
            default:
                throw new UnsupportedGranularityException(granularity.getUnitName());
        }
    }
}
