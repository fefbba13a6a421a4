package com.ns.trend.dialect;

import com.ns.trend.exception.UnsupportedGranularityException;
import com.ns.trend.model.Granularity;
import io.trino.sql.tree.ArithmeticBinaryExpression;
import io.trino.sql.tree.Expression;
import io.trino.sql.tree.Identifier;
import io.trino.sql.tree.LongLiteral;

import static com.ns.trend.dialect.SqlFunctions.call;
import static com.ns.trend.dialect.SqlFunctions.checkArguments;
import static com.ns.trend.dialect.SqlFunctions.literal;

/**
 * SQL Server: {@code FORMAT(col, pattern)}.
 *
 * FORMAT has no ISO week token, so weeks are assembled from two parts:
 * <pre>
 * CONCAT(FORMAT(DATEADD(day, 26 - DATEPART(isowk, col), col), 'yyyy'), '-', FORMAT(DATEPART(isowk, col), 'D2'))
 * </pre>
 * Shifting by {@code 26 - isowk} days lands inside the ISO week-based year, so the formatted
 * year is the ISO year rather than the calendar year.
 */
public final class TSqlDialect implements SqlDialect {

    public static final TSqlDialect INSTANCE = new TSqlDialect();

    private static final String FORMAT = "format";
    private static final String DATEPART = "datepart";
    private static final String DATEADD = "dateadd";
    private static final String CONCAT = "concat";
    private static final String ISO_WEEK_PART = "isowk";
    private static final String DAY_PART = "day";
    private static final String YEAR_PATTERN = "yyyy";
    private static final String TWO_DIGITS = "D2";
    private static final String WEEK_SEPARATOR = "-";

    private TSqlDialect() {
        // Singleton
    }

    @Override
    public String name() {
        return "T-SQL";
    }

    @Override
    public Expression formatTruncation(Expression dateField, Granularity granularity) {
        checkArguments(dateField, granularity);
        if (granularity == Granularity.WEEK) {
            return isoWeek(dateField);
        }
        return call(FORMAT, dateField, literal(pattern(granularity)));
    }

    private static Expression isoWeek(Expression dateField) {
        Expression weekNumber = call(DATEPART, new Identifier(ISO_WEEK_PART), dateField);
        Expression dayShift = new ArithmeticBinaryExpression(
                ArithmeticBinaryExpression.Operator.SUBTRACT, new LongLiteral("26"), weekNumber);
        Expression isoYearDate = call(DATEADD, new Identifier(DAY_PART), dayShift, dateField);

        Expression yearPart = call(FORMAT, isoYearDate, literal(YEAR_PATTERN));
        Expression weekPart = call(FORMAT, weekNumber, literal(TWO_DIGITS));
        return call(CONCAT, yearPart, literal(WEEK_SEPARATOR), weekPart);
    }

    static String pattern(Granularity granularity) {
        switch (granularity) {
            case MINUTE: return "yyyy-MM-dd HH:mm:00";
            case HOUR: return "yyyy-MM-dd HH:00";
            case DAY: return "yyyy-MM-dd";
            case MONTH: return "yyyy-MM";
            case YEAR: return YEAR_PATTERN;
            default:
                throw new UnsupportedGranularityException(granularity.getUnitName());
        }
    }
}
