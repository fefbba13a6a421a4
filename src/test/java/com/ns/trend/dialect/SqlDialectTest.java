package com.ns.trend.dialect;

import com.ns.trend.exception.UnsupportedGranularityException;
import com.ns.trend.model.Granularity;
import io.trino.sql.tree.Expression;
import io.trino.sql.tree.FunctionCall;
import io.trino.sql.tree.Identifier;
import io.trino.sql.tree.StringLiteral;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Locale;
import java.util.stream.Stream;

import static io.trino.sql.ExpressionFormatter.formatExpression;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SqlDialectTest {

    private static final Identifier CREATED_AT = new Identifier("created_at");

    static Stream<Arguments> truncationPatterns() {
        return Stream.of(
            Arguments.of(MySqlDialect.INSTANCE, Granularity.MINUTE, "date_format", "%Y-%m-%d %H:%i:00"),
            Arguments.of(MySqlDialect.INSTANCE, Granularity.HOUR, "date_format", "%Y-%m-%d %H:00"),
            Arguments.of(MySqlDialect.INSTANCE, Granularity.DAY, "date_format", "%Y-%m-%d"),
            Arguments.of(MySqlDialect.INSTANCE, Granularity.WEEK, "date_format", "%x-%v"),
            Arguments.of(MySqlDialect.INSTANCE, Granularity.MONTH, "date_format", "%Y-%m"),
            Arguments.of(MySqlDialect.INSTANCE, Granularity.YEAR, "date_format", "%Y"),

            Arguments.of(PostgresDialect.INSTANCE, Granularity.MINUTE, "to_char", "YYYY-MM-DD HH24:MI:00"),
            Arguments.of(PostgresDialect.INSTANCE, Granularity.HOUR, "to_char", "YYYY-MM-DD HH24:00"),
            Arguments.of(PostgresDialect.INSTANCE, Granularity.DAY, "to_char", "YYYY-MM-DD"),
            Arguments.of(PostgresDialect.INSTANCE, Granularity.WEEK, "to_char", "IYYY-IW"),
            Arguments.of(PostgresDialect.INSTANCE, Granularity.MONTH, "to_char", "YYYY-MM"),
            Arguments.of(PostgresDialect.INSTANCE, Granularity.YEAR, "to_char", "YYYY"),

            Arguments.of(SqliteDialect.INSTANCE, Granularity.MINUTE, "strftime", "%Y-%m-%d %H:%M:00"),
            Arguments.of(SqliteDialect.INSTANCE, Granularity.HOUR, "strftime", "%Y-%m-%d %H:00"),
            Arguments.of(SqliteDialect.INSTANCE, Granularity.DAY, "strftime", "%Y-%m-%d"),
            Arguments.of(SqliteDialect.INSTANCE, Granularity.WEEK, "strftime", "%G-%V"),
            Arguments.of(SqliteDialect.INSTANCE, Granularity.MONTH, "strftime", "%Y-%m"),
            Arguments.of(SqliteDialect.INSTANCE, Granularity.YEAR, "strftime", "%Y"),

            Arguments.of(TSqlDialect.INSTANCE, Granularity.MINUTE, "format", "yyyy-MM-dd HH:mm:00"),
            Arguments.of(TSqlDialect.INSTANCE, Granularity.HOUR, "format", "yyyy-MM-dd HH:00"),
            Arguments.of(TSqlDialect.INSTANCE, Granularity.DAY, "format", "yyyy-MM-dd"),
            Arguments.of(TSqlDialect.INSTANCE, Granularity.MONTH, "format", "yyyy-MM"),
            Arguments.of(TSqlDialect.INSTANCE, Granularity.YEAR, "format", "yyyy")
        );
    }

    @ParameterizedTest(name = "{0} {1}")
    @MethodSource("truncationPatterns")
    void wrapsDateFieldInFormattingCall(SqlDialect dialect, Granularity granularity, String function, String pattern) {
        FunctionCall call = (FunctionCall) dialect.formatTruncation(CREATED_AT, granularity);

        assertEquals(function, call.getName().getSuffix().toLowerCase(Locale.ROOT));
        assertEquals(2, call.getArguments().size());
        assertTrue(call.getArguments().contains(CREATED_AT), formatExpression(call));
        assertTrue(call.getArguments().contains(new StringLiteral(pattern)), formatExpression(call));
    }

    @Test
    void sqliteTakesPatternFirst() {
        FunctionCall call = (FunctionCall) SqliteDialect.INSTANCE.formatTruncation(CREATED_AT, Granularity.DAY);

        assertEquals(new StringLiteral("%Y-%m-%d"), call.getArguments().get(0));
        assertEquals(CREATED_AT, call.getArguments().get(1));
    }

    @Test
    void tsqlBuildsIsoWeekFromYearAndWeekParts() {
        FunctionCall call = (FunctionCall) TSqlDialect.INSTANCE.formatTruncation(CREATED_AT, Granularity.WEEK);
        String sql = formatExpression(call);

        assertEquals("concat", call.getName().getSuffix());
        assertEquals(3, call.getArguments().size());
        assertEquals(new StringLiteral("-"), call.getArguments().get(1));
        assertTrue(sql.contains("datepart(isowk, created_at)"), sql);
        assertTrue(sql.contains("dateadd(day"), sql);
        assertTrue(sql.contains("'D2'"), sql);
        assertTrue(sql.contains("'yyyy'"), sql);
    }

    @Test
    void acceptsGranularityNames() {
        for (SqlDialect dialect : SqlDialects.all()) {
            assertEquals(dialect.formatTruncation(CREATED_AT, Granularity.MONTH), dialect.formatTruncation(CREATED_AT, " Month"));
        }
    }

    @Test
    void rejectsUnknownOrMissingGranularity() {
        for (SqlDialect dialect : SqlDialects.all()) {
            assertThrows(UnsupportedGranularityException.class, () -> dialect.formatTruncation(CREATED_AT, "fortnight"));
            assertThrows(UnsupportedGranularityException.class, () -> dialect.formatTruncation(CREATED_AT, (Granularity) null));
        }
    }

    @Test
    void wrapsArbitraryDateExpressions() {
        Expression shifted = new FunctionCall(io.trino.sql.tree.QualifiedName.of("coalesce"),
                java.util.List.of(new Identifier("shipped_at"), CREATED_AT));

        String sql = formatExpression(PostgresDialect.INSTANCE.formatTruncation(shifted, Granularity.DAY));

        assertTrue(sql.contains("coalesce(shipped_at, created_at)"), sql);
    }
}
