package com.ns.trend.plan;

import com.ns.trend.dialect.MySqlDialect;
import com.ns.trend.dialect.TSqlDialect;
import com.ns.trend.model.AggregateFunction;
import com.ns.trend.model.Granularity;
import com.ns.trend.model.Period;
import com.ns.trend.source.TrendRecord;
import io.trino.sql.parser.ParsingOptions;
import io.trino.sql.parser.SqlParser;
import io.trino.sql.tree.FunctionCall;
import io.trino.sql.tree.Identifier;
import io.trino.sql.tree.Query;
import io.trino.sql.tree.Statement;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TrendQueryPlanTest {

    private static final LocalDateTime START = LocalDate.of(2025, 1, 1).atStartOfDay();
    private static final LocalDateTime END = LocalDate.of(2025, 1, 31).atTime(23, 59, 59);

    private static TrendQueryPlan.Builder sumPerDay() {
        return TrendQueryPlan.builder()
                .sourceName("orders")
                .dateField(new Identifier("created_at"))
                .range(START, END)
                .granularity(Granularity.DAY)
                .dialect(MySqlDialect.INSTANCE)
                .function(AggregateFunction.SUM)
                .valueField(new Identifier("amount"));
    }

    @Test
    void rendersGroupedQuery() {
        TrendQueryPlan plan = sumPerDay().build();
        String sql = plan.toSql().replaceAll("\\s+", " ");

        assertTrue(sql.contains("date_format(created_at, '%Y-%m-%d')"), sql);
        assertTrue(sql.contains("sum(amount)"), sql);
        assertTrue(sql.contains("FROM orders"), sql);
        assertTrue(sql.contains("TIMESTAMP '2025-01-01 00:00:00'"), sql);
        assertTrue(sql.contains("TIMESTAMP '2025-01-31 23:59:59'"), sql);
        assertTrue(sql.contains("GROUP BY"), sql);
        assertTrue(sql.contains("ORDER BY bucket"), sql);
    }

    @Test
    void quotesSourceNamesThatAreNotPlainIdentifiers() {
        for (String name : List.of("order", "group", "order-items", "order items")) {
            TrendQueryPlan plan = sumPerDay().sourceName(name).build();

            assertTrue(plan.toStatement() instanceof Query, name);
            String sql = plan.toSql();
            assertTrue(sql.contains("\"" + name + "\""), sql);
            assertTrue(new SqlParser().createStatement(sql, new ParsingOptions()) instanceof Query, sql);
        }
    }

    @Test
    void keepsFractionalSecondsOfRangeBounds() {
        LocalDateTime end = LocalDateTime.of(2025, 1, 15, 11, 59, 59, 999_000_000);
        String sql = sumPerDay().range(START, end).build().toSql();

        assertTrue(sql.contains("TIMESTAMP '2025-01-01 00:00:00'"), sql);
        assertTrue(sql.contains("TIMESTAMP '2025-01-15 11:59:59.999'"), sql);
    }

    @Test
    void parsesAsQueryStatement() {
        Statement statement = sumPerDay().dialect(TSqlDialect.INSTANCE).granularity(Granularity.WEEK).build().toStatement();

        assertTrue(statement instanceof Query);
    }

    @Test
    void exposesExpressionsAndFields() {
        TrendQueryPlan count = sumPerDay().function(AggregateFunction.COUNT).valueField(null).build();

        assertEquals("created_at", count.getDateField());
        assertEquals(Optional.empty(), count.getValueField());
        assertEquals("count", ((FunctionCall) count.getAggregateExpression()).getName().getSuffix());
        assertEquals(MySqlDialect.INSTANCE.formatTruncation(new Identifier("created_at"), Granularity.DAY), count.getBucketExpression());

        TrendQueryPlan sum = sumPerDay().build();
        assertEquals(Optional.of("amount"), sum.getValueField());
        assertEquals("SUM(amount) per day of orders.created_at in [2025-01-01T00:00, 2025-01-31T23:59:59] using MySQL", sum.toString());
    }

    @Test
    void groupsRecordsByTheirPeriod() {
        TrendQueryPlan plan = sumPerDay().granularity(Granularity.WEEK).build();
        TrendRecord record = TrendRecord.of(Map.of("created_at", LocalDateTime.of(2025, 1, 16, 8, 0)));

        Period period = plan.periodOf(record);

        assertEquals(LocalDate.of(2025, 1, 13).atStartOfDay(), period.toTimestamp());
    }

    @Test
    void requiresEveryComponent() {
        assertThrows(NullPointerException.class, () -> sumPerDay().sourceName(null).build());
        assertThrows(NullPointerException.class, () -> sumPerDay().range(START, null).build());
        assertThrows(NullPointerException.class, () -> sumPerDay().valueField(null).build());
    }
}
