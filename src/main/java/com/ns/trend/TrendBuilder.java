package com.ns.trend;

import com.ns.trend.analysis.FieldSelectorAnalyzer;
import com.ns.trend.config.ColumnDefinition;
import com.ns.trend.config.TableDefinition;
import com.ns.trend.config.TrendDefaults;
import com.ns.trend.dialect.SqlDialect;
import com.ns.trend.exception.InvalidRangeException;
import com.ns.trend.exception.MissingSelectorException;
import com.ns.trend.exception.UnresolvedFieldException;
import com.ns.trend.filling.GapFiller;
import com.ns.trend.model.AggregateFunction;
import com.ns.trend.model.AggregateResult;
import com.ns.trend.model.Granularity;
import com.ns.trend.model.Period;
import com.ns.trend.model.TrendSeries;
import com.ns.trend.plan.TrendQueryPlan;
import com.ns.trend.source.TrendRecord;
import com.ns.trend.source.TrendSource;
import io.trino.sql.parser.ParsingException;
import io.trino.sql.tree.Identifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Fluent builder for a single trend aggregation over a {@link TrendSource}.
 *
 * Configure the range, granularity, date column and dialect, then call one of the terminal
 * operations ({@link #count()}, {@link #sum(String)}, {@link #average(String)},
 * {@link #min(String)}, {@link #max(String)}). Each terminal call snapshots the configuration
 * into an immutable {@link TrendQueryPlan} before reading any record, so a builder should be
 * configured once and not mutated while a call is in flight.
 */
public class TrendBuilder {
    private static final Logger logger = LoggerFactory.getLogger(TrendBuilder.class);

    private final TrendSource source;
    private final TableDefinition schema; // null when the source's columns are unknown
    private final FieldSelectorAnalyzer selectorAnalyzer = new FieldSelectorAnalyzer();

    private SqlDialect dialect;
    private LocalDateTime start;
    private LocalDateTime end;
    private Granularity granularity;
    private String dateColumn;

    public TrendBuilder(TrendSource source, SqlDialect dialect) {
        this(source, dialect, new TrendDefaults(), null);
    }

    public TrendBuilder(TrendSource source, SqlDialect dialect, TrendDefaults defaults, TableDefinition schema) {
        this.source = Objects.requireNonNull(source, "source is null");
        this.dialect = Objects.requireNonNull(dialect, "dialect is null");
        Objects.requireNonNull(defaults, "defaults is null");
        this.granularity = Granularity.fromName(defaults.getGranularity());
        this.dateColumn = defaults.getDateColumn();
        this.schema = schema;
    }

    // ===== CONFIGURATION =====

    /**
     * Sets the date range, both bounds inclusive.
     */
    public TrendBuilder between(LocalDateTime start, LocalDateTime end) {
        this.start = start;
        this.end = end;
        return this;
    }

    /**
     * Sets the grouping interval by name: minute, hour, day, week, month or year.
     *
     * @throws com.ns.trend.exception.UnsupportedGranularityException for any other name
     */
    public TrendBuilder interval(String interval) {
        this.granularity = Granularity.fromName(interval);
        return this;
    }

    public TrendBuilder interval(Granularity granularity) {
        this.granularity = Objects.requireNonNull(granularity, "granularity is null");
        return this;
    }

    public TrendBuilder perMinute() {
        return interval(Granularity.MINUTE);
    }

    public TrendBuilder perHour() {
        return interval(Granularity.HOUR);
    }

    public TrendBuilder perDay() {
        return interval(Granularity.DAY);
    }

    public TrendBuilder perWeek() {
        return interval(Granularity.WEEK);
    }

    public TrendBuilder perMonth() {
        return interval(Granularity.MONTH);
    }

    public TrendBuilder perYear() {
        return interval(Granularity.YEAR);
    }

    /**
     * Sets the column to use for date grouping. Defaults to {@code CreatedAt}.
     */
    public TrendBuilder dateColumn(String column) {
        this.dateColumn = column;
        return this;
    }

    public TrendBuilder dialect(SqlDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect is null");
        return this;
    }

    // ===== TERMINAL OPERATIONS =====

    public TrendSeries count() {
        return aggregate(AggregateFunction.COUNT, null);
    }

    public TrendSeries sum(String selector) {
        return aggregate(AggregateFunction.SUM, selector);
    }

    public TrendSeries average(String selector) {
        return aggregate(AggregateFunction.AVERAGE, selector);
    }

    public TrendSeries min(String selector) {
        return aggregate(AggregateFunction.MIN, selector);
    }

    public TrendSeries max(String selector) {
        return aggregate(AggregateFunction.MAX, selector);
    }

    /**
     * Validates the configuration and snapshots it into an immutable plan without reading any
     * record. The plan can be rendered as SQL for the configured dialect.
     *
     * @param function The aggregate to compute
     * @param selector The field to reduce; ignored for COUNT
     * @throws InvalidRangeException if the range is missing or ends before it starts
     * @throws MissingSelectorException if a non-count function has no selector
     * @throws com.ns.trend.exception.UnsupportedSelectorException if the selector is not a plain field
     * @throws UnresolvedFieldException if a field is missing from the known schema
     */
    public TrendQueryPlan plan(AggregateFunction function, String selector) {
        Objects.requireNonNull(function, "function is null");
        validateRange();

        Identifier dateField = resolveDateField();
        Identifier valueField = null;
        if (function.requiresSelector()) {
            if (selector == null || selector.isBlank()) {
                throw new MissingSelectorException(function.name());
            }
            valueField = selectorAnalyzer.resolve(selector);
            checkValueColumn(valueField.getValue());
        }

        return TrendQueryPlan.builder()
                .sourceName(source.getName())
                .dateField(dateField)
                .range(start, end)
                .granularity(granularity)
                .dialect(dialect)
                .function(function)
                .valueField(valueField)
                .build();
    }

    // ===== EXECUTION =====

    private TrendSeries aggregate(AggregateFunction function, String selector) {
        TrendQueryPlan plan = plan(function, selector);
        logger.info("Computing trend: {}", plan);
        if (logger.isDebugEnabled()) {
            logEquivalentSql(plan);
        }

        Map<Period, List<BigDecimal>> groups = group(plan);
        List<AggregateResult> sparse = reduce(plan, groups);
        logger.debug("Reduced {} groups to sparse results {}", groups.size(), sparse);

        TrendSeries series = GapFiller.fill(sparse, plan.getStart(), plan.getEnd(), plan.getGranularity());
        logger.info("Trend on '{}' produced {} {} buckets ({} with data)",
                plan.getSourceName(), series.size(), plan.getGranularity(), sparse.size());
        return series;
    }

    private Map<Period, List<BigDecimal>> group(TrendQueryPlan plan) {
        List<TrendRecord> inRange;
        try (Stream<TrendRecord> records = source.between(plan.getDateField(), plan.getStart(), plan.getEnd())) {
            inRange = records.collect(Collectors.toList());
        }
        logger.debug("{} records of '{}' fell in [{}, {}]", inRange.size(), plan.getSourceName(), plan.getStart(), plan.getEnd());

        Map<Period, List<BigDecimal>> groups = new LinkedHashMap<>();
        Optional<String> valueField = plan.getValueField();
        for (TrendRecord record : inRange) {
            List<BigDecimal> values = groups.computeIfAbsent(plan.periodOf(record), key -> new ArrayList<>());
            if (valueField.isEmpty()) {
                values.add(BigDecimal.ONE);
                continue;
            }
            // nulls are skipped like SQL aggregates do
            BigDecimal value = record.getNumber(valueField.get());
            if (value != null) {
                values.add(value);
            }
        }
        return groups;
    }

    // Rendering is diagnostic only here; a failure must not change the result
    private static void logEquivalentSql(TrendQueryPlan plan) {
        try {
            logger.debug("Equivalent {} query: {}", plan.getDialect().name(), plan.toSql().replace('\n', ' '));
        } catch (ParsingException e) {
            logger.warn("Could not render {} query for '{}': {}", plan.getDialect().name(), plan.getSourceName(), e.getMessage());
        }
    }

    private static List<AggregateResult> reduce(TrendQueryPlan plan, Map<Period, List<BigDecimal>> groups) {
        return groups.entrySet().stream()
                .map(entry -> new AggregateResult(
                        entry.getKey().toTimestamp(),
                        plan.getFunction().reduce(entry.getValue())))
                .sorted()
                .collect(Collectors.toList());
    }

    // ===== VALIDATION =====

    private void validateRange() {
        if (start == null || end == null) {
            throw new InvalidRangeException("Date range is not set; call between(start, end) first");
        }
        if (end.isBefore(start)) {
            throw new InvalidRangeException(start, end);
        }
    }

    private Identifier resolveDateField() {
        if (dateColumn == null || dateColumn.isBlank()) {
            throw new UnresolvedFieldException(String.valueOf(dateColumn), "Date column is not set");
        }
        if (schema != null) {
            ColumnDefinition column = findColumn(dateColumn);
            if (!column.isTemporal()) {
                throw new UnresolvedFieldException(dateColumn,
                        "Date column '" + dateColumn + "' has non-temporal type '" + column.getType() + "'");
            }
        }
        return new Identifier(dateColumn);
    }

    private void checkValueColumn(String field) {
        if (schema == null) {
            return;
        }
        ColumnDefinition column = findColumn(field);
        if (!column.isNumeric()) {
            throw new UnresolvedFieldException(field,
                    "Column '" + field + "' has non-numeric type '" + column.getType() + "'");
        }
    }

    private ColumnDefinition findColumn(String field) {
        return schema.findColumn(field).orElseThrow(() -> new UnresolvedFieldException(field,
                "Column '" + field + "' does not exist on '" + source.getName() + "'. Available: " + schema.getColumnNames()));
    }
}
