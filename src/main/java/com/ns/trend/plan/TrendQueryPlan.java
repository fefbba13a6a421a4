package com.ns.trend.plan;

import com.ns.trend.dialect.SqlDialect;
import com.ns.trend.model.AggregateFunction;
import com.ns.trend.model.Granularity;
import com.ns.trend.model.Period;
import com.ns.trend.source.TrendRecord;
import io.trino.sql.SqlFormatter;
import io.trino.sql.parser.ParsingOptions;
import io.trino.sql.parser.SqlParser;
import io.trino.sql.tree.Expression;
import io.trino.sql.tree.Identifier;
import io.trino.sql.tree.Statement;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;

import static io.trino.sql.ExpressionFormatter.formatExpression;

/**
 * Immutable snapshot of a configured trend: what to read, how to bucket it and how to reduce
 * each bucket. Besides driving in-process aggregation it renders as a grouped SQL query for the
 * configured dialect:
 * <pre>
 * SELECT &lt;bucket&gt; AS bucket, &lt;aggregate&gt; AS aggregate_value
 * FROM &lt;source&gt;
 * WHERE &lt;date&gt; BETWEEN TIMESTAMP '&lt;start&gt;' AND TIMESTAMP '&lt;end&gt;'
 * GROUP BY &lt;bucket&gt;
 * ORDER BY bucket
 * </pre>
 */
public final class TrendQueryPlan {
    public static final String BUCKET_ALIAS = "bucket";
    public static final String AGGREGATE_ALIAS = "aggregate_value";


    private final String sourceName;
    private final Identifier dateField;
    private final LocalDateTime start;
    private final LocalDateTime end;
    private final Granularity granularity;
    private final SqlDialect dialect;
    private final AggregateFunction function;
    private final Optional<Identifier> valueField;
    private final Expression bucketExpression;
    private final Expression aggregateExpression;

    private TrendQueryPlan(Builder builder) {
        this.sourceName = Objects.requireNonNull(builder.sourceName, "sourceName is null");
        this.dateField = Objects.requireNonNull(builder.dateField, "dateField is null");
        this.start = Objects.requireNonNull(builder.start, "start is null");
        this.end = Objects.requireNonNull(builder.end, "end is null");
        this.granularity = Objects.requireNonNull(builder.granularity, "granularity is null");
        this.dialect = Objects.requireNonNull(builder.dialect, "dialect is null");
        this.function = Objects.requireNonNull(builder.function, "function is null");
        this.valueField = Optional.ofNullable(builder.valueField);
        this.bucketExpression = dialect.formatTruncation(dateField, granularity);
        this.aggregateExpression = function.toExpression(builder.valueField);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getSourceName() {
        return sourceName;
    }

    public String getDateField() {
        return dateField.getValue();
    }

    public LocalDateTime getStart() {
        return start;
    }

    public LocalDateTime getEnd() {
        return end;
    }

    public Granularity getGranularity() {
        return granularity;
    }

    public SqlDialect getDialect() {
        return dialect;
    }

    public AggregateFunction getFunction() {
        return function;
    }

    /**
     * @return The reduced field, empty for COUNT
     */
    public Optional<String> getValueField() {
        return valueField.map(Identifier::getValue);
    }

    /**
     * @return The dialect's truncation expression, the grouping key of the rendered query
     */
    public Expression getBucketExpression() {
        return bucketExpression;
    }

    public Expression getAggregateExpression() {
        return aggregateExpression;
    }

    /**
     * Grouping key of a record: its date field captured as a period at the plan's granularity.
     */
    public Period periodOf(TrendRecord record) {
        return Period.of(record.getTimestamp(dateField.getValue()), granularity);
    }

    /**
     * Parses the rendered query into a Trino statement.
     */
    public Statement toStatement() {
        return new SqlParser().createStatement(renderSql(), new ParsingOptions());
    }

    /**
     * Renders the query as formatted SQL text.
     */
    public String toSql() {
        return SqlFormatter.formatSql(toStatement());
    }

    private String renderSql() {
        String bucket = formatExpression(bucketExpression);
        return "SELECT " + bucket + " AS " + BUCKET_ALIAS + ", "
                + formatExpression(aggregateExpression) + " AS " + AGGREGATE_ALIAS
                + " FROM " + formatExpression(new Identifier(sourceName))
                + " WHERE " + formatExpression(dateField)
                + " BETWEEN TIMESTAMP '" + timestampLiteral(start) + "'"
                + " AND TIMESTAMP '" + timestampLiteral(end) + "'"
                + " GROUP BY " + bucket
                + " ORDER BY " + BUCKET_ALIAS;
    }

    // seconds always, fraction only when present: 2025-01-15 11:59:59.999
    private static String timestampLiteral(LocalDateTime timestamp) {
        return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(timestamp).replace('T', ' ');
    }

    @Override
    public String toString() {
        return function + (valueField.isPresent() ? "(" + valueField.get().getValue() + ")" : "")
                + " per " + granularity + " of " + sourceName + "." + dateField.getValue()
                + " in [" + start + ", " + end + "] using " + dialect.name();
    }

    public static final class Builder {
        private String sourceName;
        private Identifier dateField;
        private LocalDateTime start;
        private LocalDateTime end;
        private Granularity granularity;
        private SqlDialect dialect;
        private AggregateFunction function;
        private Identifier valueField;

        private Builder() {
        }

        public Builder sourceName(String sourceName) {
            this.sourceName = sourceName;
            return this;
        }

        public Builder dateField(Identifier dateField) {
            this.dateField = dateField;
            return this;
        }

        public Builder range(LocalDateTime start, LocalDateTime end) {
            this.start = start;
            this.end = end;
            return this;
        }

        public Builder granularity(Granularity granularity) {
            this.granularity = granularity;
            return this;
        }

        public Builder dialect(SqlDialect dialect) {
            this.dialect = dialect;
            return this;
        }

        public Builder function(AggregateFunction function) {
            this.function = function;
            return this;
        }

        public Builder valueField(Identifier valueField) {
            this.valueField = valueField;
            return this;
        }

        public TrendQueryPlan build() {
            return new TrendQueryPlan(this);
        }
    }
}
