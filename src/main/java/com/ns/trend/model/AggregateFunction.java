package com.ns.trend.model;

import io.trino.sql.tree.Expression;
import io.trino.sql.tree.FunctionCall;
import io.trino.sql.tree.Identifier;
import io.trino.sql.tree.QualifiedName;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.Objects;

/**
 * Aggregate functions supported by the trend builder.
 */
public enum AggregateFunction {
    COUNT("count", false),
    SUM("sum", true),
    AVERAGE("avg", true),
    MIN("min", true),
    MAX("max", true);

    private final String sqlName;
    private final boolean requiresSelector;

    AggregateFunction(String sqlName, boolean requiresSelector) {
        this.sqlName = sqlName;
        this.requiresSelector = requiresSelector;
    }

    public String getSqlName() {
        return sqlName;
    }

    /**
     * Every function but COUNT reduces a numeric field and needs a selector naming it.
     */
    public boolean requiresSelector() {
        return requiresSelector;
    }

    /**
     * Builds the SQL aggregate call, {@code count(*)} for COUNT and {@code fn(field)} otherwise.
     */
    public Expression toExpression(Identifier valueField) {
        if (!requiresSelector) {
            return new FunctionCall(QualifiedName.of(sqlName), List.of());
        }
        Objects.requireNonNull(valueField, "valueField is null");
        return new FunctionCall(QualifiedName.of(sqlName), List.of(valueField));
    }

    /**
     * Reduces the values of one group. COUNT only looks at the group size, so callers may pass
     * placeholder values for it.
     */
    public BigDecimal reduce(List<BigDecimal> values) {
        Objects.requireNonNull(values, "values is null");
        if (this == COUNT) {
            return BigDecimal.valueOf(values.size());
        }
        if (values.isEmpty()) {
            return BigDecimal.ZERO;
        }

        switch (this) {
            case SUM:
                return sum(values);
            case AVERAGE:
                return sum(values).divide(BigDecimal.valueOf(values.size()), MathContext.DECIMAL128);
            case MIN:
                return values.stream().min(BigDecimal::compareTo).orElse(BigDecimal.ZERO);
            case MAX:
                return values.stream().max(BigDecimal::compareTo).orElse(BigDecimal.ZERO);
            default:
                throw new UnsupportedOperationException("Aggregation function '" + this + "' is not supported.");
        }
    }

    private static BigDecimal sum(List<BigDecimal> values) {
        BigDecimal total = BigDecimal.ZERO;
        for (BigDecimal value : values) {
            total = total.add(value);
        }
        return total;
    }
}
