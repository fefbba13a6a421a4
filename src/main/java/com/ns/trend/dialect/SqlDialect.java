package com.ns.trend.dialect;

import com.ns.trend.model.Granularity;
import io.trino.sql.tree.Expression;

/**
 * Backend-specific way of expressing "truncate this timestamp to a bucket" as a SQL expression.
 *
 * Every implementation computes the same canonical bucket text for a given granularity (see
 * {@link Granularity#format}), only the functions and pattern tokens differ per backend. The
 * returned expression is an AST node for the execution collaborator; nothing is evaluated here.
 */
public interface SqlDialect {

    /**
     * @return The dialect name (e.g., "T-SQL", "PostgreSQL")
     */
    String name();

    /**
     * Wrap a timestamp-valued expression in this backend's truncation call.
     *
     * @param dateField The timestamp expression, usually the date column identifier
     * @param granularity The bucket size
     * @return An expression evaluating to the canonical bucket text
     * @throws com.ns.trend.exception.UnsupportedGranularityException if granularity is null
     */
    Expression formatTruncation(Expression dateField, Granularity granularity);

    /**
     * Same as {@link #formatTruncation(Expression, Granularity)} for a granularity name such as
     * {@code "week"}.
     *
     * @throws com.ns.trend.exception.UnsupportedGranularityException for unknown names
     */
    default Expression formatTruncation(Expression dateField, String granularity) {
        return formatTruncation(dateField, Granularity.fromName(granularity));
    }
}
