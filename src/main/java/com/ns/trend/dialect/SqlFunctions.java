package com.ns.trend.dialect;

import com.ns.trend.exception.UnsupportedGranularityException;
import com.ns.trend.model.Granularity;
import io.trino.sql.tree.Expression;
import io.trino.sql.tree.FunctionCall;
import io.trino.sql.tree.QualifiedName;
import io.trino.sql.tree.StringLiteral;

import java.util.List;
import java.util.Objects;

/**
 * AST construction helpers shared by the dialects.
 */
final class SqlFunctions {

    private SqlFunctions() {
    }

    static FunctionCall call(String functionName, Expression... arguments) {
        return new FunctionCall(QualifiedName.of(functionName), List.of(arguments));
    }

    static StringLiteral literal(String value) {
        return new StringLiteral(value);
    }

    static void checkArguments(Expression dateField, Granularity granularity) {
        Objects.requireNonNull(dateField, "dateField is null");
        if (granularity == null) {
            throw new UnsupportedGranularityException(null);
        }
    }
}
