package com.ns.trend.analysis;

import com.ns.trend.exception.UnsupportedSelectorException;
import io.trino.sql.parser.ParsingException;
import io.trino.sql.parser.ParsingOptions;
import io.trino.sql.parser.SqlParser;
import io.trino.sql.tree.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves field selectors to the single column they name.
 *
 * A selector is a SQL expression string. Only a bare column reference resolves; qualified
 * references ({@code o.amount}), arithmetic, function calls and anything else fail, because
 * aggregation reads the field by name from each record.
 */
public class FieldSelectorAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(FieldSelectorAnalyzer.class);

    private final SqlParser sqlParser;

    public FieldSelectorAnalyzer() {
        this(new SqlParser());
    }

    public FieldSelectorAnalyzer(SqlParser sqlParser) {
        this.sqlParser = sqlParser;
    }

    /**
     * Parses {@code selector} and returns the column identifier it references.
     *
     * @throws UnsupportedSelectorException if the selector is not a single field access
     */
    public Identifier resolve(String selector) {
        if (selector == null || selector.isBlank()) {
            throw new UnsupportedSelectorException(String.valueOf(selector), "selector is empty");
        }

        Expression expression;
        try {
            expression = sqlParser.createExpression(selector.trim(), new ParsingOptions());
        } catch (ParsingException e) {
            logger.debug("Selector '{}' failed to parse: {}", selector, e.getMessage());
            throw new UnsupportedSelectorException(selector, "not a valid expression", e);
        }

        if (expression instanceof Identifier) {
            Identifier identifier = (Identifier) expression;
            logger.debug("Selector '{}' resolved to field '{}'", selector, identifier.getValue());
            return identifier;
        }

        throw new UnsupportedSelectorException(selector, describe(expression));
    }

    /**
     * Returns the field name {@code selector} references.
     */
    public String resolveFieldName(String selector) {
        return resolve(selector).getValue();
    }

    private static String describe(Expression expression) {
        if (expression instanceof DereferenceExpression) {
            return "multi-step member access is not supported";
        }
        if (expression instanceof FunctionCall) {
            return "function calls are not supported";
        }
        if (expression instanceof ArithmeticBinaryExpression || expression instanceof ArithmeticUnaryExpression) {
            return "computed values are not supported";
        }
        if (expression instanceof Literal) {
            return "literals do not reference a field";
        }
        return expression.getClass().getSimpleName() + " is not a field access";
    }
}
