package com.ns.trend.exception;

public class UnresolvedFieldException extends TrendException {
    private final String field;

    public UnresolvedFieldException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
