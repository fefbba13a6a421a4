package com.ns.trend.exception;

public class MissingSelectorException extends TrendException {

    public MissingSelectorException(String function) {
        super("Value selector cannot be null for " + function + " aggregation");
    }
}
