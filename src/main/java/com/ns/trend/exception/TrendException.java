package com.ns.trend.exception;

/**
 * Base class for every failure raised while configuring or executing a trend aggregation.
 * A failed call never yields a partial series.
 */
public class TrendException extends RuntimeException {

    public TrendException(String message) {
        super(message);
    }

    public TrendException(String message, Throwable cause) {
        super(message, cause);
    }
}
