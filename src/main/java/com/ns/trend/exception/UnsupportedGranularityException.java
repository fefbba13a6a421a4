package com.ns.trend.exception;

public class UnsupportedGranularityException extends TrendException {
    private final String granularity;

    public UnsupportedGranularityException(String granularity) {
        super("Interval '" + granularity + "' is not supported.");
        this.granularity = granularity;
    }

    public String getGranularity() {
        return granularity;
    }
}
