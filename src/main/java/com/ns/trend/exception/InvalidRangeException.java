package com.ns.trend.exception;

import java.time.LocalDateTime;

public class InvalidRangeException extends TrendException {

    public InvalidRangeException(String message) {
        super(message);
    }

    public InvalidRangeException(LocalDateTime start, LocalDateTime end) {
        super("Range end " + end + " precedes start " + start);
    }
}
