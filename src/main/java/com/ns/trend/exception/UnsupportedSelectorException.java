package com.ns.trend.exception;

/**
 * Raised when a selector is not a plain field reference, e.g. {@code o.amount} or {@code amount * 2}.
 */
public class UnsupportedSelectorException extends TrendException {
    private final String selector;

    public UnsupportedSelectorException(String selector, String reason) {
        super("Could not determine field name from selector '" + selector + "': " + reason);
        this.selector = selector;
    }

    public UnsupportedSelectorException(String selector, String reason, Throwable cause) {
        super("Could not determine field name from selector '" + selector + "': " + reason, cause);
        this.selector = selector;
    }

    public String getSelector() {
        return selector;
    }
}
