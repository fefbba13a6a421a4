package com.ns.trend.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One point of a trend: the start of a bucket and the aggregate computed for it.
 */
public final class AggregateResult implements Comparable<AggregateResult> {
    private final LocalDateTime timestamp;
    private final BigDecimal aggregate;

    public AggregateResult(LocalDateTime timestamp, BigDecimal aggregate) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp is null");
        this.aggregate = Objects.requireNonNull(aggregate, "aggregate is null");
    }

    public static AggregateResult zero(LocalDateTime timestamp) {
        return new AggregateResult(timestamp, BigDecimal.ZERO);
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public BigDecimal getAggregate() {
        return aggregate;
    }

    /**
     * Returns a result at the same timestamp holding the sum of both aggregates.
     */
    public AggregateResult plus(AggregateResult other) {
        return new AggregateResult(timestamp, aggregate.add(other.aggregate));
    }

    @Override
    public int compareTo(AggregateResult other) {
        return timestamp.compareTo(other.timestamp);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AggregateResult that = (AggregateResult) o;
        return timestamp.equals(that.timestamp) &&
               aggregate.compareTo(that.aggregate) == 0;
    }

    @Override
    public int hashCode() {
        // equals uses compareTo, so 2 and 2.00 must hash alike
        return Objects.hash(timestamp, aggregate.stripTrailingZeros());
    }

    @Override
    public String toString() {
        return timestamp + "=" + aggregate.toPlainString();
    }
}
