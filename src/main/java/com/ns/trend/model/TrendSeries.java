package com.ns.trend.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Dense, gap-free trend: one {@link AggregateResult} per bucket, strictly ascending by timestamp.
 */
public final class TrendSeries implements Iterable<AggregateResult> {
    private final List<AggregateResult> results;

    public TrendSeries(List<AggregateResult> results) {
        Objects.requireNonNull(results, "results is null");
        for (int i = 1; i < results.size(); i++) {
            LocalDateTime previous = results.get(i - 1).getTimestamp();
            LocalDateTime current = results.get(i).getTimestamp();
            if (!current.isAfter(previous)) {
                throw new IllegalArgumentException(
                        "Trend timestamps must be strictly ascending, got " + current + " after " + previous);
            }
        }
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
    }

    public int size() {
        return results.size();
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    public AggregateResult get(int index) {
        return results.get(index);
    }

    public List<AggregateResult> getResults() {
        return results;
    }

    public List<LocalDateTime> getTimestamps() {
        return results.stream().map(AggregateResult::getTimestamp).collect(Collectors.toList());
    }

    public List<BigDecimal> getAggregates() {
        return results.stream().map(AggregateResult::getAggregate).collect(Collectors.toList());
    }

    public Stream<AggregateResult> stream() {
        return results.stream();
    }

    @Override
    public Iterator<AggregateResult> iterator() {
        return results.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return results.equals(((TrendSeries) o).results);
    }

    @Override
    public int hashCode() {
        return results.hashCode();
    }

    @Override
    public String toString() {
        return results.toString();
    }
}
