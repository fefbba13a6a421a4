package com.ns.trend.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * {@link TrendSource} over a fixed list of records. Records whose date field is null never match
 * a range.
 */
public class InMemoryTrendSource implements TrendSource {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryTrendSource.class);

    public static final String BACKEND_NAME = "in-memory";

    private final String name;
    private final String backendName;
    private final List<TrendRecord> records;

    public InMemoryTrendSource(String name, List<TrendRecord> records) {
        this(name, BACKEND_NAME, records);
    }

    public InMemoryTrendSource(String name, String backendName, List<TrendRecord> records) {
        this.name = Objects.requireNonNull(name, "name is null");
        this.backendName = backendName;
        this.records = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(records, "records is null")));
        logger.debug("Created in-memory source '{}' ({}) with {} records", name, backendName, this.records.size());
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getBackendName() {
        return backendName;
    }

    public List<TrendRecord> getRecords() {
        return records;
    }

    @Override
    public Stream<TrendRecord> between(String field, LocalDateTime start, LocalDateTime end) {
        Objects.requireNonNull(field, "field is null");
        Objects.requireNonNull(start, "start is null");
        Objects.requireNonNull(end, "end is null");
        return records.stream().filter(record -> {
            LocalDateTime value = record.getTimestamp(field);
            return value != null && !value.isBefore(start) && !value.isAfter(end);
        });
    }
}
