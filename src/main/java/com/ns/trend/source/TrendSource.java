package com.ns.trend.source;

import java.time.LocalDateTime;
import java.util.stream.Stream;

/**
 * The queryable data source a trend is computed over. Storage and query execution live behind
 * this interface; the trend builder only asks for records in a date range and groups and reduces
 * them itself.
 */
public interface TrendSource {

    /**
     * @return The table or collection name, used as the FROM target of the rendered query
     */
    String getName();

    /**
     * @return The backend identifier (JDBC product name, driver or provider name) used to pick a
     *         SQL dialect, or null if unknown
     */
    String getBackendName();

    /**
     * Streams the records whose {@code field} value lies in {@code [start, end]}, both inclusive.
     *
     * @throws com.ns.trend.exception.UnresolvedFieldException if records have no such temporal field
     */
    Stream<TrendRecord> between(String field, LocalDateTime start, LocalDateTime end);
}
