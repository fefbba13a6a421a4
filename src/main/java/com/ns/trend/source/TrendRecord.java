package com.ns.trend.source;

import com.ns.trend.exception.UnresolvedFieldException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A schema-less record: field name to value. Field lookup is exact first, then case-insensitive.
 */
public final class TrendRecord {
    private final Map<String, Object> fields;

    public TrendRecord(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields is null");
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static TrendRecord of(Map<String, ?> fields) {
        return new TrendRecord(fields);
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    public boolean hasField(String field) {
        return findKey(field).isPresent();
    }

    /**
     * @throws UnresolvedFieldException if the field is absent
     */
    public Object get(String field) {
        String key = findKey(field).orElseThrow(() ->
                new UnresolvedFieldException(field, "Record has no field '" + field + "'. Available: " + fields.keySet()));
        return fields.get(key);
    }

    /**
     * Reads a temporal field as a local timestamp. Instants and {@link Date}s are read at UTC.
     *
     * @return the timestamp, or null if the field holds null
     * @throws UnresolvedFieldException if the field is absent or not temporal
     */
    public LocalDateTime getTimestamp(String field) {
        Object value = get(field);
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toLocalDateTime();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toLocalDateTime();
        }
        if (value instanceof Instant) {
            return LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC);
        }
        if (value instanceof Date) {
            return LocalDateTime.ofInstant(((Date) value).toInstant(), ZoneOffset.UTC);
        }
        throw new UnresolvedFieldException(field,
                "Field '" + field + "' is not a timestamp (found " + value.getClass().getSimpleName() + ")");
    }

    /**
     * Reads a numeric field as a decimal.
     *
     * @return the value, or null if the field holds null
     * @throws UnresolvedFieldException if the field is absent or not numeric
     */
    public BigDecimal getNumber(String field) {
        Object value = get(field);
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Number) {
            return BigDecimal.valueOf(((Number) value).doubleValue());
        }
        throw new UnresolvedFieldException(field,
                "Field '" + field + "' is not numeric (found " + value.getClass().getSimpleName() + ")");
    }

    private Optional<String> findKey(String field) {
        if (field == null) {
            return Optional.empty();
        }
        if (fields.containsKey(field)) {
            return Optional.of(field);
        }
        return fields.keySet().stream()
                .filter(key -> key.equalsIgnoreCase(field))
                .findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return fields.equals(((TrendRecord) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "TrendRecord" + fields;
    }
}
