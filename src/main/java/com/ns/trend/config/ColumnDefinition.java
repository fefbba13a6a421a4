package com.ns.trend.config;

import java.util.Locale;
import java.util.Set;

public class ColumnDefinition {
    private static final Set<String> TEMPORAL_TYPES = Set.of("timestamp", "datetime", "date", "timestamptz", "datetime2");
    private static final Set<String> NUMERIC_TYPES = Set.of(
        "tinyint", "smallint", "int", "integer", "bigint", "decimal", "numeric", "real", "float", "double", "money"
    );

    private String name;
    private String type;

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public boolean isTemporal() {
        return TEMPORAL_TYPES.contains(baseType());
    }

    public boolean isNumeric() {
        return NUMERIC_TYPES.contains(baseType());
    }

    // "decimal(10,2)" -> "decimal"
    private String baseType() {
        if (type == null) {
            return "";
        }
        String normalized = type.toLowerCase(Locale.ROOT).trim();
        int paren = normalized.indexOf('(');
        return paren >= 0 ? normalized.substring(0, paren).trim() : normalized;
    }

    @Override
    public String toString() {
        return name + ":" + type;
    }
}
