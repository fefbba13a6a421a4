package com.ns.trend.config;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

public class TableDefinition {
    private List<Map<String, String>> schema; // [{colName: type}, ...]
    private transient List<ColumnDefinition> parsedSchema;

    public List<Map<String, String>> getSchema() {
        return schema;
    }

    public void setSchema(List<Map<String, String>> schema) {
        this.schema = schema;
        this.parsedSchema = parse(schema);
    }

    public List<ColumnDefinition> getParsedSchema() {
        if (parsedSchema == null && schema != null) { // Handle direct instantiation if needed
            this.parsedSchema = parse(schema);
        }
        return parsedSchema;
    }

    /**
     * Looks a column up by name, ignoring case.
     */
    public Optional<ColumnDefinition> findColumn(String name) {
        List<ColumnDefinition> columns = getParsedSchema();
        if (columns == null || name == null) {
            return Optional.empty();
        }
        return columns.stream()
                .filter(column -> column.getName().equalsIgnoreCase(name))
                .findFirst();
    }

    public List<String> getColumnNames() {
        List<ColumnDefinition> columns = getParsedSchema();
        if (columns == null) {
            return List.of();
        }
        return columns.stream().map(ColumnDefinition::getName).collect(Collectors.toList());
    }

    private static List<ColumnDefinition> parse(List<Map<String, String>> schema) {
        if (schema == null) {
            return null;
        }
        return schema.stream().map(colMap -> {
            ColumnDefinition cd = new ColumnDefinition();
            Map.Entry<String, String> entry = colMap.entrySet().iterator().next();
            cd.setName(entry.getKey());
            cd.setType(entry.getValue());
            return cd;
        }).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "Schema: " + (parsedSchema != null ? parsedSchema.toString() : "null");
    }
}
