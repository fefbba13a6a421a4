package com.ns.trend.config;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public class TrendConfig {
    private TrendDefaults defaults = new TrendDefaults();
    private Map<String, TableDefinition> tables = new HashMap<>();

    // Getters and Setters
    public TrendDefaults getDefaults() { return defaults; }
    public void setDefaults(TrendDefaults defaults) { this.defaults = defaults != null ? defaults : new TrendDefaults(); }
    public Map<String, TableDefinition> getTables() { return tables; }
    public void setTables(Map<String, TableDefinition> tables) { this.tables = tables != null ? tables : new HashMap<>(); }

    /**
     * Finds the schema of a source by name, ignoring case.
     */
    public Optional<TableDefinition> findTable(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return tables.entrySet().stream()
                .filter(entry -> entry.getKey().equalsIgnoreCase(name))
                .map(Map.Entry::getValue)
                .findFirst();
    }
}
