package com.ns.trend;

import com.ns.trend.config.TableDefinition;
import com.ns.trend.config.TrendConfig;
import com.ns.trend.config.TrendDefaults;
import com.ns.trend.dialect.SqlDialect;
import com.ns.trend.dialect.SqlDialects;
import com.ns.trend.source.TrendSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.InputStream;
import java.util.Objects;

/**
 * Entry points for building trends. Every entry point takes its data source explicitly.
 *
 * <pre>
 * TrendSeries perDay = Trend.query(orders)
 *         .between(start, end)
 *         .perDay()
 *         .sum("amount");
 * </pre>
 */
public final class Trend {
    private static final Logger logger = LoggerFactory.getLogger(Trend.class);

    private Trend() {
    }

    /**
     * Starts a trend over {@code source}, picking the dialect from its backend name.
     */
    public static TrendBuilder query(TrendSource source) {
        Objects.requireNonNull(source, "source is null");
        return new TrendBuilder(source, SqlDialects.forBackend(source.getBackendName()));
    }

    public static TrendBuilder query(TrendSource source, SqlDialect dialect) {
        return new TrendBuilder(source, dialect);
    }

    /**
     * Starts a trend over {@code source} with the configured defaults and, when the config
     * describes the source's table, schema checks on the date and value columns.
     */
    public static TrendBuilder query(TrendSource source, TrendConfig config) {
        Objects.requireNonNull(source, "source is null");
        Objects.requireNonNull(config, "config is null");

        TrendDefaults defaults = config.getDefaults();
        SqlDialect dialect = defaults.getDialect() != null
                ? SqlDialects.forName(defaults.getDialect())
                : SqlDialects.forBackend(source.getBackendName());
        TableDefinition schema = config.findTable(source.getName()).orElse(null);
        if (schema == null) {
            logger.debug("No schema configured for source '{}' - field checks deferred to the records", source.getName());
        }
        return new TrendBuilder(source, dialect, defaults, schema);
    }

    public static TrendConfig loadConfig(String filename) {
        LoaderOptions opts = new LoaderOptions();
        opts.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(TrendConfig.class, opts));
        InputStream resource = Trend.class.getClassLoader().getResourceAsStream(filename);
        if (resource == null) {
            logger.error("Trend config '{}' not found in classpath", filename);
            throw new RuntimeException("Config file not found in classpath: " + filename);
        }
        try (InputStream in = resource) {
            TrendConfig config = yaml.load(in);
            logger.info("Loaded trend config '{}': defaults [{}], {} table schemas",
                    filename, config.getDefaults(), config.getTables().size());
            return config;
        } catch (Exception e) {
            logger.error("Failed to load trend config '{}': {}", filename, e.getMessage());
            throw new RuntimeException("Failed to load or parse config: " + filename, e);
        }
    }
}
