package com.ns.trend.dialect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Resolves the {@link SqlDialect} for a backend.
 */
public final class SqlDialects {
    private static final Logger logger = LoggerFactory.getLogger(SqlDialects.class);

    public static final SqlDialect DEFAULT = TSqlDialect.INSTANCE;

    private static final List<SqlDialect> ALL = List.of(
        TSqlDialect.INSTANCE, MySqlDialect.INSTANCE, PostgresDialect.INSTANCE, SqliteDialect.INSTANCE
    );

    private SqlDialects() {
    }

    public static List<SqlDialect> all() {
        return ALL;
    }

    /**
     * Picks the dialect from a backend identifier reported by the data source, such as a JDBC
     * product name or a provider class name. Matching is a case-insensitive substring test;
     * unrecognized or missing identifiers fall back to T-SQL.
     */
    public static SqlDialect forBackend(String backendName) {
        String name = backendName == null ? "" : backendName.toLowerCase(Locale.ROOT);

        SqlDialect dialect;
        if (name.contains("sqlserver") || name.contains("sql server")) {
            dialect = TSqlDialect.INSTANCE;
        } else if (name.contains("mysql") || name.contains("mariadb")) {
            dialect = MySqlDialect.INSTANCE;
        } else if (name.contains("sqlite")) {
            dialect = SqliteDialect.INSTANCE;
        } else if (name.contains("postgresql") || name.contains("npgsql")) {
            dialect = PostgresDialect.INSTANCE;
        } else {
            logger.debug("Unrecognized backend '{}' - defaulting to {}", backendName, DEFAULT.name());
            dialect = DEFAULT;
        }
        logger.debug("Backend '{}' resolved to dialect {}", backendName, dialect.name());
        return dialect;
    }

    /**
     * Resolves a configured dialect name.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static SqlDialect forName(String dialectName) {
        if (dialectName == null) {
            throw new IllegalArgumentException("Dialect name cannot be null");
        }

        switch (dialectName.toLowerCase(Locale.ROOT).trim()) {
            case "tsql":
            case "t-sql":
            case "sqlserver":
                return TSqlDialect.INSTANCE;
            case "mysql":
            case "mariadb":
                return MySqlDialect.INSTANCE;
            case "postgres":
            case "postgresql":
                return PostgresDialect.INSTANCE;
            case "sqlite":
                return SqliteDialect.INSTANCE;
            default:
                throw new IllegalArgumentException("Unknown SQL dialect: '" + dialectName + "'");
        }
    }
}
