package com.schemalens.cli;

import com.schemalens.core.model.Engine;
import com.schemalens.dialects.jdbc.ConfigurationException;
import com.schemalens.dialects.jdbc.CatalogDataSources;
import com.schemalens.dialects.jdbc.ConnectionSettings;
import com.schemalens.dialects.jdbc.JdbcDialect;
import com.zaxxer.hikari.HikariDataSource;
import picocli.CommandLine.Option;

import java.util.Map;

/**
 * Connection options shared by {@code scrape} and {@code test-connection}. Host, port,
 * database, user and password fall back to {@code DB_HOST}, {@code DB_PORT}, {@code DB_NAME},
 * {@code DB_USER} and {@code DB_PASSWORD}; the JDBC URL falls back to {@code DB_CONNECTION_STRING}.
 */
public class ConnectionOptions {

    @Option(names = {"--db-type", "-t"}, defaultValue = "mssql",
            description = "Database type: sqlite, postgres, mysql, mssql or oracle (default: ${DEFAULT-VALUE})")
    String dbType;

    @Option(names = {"--host", "-H"}, description = "Database server hostname")
    String host;

    @Option(names = {"--port", "-P"}, description = "Database server port")
    Integer port;

    @Option(names = {"--database", "-d"}, description = "Database name, or the database file for SQLite")
    String database;

    @Option(names = {"--username", "-u"}, description = "Database username")
    String username;

    @Option(names = {"--password", "-p"}, description = "Database password")
    String password;

    @Option(names = {"--trusted"}, description = "Use integrated authentication (SQL Server only)")
    boolean trusted;

    @Option(names = {"--url", "-c"}, description = "Full JDBC URL, overriding host, port and database")
    String url;

    @Option(names = {"--service-name"}, description = "Oracle service name")
    String serviceName;

    @Option(names = {"--sid"}, description = "Oracle SID")
    String sid;

    /**
     * @throws ConfigurationException for an unknown database type
     */
    public Engine engine() {
        try {
            return Engine.fromId(dbType);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage());
        }
    }

    /**
     * Settings from the options, filling gaps from {@code environment}. Not validated.
     *
     * @throws ConfigurationException when {@code DB_PORT} is not a number
     */
    public ConnectionSettings settings(Map<String, String> environment) {
        Engine engine = engine();
        String db = firstNonBlank(database, environment.get("DB_NAME"));
        ConnectionSettings.Builder builder = ConnectionSettings.builder(engine)
                .host(firstNonBlank(host, environment.get("DB_HOST")))
                .port(port != null ? port : parsePort(environment.get("DB_PORT")))
                .database(db)
                .user(firstNonBlank(username, environment.get("DB_USER")))
                .password(firstNonBlank(password, environment.get("DB_PASSWORD")))
                .url(firstNonBlank(url, environment.get("DB_CONNECTION_STRING")))
                .serviceName(serviceName)
                .sid(sid)
                .trustedConnection(trusted);
        if (engine == Engine.SQLITE) {
            builder.path(db);
        }
        return builder.build();
    }

    /**
     * Opens a single-connection pool for {@code dialect}.
     *
     * @throws ConfigurationException when the driver is missing or a required setting is absent
     */
    public HikariDataSource open(JdbcDialect dialect, Map<String, String> environment) {
        if (!dialect.driverAvailable()) {
            throw new ConfigurationException("JDBC driver " + dialect.driverClass() + " for "
                    + dialect.engine().displayName() + " is not on the classpath");
        }
        return CatalogDataSources.open(dialect, settings(environment).validate(), 1);
    }

    private static Integer parsePort(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("DB_PORT is not a port number: " + value);
        }
    }

    private static String firstNonBlank(String option, String fallback) {
        if (option != null && !option.isBlank()) {
            return option;
        }
        return fallback == null || fallback.isBlank() ? null : fallback;
    }
}
