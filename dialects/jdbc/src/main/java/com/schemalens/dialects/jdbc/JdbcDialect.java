package com.schemalens.dialects.jdbc;

import com.schemalens.core.adapter.DialectAdapter;
import com.schemalens.core.catalog.CatalogKind;
import com.schemalens.core.catalog.DatabaseInfo;
import com.schemalens.core.catalog.RawRow;
import com.schemalens.core.model.Engine;
import com.zaxxer.hikari.HikariConfig;

import java.util.List;
import java.util.Map;

/**
 * Everything needed to document one engine over JDBC: how to connect, which catalog
 * queries to run and which adapter interprets their rows.
 */
public interface JdbcDialect {
    Engine engine();

    DialectAdapter adapter();

    /**
     * Catalog queries per capability. Several queries for one capability have their rows
     * concatenated; a capability without queries is not applicable.
     */
    Map<CatalogKind, List<String>> queries();

    /** Single-row query returning {@code database_name}, {@code version} and {@code default_schema}. */
    String describeQuery();

    String driverClass();

    String jdbcUrl(ConnectionSettings settings);

    default DatabaseInfo describe(RawRow row) {
        return new DatabaseInfo(row.string("database_name"), row.string("version"), row.string("default_schema"));
    }

    /** Applies engine-specific pool settings. Connections are read-only unless the driver cannot switch. */
    default void configure(HikariConfig config) {
        config.setReadOnly(true);
    }

    default boolean driverAvailable() {
        try {
            Class.forName(driverClass());
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }
}
