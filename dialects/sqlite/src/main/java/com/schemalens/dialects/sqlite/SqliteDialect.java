package com.schemalens.dialects.sqlite;

import com.schemalens.core.adapter.DialectAdapter;
import com.schemalens.core.catalog.CatalogKind;
import com.schemalens.core.catalog.DatabaseInfo;
import com.schemalens.core.catalog.RawRow;
import com.schemalens.core.model.Engine;
import com.schemalens.dialects.jdbc.ConnectionSettings;
import com.schemalens.dialects.jdbc.JdbcDialect;
import com.zaxxer.hikari.HikariConfig;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class SqliteDialect implements JdbcDialect {
    private static final Map<CatalogKind, List<String>> QUERIES = new EnumMap<>(Map.of(
            CatalogKind.SCHEMAS, List.of(SqliteQueries.SCHEMAS),
            CatalogKind.TABLES, List.of(SqliteQueries.TABLES),
            CatalogKind.COLUMNS, List.of(SqliteQueries.COLUMNS),
            CatalogKind.PRIMARY_KEYS, List.of(SqliteQueries.PRIMARY_KEYS),
            CatalogKind.INDEXES, List.of(SqliteQueries.INDEXES),
            CatalogKind.FOREIGN_KEYS, List.of(SqliteQueries.FOREIGN_KEYS),
            CatalogKind.VIEWS, List.of(SqliteQueries.VIEWS, SqliteQueries.VIEW_COLUMNS),
            CatalogKind.TRIGGERS, List.of(SqliteQueries.TRIGGERS)));

    private final SqliteAdapter adapter = new SqliteAdapter();

    @Override
    public Engine engine() {
        return Engine.SQLITE;
    }

    @Override
    public DialectAdapter adapter() {
        return adapter;
    }

    @Override
    public Map<CatalogKind, List<String>> queries() {
        return QUERIES;
    }

    @Override
    public String describeQuery() {
        return SqliteQueries.DESCRIBE;
    }

    /** The database is named after its file, without extension; in-memory databases are {@code memory}. */
    @Override
    public DatabaseInfo describe(RawRow row) {
        String file = row.text("database_name");
        String name = "memory";
        if (file != null) {
            name = Path.of(file).getFileName().toString();
            int dot = name.lastIndexOf('.');
            if (dot > 0) {
                name = name.substring(0, dot);
            }
        }
        return new DatabaseInfo(name, row.string("version"), "main");
    }

    @Override
    public String driverClass() {
        return "org.sqlite.JDBC";
    }

    @Override
    public String jdbcUrl(ConnectionSettings settings) {
        if (settings.url() != null) {
            return settings.url();
        }
        return "jdbc:sqlite:" + (settings.path() != null ? settings.path() : settings.database());
    }

    /** The driver cannot switch an open connection to read-only, so the file is opened read-only. */
    @Override
    public void configure(HikariConfig config) {
        config.addDataSourceProperty("open_mode", "1");
        config.setReadOnly(true);
        config.setMaximumPoolSize(1);
    }
}
