package com.schemalens.dialects.postgres;

import com.schemalens.core.adapter.DialectAdapter;
import com.schemalens.core.catalog.CatalogKind;
import com.schemalens.core.model.Engine;
import com.schemalens.dialects.jdbc.ConnectionSettings;
import com.schemalens.dialects.jdbc.JdbcDialect;
import com.zaxxer.hikari.HikariConfig;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class PostgresDialect implements JdbcDialect {
    private static final Map<CatalogKind, List<String>> QUERIES = new EnumMap<>(CatalogKind.class);

    static {
        QUERIES.put(CatalogKind.SCHEMAS, List.of(PostgresQueries.SCHEMAS));
        QUERIES.put(CatalogKind.TABLES, List.of(PostgresQueries.TABLES));
        QUERIES.put(CatalogKind.COLUMNS, List.of(PostgresQueries.COLUMNS));
        QUERIES.put(CatalogKind.PRIMARY_KEYS, List.of(PostgresQueries.PRIMARY_KEYS));
        QUERIES.put(CatalogKind.INDEXES, List.of(PostgresQueries.INDEXES));
        QUERIES.put(CatalogKind.FOREIGN_KEYS, List.of(PostgresQueries.FOREIGN_KEYS));
        QUERIES.put(CatalogKind.CHECKS, List.of(PostgresQueries.CHECKS));
        QUERIES.put(CatalogKind.VIEWS, List.of(PostgresQueries.VIEWS, PostgresQueries.VIEW_COLUMNS,
                PostgresQueries.VIEW_DEPENDENCIES));
        QUERIES.put(CatalogKind.ROUTINES, List.of(PostgresQueries.ROUTINES, PostgresQueries.ROUTINE_ARGUMENTS));
        QUERIES.put(CatalogKind.TRIGGERS, List.of(PostgresQueries.TRIGGERS));
        QUERIES.put(CatalogKind.TYPES, List.of(PostgresQueries.TYPES, PostgresQueries.TYPE_ATTRIBUTES,
                PostgresQueries.ENUM_VALUES));
        QUERIES.put(CatalogKind.SEQUENCES, List.of(PostgresQueries.SEQUENCES));
        QUERIES.put(CatalogKind.SECURITY, List.of(PostgresQueries.PRINCIPALS, PostgresQueries.GRANTS,
                PostgresQueries.MEMBERSHIPS));
    }

    private final PostgresAdapter adapter = new PostgresAdapter();

    @Override
    public Engine engine() {
        return Engine.POSTGRES;
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
        return PostgresQueries.DESCRIBE;
    }

    @Override
    public String driverClass() {
        return "org.postgresql.Driver";
    }

    @Override
    public String jdbcUrl(ConnectionSettings settings) {
        if (settings.url() != null) {
            return settings.url();
        }
        return String.format("jdbc:postgresql://%s:%d/%s", settings.host(), settings.effectivePort(),
                settings.database());
    }

    @Override
    public void configure(HikariConfig config) {
        config.setReadOnly(true);
        config.addDataSourceProperty("ApplicationName", "schemalens");
    }
}
