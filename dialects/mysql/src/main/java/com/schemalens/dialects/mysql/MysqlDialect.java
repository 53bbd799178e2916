package com.schemalens.dialects.mysql;

import com.schemalens.core.adapter.DialectAdapter;
import com.schemalens.core.catalog.CatalogKind;
import com.schemalens.core.model.Engine;
import com.schemalens.dialects.jdbc.ConnectionSettings;
import com.schemalens.dialects.jdbc.JdbcDialect;
import com.zaxxer.hikari.HikariConfig;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class MysqlDialect implements JdbcDialect {
    private static final Map<CatalogKind, List<String>> QUERIES = new EnumMap<>(CatalogKind.class);

    static {
        QUERIES.put(CatalogKind.SCHEMAS, List.of(MysqlQueries.SCHEMAS));
        QUERIES.put(CatalogKind.TABLES, List.of(MysqlQueries.TABLES));
        QUERIES.put(CatalogKind.COLUMNS, List.of(MysqlQueries.COLUMNS));
        QUERIES.put(CatalogKind.PRIMARY_KEYS, List.of(MysqlQueries.PRIMARY_KEYS));
        QUERIES.put(CatalogKind.INDEXES, List.of(MysqlQueries.INDEXES));
        QUERIES.put(CatalogKind.FOREIGN_KEYS, List.of(MysqlQueries.FOREIGN_KEYS));
        QUERIES.put(CatalogKind.CHECKS, List.of(MysqlQueries.CHECKS));
        QUERIES.put(CatalogKind.VIEWS, List.of(MysqlQueries.VIEWS, MysqlQueries.VIEW_COLUMNS,
                MysqlQueries.VIEW_DEPENDENCIES));
        QUERIES.put(CatalogKind.ROUTINES, List.of(MysqlQueries.ROUTINES, MysqlQueries.ROUTINE_PARAMETERS));
        QUERIES.put(CatalogKind.TRIGGERS, List.of(MysqlQueries.TRIGGERS));
        QUERIES.put(CatalogKind.SECURITY, List.of(MysqlQueries.PRINCIPALS, MysqlQueries.GRANTS,
                MysqlQueries.MEMBERSHIPS));
    }

    private final MysqlAdapter adapter = new MysqlAdapter();

    @Override
    public Engine engine() {
        return Engine.MYSQL;
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
        return MysqlQueries.DESCRIBE;
    }

    @Override
    public String driverClass() {
        return "com.mysql.cj.jdbc.Driver";
    }

    @Override
    public String jdbcUrl(ConnectionSettings settings) {
        if (settings.url() != null) {
            return settings.url();
        }
        return String.format("jdbc:mysql://%s:%d/%s", settings.host(), settings.effectivePort(),
                settings.database());
    }

    @Override
    public void configure(HikariConfig config) {
        config.setReadOnly(true);
        config.addDataSourceProperty("connectionAttributes", "program_name:schemalens");
        config.addDataSourceProperty("useInformationSchema", "true");
    }
}
