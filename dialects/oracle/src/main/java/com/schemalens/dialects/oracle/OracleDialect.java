package com.schemalens.dialects.oracle;

import com.schemalens.core.adapter.DialectAdapter;
import com.schemalens.core.catalog.CatalogKind;
import com.schemalens.core.model.Engine;
import com.schemalens.dialects.jdbc.ConnectionSettings;
import com.schemalens.dialects.jdbc.JdbcDialect;
import com.zaxxer.hikari.HikariConfig;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class OracleDialect implements JdbcDialect {
    private static final Map<CatalogKind, List<String>> QUERIES = new EnumMap<>(CatalogKind.class);

    static {
        QUERIES.put(CatalogKind.SCHEMAS, List.of(OracleQueries.SCHEMAS));
        QUERIES.put(CatalogKind.TABLES, List.of(OracleQueries.TABLES));
        QUERIES.put(CatalogKind.COLUMNS, List.of(OracleQueries.COLUMNS));
        QUERIES.put(CatalogKind.PRIMARY_KEYS, List.of(OracleQueries.PRIMARY_KEYS));
        QUERIES.put(CatalogKind.INDEXES, List.of(OracleQueries.INDEXES));
        QUERIES.put(CatalogKind.FOREIGN_KEYS, List.of(OracleQueries.FOREIGN_KEYS));
        QUERIES.put(CatalogKind.CHECKS, List.of(OracleQueries.CHECKS));
        QUERIES.put(CatalogKind.VIEWS, List.of(OracleQueries.VIEWS, OracleQueries.MATERIALIZED_VIEWS,
                OracleQueries.VIEW_COLUMNS, OracleQueries.VIEW_DEPENDENCIES));
        QUERIES.put(CatalogKind.ROUTINES, List.of(OracleQueries.ROUTINES, OracleQueries.ROUTINE_PARAMETERS,
                OracleQueries.ROUTINE_SOURCE));
        QUERIES.put(CatalogKind.TRIGGERS, List.of(OracleQueries.TRIGGERS));
        QUERIES.put(CatalogKind.TYPES, List.of(OracleQueries.TYPES, OracleQueries.TYPE_ATTRIBUTES));
        QUERIES.put(CatalogKind.SEQUENCES, List.of(OracleQueries.SEQUENCES));
        QUERIES.put(CatalogKind.SYNONYMS, List.of(OracleQueries.SYNONYMS));
        QUERIES.put(CatalogKind.SECURITY, List.of(OracleQueries.PRINCIPALS, OracleQueries.GRANTS,
                OracleQueries.MEMBERSHIPS));
    }

    private final OracleAdapter adapter = new OracleAdapter();

    @Override
    public Engine engine() {
        return Engine.ORACLE;
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
        return OracleQueries.DESCRIBE;
    }

    @Override
    public String driverClass() {
        return "oracle.jdbc.OracleDriver";
    }

    /** A SID uses the legacy {@code host:port:SID} form, a service name the {@code //host:port/service} one. */
    @Override
    public String jdbcUrl(ConnectionSettings settings) {
        if (settings.url() != null) {
            return settings.url();
        }
        if (settings.serviceName() == null && settings.sid() != null) {
            return String.format("jdbc:oracle:thin:@%s:%d:%s", settings.host(), settings.effectivePort(),
                    settings.sid());
        }
        String service = settings.serviceName() != null ? settings.serviceName() : settings.database();
        return String.format("jdbc:oracle:thin:@//%s:%d/%s", settings.host(), settings.effectivePort(), service);
    }

    @Override
    public void configure(HikariConfig config) {
        config.setReadOnly(true);
        config.addDataSourceProperty("v$session.program", "schemalens");
        config.addDataSourceProperty("oracle.jdbc.useFetchSizeWithLongColumn", "true");
    }
}
