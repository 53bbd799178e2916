package com.schemalens.dialects.mssql;

import com.schemalens.core.adapter.DialectAdapter;
import com.schemalens.core.catalog.CatalogKind;
import com.schemalens.core.model.Engine;
import com.schemalens.dialects.jdbc.ConnectionSettings;
import com.schemalens.dialects.jdbc.JdbcDialect;
import com.zaxxer.hikari.HikariConfig;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class MssqlDialect implements JdbcDialect {
    private static final Map<CatalogKind, List<String>> QUERIES = new EnumMap<>(CatalogKind.class);

    static {
        QUERIES.put(CatalogKind.SCHEMAS, List.of(MssqlQueries.SCHEMAS));
        QUERIES.put(CatalogKind.TABLES, List.of(MssqlQueries.TABLES));
        QUERIES.put(CatalogKind.COLUMNS, List.of(MssqlQueries.COLUMNS));
        QUERIES.put(CatalogKind.PRIMARY_KEYS, List.of(MssqlQueries.PRIMARY_KEYS));
        QUERIES.put(CatalogKind.INDEXES, List.of(MssqlQueries.INDEXES));
        QUERIES.put(CatalogKind.FOREIGN_KEYS, List.of(MssqlQueries.FOREIGN_KEYS));
        QUERIES.put(CatalogKind.CHECKS, List.of(MssqlQueries.CHECKS));
        QUERIES.put(CatalogKind.VIEWS, List.of(MssqlQueries.VIEWS, MssqlQueries.VIEW_COLUMNS,
                MssqlQueries.VIEW_DEPENDENCIES));
        QUERIES.put(CatalogKind.ROUTINES, List.of(MssqlQueries.ROUTINES, MssqlQueries.ROUTINE_PARAMETERS,
                MssqlQueries.ROUTINE_RESULT_COLUMNS));
        QUERIES.put(CatalogKind.TRIGGERS, List.of(MssqlQueries.TRIGGERS));
        QUERIES.put(CatalogKind.TYPES, List.of(MssqlQueries.TYPES, MssqlQueries.TYPE_COLUMNS));
        QUERIES.put(CatalogKind.SEQUENCES, List.of(MssqlQueries.SEQUENCES));
        QUERIES.put(CatalogKind.SYNONYMS, List.of(MssqlQueries.SYNONYMS));
        QUERIES.put(CatalogKind.SECURITY, List.of(MssqlQueries.PRINCIPALS, MssqlQueries.GRANTS,
                MssqlQueries.MEMBERSHIPS));
    }

    private final MssqlAdapter adapter = new MssqlAdapter();

    @Override
    public Engine engine() {
        return Engine.MSSQL;
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
        return MssqlQueries.DESCRIBE;
    }

    @Override
    public String driverClass() {
        return "com.microsoft.sqlserver.jdbc.SQLServerDriver";
    }

    @Override
    public String jdbcUrl(ConnectionSettings settings) {
        if (settings.url() != null) {
            return settings.url();
        }
        StringBuilder url = new StringBuilder(String.format(
                "jdbc:sqlserver://%s:%d;databaseName=%s;encrypt=true;trustServerCertificate=true",
                settings.host(), settings.effectivePort(), settings.database()));
        if (settings.trustedConnection()) {
            url.append(";integratedSecurity=true");
        }
        return url.toString();
    }

    @Override
    public void configure(HikariConfig config) {
        config.setReadOnly(true);
        config.addDataSourceProperty("applicationName", "schemalens");
        config.addDataSourceProperty("applicationIntent", "ReadOnly");
    }
}
