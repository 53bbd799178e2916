package com.schemalens.core.model;

import java.util.Locale;
import java.util.Set;

/**
 * The database engines a snapshot can describe, with their connection defaults and the
 * system schemas left out unless a schema include list names them.
 */
public enum Engine {
    SQLITE("sqlite", "SQLite", 0, Set.of()),
    POSTGRES("postgres", "PostgreSQL", 5432,
            Set.of("pg_catalog", "information_schema", "pg_toast")),
    MYSQL("mysql", "MySQL", 3306,
            Set.of("information_schema", "performance_schema", "mysql", "sys")),
    MSSQL("mssql", "SQL Server", 1433,
            Set.of("sys", "information_schema", "guest", "db_owner", "db_accessadmin", "db_securityadmin",
                    "db_ddladmin", "db_backupoperator", "db_datareader", "db_datawriter", "db_denydatareader",
                    "db_denydatawriter")),
    ORACLE("oracle", "Oracle", 1521,
            Set.of("sys", "system", "outln", "dbsnmp", "appqossys", "audsys", "ctxsys", "dvsys", "dvf",
                    "gsmadmin_internal", "lbacsys", "mdsys", "ojvmsys", "olapsys", "orddata", "ordsys",
                    "ordplugins", "si_informtn_schema", "wmsys", "xdb", "anonymous", "gsmcatuser",
                    "gsmuser", "remote_scheduler_agent", "sysbackup", "sysdg", "syskm", "sysrac",
                    "dip", "xs$null", "mddata", "ggsys", "gsmrootuser", "pdbadmin"));

    private final String id;
    private final String displayName;
    private final int defaultPort;
    private final Set<String> excludedSchemas;

    Engine(String id, String displayName, int defaultPort, Set<String> excludedSchemas) {
        this.id = id;
        this.displayName = displayName;
        this.defaultPort = defaultPort;
        this.excludedSchemas = excludedSchemas;
    }

    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public int defaultPort() {
        return defaultPort;
    }

    /** Lower-cased names of system schemas hidden by default. */
    public Set<String> excludedSchemas() {
        return excludedSchemas;
    }

    public static Engine fromId(String id) {
        String wanted = id.trim().toLowerCase(Locale.ROOT);
        for (Engine engine : values()) {
            if (engine.id.equals(wanted)) {
                return engine;
            }
        }
        return switch (wanted) {
            case "postgresql", "pg" -> POSTGRES;
            case "sqlserver" -> MSSQL;
            case "mariadb" -> MYSQL;
            default -> throw new IllegalArgumentException("Unknown dialect: " + id);
        };
    }
}
