package com.schemalens.cli;

import com.schemalens.core.model.Engine;
import com.schemalens.dialects.jdbc.ConfigurationException;
import com.schemalens.dialects.jdbc.JdbcDialect;
import com.schemalens.dialects.mssql.MssqlDialect;
import com.schemalens.dialects.mysql.MysqlDialect;
import com.schemalens.dialects.oracle.OracleDialect;
import com.schemalens.dialects.postgres.PostgresDialect;
import com.schemalens.dialects.sqlite.SqliteDialect;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The dialects a command may use, one per engine. Built once in {@link SchemaLensCli#main}
 * and handed to the commands.
 */
public final class DialectRegistry {
    private final Map<Engine, JdbcDialect> dialects;

    public DialectRegistry(Collection<? extends JdbcDialect> dialects) {
        Map<Engine, JdbcDialect> byEngine = new EnumMap<>(Engine.class);
        for (JdbcDialect dialect : dialects) {
            if (byEngine.putIfAbsent(dialect.engine(), dialect) != null) {
                throw new IllegalArgumentException("Dialect registered twice for " + dialect.engine().displayName());
            }
        }
        this.dialects = Collections.unmodifiableMap(byEngine);
    }

    public static DialectRegistry standard() {
        return new DialectRegistry(List.of(
                new SqliteDialect(),
                new PostgresDialect(),
                new MysqlDialect(),
                new MssqlDialect(),
                new OracleDialect()));
    }

    /**
     * @throws ConfigurationException when no dialect is registered for {@code engine}
     */
    public JdbcDialect get(Engine engine) {
        JdbcDialect dialect = dialects.get(engine);
        if (dialect == null) {
            throw new ConfigurationException("No dialect available for " + engine.displayName());
        }
        return dialect;
    }

    /**
     * @throws ConfigurationException for an unknown engine name
     */
    public JdbcDialect get(String engineId) {
        try {
            return get(Engine.fromId(engineId));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage());
        }
    }

    /** Registered dialects in engine order. */
    public Collection<JdbcDialect> all() {
        return dialects.values();
    }
}
