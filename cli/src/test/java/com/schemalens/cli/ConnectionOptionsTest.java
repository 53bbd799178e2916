package com.schemalens.cli;

import com.schemalens.core.model.Engine;
import com.schemalens.dialects.jdbc.ConfigurationException;
import com.schemalens.dialects.jdbc.ConnectionSettings;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionOptionsTest {

    private static final Map<String, String> ENV = Map.of(
            "DB_HOST", "db.internal",
            "DB_PORT", "6543",
            "DB_NAME", "inventory",
            "DB_USER", "reader",
            "DB_PASSWORD", "secret");

    private static ConnectionOptions parse(String... args) {
        ConnectionOptions options = new ConnectionOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }

    @Test
    void defaultsToSqlServer() {
        assertEquals(Engine.MSSQL, parse().engine());
    }

    @Test
    void environmentFillsUnsetOptions() {
        ConnectionSettings settings = parse("-t", "postgresql").settings(ENV);

        assertEquals(Engine.POSTGRES, settings.engine());
        assertEquals("db.internal", settings.host());
        assertEquals(6543, settings.effectivePort());
        assertEquals("inventory", settings.database());
        assertEquals("reader", settings.user());
        assertEquals("secret", settings.password());
    }

    @Test
    void optionsWinOverEnvironment() {
        ConnectionSettings settings = parse("-t", "mysql", "-H", "localhost", "-P", "3307", "-d", "shop",
                "-u", "root").settings(ENV);

        assertEquals("localhost", settings.host());
        assertEquals(3307, settings.effectivePort());
        assertEquals("shop", settings.database());
        assertEquals("root", settings.user());
        assertEquals("secret", settings.password());
    }

    @Test
    void portFallsBackToTheEngineDefault() {
        assertEquals(1521, parse("-t", "oracle").settings(Map.of()).effectivePort());
    }

    @Test
    void sqliteDatabaseIsTheFilePath() {
        ConnectionSettings settings = parse("-t", "sqlite", "-d", "/tmp/app.db").settings(Map.of());

        assertEquals("/tmp/app.db", settings.path());
    }

    @Test
    void oracleServiceNameAndSidPassThrough() {
        ConnectionSettings settings = parse("-t", "oracle", "--service-name", "ORCLPDB1").settings(ENV);

        assertEquals("ORCLPDB1", settings.serviceName());
        assertNull(settings.sid());
    }

    @Test
    void blankEnvironmentValuesAreIgnored() {
        ConnectionSettings settings = parse("-t", "postgres").settings(Map.of("DB_HOST", " ", "DB_PORT", ""));

        assertNull(settings.host());
        assertNull(settings.port());
    }

    @Test
    void rejectsANonNumericPort() {
        ConnectionOptions options = parse("-t", "postgres");

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> options.settings(Map.of("DB_PORT", "fivefour")));
        assertTrue(e.getMessage().contains("DB_PORT"));
    }

    @Test
    void rejectsAnUnknownEngine() {
        assertThrows(ConfigurationException.class, () -> parse("-t", "informix").engine());
    }
}
