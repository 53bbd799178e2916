package com.schemalens.cli;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;

class SchemaLensCliTest {

    @TempDir
    Path dir;

    @Test
    void noSubcommandPrintsUsage() {
        CliRun run = CliRun.execute();

        assertEquals(0, run.exitCode());
        assertTrue(run.out().contains("scrape"), run.out());
        assertTrue(run.out().contains("test-connection"), run.out());
        assertTrue(run.out().contains("dialects"), run.out());
    }

    @Test
    void dialectsListsEveryEngineWithItsObjectTypes() {
        CliRun run = CliRun.execute("dialects");

        assertEquals(0, run.exitCode(), run.err());
        assertTrue(run.out().contains("SQLite (sqlite)"), run.out());
        assertTrue(run.out().contains("PostgreSQL (postgres)"), run.out());
        assertTrue(run.out().contains("SQL Server (mssql)"), run.out());
        assertTrue(run.out().contains("Default port: 1521"), run.out());
    }

    @Test
    void dialectsReportsWhatSqliteCannotDocument() {
        CliRun run = CliRun.execute("dialects", "-t", "sqlite");

        assertEquals(0, run.exitCode(), run.err());
        assertFalse(run.out().contains("MySQL"), run.out());
        assertTrue(run.out().contains("Default port: -"), run.out());
        assertTrue(run.out().contains("Driver: org.sqlite.JDBC (available)"), run.out());
        assertTrue(run.out().contains("Object types: tables, views, triggers"), run.out());
        assertTrue(run.out().contains("Not applicable: procedures, functions, types, sequences, synonyms, security"),
                run.out());
    }

    @Test
    void dialectsRejectsAnUnknownType() {
        CliRun run = CliRun.execute("dialects", "-t", "db2");

        assertEquals(1, run.exitCode());
        assertEquals("Error: Unknown dialect: db2", run.err().strip());
    }

    @Test
    void testConnectionReportsDatabaseAndVersion() throws SQLException {
        Path database = dir.resolve("ledger.db");
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + database);
             Statement stmt = connection.createStatement()) {
            stmt.executeUpdate("CREATE TABLE accounts (id INTEGER PRIMARY KEY)");
        }

        CliRun run = CliRun.execute("test-connection", "-t", "sqlite", "-d", database.toString());

        assertEquals(0, run.exitCode(), run.err());
        assertTrue(run.out().contains("Connection successful!"), run.out());
        assertTrue(run.out().contains("Database: ledger"), run.out());
        assertTrue(run.out().contains("Server version: "), run.out());
    }

    @Test
    void testConnectionFailureExitsWithOne() {
        CliRun run = CliRun.execute("test-connection", "-t", "mssql", "-H", "localhost", "-d", "app");

        assertEquals(1, run.exitCode());
        assertTrue(run.err().startsWith("Error: Either a trusted connection"), run.err());
    }

    @Test
    void verbosityFlagsMapToLogLevels() {
        assertEquals(Level.WARN, Verbosity.level(new boolean[0]));
        assertEquals(Level.INFO, Verbosity.level(new boolean[] {true}));
        assertEquals(Level.DEBUG, Verbosity.level(new boolean[] {true, true}));
    }
}
