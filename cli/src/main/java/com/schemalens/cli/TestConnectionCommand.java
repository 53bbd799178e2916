package com.schemalens.cli;

import com.schemalens.core.catalog.DatabaseInfo;
import com.schemalens.core.model.Engine;
import com.schemalens.dialects.jdbc.JdbcCatalogReader;
import com.schemalens.dialects.jdbc.JdbcDialect;
import com.zaxxer.hikari.HikariDataSource;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.sql.Connection;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "test-connection",
        description = "Connect to a database and report its name and server version",
        mixinStandardHelpOptions = true
)
public class TestConnectionCommand implements Callable<Integer> {
    private final DialectRegistry registry;
    private final Map<String, String> environment;

    @Spec
    CommandSpec spec;

    @Mixin
    ConnectionOptions connection;

    @Option(names = {"--verbose", "-v"}, description = "Increase verbosity (-v info, -vv debug)")
    boolean[] verbose = new boolean[0];

    public TestConnectionCommand(DialectRegistry registry, Map<String, String> environment) {
        this.registry = registry;
        this.environment = environment;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        Verbosity.apply(verbose);
        try {
            Engine engine = connection.engine();
            JdbcDialect dialect = registry.get(engine);
            out.println("Connecting to " + engine.displayName() + " database...");
            try (HikariDataSource dataSource = connection.open(dialect, environment);
                 Connection jdbc = dataSource.getConnection()) {
                DatabaseInfo info = new JdbcCatalogReader(jdbc, dialect).describe();
                out.println("Connection successful!");
                out.println();
                out.println("Database: " + info.database());
                out.println("Server version: " + info.version());
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
