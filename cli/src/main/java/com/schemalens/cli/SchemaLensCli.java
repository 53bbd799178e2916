package com.schemalens.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.Map;

@Command(
        name = "schemalens",
        description = "Document database schemas as cross-linked Markdown. "
                + "Supports SQLite, PostgreSQL, MySQL, SQL Server and Oracle.",
        mixinStandardHelpOptions = true,
        version = "0.1.0"
)
public class SchemaLensCli implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    /** The command tree, with every command sharing {@code registry} and {@code environment}. */
    public static CommandLine commandLine(DialectRegistry registry, Map<String, String> environment) {
        return new CommandLine(new SchemaLensCli())
                .addSubcommand(new ScrapeCommand(registry, environment))
                .addSubcommand(new TestConnectionCommand(registry, environment))
                .addSubcommand(new DialectsCommand(registry));
    }

    public static void main(String[] args) {
        int exitCode = commandLine(DialectRegistry.standard(), System.getenv()).execute(args);
        System.exit(exitCode);
    }
}
