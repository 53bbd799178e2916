package com.schemalens.cli;

import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Map;

/** Runs the command tree in-process and captures what it prints. */
record CliRun(int exitCode, String out, String err) {

    static CliRun execute(Map<String, String> environment, String... args) {
        CommandLine cli = SchemaLensCli.commandLine(DialectRegistry.standard(), environment);
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(err));
        int exitCode = cli.execute(args);
        return new CliRun(exitCode, out.toString(), err.toString());
    }

    static CliRun execute(String... args) {
        return execute(Map.of(), args);
    }
}
