package com.schemalens.cli;

import com.schemalens.core.adapter.DialectAdapter;
import com.schemalens.core.catalog.CatalogKind;
import com.schemalens.core.model.ObjectType;
import com.schemalens.dialects.jdbc.JdbcDialect;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Lists the registered engines with their default port, JDBC driver and the object types
 * each can document.
 */
@Command(
        name = "dialects",
        description = "List supported database engines, their drivers and documented object types",
        mixinStandardHelpOptions = true
)
public class DialectsCommand implements Callable<Integer> {
    private final DialectRegistry registry;

    @Spec
    CommandSpec spec;

    @Option(names = {"--db-type", "-t"}, description = "Show a single database type")
    String dbType;

    public DialectsCommand(DialectRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            List<JdbcDialect> dialects = dbType == null
                    ? new ArrayList<>(registry.all())
                    : List.of(registry.get(dbType));
            for (JdbcDialect dialect : dialects) {
                out.println(describe(dialect));
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    static String describe(JdbcDialect dialect) {
        DialectAdapter adapter = dialect.adapter();
        List<String> supported = new ArrayList<>();
        List<String> unsupported = new ArrayList<>();
        for (ObjectType type : ObjectType.values()) {
            (adapter.supports(CatalogKind.producing(type)) ? supported : unsupported).add(type.id());
        }
        int port = dialect.engine().defaultPort();
        StringBuilder text = new StringBuilder()
                .append(dialect.engine().displayName()).append(" (").append(dialect.engine().id()).append(")\n")
                .append("  Default port: ").append(port == 0 ? "-" : String.valueOf(port)).append('\n')
                .append("  Driver: ").append(dialect.driverClass())
                .append(dialect.driverAvailable() ? " (available)" : " (not installed)").append('\n')
                .append("  Object types: ").append(String.join(", ", supported));
        if (!unsupported.isEmpty()) {
            text.append('\n').append("  Not applicable: ").append(String.join(", ", unsupported));
        }
        return text.toString();
    }
}
