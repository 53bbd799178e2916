package com.schemalens.cli;

import com.schemalens.core.catalog.CatalogDump;
import com.schemalens.core.catalog.CatalogReader;
import com.schemalens.core.catalog.DumpCatalogReader;
import com.schemalens.core.catalog.RecordingCatalogReader;
import com.schemalens.core.extract.ExtractionConfig;
import com.schemalens.core.extract.SchemaExtractor;
import com.schemalens.core.model.Engine;
import com.schemalens.core.model.ObjectType;
import com.schemalens.core.model.SchemaSnapshot;
import com.schemalens.dialects.jdbc.ConfigurationException;
import com.schemalens.dialects.jdbc.JdbcCatalogReader;
import com.schemalens.dialects.jdbc.JdbcDialect;
import com.schemalens.render.Document;
import com.schemalens.render.MarkdownRenderer;
import com.schemalens.render.SnapshotJson;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@Command(
        name = "scrape",
        description = "Extract a database schema and write Markdown documentation",
        mixinStandardHelpOptions = true
)
public class ScrapeCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(ScrapeCommand.class);

    private final DialectRegistry registry;
    private final Map<String, String> environment;

    @Spec
    CommandSpec spec;

    @Mixin
    ConnectionOptions connection;

    @Option(names = {"--output", "-o"}, defaultValue = "./schema_docs",
            description = "Output base directory; the database name is appended (default: ${DEFAULT-VALUE})")
    Path output;

    @Option(names = {"--schemas"}, split = ",", description = "Include only these schemas")
    List<String> schemas = new ArrayList<>();

    @Option(names = {"--exclude-schemas"}, split = ",", description = "Exclude these schemas")
    List<String> excludeSchemas = new ArrayList<>();

    @Option(names = {"--object-types"}, split = ",",
            description = "Object types to extract: tables, views, procedures, functions, triggers, types, "
                    + "sequences, synonyms, security or all (default: all)")
    List<String> objectTypes = new ArrayList<>();

    @Option(names = {"--dry-run"}, description = "Render without writing files")
    boolean dryRun;

    @Option(names = {"--json"}, description = "Also write snapshot.json")
    boolean json;

    @Option(names = {"--dump-catalog"}, description = "Save the raw catalog rows read from the database to this file")
    Path dumpCatalog;

    @Option(names = {"--from-dump"}, description = "Extract from a catalog dump instead of a live database")
    Path fromDump;

    @Option(names = {"--verbose", "-v"}, description = "Increase verbosity (-v info, -vv debug)")
    boolean[] verbose = new boolean[0];

    public ScrapeCommand(DialectRegistry registry, Map<String, String> environment) {
        this.registry = registry;
        this.environment = environment;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        Verbosity.apply(verbose);
        try {
            ExtractionConfig config = ExtractionConfig.builder()
                    .includeSchemas(schemas)
                    .excludeSchemas(excludeSchemas)
                    .objectTypes(objectTypes)
                    .build();

            SchemaSnapshot snapshot = fromDump != null ? extractFromDump(config, out) : extractLive(config, out);
            for (ObjectType type : snapshot.presentTypes()) {
                out.println("  Found " + snapshot.count(type) + " " + type.id());
            }
            if (!snapshot.warnings().isEmpty()) {
                out.println("  " + snapshot.warnings().size() + " warnings, see README.md");
            }

            out.println("Generating markdown documentation...");
            List<Document> documents = new ArrayList<>(new MarkdownRenderer().render(snapshot));
            if (json) {
                documents.add(SnapshotJson.document(snapshot));
            }

            DocumentWriter writer = new DocumentWriter(output.resolve(DocumentWriter.directoryName(snapshot.database())));
            if (dryRun) {
                documents.forEach(d -> logger.info("Would write {}", d.path()));
                out.println();
                out.println("[DRY RUN] Would create " + documents.size() + " files in " + writer.root());
            } else {
                writer.write(documents);
                out.println();
                out.println("Created " + documents.size() + " files in " + writer.root());
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            logger.debug("scrape failed", e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private SchemaSnapshot extractFromDump(ExtractionConfig config, PrintWriter out) throws Exception {
        if (dumpCatalog != null) {
            throw new ConfigurationException("--dump-catalog cannot be combined with --from-dump");
        }
        CatalogDump dump = CatalogDump.read(fromDump);
        if (dump.engine() == null) {
            throw new ConfigurationException("Catalog dump " + fromDump + " does not name its engine");
        }
        JdbcDialect dialect = registry.get(dump.engine());
        out.println("Extracting " + dump.engine().displayName() + " catalog from " + fromDump + "...");
        return new SchemaExtractor().extract(dialect.adapter(), new DumpCatalogReader(dump), config);
    }

    private SchemaSnapshot extractLive(ExtractionConfig config, PrintWriter out) throws Exception {
        Engine engine = connection.engine();
        JdbcDialect dialect = registry.get(engine);
        out.println("Connecting to " + engine.displayName() + " database...");
        try (HikariDataSource dataSource = connection.open(dialect, environment);
             Connection jdbc = dataSource.getConnection()) {
            CatalogReader reader = new JdbcCatalogReader(jdbc, dialect);
            RecordingCatalogReader recorder = dumpCatalog != null ? new RecordingCatalogReader(reader) : null;
            out.println("Extracting " + config.selection().types().stream()
                    .map(ObjectType::id)
                    .collect(Collectors.joining(", ")) + "...");
            SchemaSnapshot snapshot = new SchemaExtractor()
                    .extract(dialect.adapter(), recorder != null ? recorder : reader, config);
            if (recorder != null) {
                recorder.dump(engine).write(dumpCatalog);
                out.println("Catalog dump written to " + dumpCatalog.toAbsolutePath());
            }
            return snapshot;
        }
    }
}
