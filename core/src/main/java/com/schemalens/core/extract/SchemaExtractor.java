package com.schemalens.core.extract;

import com.schemalens.core.adapter.DialectAdapter;
import com.schemalens.core.adapter.Warnings;
import com.schemalens.core.catalog.CatalogKind;
import com.schemalens.core.catalog.CatalogReader;
import com.schemalens.core.catalog.CatalogRows;
import com.schemalens.core.catalog.DatabaseInfo;
import com.schemalens.core.catalog.QueryFailureException;
import com.schemalens.core.catalog.RawRow;
import com.schemalens.core.graph.GraphBuilder;
import com.schemalens.core.model.Engine;
import com.schemalens.core.model.Identifier;
import com.schemalens.core.model.ModelIntegrityException;
import com.schemalens.core.model.ObjectType;
import com.schemalens.core.model.RelationshipGraph;
import com.schemalens.core.model.Routine;
import com.schemalens.core.model.RoutineKind;
import com.schemalens.core.model.SchemaObjects;
import com.schemalens.core.model.SchemaSnapshot;
import com.schemalens.core.model.SecurityPrincipal;
import com.schemalens.core.model.Sequence;
import com.schemalens.core.model.Synonym;
import com.schemalens.core.model.Table;
import com.schemalens.core.model.Trigger;
import com.schemalens.core.model.UserDefinedType;
import com.schemalens.core.model.View;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Turns a dialect's raw catalog rows into a linked {@link SchemaSnapshot}.
 *
 * <p>Catalog reads happen one after another on the calling thread. A failed read of
 * {@link CatalogKind#SCHEMAS} or {@link CatalogKind#TABLES} aborts the run; any other failed
 * read is recorded as a warning and extraction continues without that category. Objects
 * that break a model invariant are skipped with a warning.
 */
public class SchemaExtractor {
    private static final Logger logger = LoggerFactory.getLogger(SchemaExtractor.class);

    public SchemaSnapshot extract(DialectAdapter adapter, CatalogReader reader, ExtractionConfig config)
            throws ExtractionException {
        Engine engine = adapter.engine();
        Set<ObjectType> selected = config.selection().types();
        Warnings warnings = new Warnings();

        DatabaseInfo info;
        try {
            info = reader.describe();
        } catch (QueryFailureException e) {
            throw new ExtractionException("Cannot connect to " + engine.displayName() + " catalog: " + e.getMessage(), e);
        }
        logger.info("Extracting {} database {} (version {})", engine.displayName(), info.database(), info.version());

        Set<ObjectType> notApplicable = EnumSet.noneOf(ObjectType.class);
        for (ObjectType type : selected) {
            if (!adapter.supports(CatalogKind.producing(type))) {
                notApplicable.add(type);
            }
        }

        Map<CatalogKind, List<RawRow>> rows = fetch(adapter, reader, selected, notApplicable, warnings);

        Set<String> schemaNames = new HashSet<>();
        Map<String, String> displayNames = new LinkedHashMap<>();
        for (String schema : adapter.schemas(rows.get(CatalogKind.SCHEMAS))) {
            if (config.schemaFilter().accepts(schema, engine)) {
                schemaNames.add(Identifier.fold(schema));
                displayNames.putIfAbsent(Identifier.fold(schema), schema);
            }
        }
        Predicate<Identifier> retained = id -> id.schema() == null
                ? adapter.defaultSchema() == null || schemaNames.contains(Identifier.fold(adapter.defaultSchema()))
                : schemaNames.contains(Identifier.fold(id.schema()));

        Map<String, Bucket> buckets = new LinkedHashMap<>();
        displayNames.forEach((key, name) -> buckets.put(key, new Bucket(name)));
        Function<Identifier, Bucket> bucket = id -> {
            String schema = id.schema() != null ? id.schema() : adapter.defaultSchema();
            return buckets.computeIfAbsent(Identifier.fold(schema == null ? "" : schema), k -> new Bucket(schema));
        };

        if (selected.contains(ObjectType.TABLES)) {
            List<Table> tables = new TableAssembler()
                    .columns(adapter.columns(rows(rows, CatalogKind.COLUMNS), warnings))
                    .primaryKeys(adapter.primaryKeys(rows(rows, CatalogKind.PRIMARY_KEYS), warnings))
                    .indexes(adapter.indexes(rows(rows, CatalogKind.INDEXES), warnings))
                    .foreignKeys(adapter.foreignKeys(rows(rows, CatalogKind.FOREIGN_KEYS), warnings))
                    .checks(adapter.checks(rows(rows, CatalogKind.CHECKS), warnings))
                    .assemble(adapter.tables(rows.get(CatalogKind.TABLES), warnings), warnings);
            tables.stream().filter(t -> retained.test(t.id())).forEach(t -> bucket.apply(t.id()).tables.add(t));
        }
        if (selected.contains(ObjectType.VIEWS)) {
            adapter.views(rows(rows, CatalogKind.VIEWS), warnings).stream()
                    .filter(v -> retained.test(v.id()))
                    .forEach(v -> bucket.apply(v.id()).views.add(v));
        }
        if (selected.contains(ObjectType.PROCEDURES) || selected.contains(ObjectType.FUNCTIONS)) {
            for (Routine routine : adapter.routines(rows(rows, CatalogKind.ROUTINES), warnings)) {
                if (!retained.test(routine.id()) || !selected.contains(routine.kind().objectType())) {
                    continue;
                }
                Bucket b = bucket.apply(routine.id());
                (routine.kind() == RoutineKind.PROCEDURE ? b.procedures : b.functions).add(routine);
            }
        }
        if (selected.contains(ObjectType.TRIGGERS)) {
            adapter.triggers(rows(rows, CatalogKind.TRIGGERS), warnings).stream()
                    .filter(t -> retained.test(t.id()))
                    .forEach(t -> bucket.apply(t.id()).triggers.add(t));
        }
        if (selected.contains(ObjectType.TYPES)) {
            adapter.types(rows(rows, CatalogKind.TYPES), warnings).stream()
                    .filter(t -> retained.test(t.id()))
                    .forEach(t -> bucket.apply(t.id()).types.add(t));
        }
        if (selected.contains(ObjectType.SEQUENCES)) {
            adapter.sequences(rows(rows, CatalogKind.SEQUENCES), warnings).stream()
                    .filter(s -> retained.test(s.id()))
                    .forEach(s -> bucket.apply(s.id()).sequences.add(s));
        }
        if (selected.contains(ObjectType.SYNONYMS)) {
            adapter.synonyms(rows(rows, CatalogKind.SYNONYMS), warnings).stream()
                    .filter(s -> retained.test(s.id()))
                    .forEach(s -> bucket.apply(s.id()).synonyms.add(s));
        }
        List<SecurityPrincipal> principals = selected.contains(ObjectType.SECURITY)
                ? adapter.security(rows(rows, CatalogKind.SECURITY), warnings)
                : List.of();

        List<SchemaObjects> schemas = new ArrayList<>();
        for (Bucket b : buckets.values()) {
            schemas.add(b.build(warnings));
        }
        RelationshipGraph graph = GraphBuilder.build(schemas, info.database(), warnings);

        SchemaSnapshot snapshot = new SchemaSnapshot(
                info.database(),
                engine,
                info.version(),
                config.clock().instant().truncatedTo(ChronoUnit.SECONDS),
                schemas,
                principals,
                selected,
                notApplicable,
                graph,
                warnings.list());
        logger.info("Extracted {} schemas, {} tables, {} views with {} warnings",
                schemas.size(), snapshot.count(ObjectType.TABLES), snapshot.count(ObjectType.VIEWS),
                snapshot.warnings().size());
        return snapshot;
    }

    /**
     * Runs independent extractions on {@code executor}, one per job, and returns their
     * snapshots in job order. The first failing job's exception is rethrown.
     */
    public List<SchemaSnapshot> extractAll(List<ExtractionJob> jobs, ExecutorService executor)
            throws ExtractionException {
        List<Future<SchemaSnapshot>> futures = new ArrayList<>();
        for (ExtractionJob job : jobs) {
            futures.add(executor.submit(() -> extract(job.adapter(), job.reader(), job.config())));
        }
        List<SchemaSnapshot> snapshots = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                snapshots.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new ExtractionException("Interrupted while extracting " + jobs.get(i).name(), e);
            } catch (ExecutionException e) {
                futures.forEach(f -> f.cancel(true));
                Throwable cause = e.getCause();
                if (cause instanceof ExtractionException) {
                    throw (ExtractionException) cause;
                }
                throw new ExtractionException("Extraction of " + jobs.get(i).name() + " failed: " + cause.getMessage(), cause);
            }
        }
        return snapshots;
    }

    private Map<CatalogKind, List<RawRow>> fetch(DialectAdapter adapter, CatalogReader reader, Set<ObjectType> selected,
                                                 Set<ObjectType> notApplicable, Warnings warnings)
            throws ExtractionException {
        Map<CatalogKind, List<RawRow>> fetched = new EnumMap<>(CatalogKind.class);
        for (CatalogKind kind : CatalogKind.values()) {
            if (!kind.neededFor(selected) || !adapter.supports(kind)) {
                continue;
            }
            try {
                CatalogRows result = reader.list(kind);
                if (!result.applicable()) {
                    if (kind.required()) {
                        throw new ExtractionException(adapter.engine(), kind, null);
                    }
                    kind.serves().stream().filter(selected::contains).forEach(notApplicable::add);
                    logger.debug("{} reports {} as not applicable", adapter.engine().displayName(), kind);
                    continue;
                }
                fetched.put(kind, result.rows());
                logger.info("Read {} {} rows", result.rows().size(), kind);
            } catch (QueryFailureException e) {
                if (kind.required()) {
                    throw new ExtractionException(adapter.engine(), kind, e);
                }
                warnings.queryFailed(kind, e);
            }
        }
        if (!fetched.containsKey(CatalogKind.SCHEMAS) || !fetched.containsKey(CatalogKind.TABLES)) {
            throw new ExtractionException(adapter.engine().displayName() + " adapter does not list schemas and tables", null);
        }
        return fetched;
    }

    private static List<RawRow> rows(Map<CatalogKind, List<RawRow>> rows, CatalogKind kind) {
        return rows.getOrDefault(kind, List.of());
    }

    /** Mutable per-schema accumulator, confined to the extracting thread. */
    private static final class Bucket {
        private final String schema;
        private final List<Table> tables = new ArrayList<>();
        private final List<View> views = new ArrayList<>();
        private final List<Routine> procedures = new ArrayList<>();
        private final List<Routine> functions = new ArrayList<>();
        private final List<Trigger> triggers = new ArrayList<>();
        private final List<UserDefinedType> types = new ArrayList<>();
        private final List<Sequence> sequences = new ArrayList<>();
        private final List<Synonym> synonyms = new ArrayList<>();

        private Bucket(String schema) {
            this.schema = schema;
        }

        SchemaObjects build(Warnings warnings) {
            return new SchemaObjects(schema,
                    unique(tables, Table::id, "table", warnings),
                    unique(views, View::id, "view", warnings),
                    unique(procedures, Routine::id, "procedure", warnings),
                    unique(functions, Routine::id, "function", warnings),
                    unique(triggers, Trigger::id, "trigger", warnings),
                    unique(types, UserDefinedType::id, "type", warnings),
                    unique(sequences, Sequence::id, "sequence", warnings),
                    unique(synonyms, Synonym::id, "synonym", warnings));
        }

        private static <T> List<T> unique(List<T> items, Function<T, Identifier> id, String what, Warnings warnings) {
            Set<Identifier> seen = new HashSet<>();
            List<T> result = new ArrayList<>();
            for (T item : items) {
                if (seen.add(id.apply(item))) {
                    result.add(item);
                } else {
                    warnings.skipped(what + " " + id.apply(item),
                            new ModelIntegrityException(what + " " + id.apply(item), "duplicate name in schema"));
                }
            }
            return result;
        }
    }
}
