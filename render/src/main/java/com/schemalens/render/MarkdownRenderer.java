package com.schemalens.render;

import com.schemalens.core.model.ExtractionWarning;
import com.schemalens.core.model.Grant;
import com.schemalens.core.model.Identifier;
import com.schemalens.core.model.ObjectType;
import com.schemalens.core.model.Routine;
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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns a snapshot into its Markdown document set. Pure: no I/O beyond loading templates, and
 * the same snapshot always yields the same documents in the same order.
 *
 * <p>Layout: {@code README.md} at the root, {@code schemas/README.md} plus one overview per
 * schema, and for every selected type the engine supports a {@code {type}/README.md} index
 * followed by one {@code {type}/{schema}.{name}.md} document per object. Security has a single
 * {@code security/README.md}.
 */
public class MarkdownRenderer {
    private static final Logger logger = LoggerFactory.getLogger(MarkdownRenderer.class);

    private final HandlebarsEngine engine;

    public MarkdownRenderer() {
        this(new HandlebarsEngine());
    }

    public MarkdownRenderer(HandlebarsEngine engine) {
        this.engine = engine;
    }

    public List<Document> render(SchemaSnapshot snapshot) {
        DocumentPaths paths = new DocumentPaths(snapshot);
        ObjectPages pages = new ObjectPages(snapshot, paths);
        List<Document> documents = new ArrayList<>();

        documents.add(new Document(DocumentPaths.ROOT, render("readme", summary(snapshot, paths))));
        documents.add(new Document(DocumentPaths.SCHEMAS, render("schemas", schemaIndex(snapshot, paths))));
        for (SchemaObjects schema : snapshot.schemas()) {
            String path = paths.schema(schema.schema());
            documents.add(new Document(path, render("schema", schemaOverview(snapshot, schema, path, paths))));
        }

        for (ObjectType type : snapshot.presentTypes()) {
            if (type == ObjectType.SECURITY) {
                String path = DocumentPaths.index(type);
                documents.add(new Document(path, render("security", security(snapshot, path, paths))));
                continue;
            }
            List<Entry> entries = entries(snapshot, type);
            String index = DocumentPaths.index(type);
            documents.add(new Document(index, render("category", category(type, entries, index, pages, paths))));
            for (Entry entry : entries) {
                String path = paths.path(type, entry.id());
                documents.add(new Document(path, object(type, entry.item(), path, pages)));
            }
            logger.debug("Rendered {} {}", entries.size(), type.id());
        }
        logger.info("Rendered {} documents for database {}", documents.size(), snapshot.database());
        return documents;
    }

    private String object(ObjectType type, Object item, String path, ObjectPages pages) {
        return switch (type) {
            case TABLES -> render("table", pages.table((Table) item, path));
            case VIEWS -> render("view", pages.view((View) item, path));
            case PROCEDURES, FUNCTIONS -> render("routine", pages.routine((Routine) item, path));
            case TRIGGERS -> render("trigger", pages.trigger((Trigger) item, path));
            case TYPES -> render("type", pages.type((UserDefinedType) item, path));
            case SEQUENCES -> render("object", pages.sequence((Sequence) item, path));
            case SYNONYMS -> render("object", pages.synonym((Synonym) item, path));
            case SECURITY -> throw new IllegalArgumentException("security has no per-object documents");
        };
    }

    private Map<String, Object> summary(SchemaSnapshot snapshot, DocumentPaths paths) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("database", snapshot.database() == null ? "(unnamed)" : Markdown.cell(snapshot.database()));
        context.put("engine", snapshot.engine().displayName());
        context.put("version", snapshot.engineVersion() == null ? "" : Markdown.cell(snapshot.engineVersion()));
        context.put("generated", DateTimeFormatter.ISO_INSTANT.format(snapshot.extractedAt()));

        List<Map<String, Object>> counts = new ArrayList<>();
        for (ObjectType type : snapshot.presentTypes()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("link", paths.link(DocumentPaths.ROOT, DocumentPaths.index(type), type.title()));
            row.put("count", snapshot.count(type));
            counts.add(row);
        }
        context.put("counts", counts);
        context.put("notApplicable", snapshot.notApplicable().stream().map(ObjectType::title).toList());

        List<String> schemas = new ArrayList<>();
        for (SchemaObjects schema : snapshot.schemas()) {
            schemas.add(paths.link(DocumentPaths.ROOT, paths.schema(schema.schema()), schema.schema()));
        }
        context.put("schemas", schemas);
        context.put("schemaIndex", paths.link(DocumentPaths.ROOT, DocumentPaths.SCHEMAS, "All schemas"));
        context.put("warnings", snapshot.warnings().stream().map(MarkdownRenderer::warning).toList());
        return context;
    }

    private static String warning(ExtractionWarning warning) {
        return "**" + warning.kind().name() + "** " + Markdown.code(warning.subject()) + ": "
                + Markdown.cell(warning.message());
    }

    private Map<String, Object> schemaIndex(SchemaSnapshot snapshot, DocumentPaths paths) {
        List<ObjectType> types = snapshot.presentTypes().stream()
                .filter(t -> t != ObjectType.SECURITY)
                .toList();
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("header", "| Schema |" + types.stream().map(t -> " " + t.title() + " |").collect(Collectors.joining()));
        context.put("separator", "|---|" + "---|".repeat(types.size()));
        List<String> rows = new ArrayList<>();
        for (SchemaObjects schema : snapshot.schemas()) {
            StringBuilder row = new StringBuilder("| ")
                    .append(paths.link(DocumentPaths.SCHEMAS, paths.schema(schema.schema()), schema.schema()))
                    .append(" |");
            for (ObjectType type : types) {
                row.append(' ').append(schema.count(type)).append(" |");
            }
            rows.add(row.toString());
        }
        context.put("rows", rows);
        return context;
    }

    private Map<String, Object> schemaOverview(SchemaSnapshot snapshot, SchemaObjects schema, String from,
                                               DocumentPaths paths) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("title", Markdown.cell(schema.schema()));
        List<Map<String, Object>> sections = new ArrayList<>();
        for (ObjectType type : snapshot.presentTypes()) {
            if (type == ObjectType.SECURITY || schema.count(type) == 0) {
                continue;
            }
            Map<String, Object> section = new LinkedHashMap<>();
            section.put("title", type.title());
            section.put("count", schema.count(type));
            section.put("entries", members(schema, type).stream()
                    .map(e -> paths.link(from, paths.path(type, e.id()), e.id().name()))
                    .toList());
            sections.add(section);
        }
        context.put("sections", sections);
        return context;
    }

    private Map<String, Object> category(ObjectType type, List<Entry> entries, String from, ObjectPages pages,
                                         DocumentPaths paths) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("title", type.title());
        context.put("lower", type.title().toLowerCase(Locale.ROOT));
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Entry entry : entries) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("link", paths.link(from, paths.path(type, entry.id()), Markdown.cell(entry.id().qualifiedName())));
            row.put("schema", entry.id().schema() == null ? "" : Markdown.cell(entry.id().schema()));
            row.put("detail", pages.summary(type, entry.item()));
            row.put("description", description(entry.item()));
            rows.add(row);
        }
        context.put("entries", rows);
        return context;
    }

    private Map<String, Object> security(SchemaSnapshot snapshot, String from, DocumentPaths paths) {
        List<Map<String, Object>> principals = new ArrayList<>();
        for (SecurityPrincipal principal : snapshot.principals()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("name", Markdown.cell(principal.name()));
            row.put("kind", principal.kind().name());
            row.put("grantCount", principal.grants().size());
            row.put("memberOf", Markdown.cell(String.join(", ", principal.memberOf())));
            List<Map<String, Object>> grants = new ArrayList<>();
            for (Grant grant : principal.grants()) {
                Map<String, Object> g = new LinkedHashMap<>();
                g.put("privilege", Markdown.cell(grant.privilege()));
                g.put("object", grantObject(grant, from, paths));
                grants.add(g);
            }
            row.put("grants", grants);
            principals.add(row);
        }
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("principals", principals);
        return context;
    }

    private static String grantObject(Grant grant, String from, DocumentPaths paths) {
        if (grant.object() == null) {
            return "(database)";
        }
        String target = paths.pathOf(grant.object());
        return target == null
                ? Markdown.code(grant.object().qualifiedName())
                : paths.link(from, target, Markdown.cell(grant.object().qualifiedName()));
    }

    private static String description(Object item) {
        String description = null;
        if (item instanceof Table) {
            description = ((Table) item).description();
        } else if (item instanceof View) {
            description = ((View) item).description();
        } else if (item instanceof Routine) {
            description = ((Routine) item).description();
        } else if (item instanceof UserDefinedType) {
            description = ((UserDefinedType) item).description();
        }
        return description == null ? "" : description;
    }

    private static List<Entry> entries(SchemaSnapshot snapshot, ObjectType type) {
        List<Entry> entries = new ArrayList<>();
        for (SchemaObjects schema : snapshot.schemas()) {
            entries.addAll(members(schema, type));
        }
        entries.sort(Comparator.comparing(Entry::id));
        return entries;
    }

    private static List<Entry> members(SchemaObjects schema, ObjectType type) {
        return switch (type) {
            case TABLES -> schema.tables().stream().map(t -> new Entry(t.id(), t)).toList();
            case VIEWS -> schema.views().stream().map(v -> new Entry(v.id(), v)).toList();
            case PROCEDURES -> schema.procedures().stream().map(r -> new Entry(r.id(), r)).toList();
            case FUNCTIONS -> schema.functions().stream().map(r -> new Entry(r.id(), r)).toList();
            case TRIGGERS -> schema.triggers().stream().map(t -> new Entry(t.id(), t)).toList();
            case TYPES -> schema.types().stream().map(t -> new Entry(t.id(), t)).toList();
            case SEQUENCES -> schema.sequences().stream().map(s -> new Entry(s.id(), s)).toList();
            case SYNONYMS -> schema.synonyms().stream().map(s -> new Entry(s.id(), s)).toList();
            case SECURITY -> List.of();
        };
    }

    private String render(String template, Map<String, Object> context) {
        try {
            return engine.render(template, context);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot render template " + template, e);
        }
    }

    private record Entry(Identifier id, Object item) {
    }
}
