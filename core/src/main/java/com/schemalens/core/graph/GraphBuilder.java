package com.schemalens.core.graph;

import com.schemalens.core.adapter.Warnings;
import com.schemalens.core.model.ForeignKey;
import com.schemalens.core.model.Identifier;
import com.schemalens.core.model.ObjectType;
import com.schemalens.core.model.ReferenceKind;
import com.schemalens.core.model.RelationshipEdge;
import com.schemalens.core.model.RelationshipGraph;
import com.schemalens.core.model.Routine;
import com.schemalens.core.model.SchemaObjects;
import com.schemalens.core.model.Synonym;
import com.schemalens.core.model.Table;
import com.schemalens.core.model.Trigger;
import com.schemalens.core.model.UnresolvedReference;
import com.schemalens.core.model.View;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Links the retained objects of a snapshot. Runs after filtering, so any reference to an
 * object that was filtered out, or that lives in another database, becomes an unresolved
 * edge instead of disappearing.
 */
public final class GraphBuilder {
    private static final Logger logger = LoggerFactory.getLogger(GraphBuilder.class);

    private GraphBuilder() {}

    /**
     * @param schemas  the retained objects
     * @param database name of the database being described; synonyms into any other database are external
     * @param warnings receives one entry per unresolved reference
     */
    public static RelationshipGraph build(List<SchemaObjects> schemas, String database, Warnings warnings) {
        Map<Identifier, ObjectType> nodes = index(schemas);
        List<RelationshipEdge> edges = new ArrayList<>();
        List<UnresolvedReference> unresolved = new ArrayList<>();
        Map<Identifier, List<Identifier>> dependents = new HashMap<>();

        for (SchemaObjects schema : schemas) {
            for (Table table : schema.tables()) {
                for (ForeignKey fk : table.foreignKeys()) {
                    boolean resolved = nodes.get(fk.target()) == ObjectType.TABLES;
                    edges.add(RelationshipEdge.foreignKey(table.id(), fk, resolved));
                    if (!resolved) {
                        unresolved.add(new UnresolvedReference(table.id(), fk.target(), ReferenceKind.FOREIGN_KEY, fk.name()));
                    }
                }
            }
            for (Synonym synonym : schema.synonyms()) {
                boolean resolved = !external(synonym, database) && nodes.containsKey(synonym.target());
                edges.add(RelationshipEdge.synonym(synonym, resolved));
                if (!resolved) {
                    unresolved.add(new UnresolvedReference(synonym.id(), synonym.target(), ReferenceKind.SYNONYM, null));
                }
            }
            for (Trigger trigger : schema.triggers()) {
                if (!nodes.containsKey(trigger.table())) {
                    unresolved.add(new UnresolvedReference(trigger.id(), trigger.table(), ReferenceKind.TRIGGER_PARENT, null));
                }
            }
            for (View view : schema.views()) {
                for (Identifier base : view.baseTables()) {
                    dependents.computeIfAbsent(base, k -> new ArrayList<>()).add(view.id());
                }
            }
        }

        unresolved.sort((a, b) -> {
            int c = a.source().compareTo(b.source());
            return c != 0 ? c : a.target().compareTo(b.target());
        });
        unresolved.forEach(warnings::unresolved);
        logger.info("Built relationship graph: {} nodes, {} edges, {} unresolved",
                nodes.size(), edges.size(), unresolved.size());
        return new RelationshipGraph(nodes, edges, dependents, unresolved);
    }

    /** Synonyms on another server, or into a database other than {@code database}, point outside the snapshot. */
    static boolean external(Synonym synonym, String database) {
        if (synonym.server() != null) {
            return true;
        }
        return synonym.database() != null && database != null
                && !Identifier.fold(synonym.database()).equals(Identifier.fold(database));
    }

    private static Map<Identifier, ObjectType> index(List<SchemaObjects> schemas) {
        Map<Identifier, ObjectType> nodes = new HashMap<>();
        for (SchemaObjects schema : schemas) {
            schema.tables().forEach(t -> nodes.putIfAbsent(t.id(), ObjectType.TABLES));
            schema.views().forEach(v -> nodes.putIfAbsent(v.id(), ObjectType.VIEWS));
            schema.procedures().stream().map(Routine::id).forEach(id -> nodes.putIfAbsent(id, ObjectType.PROCEDURES));
            schema.functions().stream().map(Routine::id).forEach(id -> nodes.putIfAbsent(id, ObjectType.FUNCTIONS));
            schema.types().forEach(t -> nodes.putIfAbsent(t.id(), ObjectType.TYPES));
            schema.sequences().forEach(s -> nodes.putIfAbsent(s.id(), ObjectType.SEQUENCES));
            schema.synonyms().forEach(s -> nodes.putIfAbsent(s.id(), ObjectType.SYNONYMS));
            schema.triggers().forEach(t -> nodes.putIfAbsent(t.id(), ObjectType.TRIGGERS));
        }
        return nodes;
    }
}
