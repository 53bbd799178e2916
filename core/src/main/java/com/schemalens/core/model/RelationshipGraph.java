package com.schemalens.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Cross-object links of one snapshot. Every edge is indexed under both its source and its
 * target, so an edge listed as outgoing from A is always listed as incoming to B. View base
 * tables are kept apart as dependencies and do not count as edges.
 */
public final class RelationshipGraph {
    private static final RelationshipGraph EMPTY =
            new RelationshipGraph(Map.of(), List.of(), Map.of(), List.of());

    private final Map<Identifier, ObjectType> nodes;
    private final List<RelationshipEdge> edges;
    private final Map<Identifier, List<Identifier>> dependents;
    private final List<UnresolvedReference> unresolved;
    private final Map<Identifier, List<RelationshipEdge>> outgoing = new HashMap<>();
    private final Map<Identifier, List<RelationshipEdge>> incoming = new HashMap<>();

    public RelationshipGraph(Map<Identifier, ObjectType> nodes,
                             List<RelationshipEdge> edges,
                             Map<Identifier, List<Identifier>> dependents,
                             List<UnresolvedReference> unresolved) {
        this.nodes = Map.copyOf(nodes);
        List<RelationshipEdge> sorted = new ArrayList<>(edges);
        sorted.sort(RelationshipEdge.ORDER);
        this.edges = List.copyOf(sorted);
        Map<Identifier, List<Identifier>> deps = new HashMap<>();
        dependents.forEach((k, v) -> deps.put(k, v.stream().distinct().sorted().toList()));
        this.dependents = Map.copyOf(deps);
        this.unresolved = List.copyOf(unresolved);

        for (RelationshipEdge edge : this.edges) {
            outgoing.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge);
            if (edge.resolved()) {
                incoming.computeIfAbsent(edge.target(), k -> new ArrayList<>()).add(edge);
            }
        }
    }

    public static RelationshipGraph empty() {
        return EMPTY;
    }

    @JsonProperty("edges")
    public List<RelationshipEdge> edges() {
        return edges;
    }

    @JsonProperty("unresolved")
    public List<UnresolvedReference> unresolved() {
        return unresolved;
    }

    public List<RelationshipEdge> edges(Identifier id, Direction direction) {
        Map<Identifier, List<RelationshipEdge>> index = direction == Direction.OUTGOING ? outgoing : incoming;
        return Collections.unmodifiableList(index.getOrDefault(id, List.of()));
    }

    public List<RelationshipEdge> outgoing(Identifier id) {
        return edges(id, Direction.OUTGOING);
    }

    public List<RelationshipEdge> incoming(Identifier id) {
        return edges(id, Direction.INCOMING);
    }

    /** Views that read from {@code id}. */
    public List<Identifier> dependents(Identifier id) {
        return dependents.getOrDefault(id, List.of());
    }

    /** The retained object's type, or null when {@code id} is outside the snapshot. */
    public ObjectType typeOf(Identifier id) {
        return nodes.get(id);
    }

    public boolean contains(Identifier id) {
        return nodes.containsKey(id);
    }
}
