package com.schemalens.core.model;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A directed link from {@code source} to {@code target}. {@code via} is the constraint
 * name, null for unnamed constraints and synonyms. An unresolved edge points at an object
 * outside the retained set and renders without a link.
 */
public record RelationshipEdge(
        Identifier source,
        Identifier target,
        String via,
        ReferenceKind kind,
        List<String> sourceColumns,
        List<String> targetColumns,
        ReferentialAction onDelete,
        ReferentialAction onUpdate,
        boolean resolved
) {
    public static final Comparator<RelationshipEdge> ORDER = Comparator
            .comparing(RelationshipEdge::source)
            .thenComparing(e -> e.via() == null ? "" : e.via())
            .thenComparing(RelationshipEdge::target)
            .thenComparing(e -> String.join(",", e.sourceColumns()));

    public RelationshipEdge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(kind, "kind");
        sourceColumns = sourceColumns == null ? List.of() : List.copyOf(sourceColumns);
        targetColumns = targetColumns == null ? List.of() : List.copyOf(targetColumns);
    }

    public static RelationshipEdge foreignKey(Identifier source, ForeignKey fk, boolean resolved) {
        return new RelationshipEdge(source, fk.target(), fk.name(), ReferenceKind.FOREIGN_KEY,
                fk.columns(), fk.targetColumns(), fk.onDelete(), fk.onUpdate(), resolved);
    }

    public static RelationshipEdge synonym(Synonym synonym, boolean resolved) {
        return new RelationshipEdge(synonym.id(), synonym.target(), null, ReferenceKind.SYNONYM,
                List.of(), List.of(), null, null, resolved);
    }
}
