package com.schemalens.core.model;

import java.util.Objects;

/**
 * An alias for another object, possibly on a different server or database.
 */
public record Synonym(Identifier id, Identifier target, String server, String database) {
    public Synonym {
        Objects.requireNonNull(id, "id");
        if (target == null) {
            throw new ModelIntegrityException("synonym " + id, "has no target");
        }
    }

    /** Full display form of the target, including server and database parts. */
    public String targetName() {
        StringBuilder sb = new StringBuilder();
        if (server != null) sb.append(server).append('.');
        if (database != null) sb.append(database).append('.');
        return sb.append(target.qualifiedName()).toString();
    }
}
