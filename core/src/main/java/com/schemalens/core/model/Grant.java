package com.schemalens.core.model;

/**
 * A granted privilege. {@code object} is null for database-level privileges.
 */
public record Grant(String privilege, Identifier object) {
    public Grant {
        if (privilege == null || privilege.isBlank()) {
            throw new ModelIntegrityException("grant", "privilege is required");
        }
    }
}
