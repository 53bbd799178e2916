package com.schemalens.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A user-defined type. Which fields are populated depends on the category: a base type for
 * domains and aliases, attributes for composite and table types, values for enums and a
 * check expression for domains.
 */
public record UserDefinedType(
        Identifier id,
        TypeCategory category,
        DataType baseType,
        List<Attribute> attributes,
        List<String> enumValues,
        String checkExpression,
        String description
) {
    public UserDefinedType {
        Objects.requireNonNull(id, "id");
        if (category == null) {
            throw new ModelIntegrityException("type " + id, "has no category");
        }
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
        enumValues = enumValues == null ? List.of() : List.copyOf(enumValues);
        if ((category == TypeCategory.DOMAIN || category == TypeCategory.ALIAS) && baseType == null) {
            throw new ModelIntegrityException("type " + id, category + " requires a base type");
        }
    }
}
