package com.schemalens.core.filter;

import com.schemalens.core.model.ObjectType;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * The object types to extract, parsed from names such as {@code tables}, {@code views}
 * or {@code all}.
 */
public final class ObjectSelection {
    private final Set<ObjectType> types;

    private ObjectSelection(Set<ObjectType> types) {
        this.types = Collections.unmodifiableSet(types);
    }

    public static ObjectSelection all() {
        return new ObjectSelection(EnumSet.allOf(ObjectType.class));
    }

    public static ObjectSelection of(ObjectType first, ObjectType... rest) {
        return new ObjectSelection(EnumSet.of(first, rest));
    }

    /**
     * @throws FilterConflictException for an empty list or an unknown type name
     */
    public static ObjectSelection parse(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return all();
        }
        Set<ObjectType> types = EnumSet.noneOf(ObjectType.class);
        for (String raw : names) {
            for (String name : raw.split(",")) {
                String trimmed = name.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                if (trimmed.equalsIgnoreCase("all")) {
                    return all();
                }
                try {
                    types.add(ObjectType.fromId(trimmed));
                } catch (IllegalArgumentException e) {
                    throw new FilterConflictException(e.getMessage());
                }
            }
        }
        if (types.isEmpty()) {
            throw new FilterConflictException("No object types selected");
        }
        return new ObjectSelection(types);
    }

    public static ObjectSelection parse(String... names) {
        return parse(List.of(names));
    }

    public Set<ObjectType> types() {
        return types;
    }

    public boolean includes(ObjectType type) {
        return types.contains(type);
    }

    @Override
    public String toString() {
        return types.toString();
    }
}
