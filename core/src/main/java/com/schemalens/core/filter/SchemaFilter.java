package com.schemalens.core.filter;

import com.schemalens.core.model.Engine;
import com.schemalens.core.model.Identifier;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Schema allow/deny list. Names compare case-insensitively. An include list, when present,
 * is the whole answer; otherwise explicit excludes apply, and without those the engine's
 * system schemas are left out.
 */
public final class SchemaFilter {
    private static final SchemaFilter DEFAULTS = new SchemaFilter(Set.of(), Set.of());

    private final Set<String> include;
    private final Set<String> exclude;

    private SchemaFilter(Set<String> include, Set<String> exclude) {
        this.include = include;
        this.exclude = exclude;
    }

    public static SchemaFilter defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean accepts(String schema, Engine engine) {
        if (schema == null) {
            return true;
        }
        String key = Identifier.fold(schema);
        if (!include.isEmpty()) {
            return include.contains(key);
        }
        if (!exclude.isEmpty()) {
            return !exclude.contains(key);
        }
        return !engine.excludedSchemas().contains(key);
    }

    public Set<String> include() {
        return include;
    }

    public Set<String> exclude() {
        return exclude;
    }

    @Override
    public String toString() {
        return "SchemaFilter{include=" + include + ", exclude=" + exclude + "}";
    }

    public static class Builder {
        private final Set<String> include = new LinkedHashSet<>();
        private final Set<String> exclude = new LinkedHashSet<>();

        public Builder include(String... schemas) {
            return include(List.of(schemas));
        }

        public Builder include(Collection<String> schemas) {
            schemas.stream().filter(s -> !s.isBlank()).forEach(include::add);
            return this;
        }

        public Builder exclude(String... schemas) {
            return exclude(List.of(schemas));
        }

        public Builder exclude(Collection<String> schemas) {
            schemas.stream().filter(s -> !s.isBlank()).forEach(exclude::add);
            return this;
        }

        /**
         * @throws FilterConflictException if a schema is both included and excluded
         */
        public SchemaFilter build() {
            Set<String> in = fold(include);
            Set<String> out = fold(exclude);
            Set<String> both = new TreeSet<>(in);
            both.retainAll(out);
            if (!both.isEmpty()) {
                throw new FilterConflictException("Schemas both included and excluded: " + String.join(", ", both));
            }
            if (in.isEmpty() && out.isEmpty()) {
                return DEFAULTS;
            }
            return new SchemaFilter(in, out);
        }

        private static Set<String> fold(Set<String> names) {
            Set<String> folded = new TreeSet<>();
            names.forEach(n -> folded.add(Identifier.fold(n)));
            return Set.copyOf(folded);
        }
    }
}
