package com.schemalens.core.extract;

import com.schemalens.core.filter.ObjectSelection;
import com.schemalens.core.filter.SchemaFilter;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * What to extract: which schemas, which object types, and the clock that stamps the snapshot.
 */
public record ExtractionConfig(
        SchemaFilter schemaFilter,
        ObjectSelection selection,
        Clock clock
) {
    public static ExtractionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<String> includeSchemas = new ArrayList<>();
        private final List<String> excludeSchemas = new ArrayList<>();
        private final List<String> objectTypes = new ArrayList<>();
        private ObjectSelection selection;
        private Clock clock = Clock.systemUTC();

        public Builder includeSchemas(Collection<String> schemas) {
            this.includeSchemas.addAll(schemas);
            return this;
        }

        public Builder includeSchema(String schema) {
            this.includeSchemas.add(schema);
            return this;
        }

        public Builder excludeSchemas(Collection<String> schemas) {
            this.excludeSchemas.addAll(schemas);
            return this;
        }

        public Builder excludeSchema(String schema) {
            this.excludeSchemas.add(schema);
            return this;
        }

        public Builder objectTypes(Collection<String> types) {
            this.objectTypes.addAll(types);
            return this;
        }

        public Builder selection(ObjectSelection selection) {
            this.selection = selection;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @throws com.schemalens.core.filter.FilterConflictException on contradictory filters
         */
        public ExtractionConfig build() {
            SchemaFilter filter = SchemaFilter.builder()
                    .include(includeSchemas)
                    .exclude(excludeSchemas)
                    .build();
            ObjectSelection types = selection != null ? selection : ObjectSelection.parse(objectTypes);
            return new ExtractionConfig(filter, types, clock);
        }
    }
}
