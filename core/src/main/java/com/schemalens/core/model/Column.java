package com.schemalens.core.model;

/**
 * A table column. {@code ordinal} is the 1-based position after the table has been assembled.
 * Default and computed expressions are raw catalog text.
 */
public record Column(
        String name,
        DataType type,
        boolean nullable,
        String defaultValue,
        boolean identity,
        Long identitySeed,
        Long identityIncrement,
        boolean computed,
        String computedExpression,
        int ordinal,
        String description
) {
    public Column {
        if (name == null || name.isBlank()) {
            throw new ModelIntegrityException("column", "name is required");
        }
        if (type == null) {
            throw new ModelIntegrityException("column " + name, "type is required");
        }
        if (ordinal < 1) {
            throw new ModelIntegrityException("column " + name, "ordinal must be positive, was " + ordinal);
        }
    }

    public Column withOrdinal(int position) {
        return new Column(name, type, nullable, defaultValue, identity, identitySeed, identityIncrement,
                computed, computedExpression, position, description);
    }

    public static Builder builder(String name, DataType type) {
        return new Builder(name, type);
    }

    public static class Builder {
        private final String name;
        private final DataType type;
        private boolean nullable = true;
        private String defaultValue;
        private boolean identity;
        private Long identitySeed;
        private Long identityIncrement;
        private boolean computed;
        private String computedExpression;
        private int ordinal = 1;
        private String description;

        private Builder(String name, DataType type) {
            this.name = name;
            this.type = type;
        }

        public Builder nullable(boolean nullable) {
            this.nullable = nullable;
            return this;
        }

        public Builder defaultValue(String defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder identity(boolean identity) {
            this.identity = identity;
            return this;
        }

        public Builder identity(Long seed, Long increment) {
            this.identity = true;
            this.identitySeed = seed;
            this.identityIncrement = increment;
            return this;
        }

        public Builder computed(String expression) {
            this.computed = true;
            this.computedExpression = expression;
            return this;
        }

        public Builder ordinal(int ordinal) {
            this.ordinal = ordinal;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Column build() {
            return new Column(name, type, nullable, defaultValue, identity, identitySeed, identityIncrement,
                    computed, computedExpression, ordinal, description);
        }
    }
}
