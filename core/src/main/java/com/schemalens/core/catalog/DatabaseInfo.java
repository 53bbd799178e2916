package com.schemalens.core.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Identity of the connected database as reported by the engine.
 */
public record DatabaseInfo(
        @JsonProperty("database") String database,
        @JsonProperty("version") String version,
        @JsonProperty("defaultSchema") String defaultSchema
) {}
