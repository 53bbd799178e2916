package com.schemalens.core.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.schemalens.core.model.Engine;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Raw catalog rows captured from a live database, stored as JSON so that extraction
 * and rendering can be repeated without a connection.
 */
public record CatalogDump(
        @JsonProperty("engine") Engine engine,
        @JsonProperty("database") DatabaseInfo database,
        @JsonProperty("catalog") Map<CatalogKind, List<RawRow>> catalog,
        @JsonProperty("notApplicable") Set<CatalogKind> notApplicable
) {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    public CatalogDump {
        catalog = catalog == null || catalog.isEmpty() ? Map.of() : new EnumMap<>(catalog);
        notApplicable = notApplicable == null || notApplicable.isEmpty()
                ? EnumSet.noneOf(CatalogKind.class) : EnumSet.copyOf(notApplicable);
    }

    public static CatalogDump read(Path path) throws IOException {
        return MAPPER.readValue(path.toFile(), CatalogDump.class);
    }

    public static CatalogDump read(InputStream in) throws IOException {
        return MAPPER.readValue(in, CatalogDump.class);
    }

    public void write(Path path) throws IOException {
        MAPPER.writeValue(path.toFile(), this);
    }
}
