package com.schemalens.render;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.schemalens.core.model.SchemaSnapshot;

import java.io.UncheckedIOException;

/**
 * Machine-readable export of a snapshot, written as {@code snapshot.json} beside the Markdown.
 * Map keys are sorted so that unchanged schemas produce identical files.
 */
public final class SnapshotJson {
    public static final String PATH = "snapshot.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private SnapshotJson() {}

    public static String write(SchemaSnapshot snapshot) {
        try {
            return MAPPER.writeValueAsString(snapshot) + "\n";
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize snapshot of " + snapshot.database(), e);
        }
    }

    public static Document document(SchemaSnapshot snapshot) {
        return new Document(PATH, write(snapshot));
    }
}
