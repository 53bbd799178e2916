package com.schemalens.cli;

import com.schemalens.render.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentWriterTest {

    @TempDir
    Path dir;

    @Test
    void writesNestedDocuments() throws IOException {
        DocumentWriter writer = new DocumentWriter(dir.resolve("out"));

        List<Path> written = writer.write(List.of(
                new Document("README.md", "# Database: shop\n"),
                new Document("tables/main.orders.md", "# Table: main.orders\n")));

        assertEquals(2, written.size());
        assertEquals("# Table: main.orders\n", Files.readString(dir.resolve("out/tables/main.orders.md")));
    }

    @Test
    void replacesExistingFiles() throws IOException {
        DocumentWriter writer = new DocumentWriter(dir);
        Files.writeString(dir.resolve("README.md"), "stale");

        writer.write(List.of(new Document("README.md", "fresh")));

        assertEquals("fresh", Files.readString(dir.resolve("README.md")));
    }

    @Test
    void refusesPathsOutsideTheOutputDirectory() {
        DocumentWriter writer = new DocumentWriter(dir.resolve("out"));

        assertThrows(IOException.class, () -> writer.write(List.of(new Document("../escape.md", "x"))));
        assertFalse(Files.exists(dir.resolve("escape.md")));
    }

    @Test
    void directoryNameKeepsOnlySafeCharacters() {
        assertEquals("sales_db-2024", DocumentWriter.directoryName("sales_db-2024"));
        assertEquals("my_shop_v2", DocumentWriter.directoryName("my shop.v2"));
        assertEquals("unknown", DocumentWriter.directoryName(null));
        assertEquals("unknown", DocumentWriter.directoryName(" "));
    }
}
