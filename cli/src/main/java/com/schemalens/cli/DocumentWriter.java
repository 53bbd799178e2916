package com.schemalens.cli;

import com.schemalens.render.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes rendered documents below an output directory, creating subdirectories as needed.
 * Existing files with the same path are replaced; other files are left alone.
 */
public class DocumentWriter {
    private static final Logger logger = LoggerFactory.getLogger(DocumentWriter.class);

    private final Path root;

    public DocumentWriter(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    public List<Path> write(List<Document> documents) throws IOException {
        List<Path> written = new ArrayList<>();
        for (Document document : documents) {
            Path target = resolve(document.path());
            Files.createDirectories(target.getParent());
            Files.writeString(target, document.content(), StandardCharsets.UTF_8);
            logger.debug("Wrote {}", target);
            written.add(target);
        }
        logger.info("Wrote {} files to {}", written.size(), root);
        return written;
    }

    /**
     * @throws IOException when a document path points outside the output directory
     */
    Path resolve(String path) throws IOException {
        Path target = root.resolve(path).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new IOException("Document path escapes output directory: " + path);
        }
        return target;
    }

    /** The per-database folder name: letters, digits, {@code -} and {@code _} survive, the rest become {@code _}. */
    public static String directoryName(String database) {
        if (database == null || database.isBlank()) {
            return "unknown";
        }
        StringBuilder name = new StringBuilder(database.length());
        for (int i = 0; i < database.length(); i++) {
            char c = database.charAt(i);
            name.append(Character.isLetterOrDigit(c) || c == '-' || c == '_' ? c : '_');
        }
        return name.toString();
    }
}
