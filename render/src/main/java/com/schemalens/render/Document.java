package com.schemalens.render;

import java.util.Objects;

/**
 * One rendered document: a relative path using {@code /} separators and its Markdown text.
 */
public record Document(String path, String content) {
    public Document {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(content, "content");
    }
}
