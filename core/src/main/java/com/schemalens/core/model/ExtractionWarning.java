package com.schemalens.core.model;

/**
 * A non-fatal problem met while extracting. {@code subject} names the capability or object.
 */
public record ExtractionWarning(WarningKind kind, String subject, String message) {
    @Override
    public String toString() {
        return kind + " " + subject + ": " + message;
    }
}
