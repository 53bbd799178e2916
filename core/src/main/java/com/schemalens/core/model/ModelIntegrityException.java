package com.schemalens.core.model;

/**
 * Raised when normalized catalog data violates an invariant of the canonical model.
 * The message always names the offending object.
 */
public class ModelIntegrityException extends RuntimeException {
    private final String subject;

    public ModelIntegrityException(String subject, String message) {
        super(subject + ": " + message);
        this.subject = subject;
    }

    public String subject() {
        return subject;
    }
}
