package com.schemalens.core.filter;

/**
 * The schema or object-type filters contradict each other. Raised before any catalog read.
 */
public class FilterConflictException extends RuntimeException {
    public FilterConflictException(String message) {
        super(message);
    }
}
