package com.schemalens.dialects.jdbc;

/**
 * Connection settings are incomplete or inconsistent for the chosen engine.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }
}
