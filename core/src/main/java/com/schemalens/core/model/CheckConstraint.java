package com.schemalens.core.model;

public record CheckConstraint(String name, String expression) {
    public CheckConstraint {
        if (expression == null || expression.isBlank()) {
            throw new ModelIntegrityException("check constraint " + name, "has no expression");
        }
    }
}
