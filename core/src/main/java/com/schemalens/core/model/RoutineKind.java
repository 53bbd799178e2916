package com.schemalens.core.model;

public enum RoutineKind {
    PROCEDURE,
    FUNCTION;

    public ObjectType objectType() {
        return this == PROCEDURE ? ObjectType.PROCEDURES : ObjectType.FUNCTIONS;
    }
}
