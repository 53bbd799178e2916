package com.schemalens.core.model;

import java.util.List;
import java.util.Objects;

public record Routine(
        Identifier id,
        RoutineKind kind,
        List<Parameter> parameters,
        ReturnShape returns,
        String language,
        String definition,
        String description
) {
    public Routine {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        returns = returns == null ? ReturnShape.none() : returns;
    }
}
