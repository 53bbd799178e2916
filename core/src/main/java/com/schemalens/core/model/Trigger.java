package com.schemalens.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

public record Trigger(
        Identifier id,
        Identifier table,
        TriggerTiming timing,
        Set<TriggerEvent> events,
        boolean enabled,
        String definition
) {
    public Trigger {
        Objects.requireNonNull(id, "id");
        if (table == null) {
            throw new ModelIntegrityException("trigger " + id, "has no parent table");
        }
        if (timing == null) {
            throw new ModelIntegrityException("trigger " + id, "has no timing");
        }
        if (events == null || events.isEmpty()) {
            throw new ModelIntegrityException("trigger " + id, "fires on none of INSERT, UPDATE or DELETE");
        }
        events = Collections.unmodifiableSet(EnumSet.copyOf(events));
    }
}
