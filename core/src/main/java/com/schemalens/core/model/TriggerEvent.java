package com.schemalens.core.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum TriggerEvent {
    INSERT,
    UPDATE,
    DELETE;

    /** Reads events out of text such as {@code INSERT OR UPDATE} or {@code INSERT,DELETE}. */
    public static Set<TriggerEvent> parseAll(String text) {
        Set<TriggerEvent> events = EnumSet.noneOf(TriggerEvent.class);
        if (text == null) {
            return events;
        }
        String upper = text.toUpperCase(Locale.ROOT);
        for (TriggerEvent event : values()) {
            if (upper.matches("(?s).*\\b" + event.name() + "\\b.*")) {
                events.add(event);
            }
        }
        return events;
    }
}
