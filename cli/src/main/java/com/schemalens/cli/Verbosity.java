package com.schemalens.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps the repeated {@code -v} flag onto the level of the {@code com.schemalens} loggers:
 * none keeps warnings only, {@code -v} adds progress, {@code -vv} adds row details.
 */
final class Verbosity {
    private Verbosity() {}

    static Level level(boolean[] flags) {
        int count = flags == null ? 0 : flags.length;
        if (count == 0) {
            return Level.WARN;
        }
        return count == 1 ? Level.INFO : Level.DEBUG;
    }

    static void apply(boolean[] flags) {
        org.slf4j.Logger logger = LoggerFactory.getLogger("com.schemalens");
        if (logger instanceof Logger) {
            ((Logger) logger).setLevel(level(flags));
        }
    }
}
