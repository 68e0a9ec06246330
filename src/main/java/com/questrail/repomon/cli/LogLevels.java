package com.questrail.repomon.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Maps {@code -v} / {@code -q} counts onto the Logback root level.
 *
 * <p>The baseline is WARN. Each {@code -v} steps towards TRACE, each
 * {@code -q} towards OFF. Protocol behavior is unaffected; only diagnostics
 * on stderr change.</p>
 */
final class LogLevels {
    private static final org.slf4j.Logger log = LoggerFactory.getLogger(LogLevels.class);

    private static final Level[] LADDER = {
        Level.OFF, Level.ERROR, Level.WARN, Level.INFO, Level.DEBUG, Level.TRACE
    };
    private static final int BASELINE = 2;

    private LogLevels() {
    }

    static Level resolve(int verbose, int quiet) {
        int index = Math.max(0, Math.min(LADDER.length - 1, BASELINE + verbose - quiet));
        return LADDER[index];
    }

    static void apply(int verbose, int quiet) {
        Level level = resolve(verbose, quiet);
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext context) {
            Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            root.setLevel(level);
            return;
        }
        log.warn("Log level {} requested but backend {} does not support dynamic level updates",
            level, factory.getClass().getName());
    }
}
