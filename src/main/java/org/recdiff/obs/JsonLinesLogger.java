package org.recdiff.obs;

import java.util.Collections;
import java.util.Map;

/**
 * Minimal structured logger that writes one JSON object per line.
 */
public interface JsonLinesLogger extends AutoCloseable {
    void log(String level, String message, DiffRunContext runContext, Map<String, ?> fields);

    default void log(String level, String message, DiffRunContext runContext) {
        log(level, message, runContext, Collections.emptyMap());
    }

    default void info(String message, DiffRunContext runContext, Map<String, ?> fields) {
        log("INFO", message, runContext, fields);
    }

    default void info(String message, DiffRunContext runContext) {
        info(message, runContext, Collections.emptyMap());
    }

    default void error(String message, DiffRunContext runContext, Map<String, ?> fields) {
        log("ERROR", message, runContext, fields);
    }

    default void error(String message, DiffRunContext runContext) {
        error(message, runContext, Collections.emptyMap());
    }

    @Override
    void close();
}
