package org.recdiff.obs;

import java.util.Map;

/**
 * Logger that drops every event.
 */
public final class DiscardingJsonLinesLogger implements JsonLinesLogger {
    public static final DiscardingJsonLinesLogger INSTANCE = new DiscardingJsonLinesLogger();

    private DiscardingJsonLinesLogger() {
    }

    @Override
    public void log(String level, String message, DiffRunContext runContext, Map<String, ?> fields) {
    }

    @Override
    public void close() {
    }
}
