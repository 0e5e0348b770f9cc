package org.recdiff.obs;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;

/**
 * Writes each diff run event as one relaxed-JSON document per line.
 *
 * <p>Every line starts with {@code timestamp}, {@code level} and {@code message}, followed by the run
 * context and then the caller's fields. A caller field never overrides a key already present.
 */
public final class StructuredJsonLinesLogger implements JsonLinesLogger {
    private static final JsonWriterSettings LINE_SETTINGS = JsonWriterSettings.builder()
        .outputMode(JsonMode.RELAXED)
        .build();

    private final Writer sink;
    private final Clock clock;
    private final boolean flushEachEvent;
    private boolean closed;

    public StructuredJsonLinesLogger(OutputStream outputStream) {
        this(outputStream, Clock.systemUTC(), true);
    }

    public StructuredJsonLinesLogger(OutputStream outputStream, Clock clock, boolean flushEachEvent) {
        this(new OutputStreamWriter(Objects.requireNonNull(outputStream, "outputStream"), StandardCharsets.UTF_8),
            clock,
            flushEachEvent);
    }

    public StructuredJsonLinesLogger(Writer sink, Clock clock, boolean flushEachEvent) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.flushEachEvent = flushEachEvent;
    }

    @Override
    public synchronized void log(String level, String message, DiffRunContext runContext, Map<String, ?> fields) {
        if (closed) {
            throw new IllegalStateException("logger is already closed");
        }
        Objects.requireNonNull(runContext, "runContext");

        BsonDocument event = new BsonDocument()
            .append("timestamp", new BsonString(Instant.now(clock).toString()))
            .append("level", new BsonString(levelName(level)))
            .append("message", new BsonString(message == null ? "" : message));
        appendMissing(event, runContext.asFields());
        if (fields != null) {
            appendMissing(event, fields);
        }
        writeLine(event.toJson(LINE_SETTINGS));
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            sink.close();
        } catch (IOException e) {
            throw new UncheckedIOException("failed to close log sink", e);
        }
    }

    private static void appendMissing(BsonDocument event, Map<String, ?> fields) {
        for (Map.Entry<String, ?> field : fields.entrySet()) {
            String key = field.getKey();
            if (key != null && !key.isBlank() && !event.containsKey(key)) {
                event.append(key, BsonValues.of(field.getValue()));
            }
        }
    }

    private void writeLine(String line) {
        try {
            sink.write(line);
            sink.write('\n');
            if (flushEachEvent) {
                sink.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write log event", e);
        }
    }

    private static String levelName(String level) {
        return level == null || level.isBlank() ? "INFO" : level.trim().toUpperCase(Locale.ROOT);
    }
}
