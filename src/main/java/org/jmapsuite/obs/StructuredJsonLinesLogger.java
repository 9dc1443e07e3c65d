package org.jmapsuite.obs;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.jmapsuite.json.JsonValues;

/**
 * JSON-lines logger intended for deterministic diagnostics: keys are written in sorted order.
 */
public final class StructuredJsonLinesLogger implements JsonLinesLogger {
    private final Writer writer;
    private final Clock clock;
    private final boolean autoFlush;
    private boolean closed;

    public StructuredJsonLinesLogger(OutputStream outputStream) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), Clock.systemUTC(), true);
    }

    public StructuredJsonLinesLogger(OutputStream outputStream, Clock clock, boolean autoFlush) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), clock, autoFlush);
    }

    public StructuredJsonLinesLogger(Writer writer, Clock clock, boolean autoFlush) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.autoFlush = autoFlush;
        this.closed = false;
    }

    @Override
    public synchronized void log(
        String level,
        String message,
        CorrelationContext correlationContext,
        Map<String, ?> fields
    ) {
        ensureOpen();
        CorrelationContext safeCorrelation = Objects.requireNonNull(correlationContext, "correlationContext");
        Map<String, ?> safeFields = fields == null ? Map.of() : fields;

        TreeMap<String, BsonValue> event = new TreeMap<>();
        event.put("timestamp", new BsonString(Instant.now(clock).toString()));
        event.put("level", new BsonString(normalizeLevel(level)));
        event.put("message", new BsonString(message == null ? "" : message));
        for (Map.Entry<String, Object> entry : safeCorrelation.asFields().entrySet()) {
            event.put(entry.getKey(), JsonValues.toJson(entry.getValue()));
        }
        for (Map.Entry<String, ?> entry : safeFields.entrySet()) {
            String key = entry.getKey();
            if (key == null || key.isBlank() || event.containsKey(key)) {
                continue;
            }
            event.put(key, toJsonOrText(entry.getValue()));
        }

        BsonDocument line = new BsonDocument();
        event.forEach(line::append);
        writeLine(JsonValues.render(line));
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.flush();
            writer.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close logger writer", e);
        }
    }

    private void writeLine(String encoded) {
        try {
            writer.write(encoded);
            writer.write('\n');
            if (autoFlush) {
                writer.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write log event", e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("logger is already closed");
        }
    }

    private static BsonValue toJsonOrText(Object value) {
        try {
            return JsonValues.toJson(value);
        } catch (IllegalArgumentException unsupported) {
            return new BsonString(String.valueOf(value));
        }
    }

    private static String normalizeLevel(String level) {
        if (level == null || level.isBlank()) {
            return "INFO";
        }
        return level.trim().toUpperCase();
    }
}
