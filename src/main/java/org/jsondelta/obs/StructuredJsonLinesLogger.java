package org.jsondelta.obs;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.jsondelta.value.JsonArray;
import org.jsondelta.value.JsonBoolean;
import org.jsondelta.value.JsonNull;
import org.jsondelta.value.JsonNumber;
import org.jsondelta.value.JsonObject;
import org.jsondelta.value.JsonString;
import org.jsondelta.value.JsonValue;
import org.jsondelta.value.JsonValues;

/**
 * JSON-lines logger for deterministic diagnostics. Events below the configured level are dropped;
 * field values that are not JSON-shaped are logged by their {@code toString()}.
 */
public final class StructuredJsonLinesLogger implements JsonLinesLogger {
    private static final List<String> LEVELS = List.of("DEBUG", "INFO", "WARN", "ERROR");

    private final Writer writer;
    private final Clock clock;
    private final boolean autoFlush;
    private final int threshold;
    private boolean closed;

    public StructuredJsonLinesLogger(OutputStream outputStream) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), Clock.systemUTC(), true, "INFO");
    }

    public StructuredJsonLinesLogger(OutputStream outputStream, Clock clock, boolean autoFlush) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), clock, autoFlush, "DEBUG");
    }

    public StructuredJsonLinesLogger(Writer writer, Clock clock, boolean autoFlush, String minimumLevel) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.autoFlush = autoFlush;
        this.threshold = rank(normalizeLevel(minimumLevel));
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
        String safeLevel = normalizeLevel(level);
        if (rank(safeLevel) < threshold) {
            return;
        }
        CorrelationContext safeCorrelation = Objects.requireNonNull(correlationContext, "correlationContext");
        Map<String, ?> safeFields = fields == null ? Map.of() : fields;

        JsonObject.Builder event = JsonObject.builder()
            .put("timestamp", Instant.now(clock).toString())
            .put("level", safeLevel)
            .put("message", message == null ? "" : message);
        Map<String, Object> reserved = safeCorrelation.asFields();
        for (Map.Entry<String, Object> entry : reserved.entrySet()) {
            event.put(entry.getKey(), toJson(entry.getValue()));
        }
        for (Map.Entry<String, Object> entry : withoutBlankKeys(safeFields).entrySet()) {
            String key = entry.getKey();
            if (reserved.containsKey(key) || "timestamp".equals(key) || "level".equals(key) || "message".equals(key)) {
                continue;
            }
            event.put(key, toJson(entry.getValue()));
        }

        writeLine(JsonValues.render(event.build()));
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

    static JsonValue toJson(Object value) {
        if (value == null) {
            return JsonNull.INSTANCE;
        }
        if (value instanceof JsonValue json) {
            return json;
        }
        if (value instanceof CharSequence text) {
            return JsonString.of(text.toString());
        }
        if (value instanceof Boolean flag) {
            return JsonBoolean.of(flag);
        }
        if (value instanceof BigDecimal decimal) {
            return JsonNumber.of(decimal);
        }
        if (value instanceof BigInteger integer) {
            return JsonNumber.of(new BigDecimal(integer));
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? JsonNumber.of(d) : JsonString.of(Double.toString(d));
        }
        if (value instanceof Number number) {
            return JsonNumber.of(number.longValue());
        }
        if (value instanceof Map<?, ?> map) {
            JsonObject.Builder builder = JsonObject.builder();
            Map<String, Object> sorted = new TreeMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                sorted.put(String.valueOf(entry.getKey()), entry.getValue());
            }
            for (Map.Entry<String, Object> entry : sorted.entrySet()) {
                builder.put(entry.getKey(), toJson(entry.getValue()));
            }
            return builder.build();
        }
        if (value instanceof Collection<?> collection) {
            List<JsonValue> elements = new ArrayList<>(collection.size());
            for (Object item : collection) {
                elements.add(toJson(item));
            }
            return JsonArray.of(elements);
        }
        if (value instanceof Enum<?> constant) {
            return JsonString.of(constant.name());
        }
        return JsonString.of(String.valueOf(value));
    }

    private static Map<String, Object> withoutBlankKeys(Map<String, ?> fields) {
        Map<String, Object> kept = new TreeMap<>();
        for (Map.Entry<String, ?> entry : fields.entrySet()) {
            if (entry.getKey() != null && !entry.getKey().isBlank()) {
                kept.put(entry.getKey(), entry.getValue());
            }
        }
        return kept;
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

    private static int rank(String level) {
        int index = LEVELS.indexOf(level);
        return index < 0 ? LEVELS.indexOf("INFO") : index;
    }

    private static String normalizeLevel(String level) {
        if (level == null || level.isBlank()) {
            return "INFO";
        }
        return level.trim().toUpperCase(Locale.ROOT);
    }
}
