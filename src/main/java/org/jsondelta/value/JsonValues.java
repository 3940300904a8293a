package org.jsondelta.value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Generic walks over {@link JsonValue} trees.
 */
public final class JsonValues {
    private static final JsonFolder<Integer> NODE_COUNTER = new JsonFolder<>() {
        @Override
        public Integer onNull() {
            return 1;
        }

        @Override
        public Integer onBoolean(boolean value) {
            return 1;
        }

        @Override
        public Integer onNumber(BigDecimal value) {
            return 1;
        }

        @Override
        public Integer onString(String value) {
            return 1;
        }

        @Override
        public Integer onObject(JsonObject source, Map<String, Integer> fields) {
            int total = 1;
            for (Integer count : fields.values()) {
                total += count;
            }
            return total;
        }

        @Override
        public Integer onArray(JsonArray source, List<Integer> elements) {
            int total = 1;
            for (Integer count : elements) {
                total += count;
            }
            return total;
        }
    };

    private JsonValues() {}

    public static <R> R fold(JsonValue value, JsonFolder<R> folder) {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(folder, "folder");
        return switch (value.kind()) {
            case NULL -> folder.onNull();
            case BOOLEAN -> folder.onBoolean(((JsonBoolean) value).value());
            case NUMBER -> folder.onNumber(((JsonNumber) value).value());
            case STRING -> folder.onString(((JsonString) value).value());
            case OBJECT -> {
                JsonObject object = (JsonObject) value;
                Map<String, R> folded = new LinkedHashMap<>();
                for (Map.Entry<String, JsonValue> entry : object.fields().entrySet()) {
                    folded.put(entry.getKey(), fold(entry.getValue(), folder));
                }
                yield folder.onObject(object, folded);
            }
            case ARRAY -> {
                JsonArray array = (JsonArray) value;
                List<R> folded = new ArrayList<>(array.size());
                for (JsonValue element : array.elements()) {
                    folded.add(fold(element, folder));
                }
                yield folder.onArray(array, folded);
            }
        };
    }

    public static int nodeCount(JsonValue value) {
        return fold(value, NODE_COUNTER);
    }

    /**
     * Compact JSON text, fields in declaration order.
     */
    public static String render(JsonValue value) {
        StringBuilder sb = new StringBuilder();
        appendValue(sb, value);
        return sb.toString();
    }

    private static void appendValue(StringBuilder sb, JsonValue value) {
        switch (value.kind()) {
            case NULL -> sb.append("null");
            case BOOLEAN -> sb.append(((JsonBoolean) value).value());
            case NUMBER -> sb.append(((JsonNumber) value).canonicalText());
            case STRING -> appendString(sb, ((JsonString) value).value());
            case OBJECT -> {
                sb.append('{');
                boolean first = true;
                for (Map.Entry<String, JsonValue> entry : ((JsonObject) value).fields().entrySet()) {
                    if (!first) {
                        sb.append(',');
                    }
                    first = false;
                    appendString(sb, entry.getKey());
                    sb.append(':');
                    appendValue(sb, entry.getValue());
                }
                sb.append('}');
            }
            case ARRAY -> {
                sb.append('[');
                boolean first = true;
                for (JsonValue element : ((JsonArray) value).elements()) {
                    if (!first) {
                        sb.append(',');
                    }
                    first = false;
                    appendValue(sb, element);
                }
                sb.append(']');
            }
        }
    }

    private static void appendString(StringBuilder sb, String value) {
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c <= 0x1F) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }
}
