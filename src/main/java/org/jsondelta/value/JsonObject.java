package org.jsondelta.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Object node. Field order is the declaration order of the source document.
 */
public final class JsonObject implements JsonValue {
    private static final JsonObject EMPTY = new JsonObject(new LinkedHashMap<>());

    private final Map<String, JsonValue> fields;

    private JsonObject(LinkedHashMap<String, JsonValue> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static JsonObject empty() {
        return EMPTY;
    }

    public static JsonObject of(Map<String, ? extends JsonValue> fields) {
        Objects.requireNonNull(fields, "fields");
        LinkedHashMap<String, JsonValue> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends JsonValue> entry : fields.entrySet()) {
            copy.put(
                Objects.requireNonNull(entry.getKey(), "field name"),
                Objects.requireNonNull(entry.getValue(), "field value"));
        }
        return new JsonObject(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Kind kind() {
        return Kind.OBJECT;
    }

    public Map<String, JsonValue> fields() {
        return fields;
    }

    public List<String> fieldNames() {
        return List.copyOf(fields.keySet());
    }

    public boolean has(String name) {
        return fields.containsKey(name);
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    @Override
    public Optional<JsonValue> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof JsonObject that)) {
            return false;
        }
        return fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return JsonValues.render(this);
    }

    public static final class Builder {
        private final LinkedHashMap<String, JsonValue> fields = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(String name, JsonValue value) {
            fields.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder put(String name, String value) {
            return put(name, JsonString.of(value));
        }

        public Builder put(String name, long value) {
            return put(name, JsonNumber.of(value));
        }

        public Builder put(String name, boolean value) {
            return put(name, JsonBoolean.of(value));
        }

        public JsonObject build() {
            return new JsonObject(new LinkedHashMap<>(fields));
        }
    }
}
