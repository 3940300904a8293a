package org.jsondelta.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class JsonArray implements JsonValue {
    private static final JsonArray EMPTY = new JsonArray(List.of());

    private final List<JsonValue> elements;

    private JsonArray(List<JsonValue> elements) {
        this.elements = elements;
    }

    public static JsonArray empty() {
        return EMPTY;
    }

    public static JsonArray of(List<? extends JsonValue> elements) {
        Objects.requireNonNull(elements, "elements");
        List<JsonValue> copy = new ArrayList<>(elements.size());
        for (JsonValue element : elements) {
            copy.add(Objects.requireNonNull(element, "element"));
        }
        return new JsonArray(Collections.unmodifiableList(copy));
    }

    public static JsonArray of(JsonValue... elements) {
        return of(List.of(elements));
    }

    @Override
    public Kind kind() {
        return Kind.ARRAY;
    }

    public List<JsonValue> elements() {
        return elements;
    }

    public JsonValue get(int index) {
        return elements.get(index);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public Optional<JsonValue> element(int index) {
        if (index < 0 || index >= elements.size()) {
            return Optional.empty();
        }
        return Optional.of(elements.get(index));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof JsonArray that)) {
            return false;
        }
        return elements.equals(that.elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return JsonValues.render(this);
    }
}
