package org.jsondelta.path;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jsondelta.value.JsonArray;
import org.jsondelta.value.JsonNumber;
import org.jsondelta.value.JsonString;
import org.jsondelta.value.JsonValue;
import org.jsondelta.value.JsonValues;

/**
 * One or more object field names whose values together identify an array element.
 */
public record IdentityKey(List<String> fields) {
    public IdentityKey {
        Objects.requireNonNull(fields, "fields");
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("identity key needs at least one field");
        }
        fields = List.copyOf(fields);
        if (fields.stream().distinct().count() != fields.size()) {
            throw new IllegalArgumentException("identity key fields must be distinct: " + fields);
        }
    }

    public static IdentityKey of(String... fields) {
        return new IdentityKey(List.of(fields));
    }

    public boolean isComposite() {
        return fields.size() > 1;
    }

    /**
     * Fields joined with {@code +}, e.g. {@code sku+rev}.
     */
    public String displayName() {
        return String.join("+", fields);
    }

    /**
     * Key values of {@code element}, in field order. Empty unless the element is an object holding a
     * string or number under every key field.
     */
    public Optional<List<JsonValue>> valuesOf(JsonValue element) {
        if (element == null || element.kind() != JsonValue.Kind.OBJECT) {
            return Optional.empty();
        }
        List<JsonValue> values = new ArrayList<>(fields.size());
        for (String field : fields) {
            Optional<JsonValue> value = element.field(field);
            if (value.isEmpty() || !isKeyValue(value.get())) {
                return Optional.empty();
            }
            values.add(value.get());
        }
        return Optional.of(values);
    }

    public boolean appliesTo(JsonArray array) {
        for (JsonValue element : array.elements()) {
            if (valuesOf(element).isEmpty()) {
                return false;
            }
        }
        return true;
    }

    public boolean matches(PathSegment.Key segment) {
        return fields.equals(segment.fields());
    }

    /**
     * Key segment for every element of {@code array}, in array order. Elements repeating an earlier
     * key text get occurrence 2, 3, ...; elements without usable key values get an empty entry.
     */
    public List<Optional<PathSegment.Key>> segmentsFor(JsonArray array) {
        List<Optional<PathSegment.Key>> segments = new ArrayList<>(array.size());
        Map<List<String>, Integer> seen = new HashMap<>();
        for (JsonValue element : array.elements()) {
            Optional<List<JsonValue>> values = valuesOf(element);
            if (values.isEmpty()) {
                segments.add(Optional.empty());
                continue;
            }
            List<String> texts = values.get().stream().map(IdentityKey::keyText).toList();
            int occurrence = seen.merge(texts, 1, Integer::sum);
            segments.add(Optional.of(segmentFor(texts, occurrence)));
        }
        return segments;
    }

    public PathSegment.Key segmentFor(List<String> keyTexts, int occurrence) {
        if (keyTexts.size() != fields.size()) {
            throw new IllegalArgumentException("expected " + fields.size() + " key values, got " + keyTexts.size());
        }
        List<PathSegment.KeyComponent> components = new ArrayList<>(fields.size());
        for (int i = 0; i < fields.size(); i++) {
            components.add(new PathSegment.KeyComponent(fields.get(i), keyTexts.get(i)));
        }
        return new PathSegment.Key(components, occurrence);
    }

    /**
     * Text used inside a key segment: a string as is, a number in canonical decimal form.
     */
    public static String keyText(JsonValue value) {
        if (value instanceof JsonString string) {
            return string.value();
        }
        if (value instanceof JsonNumber number) {
            return number.canonicalText();
        }
        return JsonValues.render(value);
    }

    public static boolean isKeyValue(JsonValue value) {
        return value.kind() == JsonValue.Kind.STRING || value.kind() == JsonValue.Kind.NUMBER;
    }

    @Override
    public String toString() {
        return displayName();
    }
}
