package org.jsondelta.value;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonValuesTest {
    @Test
    void numbersCompareByValueRegardlessOfScale() {
        assertEquals(JsonNumber.of(1), JsonNumber.of(new BigDecimal("1.00")));
        assertEquals(JsonNumber.of(1).hashCode(), JsonNumber.of(new BigDecimal("1.00")).hashCode());
        assertEquals("1000", JsonNumber.of(new BigDecimal("1E+3")).canonicalText());
        assertEquals("2.5", JsonNumber.of(new BigDecimal("2.50")).canonicalText());
        assertEquals("0", JsonNumber.of(new BigDecimal("0.000")).canonicalText());
        assertNotEquals(JsonNumber.of(1), JsonString.of("1"));
        assertThrows(IllegalArgumentException.class, () -> JsonNumber.of(Double.NaN));
    }

    @Test
    void renderWritesCompactJsonInDeclarationOrder() {
        JsonValue value = JsonObject.builder()
            .put("b", true)
            .put("a", JsonArray.of(JsonNumber.of(1), JsonNull.INSTANCE, JsonString.of("x\"y\n")))
            .build();

        assertEquals("{\"b\":true,\"a\":[1,null,\"x\\\"y\\n\"]}", JsonValues.render(value));
    }

    @Test
    void nodeCountIncludesContainers() {
        JsonValue value = JsonObject.builder()
            .put("a", JsonArray.of(JsonNumber.of(1), JsonNumber.of(2), JsonObject.builder().put("b", JsonNull.INSTANCE).build()))
            .build();

        assertEquals(6, JsonValues.nodeCount(value));
        assertEquals(1, JsonValues.nodeCount(JsonNull.INSTANCE));
    }

    @Test
    void childLookupIsEmptyForMissingChildrenAndWrongKinds() {
        JsonArray array = JsonArray.of(JsonString.of("x"));
        JsonObject object = JsonObject.builder().put("k", "v").build();

        assertEquals(JsonString.of("x"), array.element(0).orElseThrow());
        assertTrue(array.element(1).isEmpty());
        assertTrue(array.element(-1).isEmpty());
        assertTrue(array.field("k").isEmpty());
        assertEquals(JsonString.of("v"), object.field("k").orElseThrow());
        assertTrue(object.field("missing").isEmpty());
        assertTrue(object.element(0).isEmpty());
        assertTrue(JsonBoolean.TRUE.field("k").isEmpty());
    }

    @Test
    void foldVisitsChildrenBeforeParents() {
        JsonFolder<String> shape = new JsonFolder<>() {
            @Override
            public String onNull() {
                return "n";
            }

            @Override
            public String onBoolean(boolean value) {
                return "b";
            }

            @Override
            public String onNumber(BigDecimal value) {
                return "#";
            }

            @Override
            public String onString(String value) {
                return "s";
            }

            @Override
            public String onObject(JsonObject source, Map<String, String> fields) {
                return "{" + String.join(",", fields.values()) + "}";
            }

            @Override
            public String onArray(JsonArray source, List<String> elements) {
                return "[" + String.join(",", elements) + "]";
            }
        };
        JsonValue value = BsonJson.parse("{\"a\": [1, \"x\", null], \"b\": {\"c\": false}}");

        assertEquals("{[#,s,n],{b}}", JsonValues.fold(value, shape));
    }

    @Test
    void containersAreImmutable() {
        JsonArray array = JsonArray.of(JsonNumber.of(1));
        JsonObject object = JsonObject.builder().put("a", 1).build();

        assertThrows(UnsupportedOperationException.class, () -> array.elements().add(JsonNull.INSTANCE));
        assertThrows(UnsupportedOperationException.class, () -> object.fields().put("b", JsonNull.INSTANCE));
    }
}
