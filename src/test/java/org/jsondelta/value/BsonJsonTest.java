package org.jsondelta.value;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

class BsonJsonTest {
    @Test
    void parsesObjectsKeepingFieldOrder() {
        JsonValue value = BsonJson.parse("{\"z\": 1, \"a\": {\"n\": null, \"t\": true}, \"s\": \"text\"}");

        JsonObject object = (JsonObject) value;
        assertEquals(List.of("z", "a", "s"), object.fieldNames());
        assertEquals(JsonNumber.of(1), object.field("z").orElseThrow());
        assertEquals(JsonNull.INSTANCE, object.field("a").flatMap(a -> a.field("n")).orElseThrow());
        assertEquals(JsonBoolean.TRUE, object.field("a").flatMap(a -> a.field("t")).orElseThrow());
        assertEquals(JsonString.of("text"), object.field("s").orElseThrow());
    }

    @Test
    void parsesArrayAtRoot() {
        JsonValue value = BsonJson.parse("[1, 2.5, \"x\"]");

        assertEquals(JsonArray.of(JsonNumber.of(1), JsonNumber.of(new BigDecimal("2.5")), JsonString.of("x")), value);
    }

    @Test
    void rejectsMalformedAndBlankInput() {
        assertThrows(IllegalArgumentException.class, () -> BsonJson.parse("{\"a\": "));
        assertThrows(IllegalArgumentException.class, () -> BsonJson.parse("   "));
    }

    @Test
    void rejectsContentAfterTheFirstValue() {
        IllegalArgumentException error = assertThrows(
            IllegalArgumentException.class, () -> BsonJson.parse("{\"a\": 1} {\"b\": 2}"));
        assertEquals("invalid JSON document: trailing content", error.getMessage());
        assertThrows(IllegalArgumentException.class, () -> BsonJson.parse("[1] 2"));
        assertEquals(JsonNumber.of(42), BsonJson.parse(" 42 \n"));
    }

    @Test
    void keepsNumbersBeyondDecimal128AsText() {
        BigDecimal huge = new BigDecimal("1234567890123456789012345678901234567891");

        BsonValue bson = BsonJson.toBson(JsonNumber.of(huge));

        assertTrue(bson.isString());
        assertEquals("1234567890123456789012345678901234567891", bson.asString().getValue());
    }

    @Test
    void convertsToBsonWithNarrowestNumericType() {
        JsonValue value = BsonJson.parse("{\"small\": 7, \"big\": 9007199254740993, \"ratio\": 0.25, \"list\": [true]}");

        BsonDocument document = BsonJson.toBson(value).asDocument();
        assertTrue(document.get("small").isInt32());
        assertTrue(document.get("big").isInt64());
        assertEquals(9007199254740993L, document.getInt64("big").getValue());
        assertTrue(document.get("ratio").isDouble());
        assertTrue(document.getArray("list").get(0).asBoolean().getValue());
        assertEquals(value, BsonJson.fromBson(document));
    }

    @Test
    void flattensBsonOnlyTypes() {
        ObjectId id = new ObjectId("65f1c0ffee0000000000abcd");
        BsonValue bson = BsonDocument.parse("{\"_id\": {\"$oid\": \"65f1c0ffee0000000000abcd\"}, \"at\": {\"$date\": {\"$numberLong\": \"0\"}}}");

        JsonObject object = BsonJson.fromBsonDocument(bson.asDocument());
        assertEquals(JsonString.of(id.toHexString()), object.field("_id").orElseThrow());
        assertEquals(JsonString.of("1970-01-01T00:00:00Z"), object.field("at").orElseThrow());
    }

    @Test
    void convertsPlainJavaTrees() {
        Document document = new Document("name", "alpha")
            .append("tags", Arrays.asList("a", null))
            .append("count", 3L)
            .append("score", 1.5d);

        JsonValue value = BsonJson.fromJava(document);

        assertEquals(
            BsonJson.parse("{\"name\": \"alpha\", \"tags\": [\"a\", null], \"count\": 3, \"score\": 1.5}"),
            value);
        assertThrows(IllegalArgumentException.class, () -> BsonJson.fromJava(new Object()));
    }
}
