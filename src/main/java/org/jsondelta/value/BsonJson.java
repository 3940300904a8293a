package org.jsondelta.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDecimal128;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonInvalidOperationException;
import org.bson.BsonNull;
import org.bson.BsonString;
import org.bson.BsonType;
import org.bson.BsonValue;
import org.bson.codecs.BsonValueCodec;
import org.bson.codecs.DecoderContext;
import org.bson.json.JsonParseException;
import org.bson.json.JsonReader;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

/**
 * Conversions between {@link JsonValue} trees and the bson library's value model and JSON reader.
 *
 * <p>BSON types without a JSON counterpart are flattened: ObjectId to its hex string, DateTime to an
 * ISO-8601 instant, Binary to base64, Timestamp to its numeric value.
 */
public final class BsonJson {
    private static final BsonValueCodec VALUE_CODEC = new BsonValueCodec();

    private static final JsonFolder<BsonValue> TO_BSON = new JsonFolder<>() {
        @Override
        public BsonValue onNull() {
            return BsonNull.VALUE;
        }

        @Override
        public BsonValue onBoolean(boolean value) {
            return BsonBoolean.valueOf(value);
        }

        @Override
        public BsonValue onNumber(BigDecimal value) {
            return toBsonNumber(value);
        }

        @Override
        public BsonValue onString(String value) {
            return new BsonString(value);
        }

        @Override
        public BsonValue onObject(JsonObject source, Map<String, BsonValue> fields) {
            BsonDocument document = new BsonDocument();
            for (Map.Entry<String, BsonValue> entry : fields.entrySet()) {
                document.put(entry.getKey(), entry.getValue());
            }
            return document;
        }

        @Override
        public BsonValue onArray(JsonArray source, List<BsonValue> elements) {
            return new BsonArray(elements);
        }
    };

    private BsonJson() {}

    /**
     * Parses JSON (or MongoDB extended JSON) text. Any value may appear at the root.
     */
    public static JsonValue parse(String json) {
        Objects.requireNonNull(json, "json");
        String trimmed = json.strip();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("json must not be blank");
        }
        try (JsonReader reader = new JsonReader(trimmed)) {
            reader.readBsonType();
            JsonValue value = fromBson(VALUE_CODEC.decode(reader, DecoderContext.builder().build()));
            if (reader.readBsonType() != BsonType.END_OF_DOCUMENT) {
                throw new IllegalArgumentException("invalid JSON document: trailing content");
            }
            return value;
        } catch (JsonParseException | BsonInvalidOperationException e) {
            throw new IllegalArgumentException("invalid JSON document: " + e.getMessage(), e);
        }
    }

    public static JsonValue fromBson(BsonValue value) {
        if (value == null) {
            return JsonNull.INSTANCE;
        }
        return switch (value.getBsonType()) {
            case NULL, UNDEFINED -> JsonNull.INSTANCE;
            case BOOLEAN -> JsonBoolean.of(value.asBoolean().getValue());
            case STRING -> JsonString.of(value.asString().getValue());
            case INT32 -> JsonNumber.of(value.asInt32().getValue());
            case INT64 -> JsonNumber.of(value.asInt64().getValue());
            case DOUBLE -> fromDouble(value.asDouble().getValue());
            case DECIMAL128 -> fromDecimal128(value.asDecimal128().getValue());
            case TIMESTAMP -> JsonNumber.of(value.asTimestamp().getValue());
            case DOCUMENT -> fromBsonDocument(value.asDocument());
            case ARRAY -> fromBsonArray(value.asArray());
            case OBJECT_ID -> JsonString.of(value.asObjectId().getValue().toHexString());
            case DATE_TIME -> JsonString.of(Instant.ofEpochMilli(value.asDateTime().getValue()).toString());
            case BINARY -> JsonString.of(Base64.getEncoder().encodeToString(value.asBinary().getData()));
            case SYMBOL -> JsonString.of(value.asSymbol().getSymbol());
            case JAVASCRIPT -> JsonString.of(value.asJavaScript().getCode());
            case JAVASCRIPT_WITH_SCOPE -> JsonString.of(value.asJavaScriptWithScope().getCode());
            case REGULAR_EXPRESSION -> JsonString.of(
                "/" + value.asRegularExpression().getPattern() + "/" + value.asRegularExpression().getOptions());
            case DB_POINTER -> JsonString.of(
                value.asDBPointer().getNamespace() + "/" + value.asDBPointer().getId().toHexString());
            case MIN_KEY -> JsonString.of("MinKey");
            case MAX_KEY -> JsonString.of("MaxKey");
            case END_OF_DOCUMENT -> throw new IllegalArgumentException("END_OF_DOCUMENT is not a value");
        };
    }

    public static JsonObject fromBsonDocument(BsonDocument document) {
        Objects.requireNonNull(document, "document");
        Map<String, JsonValue> fields = new LinkedHashMap<>();
        for (Map.Entry<String, BsonValue> entry : document.entrySet()) {
            fields.put(entry.getKey(), fromBson(entry.getValue()));
        }
        return JsonObject.of(fields);
    }

    public static BsonValue toBson(JsonValue value) {
        return JsonValues.fold(value, TO_BSON);
    }

    /**
     * Converts a plain Java tree such as an {@code org.bson.Document}: maps, collections, boxed
     * primitives, strings and the common bson scalar types.
     */
    public static JsonValue fromJava(Object value) {
        if (value == null) {
            return JsonNull.INSTANCE;
        }
        if (value instanceof JsonValue jsonValue) {
            return jsonValue;
        }
        if (value instanceof BsonValue bsonValue) {
            return fromBson(bsonValue);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, JsonValue> fields = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new IllegalArgumentException("document keys must be strings");
                }
                fields.put(key, fromJava(entry.getValue()));
            }
            return JsonObject.of(fields);
        }
        if (value instanceof Collection<?> collection) {
            List<JsonValue> elements = new ArrayList<>(collection.size());
            for (Object item : collection) {
                elements.add(fromJava(item));
            }
            return JsonArray.of(elements);
        }
        if (value instanceof Object[] array) {
            return fromJava(Arrays.asList(array));
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
            return fromDouble(((Number) value).doubleValue());
        }
        if (value instanceof Number number) {
            return JsonNumber.of(number.longValue());
        }
        if (value instanceof Decimal128 decimal128) {
            return fromDecimal128(decimal128);
        }
        if (value instanceof ObjectId objectId) {
            return JsonString.of(objectId.toHexString());
        }
        if (value instanceof Date date) {
            return JsonString.of(date.toInstant().toString());
        }
        if (value instanceof Instant instant) {
            return JsonString.of(instant.toString());
        }
        if (value instanceof byte[] bytes) {
            return JsonString.of(Base64.getEncoder().encodeToString(bytes));
        }
        throw new IllegalArgumentException("unsupported value type: " + value.getClass().getName());
    }

    private static JsonArray fromBsonArray(BsonArray array) {
        List<JsonValue> elements = new ArrayList<>(array.size());
        for (BsonValue element : array) {
            elements.add(fromBson(element));
        }
        return JsonArray.of(elements);
    }

    private static JsonValue fromDouble(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return JsonString.of(Double.toString(value));
        }
        return JsonNumber.of(value);
    }

    private static JsonValue fromDecimal128(Decimal128 value) {
        if (value.isNaN() || value.isInfinite()) {
            return JsonString.of(value.toString());
        }
        return JsonNumber.of(new BigDecimal(value.toString()));
    }

    private static BsonValue toBsonNumber(BigDecimal value) {
        JsonNumber number = JsonNumber.of(value);
        if (number.isIntegral()) {
            BigInteger integer = value.toBigInteger();
            if (integer.bitLength() < 32) {
                return new BsonInt32(integer.intValue());
            }
            if (integer.bitLength() < 64) {
                return new BsonInt64(integer.longValue());
            }
            return toDecimal128(number);
        }
        double asDouble = value.doubleValue();
        if (!Double.isInfinite(asDouble) && BigDecimal.valueOf(asDouble).compareTo(value) == 0) {
            return new BsonDouble(asDouble);
        }
        return toDecimal128(number);
    }

    // Decimal128 holds at most 34 significant digits; longer numbers are kept as their text
    private static BsonValue toDecimal128(JsonNumber number) {
        try {
            return new BsonDecimal128(new Decimal128(number.value()));
        } catch (NumberFormatException e) {
            return new BsonString(number.canonicalText());
        }
    }
}
