package org.jmapsuite.json;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
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
import org.bson.BsonNull;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.bson.json.JsonMode;
import org.bson.json.Converter;
import org.bson.json.JsonWriterSettings;
import org.bson.types.Decimal128;

/**
 * Conversions between plain Java values, JSON text and the BSON value tree used to hold JSON.
 */
public final class JsonValues {
    // decimals go out as plain JSON numbers, not as {"$numberDecimal": ...}
    private static final Converter<Decimal128> DECIMAL_AS_NUMBER =
            (value, writer) -> writer.writeNumber(value.toString());
    private static final JsonWriterSettings RELAXED = JsonWriterSettings.builder()
            .outputMode(JsonMode.RELAXED)
            .decimal128Converter(DECIMAL_AS_NUMBER)
            .build();
    private static final JsonWriterSettings INDENTED = JsonWriterSettings.builder()
            .outputMode(JsonMode.RELAXED)
            .decimal128Converter(DECIMAL_AS_NUMBER)
            .indent(true)
            .build();
    private static final String WRAPPER_KEY = "v";

    private JsonValues() {}

    public static BsonValue toJson(final Object value) {
        if (value == null) {
            return BsonNull.VALUE;
        }
        if (value instanceof BsonValue bsonValue) {
            return bsonValue;
        }
        if (value instanceof String s) {
            return new BsonString(s);
        }
        if (value instanceof Boolean b) {
            return BsonBoolean.valueOf(b);
        }
        if (value instanceof Integer n) {
            return new BsonInt32(n);
        }
        if (value instanceof Long n) {
            return new BsonInt64(n);
        }
        if (value instanceof Double n) {
            return new BsonDouble(n);
        }
        if (value instanceof Float n) {
            return new BsonDouble(n.doubleValue());
        }
        if (value instanceof Short n) {
            return new BsonInt32(n.intValue());
        }
        if (value instanceof Byte n) {
            return new BsonInt32(n.intValue());
        }
        if (value instanceof BigDecimal decimal) {
            return new BsonDecimal128(new Decimal128(decimal));
        }
        if (value instanceof Map<?, ?> map) {
            return toDocument(map);
        }
        if (value instanceof Collection<?> collection) {
            final BsonArray array = new BsonArray();
            for (Object item : collection) {
                array.add(toJson(item));
            }
            return array;
        }
        throw new IllegalArgumentException("unsupported JSON value type: " + value.getClass().getName());
    }

    public static BsonDocument toDocument(final Map<?, ?> source) {
        Objects.requireNonNull(source, "source");
        final BsonDocument document = new BsonDocument();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            final Object key = Objects.requireNonNull(entry.getKey(), "document key");
            document.put(String.valueOf(key), toJson(entry.getValue()));
        }
        return document;
    }

    public static Object toJava(final BsonValue value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isDocument()) {
            final Map<String, Object> result = new LinkedHashMap<>();
            for (Map.Entry<String, BsonValue> entry : value.asDocument().entrySet()) {
                result.put(entry.getKey(), toJava(entry.getValue()));
            }
            return result;
        }
        if (value.isArray()) {
            final List<Object> results = new ArrayList<>();
            for (BsonValue item : value.asArray()) {
                results.add(toJava(item));
            }
            return results;
        }
        if (value.isString()) {
            return value.asString().getValue();
        }
        if (value.isBoolean()) {
            return value.asBoolean().getValue();
        }
        if (value.isInt32()) {
            return value.asInt32().getValue();
        }
        if (value.isInt64()) {
            return value.asInt64().getValue();
        }
        if (value.isDouble()) {
            return value.asDouble().getValue();
        }
        if (value.isDecimal128()) {
            return value.asDecimal128().decimal128Value().bigDecimalValue();
        }
        return value.toString();
    }

    /**
     * Parses strict JSON text, including top-level arrays and scalars.
     *
     * @throws IllegalArgumentException when the text is not valid JSON
     */
    public static BsonValue parse(final String json) {
        return JsonTreeReader.read(json);
    }

    public static String render(final BsonValue value) {
        if (value == null) {
            return "null";
        }
        if (value.isDocument()) {
            return value.asDocument().toJson(RELAXED);
        }
        final String wrapped = new BsonDocument(WRAPPER_KEY, value).toJson(RELAXED);
        final int start = wrapped.indexOf(':') + 1;
        return wrapped.substring(start, wrapped.length() - 1).trim();
    }

    public static String renderIndented(final BsonDocument document) {
        return Objects.requireNonNull(document, "document").toJson(INDENTED);
    }

    public static boolean numericEquals(final BsonValue left, final BsonValue right) {
        final BigDecimal leftDecimal = decimalValue(left);
        final BigDecimal rightDecimal = decimalValue(right);
        if (leftDecimal == null || rightDecimal == null) {
            return false;
        }
        return leftDecimal.compareTo(rightDecimal) == 0;
    }

    /**
     * Deep JSON equality: kinds must agree, numbers compare by value, object key order is ignored.
     */
    public static boolean jsonEquals(final BsonValue left, final BsonValue right) {
        final JsonKind leftKind = JsonKind.of(left);
        final JsonKind rightKind = JsonKind.of(right);
        if (leftKind != rightKind) {
            return false;
        }
        switch (leftKind) {
            case NULL:
                return true;
            case NUMBER:
                return numericEquals(left, right);
            case OBJECT: {
                final BsonDocument leftDocument = left.asDocument();
                final BsonDocument rightDocument = right.asDocument();
                if (!leftDocument.keySet().equals(rightDocument.keySet())) {
                    return false;
                }
                for (Map.Entry<String, BsonValue> entry : leftDocument.entrySet()) {
                    if (!jsonEquals(entry.getValue(), rightDocument.get(entry.getKey()))) {
                        return false;
                    }
                }
                return true;
            }
            case ARRAY: {
                final BsonArray leftArray = left.asArray();
                final BsonArray rightArray = right.asArray();
                if (leftArray.size() != rightArray.size()) {
                    return false;
                }
                for (int i = 0; i < leftArray.size(); i++) {
                    if (!jsonEquals(leftArray.get(i), rightArray.get(i))) {
                        return false;
                    }
                }
                return true;
            }
            default:
                return left.equals(right);
        }
    }

    public static String readString(final BsonDocument document, final String key) {
        final BsonValue value = document == null ? null : document.get(key);
        if (value == null || !value.isString()) {
            return null;
        }
        return value.asString().getValue();
    }

    public static BsonDocument readDocument(final BsonDocument document, final String key) {
        final BsonValue value = document == null ? null : document.get(key);
        if (value == null || !value.isDocument()) {
            return null;
        }
        return value.asDocument();
    }

    private static BigDecimal decimalValue(final BsonValue value) {
        if (value == null) {
            return null;
        }
        if (value.isInt32()) {
            return BigDecimal.valueOf(value.asInt32().getValue());
        }
        if (value.isInt64()) {
            return BigDecimal.valueOf(value.asInt64().getValue());
        }
        if (value.isDouble()) {
            final double number = value.asDouble().getValue();
            if (!Double.isFinite(number)) {
                return null;
            }
            return new BigDecimal(Double.toString(number));
        }
        if (value.isDecimal128()) {
            try {
                return value.asDecimal128().decimal128Value().bigDecimalValue();
            } catch (ArithmeticException ignored) {
                return null;
            }
        }
        return null;
    }
}
