package org.jmapsuite.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
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
import org.bson.types.Decimal128;

/**
 * Strict RFC 8259 reader producing the BSON value tree.
 *
 * <p>Object keys are taken literally: {@code {"$numberLong": "5"}} stays an object.
 * Duplicate keys and trailing content are rejected.
 */
final class JsonTreeReader {
    private static final JsonFactory FACTORY = JsonFactory.builder().build();

    private JsonTreeReader() {}

    static BsonValue read(final String json) {
        Objects.requireNonNull(json, "json");
        try (JsonParser parser = FACTORY.createParser(json)) {
            parser.enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
            final JsonToken first = parser.nextToken();
            if (first == null) {
                throw new IllegalArgumentException("JSON text is empty");
            }
            final BsonValue value = readValue(parser, first);
            final JsonToken trailing = parser.nextToken();
            if (trailing != null) {
                throw new IllegalArgumentException("JSON text has trailing content: " + trailing);
            }
            return value;
        } catch (IOException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    private static BsonValue readValue(final JsonParser parser, final JsonToken token) throws IOException {
        if (token == null) {
            throw new IllegalArgumentException("JSON text ends unexpectedly");
        }
        return switch (token) {
            case START_OBJECT -> readObject(parser);
            case START_ARRAY -> readArray(parser);
            case VALUE_STRING -> new BsonString(parser.getText());
            case VALUE_NUMBER_INT -> readInteger(parser);
            case VALUE_NUMBER_FLOAT -> new BsonDouble(parser.getDoubleValue());
            case VALUE_TRUE -> BsonBoolean.TRUE;
            case VALUE_FALSE -> BsonBoolean.FALSE;
            case VALUE_NULL -> BsonNull.VALUE;
            default -> throw new IllegalArgumentException("unexpected JSON token: " + token);
        };
    }

    private static BsonDocument readObject(final JsonParser parser) throws IOException {
        final BsonDocument document = new BsonDocument();
        JsonToken token = parser.nextToken();
        while (token != JsonToken.END_OBJECT) {
            final String name = parser.currentName();
            document.put(name, readValue(parser, parser.nextToken()));
            token = parser.nextToken();
        }
        return document;
    }

    private static BsonArray readArray(final JsonParser parser) throws IOException {
        final BsonArray array = new BsonArray();
        JsonToken token = parser.nextToken();
        while (token != JsonToken.END_ARRAY) {
            array.add(readValue(parser, token));
            token = parser.nextToken();
        }
        return array;
    }

    private static BsonValue readInteger(final JsonParser parser) throws IOException {
        final JsonParser.NumberType type = parser.getNumberType();
        if (type == JsonParser.NumberType.INT) {
            return new BsonInt32(parser.getIntValue());
        }
        if (type == JsonParser.NumberType.LONG) {
            return new BsonInt64(parser.getLongValue());
        }
        try {
            return new BsonDecimal128(new Decimal128(parser.getDecimalValue()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("integer out of range: " + parser.getText(), e);
        }
    }
}
