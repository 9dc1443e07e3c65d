package org.jmapsuite.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonNull;
import org.bson.BsonObjectId;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.junit.jupiter.api.Test;

class JsonValuesTest {
    @Test
    void convertsJavaValuesRecursively() {
        final Map<String, Object> source = new LinkedHashMap<>();
        source.put("name", "X");
        source.put("sortOrder", 5);
        source.put("size", 7L);
        source.put("isSubscribed", true);
        source.put("parentId", null);
        source.put("ids", List.of("a", "b"));

        final BsonDocument document = JsonValues.toDocument(source);
        assertEquals(
                "{\"name\": \"X\", \"sortOrder\": 5, \"size\": 7, \"isSubscribed\": true, \"parentId\": null,"
                        + " \"ids\": [\"a\", \"b\"]}",
                JsonValues.render(document));
        assertEquals(new BsonInt64(7), document.get("size"));
        assertEquals(source, JsonValues.toJava(document));
        assertThrows(IllegalArgumentException.class, () -> JsonValues.toJson(new Object()));
    }

    @Test
    void rendersDecimalsAsPlainNumbers() {
        final BsonDocument document = JsonValues.toDocument(Map.of("quota", new BigDecimal("2.50")));

        assertEquals("{\"quota\": 2.50}", JsonValues.render(document));
        final BsonValue reparsed = JsonValues.parse(JsonValues.render(document));
        assertEquals(JsonKind.NUMBER, JsonKind.of(reparsed.asDocument().get("quota")));
    }

    @Test
    void parsingIsStrictJson() {
        assertThrows(IllegalArgumentException.class, () -> JsonValues.parse("{name: 1}"));
        assertThrows(IllegalArgumentException.class, () -> JsonValues.parse("{'name': 1}"));
        assertThrows(IllegalArgumentException.class, () -> JsonValues.parse("[1] [2]"));
        assertThrows(IllegalArgumentException.class, () -> JsonValues.parse("{\"a\": 1, \"a\": 2}"));
        assertThrows(IllegalArgumentException.class, () -> JsonValues.parse(""));
        assertEquals(
                new BsonDocument("$numberLong", new BsonString("5")),
                JsonValues.parse("{\"$numberLong\": \"5\"}"));
    }

    @Test
    void parsesTopLevelArraysAndScalars() {
        assertEquals(new BsonArray(Arrays.asList(new BsonInt32(1), new BsonString("x"))), JsonValues.parse("[1, \"x\"]"));
        assertEquals(new BsonString("plain"), JsonValues.parse("\"plain\""));
        assertEquals(BsonNull.VALUE, JsonValues.parse("null"));
        assertEquals("[1, \"x\"]", JsonValues.render(JsonValues.parse("[1,\"x\"]")));
        assertEquals("\"a:b\"", JsonValues.render(new BsonString("a:b")));
    }

    @Test
    void jsonEqualityIsTypeStrictAndNumericByValue() {
        assertTrue(JsonValues.jsonEquals(new BsonInt32(1), JsonValues.parse("1.0")));
        assertTrue(JsonValues.jsonEquals(new BsonInt32(1), new BsonInt64(1)));
        assertTrue(JsonValues.jsonEquals(JsonValues.toJson(new BigDecimal("2.50")), JsonValues.parse("2.5")));
        assertFalse(JsonValues.jsonEquals(new BsonInt32(1), new BsonString("1")));
        assertTrue(JsonValues.jsonEquals(
                BsonDocument.parse("{\"a\":1,\"b\":[true,null]}"),
                BsonDocument.parse("{\"b\":[true,null],\"a\":1}")));
        assertFalse(JsonValues.jsonEquals(JsonValues.parse("[1,2]"), JsonValues.parse("[2,1]")));
        assertFalse(JsonValues.jsonEquals(BsonDocument.parse("{\"a\":1}"), BsonDocument.parse("{\"a\":1,\"b\":2}")));
    }

    @Test
    void kindsCoverJsonTypesOnly() {
        assertEquals(JsonKind.NULL, JsonKind.of(null));
        assertEquals(JsonKind.NUMBER, JsonKind.of(JsonValues.parse("1e3")));
        assertEquals(JsonKind.OBJECT, JsonKind.of(new BsonDocument()));
        assertEquals("bool", JsonKind.of(JsonValues.parse("false")).label());
        final BsonValue objectId = new BsonObjectId();
        assertThrows(IllegalArgumentException.class, () -> JsonKind.of(objectId));
    }
}
