package org.jmapsuite.match;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.BsonBoolean;
import org.bson.BsonNull;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.jmapsuite.json.JsonKind;
import org.jmapsuite.json.JsonValues;

/**
 * Factory methods for {@link ExpectedTemplate}s.
 *
 * <pre>{@code
 * Expect.supersetOf(
 *     "created", Expect.supersetOf("new", Expect.supersetOf("id", Expect.string())),
 *     "notCreated", Expect.nullValue());
 * }</pre>
 */
public final class Expect {
    private static final ExpectedTemplate ANY = new ExpectedTemplate.Any();

    private Expect() {}

    public static ExpectedTemplate any() {
        return ANY;
    }

    public static ExpectedTemplate string() {
        return new ExpectedTemplate.TypedLiteral(JsonKind.STRING, null);
    }

    public static ExpectedTemplate string(final String value) {
        return new ExpectedTemplate.TypedLiteral(JsonKind.STRING, new BsonString(Objects.requireNonNull(value, "value")));
    }

    public static ExpectedTemplate number() {
        return new ExpectedTemplate.TypedLiteral(JsonKind.NUMBER, null);
    }

    public static ExpectedTemplate number(final Number value) {
        return new ExpectedTemplate.TypedLiteral(JsonKind.NUMBER, JsonValues.toJson(Objects.requireNonNull(value, "value")));
    }

    public static ExpectedTemplate bool() {
        return new ExpectedTemplate.TypedLiteral(JsonKind.BOOL, null);
    }

    public static ExpectedTemplate bool(final boolean value) {
        return new ExpectedTemplate.TypedLiteral(JsonKind.BOOL, BsonBoolean.valueOf(value));
    }

    public static ExpectedTemplate isTrue() {
        return bool(true);
    }

    public static ExpectedTemplate isFalse() {
        return bool(false);
    }

    public static ExpectedTemplate nullValue() {
        return new ExpectedTemplate.TypedLiteral(JsonKind.NULL, BsonNull.VALUE);
    }

    public static ExpectedTemplate literal(final Object value) {
        return new ExpectedTemplate.Literal(JsonValues.toJson(value));
    }

    /**
     * Object containing at least the given keys; arguments alternate key and template/value.
     */
    public static ExpectedTemplate supersetOf(final Object... keyValues) {
        return new ExpectedTemplate.SupersetOf(fields(keyValues));
    }

    public static ExpectedTemplate supersetOf(final Map<String, ?> required) {
        return new ExpectedTemplate.SupersetOf(convertFields(required));
    }

    /**
     * Object with exactly the given keys; arguments alternate key and template/value.
     */
    public static ExpectedTemplate exactly(final Object... keyValues) {
        return new ExpectedTemplate.ExactMapping(fields(keyValues));
    }

    public static ExpectedTemplate sequence(final Object... elements) {
        final List<ExpectedTemplate> converted = new ArrayList<>(elements.length);
        for (Object element : elements) {
            converted.add(of(element));
        }
        return new ExpectedTemplate.Sequence(converted);
    }

    /**
     * Converts a Java value into a template: templates pass through, maps become
     * exact mappings, collections become sequences and anything else a literal.
     */
    public static ExpectedTemplate of(final Object value) {
        if (value instanceof ExpectedTemplate template) {
            return template;
        }
        if (value instanceof Map<?, ?> map) {
            final Map<String, Object> normalized = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                normalized.put(String.valueOf(entry.getKey()), entry.getValue());
            }
            return new ExpectedTemplate.ExactMapping(convertFields(normalized));
        }
        if (value instanceof Collection<?> collection) {
            final List<ExpectedTemplate> converted = new ArrayList<>(collection.size());
            for (Object element : collection) {
                converted.add(of(element));
            }
            return new ExpectedTemplate.Sequence(converted);
        }
        if (value instanceof BsonValue bsonValue && (bsonValue.isDocument() || bsonValue.isArray())) {
            return of(JsonValues.toJava(bsonValue));
        }
        return new ExpectedTemplate.Literal(JsonValues.toJson(value));
    }

    private static Map<String, ExpectedTemplate> fields(final Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must contain an even number of entries");
        }
        final Map<String, ExpectedTemplate> fields = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            final Object key = keyValues[i];
            if (!(key instanceof String name)) {
                throw new IllegalArgumentException("key at index " + i + " must be a string");
            }
            fields.put(name, of(keyValues[i + 1]));
        }
        return fields;
    }

    private static Map<String, ExpectedTemplate> convertFields(final Map<String, ?> source) {
        Objects.requireNonNull(source, "fields");
        final Map<String, ExpectedTemplate> fields = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : source.entrySet()) {
            fields.put(entry.getKey(), of(entry.getValue()));
        }
        return fields;
    }
}
