package org.jmapsuite.json;

import java.util.Locale;
import org.bson.BsonValue;

/**
 * JSON type of a decoded value.
 */
public enum JsonKind {
    STRING,
    NUMBER,
    BOOL,
    NULL,
    OBJECT,
    ARRAY;

    public static JsonKind of(final BsonValue value) {
        if (value == null || value.isNull()) {
            return NULL;
        }
        if (value.isString()) {
            return STRING;
        }
        if (value.isNumber() || value.isDecimal128()) {
            return NUMBER;
        }
        if (value.isBoolean()) {
            return BOOL;
        }
        if (value.isDocument()) {
            return OBJECT;
        }
        if (value.isArray()) {
            return ARRAY;
        }
        throw new IllegalArgumentException("value has no JSON representation: " + value.getBsonType());
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
