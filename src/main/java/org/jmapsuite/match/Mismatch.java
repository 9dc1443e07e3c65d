package org.jmapsuite.match;

import org.bson.BsonValue;
import org.jmapsuite.json.JsonValues;

/**
 * One point where an actual value departs from its template.
 */
public final class Mismatch {
    private final String path;
    private final String reason;
    private final String expected;
    private final BsonValue actual;

    public Mismatch(String path, String reason, String expected, BsonValue actual) {
        this.path = requireText(path, "path");
        this.reason = requireText(reason, "reason");
        this.expected = expected == null ? "" : expected;
        this.actual = actual;
    }

    public String path() {
        return path;
    }

    public String reason() {
        return reason;
    }

    public String expected() {
        return expected;
    }

    /**
     * Actual value at {@link #path()}, or {@code null} when the key was absent.
     */
    public BsonValue actual() {
        return actual;
    }

    public String describe() {
        return path + ": " + reason
                + " (expected " + expected + ", got " + (actual == null ? "<absent>" : JsonValues.render(actual)) + ")";
    }

    @Override
    public String toString() {
        return describe();
    }

    private static String requireText(String value, String fieldName) {
        String normalized = value == null ? null : value.trim();
        if (normalized == null || normalized.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }
}
