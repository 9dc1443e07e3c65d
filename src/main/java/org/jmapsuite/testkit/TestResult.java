package org.jmapsuite.testkit;

import java.util.List;
import java.util.Objects;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.jmapsuite.json.JsonValues;

/**
 * Outcome of one registered test.
 */
public record TestResult(String name, Status status, int assertionCount, List<String> diagnostics) {
    public enum Status {
        PASSED,
        FAILED,
        SKIPPED,
        ERROR
    }

    public TestResult {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(status, "status");
        if (assertionCount < 0) {
            throw new IllegalArgumentException("assertionCount must be >= 0");
        }
        diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics"));
    }

    public static TestResult passed(final String name, final int assertionCount) {
        return new TestResult(name, Status.PASSED, assertionCount, List.of());
    }

    public static TestResult failed(final String name, final int assertionCount, final List<String> diagnostics) {
        return new TestResult(name, Status.FAILED, assertionCount, diagnostics);
    }

    public static TestResult skipped(final String name, final String reason) {
        return new TestResult(name, Status.SKIPPED, 0, List.of(reason));
    }

    public static TestResult error(final String name, final int assertionCount, final String message) {
        return new TestResult(name, Status.ERROR, assertionCount, List.of(message));
    }

    public BsonDocument toDocument() {
        return new BsonDocument()
                .append("name", new BsonString(name))
                .append("status", new BsonString(status.name()))
                .append("assertions", new BsonInt32(assertionCount))
                .append("diagnostics", JsonValues.toJson(diagnostics));
    }
}
