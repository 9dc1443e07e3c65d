package org.jmapsuite.testkit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.jmapsuite.json.JsonValues;

/**
 * Aggregate report for one conformance run.
 */
public final class SuiteReport {
    private final Instant generatedAt;
    private final String serverName;
    private final List<TestResult> results;

    public SuiteReport(final Instant generatedAt, final String serverName, final List<TestResult> results) {
        this.generatedAt = Objects.requireNonNull(generatedAt, "generatedAt");
        this.serverName = requireText(serverName, "serverName");
        this.results = List.copyOf(new ArrayList<>(Objects.requireNonNull(results, "results")));
    }

    public Instant generatedAt() {
        return generatedAt;
    }

    public String serverName() {
        return serverName;
    }

    public List<TestResult> results() {
        return results;
    }

    public int totalTests() {
        return results.size();
    }

    public int passedCount() {
        return countByStatus(TestResult.Status.PASSED);
    }

    public int failedCount() {
        return countByStatus(TestResult.Status.FAILED);
    }

    public int skippedCount() {
        return countByStatus(TestResult.Status.SKIPPED);
    }

    public int errorCount() {
        return countByStatus(TestResult.Status.ERROR);
    }

    public boolean isSuccessful() {
        return failedCount() == 0 && errorCount() == 0;
    }

    public BsonDocument toDocument() {
        final BsonArray tests = new BsonArray();
        for (TestResult result : results) {
            tests.add(result.toDocument());
        }
        return new BsonDocument()
                .append("generatedAt", new BsonString(generatedAt.toString()))
                .append("server", new BsonString(serverName))
                .append("summary", new BsonDocument()
                        .append("total", new BsonInt32(totalTests()))
                        .append("passed", new BsonInt32(passedCount()))
                        .append("failed", new BsonInt32(failedCount()))
                        .append("skipped", new BsonInt32(skippedCount()))
                        .append("error", new BsonInt32(errorCount())))
                .append("tests", tests);
    }

    public String toJson() {
        return JsonValues.renderIndented(toDocument());
    }

    private int countByStatus(final TestResult.Status status) {
        int count = 0;
        for (TestResult result : results) {
            if (result.status() == status) {
                count++;
            }
        }
        return count;
    }

    private static String requireText(final String value, final String fieldName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value.trim();
    }
}
