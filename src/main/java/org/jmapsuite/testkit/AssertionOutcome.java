package org.jmapsuite.testkit;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jmapsuite.batch.Batch;
import org.jmapsuite.client.BatchResult;

/**
 * Pass/fail result of one "make a request and assert the response" step, with diagnostics.
 */
public final class AssertionOutcome {
    private final String description;
    private final boolean passed;
    private final List<CallAssertion> calls;
    private final List<String> diagnostics;
    private final BatchResult result;
    private final String batchDump;

    AssertionOutcome(
            final String description,
            final boolean passed,
            final List<CallAssertion> calls,
            final List<String> diagnostics,
            final BatchResult result,
            final String batchDump) {
        this.description = description == null || description.isBlank() ? "request" : description.trim();
        this.passed = passed;
        this.calls = List.copyOf(Objects.requireNonNull(calls, "calls"));
        this.diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics"));
        this.result = result;
        this.batchDump = batchDump;
    }

    public String description() {
        return description;
    }

    public boolean passed() {
        return passed;
    }

    public List<CallAssertion> calls() {
        return calls;
    }

    public List<String> diagnostics() {
        return diagnostics;
    }

    public Optional<Batch> batch() {
        return result == null ? Optional.empty() : result.batch();
    }

    public Optional<BatchResult> result() {
        return Optional.ofNullable(result);
    }

    /**
     * Full decoded batch rendered as JSON, present on failures that got a response.
     */
    public Optional<String> batchDump() {
        return Optional.ofNullable(batchDump);
    }

    public String message() {
        final StringBuilder message = new StringBuilder();
        message.append(passed ? "ok: " : "not ok: ").append(description);
        for (String line : diagnostics) {
            message.append(System.lineSeparator()).append("  ").append(line);
        }
        if (!passed && batchDump != null) {
            message.append(System.lineSeparator()).append("  batch: ").append(batchDump);
        }
        return message.toString();
    }

    /**
     * Returns this outcome when it passed.
     *
     * @throws ConformanceAssertionError when it failed
     */
    public AssertionOutcome orThrow() {
        if (!passed) {
            throw new ConformanceAssertionError(message());
        }
        return this;
    }

    static List<String> collectDiagnostics(final List<CallAssertion> calls, final List<String> extra) {
        final List<String> lines = new ArrayList<>();
        for (CallAssertion call : calls) {
            for (String line : call.diagnostics()) {
                lines.add(call.methodName() + " " + call.correlationId() + ": " + line);
            }
        }
        lines.addAll(extra);
        return lines;
    }
}
