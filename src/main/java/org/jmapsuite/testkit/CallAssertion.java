package org.jmapsuite.testkit;

import java.util.List;
import java.util.Objects;

/**
 * Assertion outcome for one call of a batch.
 */
public record CallAssertion(String correlationId, String methodName, Status status, List<String> diagnostics) {
    public enum Status {
        PASS,
        MISMATCH,
        NO_RESPONSE,
        TRANSPORT_FAILURE
    }

    public CallAssertion {
        Objects.requireNonNull(correlationId, "correlationId");
        Objects.requireNonNull(methodName, "methodName");
        Objects.requireNonNull(status, "status");
        diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics"));
    }

    public boolean passed() {
        return status == Status.PASS;
    }
}
