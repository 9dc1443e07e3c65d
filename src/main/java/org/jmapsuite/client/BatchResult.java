package org.jmapsuite.client;

import java.util.Objects;
import java.util.Optional;
import org.jmapsuite.batch.Batch;
import org.jmapsuite.batch.BatchInvariantChecker;

/**
 * Outcome of one orchestrated round trip.
 */
public final class BatchResult {
    private final Batch batch;
    private final BatchInvariantChecker.InvariantReport invariants;
    private final String failureMessage;

    private BatchResult(
            final Batch batch,
            final BatchInvariantChecker.InvariantReport invariants,
            final String failureMessage) {
        this.batch = batch;
        this.invariants = invariants;
        this.failureMessage = failureMessage;
    }

    public static BatchResult success(final Batch batch, final BatchInvariantChecker.InvariantReport invariants) {
        return new BatchResult(
                Objects.requireNonNull(batch, "batch"),
                Objects.requireNonNull(invariants, "invariants"),
                null);
    }

    public static BatchResult transportFailure(final String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message must not be blank");
        }
        return new BatchResult(null, null, message.trim());
    }

    public boolean isSuccess() {
        return batch != null;
    }

    public Optional<Batch> batch() {
        return Optional.ofNullable(batch);
    }

    public Optional<BatchInvariantChecker.InvariantReport> invariants() {
        return Optional.ofNullable(invariants);
    }

    public Optional<String> failureMessage() {
        return Optional.ofNullable(failureMessage);
    }

    /**
     * The decoded batch.
     *
     * @throws IllegalStateException when the round trip failed
     */
    public Batch requireBatch() {
        if (batch == null) {
            throw new IllegalStateException("request failed: " + failureMessage);
        }
        return batch;
    }
}
