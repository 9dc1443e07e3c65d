package org.jmapsuite.batch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jmapsuite.wire.MethodResponse;

/**
 * Pairing of calls to responses by correlation id, plus what could not be paired.
 */
public final class CorrelationReport {
    private final Map<String, MethodResponse> resolved;
    private final List<String> missing;
    private final List<String> extra;
    private final Map<String, Integer> duplicates;

    CorrelationReport(
            final Map<String, MethodResponse> resolved,
            final List<String> missing,
            final List<String> extra,
            final Map<String, Integer> duplicates) {
        this.resolved = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(resolved, "resolved")));
        this.missing = List.copyOf(Objects.requireNonNull(missing, "missing"));
        this.extra = List.copyOf(Objects.requireNonNull(extra, "extra"));
        this.duplicates = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(duplicates, "duplicates")));
    }

    /**
     * Correlation id to response, in call order.
     */
    public Map<String, MethodResponse> resolved() {
        return resolved;
    }

    public Optional<MethodResponse> responseFor(final String correlationId) {
        return Optional.ofNullable(resolved.get(correlationId));
    }

    /**
     * Call ids with no response.
     */
    public List<String> missing() {
        return missing;
    }

    /**
     * Response ids that match no call.
     */
    public List<String> extra() {
        return extra;
    }

    /**
     * Response ids seen more than once, with their occurrence count.
     */
    public Map<String, Integer> duplicates() {
        return duplicates;
    }

    public boolean isClean() {
        return missing.isEmpty() && extra.isEmpty() && duplicates.isEmpty();
    }
}
