package org.jmapsuite.match;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one structural match.
 */
public final class MatchResult {
    private static final MatchResult OK = new MatchResult(List.of());

    private final List<Mismatch> mismatches;

    private MatchResult(List<Mismatch> mismatches) {
        this.mismatches = List.copyOf(new ArrayList<>(Objects.requireNonNull(mismatches, "mismatches")));
    }

    public static MatchResult ok() {
        return OK;
    }

    public static MatchResult of(List<Mismatch> mismatches) {
        if (mismatches == null || mismatches.isEmpty()) {
            return OK;
        }
        return new MatchResult(mismatches);
    }

    public boolean isOk() {
        return mismatches.isEmpty();
    }

    public List<Mismatch> mismatches() {
        return mismatches;
    }

    public Optional<Mismatch> firstMismatch() {
        return mismatches.isEmpty() ? Optional.empty() : Optional.of(mismatches.get(0));
    }

    public List<String> diagnostics() {
        List<String> lines = new ArrayList<>(mismatches.size());
        for (Mismatch mismatch : mismatches) {
            lines.add(mismatch.describe());
        }
        return List.copyOf(lines);
    }
}
