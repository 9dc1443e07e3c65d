package org.jmapsuite.batch;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jmapsuite.wire.MethodCall;
import org.jmapsuite.wire.MethodResponse;

/**
 * Pairs method calls with method responses by correlation id, independent of response order.
 */
public final class CorrelationResolver {
    private CorrelationResolver() {}

    public static CorrelationReport resolve(final List<MethodCall> calls, final List<MethodResponse> responses) {
        Objects.requireNonNull(calls, "calls");
        Objects.requireNonNull(responses, "responses");

        final Map<String, MethodResponse> byId = new LinkedHashMap<>();
        final Map<String, Integer> occurrences = new LinkedHashMap<>();
        for (MethodResponse response : responses) {
            Objects.requireNonNull(response, "response");
            // first seen wins; later copies only count towards the duplicate report
            byId.putIfAbsent(response.correlationId(), response);
            occurrences.merge(response.correlationId(), 1, Integer::sum);
        }

        final Set<String> callIds = new HashSet<>();
        final Map<String, MethodResponse> resolved = new LinkedHashMap<>();
        final List<String> missing = new ArrayList<>();
        for (MethodCall call : calls) {
            final String id = Objects.requireNonNull(call, "call").correlationId();
            if (!callIds.add(id)) {
                throw new IllegalArgumentException("duplicate correlation id in calls: " + id);
            }
            final MethodResponse response = byId.get(id);
            if (response == null) {
                missing.add(id);
            } else {
                resolved.put(id, response);
            }
        }

        final Set<String> extra = new LinkedHashSet<>();
        for (String responseId : byId.keySet()) {
            if (!callIds.contains(responseId)) {
                extra.add(responseId);
            }
        }

        final Map<String, Integer> duplicates = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : occurrences.entrySet()) {
            if (entry.getValue() > 1) {
                duplicates.put(entry.getKey(), entry.getValue());
            }
        }
        return new CorrelationReport(resolved, missing, new ArrayList<>(extra), duplicates);
    }
}
