package org.jmapsuite.batch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.jmapsuite.json.JsonValues;
import org.jmapsuite.wire.MethodCall;
import org.jmapsuite.wire.MethodNames;
import org.jmapsuite.wire.MethodResponse;

/**
 * A sent batch of method calls together with the responses received for it.
 */
public final class Batch {
    private final List<MethodCall> calls;
    private final List<MethodResponse> responses;
    private final String sessionState;
    private final CorrelationReport correlation;

    public Batch(final List<MethodCall> calls, final List<MethodResponse> responses) {
        this(calls, responses, null);
    }

    public Batch(final List<MethodCall> calls, final List<MethodResponse> responses, final String sessionState) {
        this.calls = List.copyOf(Objects.requireNonNull(calls, "calls"));
        this.responses = List.copyOf(Objects.requireNonNull(responses, "responses"));
        this.sessionState = sessionState;
        this.correlation = CorrelationResolver.resolve(this.calls, this.responses);
    }

    public List<MethodCall> calls() {
        return calls;
    }

    public List<MethodResponse> responses() {
        return responses;
    }

    public Optional<String> sessionState() {
        return Optional.ofNullable(sessionState);
    }

    public CorrelationReport correlation() {
        return correlation;
    }

    public Optional<MethodResponse> responseFor(final String correlationId) {
        return correlation.responseFor(correlationId);
    }

    public Optional<MethodCall> call(final String correlationId) {
        for (MethodCall call : calls) {
            if (call.correlationId().equals(correlationId)) {
                return Optional.of(call);
            }
        }
        return Optional.empty();
    }

    /**
     * Creation ids offered in the {@code create} argument of one set call, mapped to their property bags.
     */
    public static Map<String, BsonDocument> creationSpec(final MethodCall call) {
        Objects.requireNonNull(call, "call");
        if (!MethodNames.isSet(call.name())) {
            return Map.of();
        }
        final BsonDocument create = JsonValues.readDocument(call.arguments(), "create");
        if (create == null) {
            return Map.of();
        }
        final Map<String, BsonDocument> spec = new LinkedHashMap<>();
        for (Map.Entry<String, BsonValue> entry : create.entrySet()) {
            final BsonValue value = entry.getValue();
            spec.put(entry.getKey(), value.isDocument() ? value.asDocument() : new BsonDocument());
        }
        return Collections.unmodifiableMap(spec);
    }

    public boolean hasCreateSpec() {
        for (MethodCall call : calls) {
            if (!creationSpec(call).isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Creation ids offered across every set call of the batch.
     */
    public Set<String> creationIds() {
        final TreeSet<String> ids = new TreeSet<>();
        for (MethodCall call : calls) {
            ids.addAll(creationSpec(call).keySet());
        }
        return ids;
    }

    /**
     * Creation ids mentioned in {@code created}/{@code notCreated} of responses to calls that offered creations.
     */
    public Set<String> resultIds() {
        final TreeSet<String> ids = new TreeSet<>();
        for (MethodCall call : calls) {
            if (creationSpec(call).isEmpty()) {
                continue;
            }
            creationResults(call.correlationId()).ifPresent(results -> ids.addAll(results.resultIds()));
        }
        return ids;
    }

    /**
     * Creation outcome of the set response answering {@code correlationId}; empty for error or missing responses.
     */
    public Optional<CreationResults> creationResults(final String correlationId) {
        final Optional<MethodResponse> response = responseFor(correlationId);
        if (response.isEmpty() || response.get().isError() || !MethodNames.isSet(response.get().name())) {
            return Optional.empty();
        }
        return Optional.of(CreationResults.from(response.get().arguments()));
    }

    /**
     * Server id for a creation id offered anywhere in this batch.
     *
     * @throws UnresolvedCreationReferenceException when no response created it
     */
    public String createdId(final String creationId) {
        Objects.requireNonNull(creationId, "creationId");
        UnresolvedCreationReferenceException notCreated = null;
        for (MethodCall call : calls) {
            final Optional<CreationResults> results = creationResults(call.correlationId());
            if (results.isEmpty() || !results.get().mentions(creationId)) {
                continue;
            }
            try {
                return results.get().createdId(creationId);
            } catch (UnresolvedCreationReferenceException e) {
                notCreated = e;
            }
        }
        if (notCreated != null) {
            throw notCreated;
        }
        throw new UnresolvedCreationReferenceException(
                creationId,
                UnresolvedCreationReferenceException.Kind.NOT_FOUND,
                "no response in this batch mentions creation id '" + creationId + "'");
    }

    public BsonDocument toDocument() {
        final BsonArray encodedCalls = new BsonArray();
        for (MethodCall call : calls) {
            encodedCalls.add(call.toInvocation());
        }
        final BsonArray encodedResponses = new BsonArray();
        for (MethodResponse response : responses) {
            encodedResponses.add(response.toInvocation());
        }
        final BsonDocument document = new BsonDocument()
                .append("methodCalls", encodedCalls)
                .append("methodResponses", encodedResponses);
        if (sessionState != null) {
            document.append("sessionState", new BsonString(sessionState));
        }
        return document;
    }
}
