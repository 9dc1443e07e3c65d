package org.jmapsuite.client;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.jmapsuite.batch.CreationIdMap;
import org.jmapsuite.json.JsonValues;
import org.jmapsuite.wire.JmapRequest;
import org.jmapsuite.wire.MethodCall;

/**
 * Caller-side description of a request, either the single-call shorthand or a full batch.
 */
public final class BatchRequest {
    static final String SHORTHAND_CORRELATION_ID = "a";
    private static final String GENERATED_ID_PREFIX = "r";

    private final List<CallSpec> calls;
    private final List<String> using;
    private final boolean shorthand;

    private BatchRequest(final List<CallSpec> calls, final List<String> using, final boolean shorthand) {
        Objects.requireNonNull(calls, "calls");
        if (calls.isEmpty()) {
            throw new IllegalArgumentException("calls must not be empty");
        }
        this.calls = List.copyOf(calls);
        this.using = List.copyOf(Objects.requireNonNull(using, "using"));
        this.shorthand = shorthand;
        ensureExplicitIdsUnique(this.calls);
    }

    /**
     * Single call without an explicit correlation id.
     */
    public static BatchRequest single(final String methodName, final Map<String, ?> arguments) {
        return single(methodName, JsonValues.toDocument(Objects.requireNonNull(arguments, "arguments")));
    }

    public static BatchRequest single(final String methodName, final BsonDocument arguments) {
        return new BatchRequest(List.of(new CallSpec(methodName, arguments, null)), JmapRequest.DEFAULT_USING, true);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<CallSpec> calls() {
        return calls;
    }

    public List<String> using() {
        return using;
    }

    public boolean isShorthand() {
        return shorthand;
    }

    /**
     * Method calls with correlation ids filled in: {@code "a"} for the shorthand form,
     * {@code r1, r2, ...} for unnamed calls of a full batch, skipping ids used explicitly.
     */
    public List<MethodCall> toMethodCalls() {
        if (shorthand) {
            final CallSpec only = calls.get(0);
            return List.of(new MethodCall(only.methodName(), only.arguments(), SHORTHAND_CORRELATION_ID));
        }
        final Set<String> taken = new HashSet<>();
        for (CallSpec call : calls) {
            if (call.correlationId() != null) {
                taken.add(call.correlationId());
            }
        }
        final List<MethodCall> methodCalls = new ArrayList<>(calls.size());
        int sequence = 0;
        for (CallSpec call : calls) {
            String id = call.correlationId();
            if (id == null) {
                do {
                    sequence++;
                    id = GENERATED_ID_PREFIX + sequence;
                } while (taken.contains(id));
                taken.add(id);
            }
            methodCalls.add(new MethodCall(call.methodName(), call.arguments(), id));
        }
        return List.copyOf(methodCalls);
    }

    public JmapRequest toJmapRequest() {
        return new JmapRequest(using, toMethodCalls());
    }

    /**
     * Same request with creation references rewritten to server ids known to {@code ids}.
     */
    public BatchRequest withCreationIds(final CreationIdMap ids) {
        Objects.requireNonNull(ids, "ids");
        final List<CallSpec> rewritten = new ArrayList<>(calls.size());
        for (CallSpec call : calls) {
            rewritten.add(new CallSpec(call.methodName(), ids.rewrite(call.arguments()), call.correlationId()));
        }
        return new BatchRequest(rewritten, using, shorthand);
    }

    /**
     * Same request with {@code accountId} added to every call that does not name one.
     */
    public BatchRequest withDefaultAccount(final String accountId) {
        Objects.requireNonNull(accountId, "accountId");
        final List<CallSpec> rewritten = new ArrayList<>(calls.size());
        for (CallSpec call : calls) {
            final BsonDocument arguments = call.arguments();
            if (!arguments.containsKey("accountId")) {
                arguments.put("accountId", new BsonString(accountId));
            }
            rewritten.add(new CallSpec(call.methodName(), arguments, call.correlationId()));
        }
        return new BatchRequest(rewritten, using, shorthand);
    }

    /**
     * Same request with {@code capabilities} appended to its {@code using} list.
     */
    public BatchRequest withCapabilities(final List<String> capabilities) {
        Objects.requireNonNull(capabilities, "capabilities");
        final Set<String> merged = new LinkedHashSet<>(using);
        merged.addAll(capabilities);
        return new BatchRequest(calls, new ArrayList<>(merged), shorthand);
    }

    private static void ensureExplicitIdsUnique(final List<CallSpec> calls) {
        final Set<String> seen = new HashSet<>();
        for (CallSpec call : calls) {
            if (call.correlationId() != null && !seen.add(call.correlationId())) {
                throw new IllegalArgumentException("duplicate correlation id: " + call.correlationId());
            }
        }
    }

    /**
     * One call of a batch; {@code correlationId} is {@code null} when it should be generated.
     */
    public record CallSpec(String methodName, BsonDocument arguments, String correlationId) {
        public CallSpec {
            if (methodName == null || methodName.isBlank()) {
                throw new IllegalArgumentException("methodName must not be blank");
            }
            arguments = Objects.requireNonNull(arguments, "arguments").clone();
            if (correlationId != null && correlationId.isBlank()) {
                throw new IllegalArgumentException("correlationId must not be blank when given");
            }
        }

        @Override
        public BsonDocument arguments() {
            return arguments.clone();
        }
    }

    public static final class Builder {
        private final List<CallSpec> calls = new ArrayList<>();
        private List<String> using = JmapRequest.DEFAULT_USING;

        private Builder() {}

        public Builder call(final String methodName, final Map<String, ?> arguments) {
            return call(methodName, JsonValues.toDocument(Objects.requireNonNull(arguments, "arguments")), null);
        }

        public Builder call(final String methodName, final Map<String, ?> arguments, final String correlationId) {
            return call(methodName, JsonValues.toDocument(Objects.requireNonNull(arguments, "arguments")), correlationId);
        }

        public Builder call(final String methodName, final BsonDocument arguments, final String correlationId) {
            calls.add(new CallSpec(methodName, arguments, correlationId));
            return this;
        }

        public Builder using(final List<String> capabilities) {
            this.using = List.copyOf(Objects.requireNonNull(capabilities, "capabilities"));
            return this;
        }

        public BatchRequest build() {
            return new BatchRequest(calls, using, false);
        }
    }
}
