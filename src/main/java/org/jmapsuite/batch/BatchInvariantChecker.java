package org.jmapsuite.batch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.jmapsuite.wire.MethodCall;
import org.jmapsuite.wire.MethodNames;
import org.jmapsuite.wire.MethodResponse;

/**
 * Evaluates batch-level protocol invariants and reports every violation found.
 *
 * <p>Never fails fast: all calls are checked and the report is sorted deterministically.
 */
public final class BatchInvariantChecker {
    private static final Comparator<Violation> VIOLATION_ORDER = Comparator
            .comparingInt(Violation::position)
            .thenComparing(Violation::kind)
            .thenComparing(Violation::code)
            .thenComparing(Violation::correlationId);

    private final boolean strictProperties;

    public BatchInvariantChecker() {
        this(false);
    }

    public BatchInvariantChecker(final boolean strictProperties) {
        this.strictProperties = strictProperties;
    }

    public boolean strictProperties() {
        return strictProperties;
    }

    public InvariantReport check(final Batch batch) {
        Objects.requireNonNull(batch, "batch");
        final List<Violation> violations = new ArrayList<>();
        checkCorrelation(batch, violations);

        final List<MethodCall> calls = batch.calls();
        for (int position = 0; position < calls.size(); position++) {
            final MethodCall call = calls.get(position);
            final Optional<MethodResponse> response = batch.responseFor(call.correlationId());
            if (response.isEmpty() || response.get().isError()) {
                continue;
            }
            checkCreationIds(position, call, response.get(), violations);
            if (strictProperties) {
                checkUnknownProperties(position, response.get(), violations);
            }
        }

        violations.sort(VIOLATION_ORDER);
        return new InvariantReport(violations);
    }

    private static void checkCorrelation(final Batch batch, final List<Violation> violations) {
        final CorrelationReport correlation = batch.correlation();
        final List<MethodCall> calls = batch.calls();
        for (int position = 0; position < calls.size(); position++) {
            final MethodCall call = calls.get(position);
            if (correlation.missing().contains(call.correlationId())) {
                violations.add(new Violation(
                        ViolationKind.CORRELATION_MISMATCH,
                        "NO_RESPONSE",
                        position,
                        call.correlationId(),
                        call.name(),
                        "no method response carries correlation id " + call.correlationId(),
                        Set.of(call.correlationId())));
            }
            final Integer count = correlation.duplicates().get(call.correlationId());
            if (count != null) {
                violations.add(new Violation(
                        ViolationKind.CORRELATION_MISMATCH,
                        "DUPLICATE_RESPONSE",
                        position,
                        call.correlationId(),
                        call.name(),
                        count + " method responses carry correlation id " + call.correlationId(),
                        Set.of(call.correlationId())));
            }
        }

        final List<MethodResponse> responses = batch.responses();
        for (String extraId : correlation.extra()) {
            final int responsePosition = firstResponsePosition(responses, extraId);
            violations.add(new Violation(
                    ViolationKind.CORRELATION_MISMATCH,
                    "UNEXPECTED_RESPONSE",
                    calls.size() + responsePosition,
                    extraId,
                    responses.get(responsePosition).name(),
                    "method response " + extraId + " answers no call in the batch",
                    Set.of(extraId)));
            final Integer count = correlation.duplicates().get(extraId);
            if (count != null) {
                violations.add(new Violation(
                        ViolationKind.CORRELATION_MISMATCH,
                        "DUPLICATE_RESPONSE",
                        calls.size() + responsePosition,
                        extraId,
                        responses.get(responsePosition).name(),
                        count + " method responses carry correlation id " + extraId,
                        Set.of(extraId)));
            }
        }
    }

    private static void checkCreationIds(
            final int position,
            final MethodCall call,
            final MethodResponse response,
            final List<Violation> violations) {
        final Map<String, BsonDocument> spec = Batch.creationSpec(call);
        if (spec.isEmpty()) {
            return;
        }
        final CreationResults results = CreationResults.from(response.arguments());
        final TreeSet<String> offered = new TreeSet<>(spec.keySet());
        final TreeSet<String> answered = new TreeSet<>(results.resultIds());

        final TreeSet<String> difference = new TreeSet<>(offered);
        difference.removeAll(answered);
        final TreeSet<String> unexpected = new TreeSet<>(answered);
        unexpected.removeAll(offered);
        difference.addAll(unexpected);
        if (!difference.isEmpty()) {
            violations.add(new Violation(
                    ViolationKind.CREATION_ID_MISMATCH,
                    "CREATION_ID_SET_DIFFERS",
                    position,
                    call.correlationId(),
                    call.name(),
                    "created/notCreated keys " + answered + " differ from creation ids " + offered,
                    difference));
        }

        final TreeSet<String> both = new TreeSet<>(results.created().keySet());
        both.retainAll(results.notCreated().keySet());
        if (!both.isEmpty()) {
            violations.add(new Violation(
                    ViolationKind.CREATION_ID_MISMATCH,
                    "CREATION_ID_IN_BOTH",
                    position,
                    call.correlationId(),
                    call.name(),
                    "creation ids " + both + " appear in both created and notCreated",
                    both));
        }
    }

    private static void checkUnknownProperties(
            final int position,
            final MethodResponse response,
            final List<Violation> violations) {
        final Optional<EntityKind> kind = EntityKind.forMethod(response.name());
        if (kind.isEmpty()) {
            return;
        }
        if (MethodNames.isSet(response.name())) {
            for (CreatedResult created : CreationResults.from(response.arguments()).created().values()) {
                reportUnknown(position, response, kind.get(), created.creationId(), created.properties(), violations);
            }
            return;
        }
        if (MethodNames.isGet(response.name())) {
            final BsonValue list = response.arguments().get("list");
            if (list == null || !list.isArray()) {
                return;
            }
            final BsonArray objects = list.asArray();
            for (int index = 0; index < objects.size(); index++) {
                final BsonValue object = objects.get(index);
                if (!object.isDocument()) {
                    continue;
                }
                final BsonValue idValue = object.asDocument().get("id");
                final String id = idValue != null && idValue.isString()
                        ? idValue.asString().getValue()
                        : "list[" + index + "]";
                reportUnknown(position, response, kind.get(), id, object.asDocument(), violations);
            }
        }
    }

    private static void reportUnknown(
            final int position,
            final MethodResponse response,
            final EntityKind kind,
            final String resultId,
            final BsonDocument properties,
            final List<Violation> violations) {
        final List<String> unknown = kind.unknownProperties(properties);
        if (unknown.isEmpty()) {
            return;
        }
        violations.add(new Violation(
                ViolationKind.UNKNOWN_PROPERTY,
                "UNKNOWN_PROPERTY",
                position,
                response.correlationId(),
                response.name(),
                resultId + " has unknown properties: " + String.join(", ", unknown),
                new TreeSet<>(unknown)));
    }

    private static int firstResponsePosition(final List<MethodResponse> responses, final String correlationId) {
        for (int i = 0; i < responses.size(); i++) {
            if (responses.get(i).correlationId().equals(correlationId)) {
                return i;
            }
        }
        throw new IllegalStateException("response " + correlationId + " not found");
    }

    public enum ViolationKind {
        CORRELATION_MISMATCH,
        CREATION_ID_MISMATCH,
        UNKNOWN_PROPERTY
    }

    public record InvariantReport(List<Violation> violations) {
        public InvariantReport {
            violations = List.copyOf(Objects.requireNonNull(violations, "violations"));
        }

        public boolean hasViolations() {
            return !violations.isEmpty();
        }

        public List<Violation> ofKind(final ViolationKind kind) {
            final List<Violation> matching = new ArrayList<>();
            for (Violation violation : violations) {
                if (violation.kind() == kind) {
                    matching.add(violation);
                }
            }
            return List.copyOf(matching);
        }

        public List<String> diagnostics() {
            final List<String> lines = new ArrayList<>(violations.size());
            for (Violation violation : violations) {
                lines.add(violation.describe());
            }
            return List.copyOf(lines);
        }

        public BsonDocument toDocument() {
            final Map<ViolationKind, Integer> counts = new LinkedHashMap<>();
            for (ViolationKind kind : ViolationKind.values()) {
                counts.put(kind, 0);
            }
            final BsonArray encodedViolations = new BsonArray(violations.size());
            for (Violation violation : violations) {
                encodedViolations.add(violation.toDocument());
                counts.merge(violation.kind(), 1, Integer::sum);
            }
            final BsonDocument byKind = new BsonDocument();
            counts.forEach((kind, count) -> byKind.append(kind.name(), new BsonInt32(count)));
            return new BsonDocument()
                    .append("violationCount", new BsonInt32(violations.size()))
                    .append("byKind", byKind)
                    .append("violations", encodedViolations);
        }
    }

    public record Violation(
            ViolationKind kind,
            String code,
            int position,
            String correlationId,
            String methodName,
            String message,
            Set<String> ids) {
        public Violation {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(code, "code");
            Objects.requireNonNull(correlationId, "correlationId");
            Objects.requireNonNull(methodName, "methodName");
            Objects.requireNonNull(message, "message");
            ids = Set.copyOf(new TreeSet<>(Objects.requireNonNull(ids, "ids")));
        }

        public String describe() {
            return kind + " " + code + " [" + methodName + " " + correlationId + "]: " + message;
        }

        public BsonDocument toDocument() {
            final BsonArray encodedIds = new BsonArray();
            for (String id : new TreeSet<>(ids)) {
                encodedIds.add(new BsonString(id));
            }
            return new BsonDocument()
                    .append("kind", new BsonString(kind.name()))
                    .append("code", new BsonString(code))
                    .append("position", new BsonInt32(position))
                    .append("correlationId", new BsonString(correlationId))
                    .append("methodName", new BsonString(methodName))
                    .append("message", new BsonString(message))
                    .append("ids", encodedIds);
        }
    }
}
