package org.jmapsuite.client;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jmapsuite.batch.Batch;
import org.jmapsuite.batch.BatchInvariantChecker;
import org.jmapsuite.json.JsonValues;
import org.jmapsuite.obs.CorrelationContext;
import org.jmapsuite.obs.JsonLinesLogger;
import org.jmapsuite.wire.JmapRequest;
import org.jmapsuite.wire.JmapResponse;
import org.jmapsuite.wire.MethodCall;

/**
 * Normalizes a {@link BatchRequest}, performs the round trip and runs correlation and
 * invariant checks on what came back.
 *
 * <p>No retries: a failed round trip is returned as a failed {@link BatchResult}.
 */
public final class RequestOrchestrator {
    private final JmapTransport transport;
    private final BatchInvariantChecker invariantChecker;
    private final JsonLinesLogger logger;
    private long requestSequence;

    public RequestOrchestrator(final JmapTransport transport) {
        this(transport, new BatchInvariantChecker(), JsonLinesLogger.noop());
    }

    public RequestOrchestrator(
            final JmapTransport transport,
            final BatchInvariantChecker invariantChecker,
            final JsonLinesLogger logger) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.invariantChecker = Objects.requireNonNull(invariantChecker, "invariantChecker");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public JmapTransport transport() {
        return transport;
    }

    public BatchInvariantChecker invariantChecker() {
        return invariantChecker;
    }

    public BatchResult send(final BatchRequest request) {
        Objects.requireNonNull(request, "request");
        final JmapRequest jmapRequest = request.toJmapRequest();
        final List<MethodCall> calls = jmapRequest.methodCalls();
        final String requestId = "req-" + (++requestSequence);
        final String accountId = JsonValues.readString(calls.get(0).arguments(), "accountId");
        final String methodLabel =
                calls.size() == 1 ? calls.get(0).name() : calls.get(0).name() + "+" + (calls.size() - 1);
        final CorrelationContext.Builder builder = CorrelationContext.builder(requestId, methodLabel)
                .accountId(accountId);
        if (calls.size() == 1) {
            builder.callId(calls.get(0).correlationId());
        }
        final CorrelationContext correlation = builder.build();

        final JmapResponse response;
        try {
            response = transport.send(jmapRequest);
        } catch (JmapTransportException e) {
            logger.error("jmap.request.failed", correlation, Map.of(
                    "transport", transport.name(),
                    "error", String.valueOf(e.getMessage())));
            return BatchResult.transportFailure(transport.name() + ": " + e.getMessage());
        }

        final Batch batch = new Batch(calls, response.methodResponses(), response.sessionState().orElse(null));
        final BatchInvariantChecker.InvariantReport invariants = invariantChecker.check(batch);

        final Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("calls", calls.size());
        fields.put("responses", response.methodResponses().size());
        fields.put("violations", invariants.violations().size());
        if (invariants.hasViolations()) {
            fields.put("diagnostics", invariants.diagnostics());
            logger.warn("jmap.request.violations", correlation, fields);
            for (BatchInvariantChecker.Violation violation : invariants.violations()) {
                final CorrelationContext callCorrelation = CorrelationContext.builder(requestId, violation.methodName())
                        .callId(violation.correlationId())
                        .accountId(accountId)
                        .build();
                logger.warn("jmap.call.violation", callCorrelation, Map.of(
                        "kind", violation.kind().name(),
                        "code", violation.code(),
                        "detail", violation.message()));
            }
        } else {
            logger.info("jmap.request.completed", correlation, fields);
        }
        return BatchResult.success(batch, invariants);
    }
}
