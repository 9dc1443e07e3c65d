package org.jmapsuite.testkit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.jmapsuite.batch.Batch;
import org.jmapsuite.batch.BatchInvariantChecker;
import org.jmapsuite.client.BatchRequest;
import org.jmapsuite.client.BatchResult;
import org.jmapsuite.client.RequestOrchestrator;
import org.jmapsuite.match.ExpectedTemplate;
import org.jmapsuite.match.MatchResult;
import org.jmapsuite.match.StructuralMatcher;
import org.jmapsuite.obs.BatchSnapshotDumper;
import org.jmapsuite.wire.MethodCall;
import org.jmapsuite.wire.MethodResponse;

/**
 * Entry point for "make a request and assert the response" steps.
 *
 * <p>Responses are paired with expectations through their correlation ids, never by array position.
 */
public final class ConformanceAsserter {
    private final RequestOrchestrator orchestrator;
    private final BatchSnapshotDumper dumper;
    private final UnaryOperator<BatchRequest> preparer;

    public ConformanceAsserter(final RequestOrchestrator orchestrator) {
        this(orchestrator, UnaryOperator.identity());
    }

    /**
     * @param preparer applied to every request before it is sent, e.g. to fill in the account id
     */
    public ConformanceAsserter(final RequestOrchestrator orchestrator, final UnaryOperator<BatchRequest> preparer) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.preparer = Objects.requireNonNull(preparer, "preparer");
        this.dumper = new BatchSnapshotDumper(orchestrator.invariantChecker());
    }

    /**
     * Shorthand form: one call, one expected argument template, response name must equal the call name.
     */
    public AssertionOutcome requestAndAssert(
            final String methodName,
            final Map<String, ?> arguments,
            final ExpectedTemplate expected,
            final String description) {
        return requestAndAssert(
                BatchRequest.single(methodName, arguments),
                List.of(ExpectedResponse.sameName(expected)),
                description);
    }

    /**
     * Full form: one expected response per call, in call order.
     */
    public AssertionOutcome requestAndAssert(
            final BatchRequest request,
            final List<ExpectedResponse> expected,
            final String description) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(expected, "expected");
        if (expected.size() != request.calls().size()) {
            throw new IllegalArgumentException(
                    "expected " + request.calls().size() + " expected responses, got " + expected.size());
        }
        final BatchRequest effective = Objects.requireNonNull(preparer.apply(request), "prepared request");
        final BatchResult result = orchestrator.send(effective);
        return assertResult(effective.toMethodCalls(), result, expected, description);
    }

    /**
     * Asserts an already completed round trip.
     */
    public AssertionOutcome assertResult(
            final List<MethodCall> calls,
            final BatchResult result,
            final List<ExpectedResponse> expected,
            final String description) {
        Objects.requireNonNull(calls, "calls");
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(expected, "expected");
        if (expected.size() != calls.size()) {
            throw new IllegalArgumentException("expected " + calls.size() + " expected responses, got " + expected.size());
        }

        final List<CallAssertion> assertions = new ArrayList<>(calls.size());
        if (!result.isSuccess()) {
            final String failure = result.failureMessage().orElse("transport failure");
            for (MethodCall call : calls) {
                assertions.add(new CallAssertion(
                        call.correlationId(),
                        call.name(),
                        CallAssertion.Status.TRANSPORT_FAILURE,
                        List.of(failure)));
            }
            return new AssertionOutcome(
                    description,
                    false,
                    assertions,
                    AssertionOutcome.collectDiagnostics(assertions, List.of()),
                    result,
                    null);
        }

        final Batch batch = result.requireBatch();
        boolean passed = true;
        for (int i = 0; i < calls.size(); i++) {
            final CallAssertion assertion = assertCall(batch, calls.get(i), expected.get(i));
            passed &= assertion.passed();
            assertions.add(assertion);
        }
        return new AssertionOutcome(
                description,
                passed,
                assertions,
                AssertionOutcome.collectDiagnostics(assertions, List.of()),
                result,
                passed ? null : dumper.dumpJson(batch));
    }

    /**
     * Asserts the batch-level invariants: every creation id answered exactly once and, in strict
     * mode, no unknown properties in returned objects.
     */
    public AssertionOutcome batchOk(final BatchResult result, final String description) {
        Objects.requireNonNull(result, "result");
        if (!result.isSuccess()) {
            return new AssertionOutcome(
                    description,
                    false,
                    List.of(),
                    List.of(result.failureMessage().orElse("transport failure")),
                    result,
                    null);
        }
        final Batch batch = result.requireBatch();
        final BatchInvariantChecker.InvariantReport report = result.invariants()
                .orElseGet(() -> orchestrator.invariantChecker().check(batch));
        final boolean passed = !report.hasViolations();
        return new AssertionOutcome(
                description,
                passed,
                List.of(),
                report.diagnostics(),
                result,
                passed ? null : dumper.dumpJson(batch));
    }

    private static CallAssertion assertCall(final Batch batch, final MethodCall call, final ExpectedResponse expected) {
        final Optional<MethodResponse> response = batch.responseFor(call.correlationId());
        if (response.isEmpty()) {
            return new CallAssertion(
                    call.correlationId(),
                    call.name(),
                    CallAssertion.Status.NO_RESPONSE,
                    List.of("no matching response for correlation id " + call.correlationId()));
        }

        final List<String> diagnostics = new ArrayList<>();
        final String expectedName = expected.methodName() == null ? call.name() : expected.methodName();
        if (!expectedName.equals(response.get().name())) {
            diagnostics.add("response name: expected " + expectedName + ", got " + response.get().name());
        }
        final MatchResult match = StructuralMatcher.matches(response.get().arguments(), expected.arguments());
        diagnostics.addAll(match.diagnostics());
        if (batch.correlation().duplicates().containsKey(call.correlationId())) {
            diagnostics.add("correlation id " + call.correlationId() + " answered more than once; first response used");
        }
        return new CallAssertion(
                call.correlationId(),
                call.name(),
                diagnostics.isEmpty() ? CallAssertion.Status.PASS : CallAssertion.Status.MISMATCH,
                diagnostics);
    }
}
