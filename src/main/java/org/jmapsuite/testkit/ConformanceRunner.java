package org.jmapsuite.testkit;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jmapsuite.obs.CorrelationContext;
import org.jmapsuite.obs.JsonLinesLogger;

/**
 * Runs registered conformance tests one at a time against a server adapter.
 *
 * <p>A failing or erroring test never stops the run.
 */
public final class ConformanceRunner {
    static final String NO_PRISTINE_ACCOUNT = "server adapter cannot provide a pristine account";

    private final ServerAdapter adapter;
    private final JsonLinesLogger logger;
    private final Clock clock;

    public ConformanceRunner(final ServerAdapter adapter) {
        this(adapter, JsonLinesLogger.noop(), Clock.systemUTC());
    }

    public ConformanceRunner(final ServerAdapter adapter, final JsonLinesLogger logger, final Clock clock) {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public SuiteReport run(final TestRegistry registry) {
        Objects.requireNonNull(registry, "registry");
        final List<TestResult> results = new ArrayList<>(registry.size());
        int sequence = 0;
        for (TestRegistry.RegisteredTest test : registry.tests()) {
            final TestResult result = runTest(test);
            log(++sequence, result);
            results.add(result);
        }
        return new SuiteReport(clock.instant(), adapter.name(), results);
    }

    public TestResult runTest(final TestRegistry.RegisteredTest test) {
        Objects.requireNonNull(test, "test");
        final AccountHandle account;
        try {
            if (test.pristine()) {
                final Optional<AccountHandle> pristine = adapter.pristineAccount();
                if (pristine.isEmpty()) {
                    return TestResult.skipped(test.name(), NO_PRISTINE_ACCOUNT);
                }
                account = pristine.get();
            } else {
                account = adapter.anyAccount();
            }
        } catch (RuntimeException e) {
            return TestResult.error(test.name(), 0, "account provisioning failed: " + describe(e));
        }

        final TestContext context = new TestContext(test.name(), adapter, account);
        try {
            test.test().run(context);
        } catch (TestSkippedException e) {
            return TestResult.skipped(test.name(), String.valueOf(e.getMessage()));
        } catch (AssertionError e) {
            final List<String> diagnostics = failureMessages(context);
            final String message = String.valueOf(e.getMessage());
            if (!diagnostics.contains(message)) {
                diagnostics.add(message);
            }
            return TestResult.failed(test.name(), context.outcomes().size(), diagnostics);
        } catch (Exception e) {
            return TestResult.error(test.name(), context.outcomes().size(), describe(e));
        }

        final List<String> diagnostics = failureMessages(context);
        if (!diagnostics.isEmpty()) {
            return TestResult.failed(test.name(), context.outcomes().size(), diagnostics);
        }
        return TestResult.passed(test.name(), context.outcomes().size());
    }

    private static List<String> failureMessages(final TestContext context) {
        final List<String> messages = new ArrayList<>();
        for (AssertionOutcome outcome : context.failedOutcomes()) {
            messages.add(outcome.message());
        }
        return messages;
    }

    private void log(final int sequence, final TestResult result) {
        final CorrelationContext correlation = CorrelationContext.of("test-" + sequence, "conformance.test");
        final Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("test", result.name());
        fields.put("status", result.status().name());
        fields.put("assertions", result.assertionCount());
        if (result.status() == TestResult.Status.FAILED || result.status() == TestResult.Status.ERROR) {
            fields.put("diagnostics", result.diagnostics());
            logger.warn("conformance.test.finished", correlation, fields);
        } else {
            logger.info("conformance.test.finished", correlation, fields);
        }
    }

    private static String describe(final Exception e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
