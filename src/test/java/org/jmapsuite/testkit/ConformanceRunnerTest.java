package org.jmapsuite.testkit;

import static org.jmapsuite.match.Expect.supersetOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.bson.BsonDocument;
import org.jmapsuite.client.RequestOrchestrator;
import org.jmapsuite.obs.StructuredJsonLinesLogger;
import org.junit.jupiter.api.Test;

class ConformanceRunnerTest {
    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-03-01T09:00:00Z"), ZoneOffset.UTC);

    @Test
    void skipsPristineTestsWhenTheAdapterHasNoPristineAccount() {
        final List<String> ran = new ArrayList<>();
        final TestRegistry registry = new TestRegistry()
                .register("shared", context -> ran.add("shared:" + context.account().accountId()))
                .registerPristine("isolated", context -> ran.add("isolated:" + context.account().accountId()));

        final InMemoryMailboxServer server = new InMemoryMailboxServer("u1", "fresh");
        final SuiteReport withoutPristine = new ConformanceRunner(
                new StaticAccountServerAdapter(new RequestOrchestrator(server), "u1")).run(registry);
        assertEquals(List.of("shared:u1"), ran);
        assertEquals(TestResult.Status.SKIPPED, withoutPristine.results().get(1).status());
        assertEquals(List.of(ConformanceRunner.NO_PRISTINE_ACCOUNT), withoutPristine.results().get(1).diagnostics());
        assertTrue(withoutPristine.isSuccessful());

        ran.clear();
        final SuiteReport withPristine = new ConformanceRunner(
                new StaticAccountServerAdapter(new RequestOrchestrator(server), "u1", "fresh")).run(registry);
        assertEquals(List.of("shared:u1", "isolated:fresh"), ran);
        assertEquals(2, withPristine.passedCount());
    }

    @Test
    void classifiesEveryOutcomeAndKeepsGoing() {
        final TestRegistry registry = new TestRegistry()
                .register("passes", context -> context.check(context.asserter().requestAndAssert(
                        "Mailbox/get", Map.of("ids", List.of()), supersetOf("list", List.of()), "empty get")))
                .register("soft-fails", context -> {
                    context.check(context.asserter().requestAndAssert(
                            "Mailbox/get", Map.of("ids", List.of()), supersetOf("list", List.of(1)), "first"));
                    context.check(context.asserter().requestAndAssert(
                            "Mailbox/get", Map.of("ids", List.of()), supersetOf("state", "nope"), "second"));
                })
                .register("hard-fails", context -> {
                    context.require(context.asserter().requestAndAssert(
                            "Mailbox/get", Map.of("ids", List.of()), supersetOf("missing", 1), "required step"));
                    throw new IllegalStateException("not reached");
                })
                .register("errors", context -> {
                    throw new IllegalStateException("boom");
                })
                .register("skips", context -> context.skip("needs Email support"));

        final SuiteReport report = runner(new InMemoryMailboxServer("u1")).run(registry);

        assertEquals(5, report.totalTests());
        assertEquals(TestResult.Status.PASSED, report.results().get(0).status());
        assertEquals(1, report.results().get(0).assertionCount());

        final TestResult softFails = report.results().get(1);
        assertEquals(TestResult.Status.FAILED, softFails.status());
        assertEquals(2, softFails.assertionCount());
        assertEquals(2, softFails.diagnostics().size());
        assertTrue(softFails.diagnostics().get(0).startsWith("not ok: first"));

        final TestResult hardFails = report.results().get(2);
        assertEquals(TestResult.Status.FAILED, hardFails.status());
        assertEquals(1, hardFails.diagnostics().size());
        assertTrue(hardFails.diagnostics().get(0).contains("$.missing: missing key"));

        assertEquals(TestResult.Status.ERROR, report.results().get(3).status());
        assertEquals(List.of("IllegalStateException: boom"), report.results().get(3).diagnostics());
        assertEquals(TestResult.Status.SKIPPED, report.results().get(4).status());
        assertEquals(List.of("needs Email support"), report.results().get(4).diagnostics());

        assertFalse(report.isSuccessful());
        assertEquals(1, report.passedCount());
        assertEquals(2, report.failedCount());
        assertEquals(1, report.errorCount());
        assertEquals(1, report.skippedCount());
    }

    @Test
    void reportRendersSummaryAndLogsOneLinePerTest() {
        final ByteArrayOutputStream logBytes = new ByteArrayOutputStream();
        final StructuredJsonLinesLogger logger = new StructuredJsonLinesLogger(logBytes, FIXED_CLOCK, true);
        final InMemoryMailboxServer server = new InMemoryMailboxServer("u1");
        final ConformanceRunner runner = new ConformanceRunner(
                new StaticAccountServerAdapter(new RequestOrchestrator(server), "u1"), logger, FIXED_CLOCK);

        final SuiteReport report = runner.run(new TestRegistry()
                .register("one", context -> {})
                .register("two", context -> {
                    throw new AssertionError("plain assertion");
                }));
        logger.close();

        final BsonDocument document = report.toDocument();
        assertEquals("2026-03-01T09:00:00Z", document.getString("generatedAt").getValue());
        assertEquals("in-memory", document.getString("server").getValue());
        assertEquals(2, document.getDocument("summary").getInt32("total").getValue());
        assertEquals(1, document.getDocument("summary").getInt32("failed").getValue());
        assertEquals(
                "plain assertion",
                document.getArray("tests").get(1).asDocument().getArray("diagnostics").get(0).asString().getValue());
        assertEquals(document, BsonDocument.parse(report.toJson()));

        final String[] lines = logBytes.toString(StandardCharsets.UTF_8).trim().split("\\R");
        assertEquals(2, lines.length);
        final BsonDocument first = BsonDocument.parse(lines[0]);
        assertEquals("INFO", first.getString("level").getValue());
        assertEquals("conformance.test.finished", first.getString("message").getValue());
        assertEquals("one", first.getString("test").getValue());
        assertEquals("test-1", first.getString("requestId").getValue());
        assertEquals("WARN", BsonDocument.parse(lines[1]).getString("level").getValue());
    }

    @Test
    void registryRejectsDuplicateNamesAndRemembersPristineMarks() {
        final TestRegistry registry = new TestRegistry()
                .register("a", context -> {})
                .registerPristine("b", context -> {});

        assertFalse(registry.isPristine("a"));
        assertTrue(registry.isPristine("b"));
        assertFalse(registry.isPristine("unknown"));
        final IllegalArgumentException duplicate = assertThrows(
                IllegalArgumentException.class,
                () -> registry.registerPristine("a", context -> {}));
        assertEquals("duplicate test name: a", duplicate.getMessage());
        assertThrows(IllegalArgumentException.class, () -> registry.register(" ", context -> {}));
        assertEquals(List.of("a", "b"), registry.tests().stream().map(TestRegistry.RegisteredTest::name).toList());
    }

    private static ConformanceRunner runner(final InMemoryMailboxServer server) {
        return new ConformanceRunner(new StaticAccountServerAdapter(new RequestOrchestrator(server), "u1"));
    }
}
