package org.jmapsuite.testkit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.jmapsuite.batch.BatchInvariantChecker;
import org.jmapsuite.client.RequestOrchestrator;
import org.jmapsuite.obs.JsonLinesLogger;
import org.junit.jupiter.api.Test;

class MailboxConformanceCatalogTest {
    @Test
    void conformantServerPassesEveryBuiltInTestInStrictMode() {
        final InMemoryMailboxServer server = new InMemoryMailboxServer("u1");
        final SuiteReport report = run(server, true);

        assertEquals(
                List.of(
                        MailboxConformanceCatalog.CREATE_DEFAULTS,
                        MailboxConformanceCatalog.CREATE_WITH_PARENT,
                        MailboxConformanceCatalog.GET_UNKNOWN_ID,
                        MailboxConformanceCatalog.DESTROY,
                        MailboxConformanceCatalog.UNKNOWN_METHOD),
                report.results().stream().map(TestResult::name).toList());
        for (TestResult result : report.results()) {
            assertEquals(TestResult.Status.PASSED, result.status(), result.name() + " " + result.diagnostics());
        }
        assertTrue(server.mailboxes().isEmpty(), "tests clean up the mailboxes they create");
    }

    @Test
    void wrongServerDefaultFailsTheDefaultsTestAtTheOffendingPath() {
        final SuiteReport report = run(new InMemoryMailboxServer("u1").defaultSortOrder(7), false);

        final TestResult defaults = report.results().get(0);
        assertEquals(TestResult.Status.FAILED, defaults.status());
        assertEquals(1, defaults.diagnostics().size());
        assertTrue(defaults.diagnostics().get(0).contains("$.list[0].sortOrder: value mismatch"));
        assertEquals(TestResult.Status.PASSED, report.results().get(1).status());
    }

    @Test
    void strictModeFlagsPropertiesOutsideTheMailboxAllowlist() {
        final SuiteReport lenient = run(new InMemoryMailboxServer("u1").returnExtraProperty("x-vendor"), false);
        assertEquals(TestResult.Status.PASSED, lenient.results().get(0).status());

        final SuiteReport strict = run(new InMemoryMailboxServer("u1").returnExtraProperty("x-vendor"), true);
        final TestResult defaults = strict.results().get(0);
        assertEquals(TestResult.Status.FAILED, defaults.status());
        assertTrue(defaults.diagnostics().get(0).contains("UNKNOWN_PROPERTY"));
        assertTrue(defaults.diagnostics().get(0).contains("x-vendor"));
        assertFalse(strict.isSuccessful());
    }

    @Test
    void unknownPropertiesAreReportedWithoutAbortingTests() {
        final SuiteReport report = run(new InMemoryMailboxServer("u1").returnExtraProperty("vendorColor"), true);

        final TestResult withParent = report.results().get(1);
        assertEquals(MailboxConformanceCatalog.CREATE_WITH_PARENT, withParent.name());
        assertEquals(TestResult.Status.FAILED, withParent.status());
        assertEquals(3, withParent.assertionCount());
        assertEquals(1, withParent.diagnostics().size());
        assertTrue(withParent.diagnostics().get(0).contains("UNKNOWN_PROPERTY"));
        assertTrue(withParent.diagnostics().get(0).contains("vendorColor"));

        final TestResult destroy = report.results().get(3);
        assertEquals(MailboxConformanceCatalog.DESTROY, destroy.name());
        assertEquals(TestResult.Status.PASSED, destroy.status(), destroy.diagnostics().toString());
        assertEquals(2, destroy.assertionCount());
    }

    @Test
    void missingCreationResultFailsCreationTests() {
        final SuiteReport report = run(new InMemoryMailboxServer("u1").dropCreationResult("new"), false);

        final TestResult defaults = report.results().get(0);
        assertEquals(TestResult.Status.FAILED, defaults.status());
        assertTrue(defaults.diagnostics().get(0).contains("$.created.new: missing key"));
        assertEquals(TestResult.Status.FAILED, report.results().get(1).status());
        assertEquals(TestResult.Status.PASSED, report.results().get(2).status());
    }

    private static SuiteReport run(final InMemoryMailboxServer server, final boolean strict) {
        final RequestOrchestrator orchestrator = new RequestOrchestrator(
                server, new BatchInvariantChecker(strict), JsonLinesLogger.noop());
        return new ConformanceRunner(new StaticAccountServerAdapter(orchestrator, "u1"))
                .run(MailboxConformanceCatalog.registry());
    }
}
