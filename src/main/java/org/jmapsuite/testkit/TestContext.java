package org.jmapsuite.testkit;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Per-test state handed to a {@link ConformanceTest}: the account to use and the assertion
 * outcomes recorded so far.
 */
public final class TestContext {
    private final String testName;
    private final ServerAdapter adapter;
    private final AccountHandle account;
    private final List<AssertionOutcome> outcomes = new ArrayList<>();

    TestContext(final String testName, final ServerAdapter adapter, final AccountHandle account) {
        this.testName = Objects.requireNonNull(testName, "testName");
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.account = Objects.requireNonNull(account, "account");
    }

    public String testName() {
        return testName;
    }

    public ServerAdapter adapter() {
        return adapter;
    }

    public AccountHandle account() {
        return account;
    }

    public ConformanceAsserter asserter() {
        return account.asserter();
    }

    /**
     * Records an outcome and keeps going; the test fails at the end if any recorded outcome failed.
     */
    public AssertionOutcome check(final AssertionOutcome outcome) {
        outcomes.add(Objects.requireNonNull(outcome, "outcome"));
        return outcome;
    }

    /**
     * Records an outcome and stops the test when it failed, for steps later steps depend on.
     */
    public AssertionOutcome require(final AssertionOutcome outcome) {
        return check(outcome).orThrow();
    }

    public void skip(final String reason) {
        throw new TestSkippedException(reason);
    }

    public List<AssertionOutcome> outcomes() {
        return List.copyOf(outcomes);
    }

    List<AssertionOutcome> failedOutcomes() {
        final List<AssertionOutcome> failed = new ArrayList<>();
        for (AssertionOutcome outcome : outcomes) {
            if (!outcome.passed()) {
                failed.add(outcome);
            }
        }
        return failed;
    }
}
