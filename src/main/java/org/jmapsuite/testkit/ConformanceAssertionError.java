package org.jmapsuite.testkit;

/**
 * Failed conformance assertion, raised by {@link AssertionOutcome#orThrow()}.
 */
public final class ConformanceAssertionError extends AssertionError {
    private static final long serialVersionUID = 1L;

    public ConformanceAssertionError(final String message) {
        super(message);
    }
}
