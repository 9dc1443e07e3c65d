package org.jmapsuite.testkit;

/**
 * Thrown by a test that cannot run against the current server; the runner records it as skipped.
 */
public final class TestSkippedException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public TestSkippedException(final String reason) {
        super(reason);
    }
}
