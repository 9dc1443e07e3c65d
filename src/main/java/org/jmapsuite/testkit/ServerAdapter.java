package org.jmapsuite.testkit;

import java.util.Optional;

/**
 * Server-under-test boundary that provisions accounts for conformance tests.
 */
public interface ServerAdapter {
    String name();

    /**
     * An account that may already hold data from earlier tests.
     */
    AccountHandle anyAccount();

    /**
     * An account guaranteed free of pre-existing data, or empty when the server cannot provide
     * one. Tests registered as pristine are skipped when this is empty.
     */
    Optional<AccountHandle> pristineAccount();
}
