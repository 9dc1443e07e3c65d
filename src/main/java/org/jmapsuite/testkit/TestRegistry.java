package org.jmapsuite.testkit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Explicit, ordered registration of conformance tests.
 *
 * <p>Built once while assembling a suite and handed to {@link ConformanceRunner}.
 */
public final class TestRegistry {
    private final Map<String, RegisteredTest> tests = new LinkedHashMap<>();

    public TestRegistry register(final String name, final ConformanceTest test) {
        return add(name, test, false);
    }

    /**
     * Registers a test that needs an account free of pre-existing data.
     */
    public TestRegistry registerPristine(final String name, final ConformanceTest test) {
        return add(name, test, true);
    }

    public boolean isPristine(final String name) {
        final RegisteredTest registered = tests.get(name);
        return registered != null && registered.pristine();
    }

    public List<RegisteredTest> tests() {
        return List.copyOf(new ArrayList<>(tests.values()));
    }

    public int size() {
        return tests.size();
    }

    private TestRegistry add(final String name, final ConformanceTest test, final boolean pristine) {
        final RegisteredTest registered = new RegisteredTest(name, pristine, test);
        if (tests.putIfAbsent(registered.name(), registered) != null) {
            throw new IllegalArgumentException("duplicate test name: " + registered.name());
        }
        return this;
    }

    public record RegisteredTest(String name, boolean pristine, ConformanceTest test) {
        public RegisteredTest {
            if (name == null || name.trim().isEmpty()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            name = name.trim();
            Objects.requireNonNull(test, "test");
        }
    }
}
