package org.jmapsuite.wire;

import java.util.Objects;

/**
 * Splits JMAP method names of the form {@code Type/operation}.
 */
public final class MethodNames {
    public static final String SET = "set";
    public static final String GET = "get";

    private MethodNames() {}

    public static String entityType(final String methodName) {
        final int slash = Objects.requireNonNull(methodName, "methodName").indexOf('/');
        return slash < 0 ? "" : methodName.substring(0, slash);
    }

    public static String operation(final String methodName) {
        final int slash = Objects.requireNonNull(methodName, "methodName").indexOf('/');
        return slash < 0 ? methodName : methodName.substring(slash + 1);
    }

    public static boolean isSet(final String methodName) {
        return SET.equals(operation(methodName));
    }

    public static boolean isGet(final String methodName) {
        return GET.equals(operation(methodName));
    }
}
