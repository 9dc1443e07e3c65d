package org.jmapsuite.testkit;

import java.util.Objects;
import org.jmapsuite.match.Expect;
import org.jmapsuite.match.ExpectedTemplate;

/**
 * Expected method response for one call: its name and a template for its arguments.
 *
 * <p>A {@code null} method name means the response must carry the same name as the call.
 */
public record ExpectedResponse(String methodName, ExpectedTemplate arguments) {
    public ExpectedResponse {
        if (methodName != null && methodName.isBlank()) {
            throw new IllegalArgumentException("methodName must not be blank when given");
        }
        Objects.requireNonNull(arguments, "arguments");
    }

    public static ExpectedResponse of(final String methodName, final ExpectedTemplate arguments) {
        return new ExpectedResponse(methodName, arguments);
    }

    public static ExpectedResponse sameName(final ExpectedTemplate arguments) {
        return new ExpectedResponse(null, arguments);
    }

    /**
     * A method-level {@code error} response of the given JMAP error type.
     */
    public static ExpectedResponse error(final String type) {
        return new ExpectedResponse("error", Expect.supersetOf("type", Expect.string(type)));
    }
}
