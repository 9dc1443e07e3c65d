package org.jmapsuite.wire;

import java.util.Objects;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonString;

/**
 * One method invocation as sent: {@code [name, arguments, callId]}.
 */
public final class MethodCall {
    private final String name;
    private final BsonDocument arguments;
    private final String correlationId;

    public MethodCall(final String name, final BsonDocument arguments, final String correlationId) {
        this.name = requireText(name, "name");
        this.arguments = Objects.requireNonNull(arguments, "arguments").clone();
        this.correlationId = requireText(correlationId, "correlationId");
    }

    public String name() {
        return name;
    }

    public BsonDocument arguments() {
        return arguments.clone();
    }

    public String correlationId() {
        return correlationId;
    }

    /**
     * Entity type named by the method, e.g. {@code Mailbox} for {@code Mailbox/set}.
     */
    public String entityType() {
        return MethodNames.entityType(name);
    }

    public String operation() {
        return MethodNames.operation(name);
    }

    public BsonArray toInvocation() {
        final BsonArray invocation = new BsonArray();
        invocation.add(new BsonString(name));
        invocation.add(arguments.clone());
        invocation.add(new BsonString(correlationId));
        return invocation;
    }

    @Override
    public String toString() {
        return "MethodCall{" + name + ", " + correlationId + "}";
    }

    static String requireText(final String value, final String fieldName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
