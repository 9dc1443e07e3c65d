package org.jmapsuite.wire;

import java.util.Objects;
import java.util.Optional;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.jmapsuite.json.JsonValues;

/**
 * One method response as received: {@code [name, arguments, callId]}.
 */
public final class MethodResponse {
    public static final String ERROR_NAME = "error";

    private final String name;
    private final BsonDocument arguments;
    private final String correlationId;

    public MethodResponse(final String name, final BsonDocument arguments, final String correlationId) {
        this.name = MethodCall.requireText(name, "name");
        this.arguments = Objects.requireNonNull(arguments, "arguments").clone();
        this.correlationId = MethodCall.requireText(correlationId, "correlationId");
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

    public boolean isError() {
        return ERROR_NAME.equals(name);
    }

    /**
     * JMAP error type of a method-level error response such as {@code unknownMethod}.
     */
    public Optional<String> errorType() {
        if (!isError()) {
            return Optional.empty();
        }
        return Optional.ofNullable(JsonValues.readString(arguments, "type"));
    }

    public String entityType() {
        return MethodNames.entityType(name);
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
        return "MethodResponse{" + name + ", " + correlationId + "}";
    }
}
