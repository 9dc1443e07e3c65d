package org.jmapsuite.wire;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.jmapsuite.json.JsonValues;

public final class JmapCodec {
    private static final String METHOD_CALLS = "methodCalls";
    private static final String METHOD_RESPONSES = "methodResponses";

    public String encode(final JmapRequest request) {
        return JsonValues.render(Objects.requireNonNull(request, "request").toDocument());
    }

    public String encode(final JmapResponse response) {
        return JsonValues.render(Objects.requireNonNull(response, "response").toDocument());
    }

    public JmapResponse decodeResponse(final String json) {
        final BsonDocument root = parseObject(json, "response");
        final BsonArray invocations = requireArray(root, METHOD_RESPONSES);
        final List<MethodResponse> responses = new ArrayList<>(invocations.size());
        for (int index = 0; index < invocations.size(); index++) {
            final Invocation invocation = readInvocation(invocations.get(index), METHOD_RESPONSES, index);
            responses.add(new MethodResponse(invocation.name(), invocation.arguments(), invocation.callId()));
        }
        return new JmapResponse(
                responses,
                optionalString(root, "sessionState"),
                readCreatedIds(root));
    }

    public JmapRequest decodeRequest(final String json) {
        final BsonDocument root = parseObject(json, "request");
        final BsonArray invocations = requireArray(root, METHOD_CALLS);
        if (invocations.isEmpty()) {
            throw new JmapCodecException(METHOD_CALLS + " must not be empty");
        }
        final List<MethodCall> calls = new ArrayList<>(invocations.size());
        for (int index = 0; index < invocations.size(); index++) {
            final Invocation invocation = readInvocation(invocations.get(index), METHOD_CALLS, index);
            calls.add(new MethodCall(invocation.name(), invocation.arguments(), invocation.callId()));
        }

        final List<String> using = new ArrayList<>();
        final BsonValue usingValue = root.get("using");
        if (usingValue == null || !usingValue.isArray()) {
            throw new JmapCodecException("using must be an array");
        }
        for (BsonValue capability : usingValue.asArray()) {
            if (!capability.isString()) {
                throw new JmapCodecException("using entries must be strings");
            }
            using.add(capability.asString().getValue());
        }
        return new JmapRequest(using, calls, readCreatedIds(root));
    }

    private static BsonDocument parseObject(final String json, final String what) {
        if (json == null || json.isBlank()) {
            throw new JmapCodecException(what + " body is empty");
        }
        final BsonValue root;
        try {
            root = JsonValues.parse(json);
        } catch (RuntimeException e) {
            throw new JmapCodecException(what + " body is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isDocument()) {
            throw new JmapCodecException(what + " body must be a JSON object");
        }
        return root.asDocument();
    }

    private static BsonArray requireArray(final BsonDocument root, final String key) {
        final BsonValue value = root.get(key);
        if (value == null || !value.isArray()) {
            throw new JmapCodecException(key + " must be an array");
        }
        return value.asArray();
    }

    private static Invocation readInvocation(final BsonValue value, final String field, final int index) {
        final String location = field + "[" + index + "]";
        if (value == null || !value.isArray() || value.asArray().size() != 3) {
            throw new JmapCodecException(location + " must be a [name, arguments, callId] array");
        }
        final BsonArray triple = value.asArray();
        if (!triple.get(0).isString()) {
            throw new JmapCodecException(location + " name must be a string");
        }
        if (!triple.get(1).isDocument()) {
            throw new JmapCodecException(location + " arguments must be an object");
        }
        if (!triple.get(2).isString()) {
            throw new JmapCodecException(location + " callId must be a string");
        }
        final String name = triple.get(0).asString().getValue();
        final String callId = triple.get(2).asString().getValue();
        if (name.isBlank() || callId.isBlank()) {
            throw new JmapCodecException(location + " name and callId must not be blank");
        }
        return new Invocation(name, triple.get(1).asDocument(), callId);
    }

    private static String optionalString(final BsonDocument root, final String key) {
        final BsonValue value = root.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isString()) {
            throw new JmapCodecException(key + " must be a string");
        }
        return value.asString().getValue();
    }

    private static Map<String, String> readCreatedIds(final BsonDocument root) {
        final BsonValue value = root.get("createdIds");
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isDocument()) {
            throw new JmapCodecException("createdIds must be an object");
        }
        final Map<String, String> ids = new LinkedHashMap<>();
        for (Map.Entry<String, BsonValue> entry : value.asDocument().entrySet()) {
            if (!entry.getValue().isString()) {
                throw new JmapCodecException("createdIds." + entry.getKey() + " must be a string");
            }
            ids.put(entry.getKey(), entry.getValue().asString().getValue());
        }
        return ids;
    }

    private record Invocation(String name, BsonDocument arguments, String callId) {}
}
