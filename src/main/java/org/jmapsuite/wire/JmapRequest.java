package org.jmapsuite.wire;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonString;

/**
 * JMAP request envelope: capabilities in use plus an ordered batch of method calls.
 */
public final class JmapRequest {
    public static final String CORE_CAPABILITY = "urn:ietf:params:jmap:core";
    public static final String MAIL_CAPABILITY = "urn:ietf:params:jmap:mail";
    public static final List<String> DEFAULT_USING = List.of(CORE_CAPABILITY, MAIL_CAPABILITY);

    private final List<String> using;
    private final List<MethodCall> methodCalls;
    private final Map<String, String> createdIds;

    public JmapRequest(final List<String> using, final List<MethodCall> methodCalls) {
        this(using, methodCalls, null);
    }

    public JmapRequest(
            final List<String> using,
            final List<MethodCall> methodCalls,
            final Map<String, String> createdIds) {
        this.using = copyUsing(using);
        this.methodCalls = copyCalls(methodCalls);
        this.createdIds = createdIds == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(createdIds));
    }

    public List<String> using() {
        return using;
    }

    public List<MethodCall> methodCalls() {
        return methodCalls;
    }

    public Optional<Map<String, String>> createdIds() {
        return Optional.ofNullable(createdIds);
    }

    public BsonDocument toDocument() {
        final BsonArray usingArray = new BsonArray();
        for (String capability : using) {
            usingArray.add(new BsonString(capability));
        }
        final BsonArray calls = new BsonArray();
        for (MethodCall call : methodCalls) {
            calls.add(call.toInvocation());
        }
        final BsonDocument document = new BsonDocument()
                .append("using", usingArray)
                .append("methodCalls", calls);
        if (createdIds != null) {
            final BsonDocument ids = new BsonDocument();
            createdIds.forEach((tempId, serverId) -> ids.append(tempId, new BsonString(serverId)));
            document.append("createdIds", ids);
        }
        return document;
    }

    private static List<String> copyUsing(final List<String> source) {
        Objects.requireNonNull(source, "using");
        final LinkedHashSet<String> copied = new LinkedHashSet<>();
        for (String capability : source) {
            copied.add(MethodCall.requireText(capability, "capability"));
        }
        return List.copyOf(copied);
    }

    private static List<MethodCall> copyCalls(final List<MethodCall> source) {
        Objects.requireNonNull(source, "methodCalls");
        if (source.isEmpty()) {
            throw new IllegalArgumentException("methodCalls must not be empty");
        }
        final List<MethodCall> copied = new ArrayList<>(source.size());
        for (MethodCall call : source) {
            copied.add(Objects.requireNonNull(call, "methodCall"));
        }
        return List.copyOf(copied);
    }
}
