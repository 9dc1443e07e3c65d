package org.jmapsuite.wire;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonString;

/**
 * JMAP response envelope as decoded from the server.
 */
public final class JmapResponse {
    private final List<MethodResponse> methodResponses;
    private final String sessionState;
    private final Map<String, String> createdIds;

    public JmapResponse(final List<MethodResponse> methodResponses, final String sessionState) {
        this(methodResponses, sessionState, null);
    }

    public JmapResponse(
            final List<MethodResponse> methodResponses,
            final String sessionState,
            final Map<String, String> createdIds) {
        Objects.requireNonNull(methodResponses, "methodResponses");
        final List<MethodResponse> copied = new ArrayList<>(methodResponses.size());
        for (MethodResponse response : methodResponses) {
            copied.add(Objects.requireNonNull(response, "methodResponse"));
        }
        this.methodResponses = List.copyOf(copied);
        this.sessionState = sessionState;
        this.createdIds = createdIds == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(createdIds));
    }

    public List<MethodResponse> methodResponses() {
        return methodResponses;
    }

    public Optional<String> sessionState() {
        return Optional.ofNullable(sessionState);
    }

    public Optional<Map<String, String>> createdIds() {
        return Optional.ofNullable(createdIds);
    }

    public BsonDocument toDocument() {
        final BsonArray responses = new BsonArray();
        for (MethodResponse response : methodResponses) {
            responses.add(response.toInvocation());
        }
        final BsonDocument document = new BsonDocument("methodResponses", responses);
        if (sessionState != null) {
            document.append("sessionState", new BsonString(sessionState));
        }
        if (createdIds != null) {
            final BsonDocument ids = new BsonDocument();
            createdIds.forEach((tempId, serverId) -> ids.append(tempId, new BsonString(serverId)));
            document.append("createdIds", ids);
        }
        return document;
    }
}
