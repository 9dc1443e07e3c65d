package org.jmapsuite.batch;

import java.util.Objects;
import java.util.Optional;
import org.bson.BsonDocument;

/**
 * One entry of a {@code created} map: the server id plus every property the server returned.
 */
public final class CreatedResult {
    private final String creationId;
    private final String serverId;
    private final BsonDocument properties;

    CreatedResult(final String creationId, final String serverId, final BsonDocument properties) {
        this.creationId = Objects.requireNonNull(creationId, "creationId");
        this.serverId = serverId;
        this.properties = Objects.requireNonNull(properties, "properties").clone();
    }

    public String creationId() {
        return creationId;
    }

    /**
     * Server-assigned id; empty when the server omitted {@code id} or sent a non-string.
     */
    public Optional<String> serverId() {
        return Optional.ofNullable(serverId);
    }

    public BsonDocument properties() {
        return properties.clone();
    }
}
