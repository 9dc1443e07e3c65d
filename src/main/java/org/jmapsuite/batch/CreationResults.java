package org.jmapsuite.batch;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.bson.BsonDocument;

/**
 * Creation outcome of one {@code Foo/set} response: which creation ids were created and which failed.
 */
public final class CreationResults {
    private final Map<String, CreatedResult> created;
    private final Map<String, SetError> notCreated;

    private CreationResults(final Map<String, CreatedResult> created, final Map<String, SetError> notCreated) {
        this.created = created;
        this.notCreated = notCreated;
    }

    public static CreationResults from(final BsonDocument responseArguments) {
        final SetResponseView view = new SetResponseView(Objects.requireNonNull(responseArguments, "responseArguments"));
        return new CreationResults(view.created(), view.notCreated());
    }

    public Map<String, CreatedResult> created() {
        return created;
    }

    public Map<String, SetError> notCreated() {
        return notCreated;
    }

    /**
     * Every creation id the response mentions, from both {@code created} and {@code notCreated}.
     */
    public Set<String> resultIds() {
        final TreeSet<String> ids = new TreeSet<>(created.keySet());
        ids.addAll(notCreated.keySet());
        return ids;
    }

    public boolean mentions(final String creationId) {
        return created.containsKey(creationId) || notCreated.containsKey(creationId);
    }

    /**
     * Permanent server id assigned to {@code creationId}.
     *
     * @throws UnresolvedCreationReferenceException when the id was not created
     */
    public String createdId(final String creationId) {
        Objects.requireNonNull(creationId, "creationId");
        final CreatedResult result = created.get(creationId);
        if (result != null) {
            return result.serverId().orElseThrow(() -> new UnresolvedCreationReferenceException(
                    creationId,
                    UnresolvedCreationReferenceException.Kind.MISSING_SERVER_ID,
                    "created entry for '" + creationId + "' has no string id"));
        }
        final SetError error = notCreated.get(creationId);
        if (error != null) {
            throw new UnresolvedCreationReferenceException(
                    creationId,
                    UnresolvedCreationReferenceException.Kind.NOT_CREATED,
                    "'" + creationId + "' was not created: " + error.type()
                            + error.descriptionText().map(text -> " (" + text + ")").orElse(""));
        }
        throw new UnresolvedCreationReferenceException(
                creationId,
                UnresolvedCreationReferenceException.Kind.NOT_FOUND,
                "no creation result for '" + creationId + "'");
    }
}
