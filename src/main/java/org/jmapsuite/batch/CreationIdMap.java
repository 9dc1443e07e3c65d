package org.jmapsuite.batch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.bson.BsonValue;

/**
 * Accumulates creation id to server id mappings across round trips and rewrites
 * {@code "#creationId"} references in the arguments of later calls.
 *
 * <p>References to creation ids this map has never seen are left alone: the server may still
 * resolve them against a creation earlier in the same request.
 */
public final class CreationIdMap {
    private static final char REFERENCE_PREFIX = '#';
    private static final String RESULT_OF = "resultOf";

    private final Map<String, String> resolved = new LinkedHashMap<>();
    private final Set<String> failed = new LinkedHashSet<>();

    public CreationIdMap record(final CreationResults results) {
        Objects.requireNonNull(results, "results");
        for (CreatedResult created : results.created().values()) {
            created.serverId().ifPresent(serverId -> {
                resolved.put(created.creationId(), serverId);
                failed.remove(created.creationId());
            });
        }
        for (String creationId : results.notCreated().keySet()) {
            if (!resolved.containsKey(creationId)) {
                failed.add(creationId);
            }
        }
        return this;
    }

    public CreationIdMap record(final Batch batch) {
        Objects.requireNonNull(batch, "batch");
        batch.calls().forEach(call -> batch.creationResults(call.correlationId()).ifPresent(this::record));
        return this;
    }

    public Optional<String> serverId(final String creationId) {
        return Optional.ofNullable(resolved.get(creationId));
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(resolved));
    }

    /**
     * Copy of {@code arguments} with every known {@code "#creationId"} string value and object key
     * replaced by its server id.
     *
     * @throws UnresolvedCreationReferenceException when a reference names a creation the server rejected
     */
    public BsonDocument rewrite(final BsonDocument arguments) {
        return rewriteDocument(Objects.requireNonNull(arguments, "arguments"));
    }

    private BsonDocument rewriteDocument(final BsonDocument source) {
        final BsonDocument rewritten = new BsonDocument();
        for (Map.Entry<String, BsonValue> entry : source.entrySet()) {
            final String key = entry.getKey();
            final BsonValue value = entry.getValue();
            // "#prop": {"resultOf": ...} is a result reference, not a creation reference
            if (isResultReference(value)) {
                rewritten.put(key, value.asDocument().clone());
                continue;
            }
            rewritten.put(rewriteReference(key), rewriteValue(value));
        }
        return rewritten;
    }

    private BsonValue rewriteValue(final BsonValue value) {
        if (value.isDocument()) {
            return rewriteDocument(value.asDocument());
        }
        if (value.isArray()) {
            final BsonArray rewritten = new BsonArray();
            for (BsonValue item : value.asArray()) {
                rewritten.add(rewriteValue(item));
            }
            return rewritten;
        }
        if (value.isString()) {
            final String text = value.asString().getValue();
            final String replaced = rewriteReference(text);
            return replaced.equals(text) ? value : new BsonString(replaced);
        }
        return value;
    }

    private String rewriteReference(final String text) {
        if (text.length() < 2 || text.charAt(0) != REFERENCE_PREFIX) {
            return text;
        }
        final String creationId = text.substring(1);
        final String serverId = resolved.get(creationId);
        if (serverId != null) {
            return serverId;
        }
        if (failed.contains(creationId)) {
            throw new UnresolvedCreationReferenceException(
                    creationId,
                    UnresolvedCreationReferenceException.Kind.NOT_CREATED,
                    "reference '" + text + "' names a creation the server rejected");
        }
        return text;
    }

    private static boolean isResultReference(final BsonValue value) {
        return value.isDocument() && value.asDocument().containsKey(RESULT_OF);
    }
}
