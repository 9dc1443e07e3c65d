package org.jmapsuite.batch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.jmapsuite.json.JsonValues;

/**
 * Read-only view over the arguments of a {@code Foo/set} response.
 *
 * <p>Absent or {@code null} result maps read as empty.
 */
public final class SetResponseView {
    private final BsonDocument arguments;

    public SetResponseView(final BsonDocument arguments) {
        this.arguments = Objects.requireNonNull(arguments, "arguments").clone();
    }

    public Optional<String> accountId() {
        return Optional.ofNullable(JsonValues.readString(arguments, "accountId"));
    }

    public Optional<String> oldState() {
        return Optional.ofNullable(JsonValues.readString(arguments, "oldState"));
    }

    public Optional<String> newState() {
        return Optional.ofNullable(JsonValues.readString(arguments, "newState"));
    }

    public Map<String, CreatedResult> created() {
        final Map<String, CreatedResult> created = new LinkedHashMap<>();
        for (Map.Entry<String, BsonValue> entry : readMap("created").entrySet()) {
            final BsonValue value = entry.getValue();
            final BsonDocument properties = value.isDocument() ? value.asDocument() : new BsonDocument();
            created.put(entry.getKey(), new CreatedResult(
                    entry.getKey(),
                    JsonValues.readString(properties, "id"),
                    properties));
        }
        return Collections.unmodifiableMap(created);
    }

    public Map<String, SetError> notCreated() {
        return readErrors("notCreated");
    }

    /**
     * Ids in {@code updated}; values are the server-changed properties, or an empty document for {@code null}.
     */
    public Map<String, BsonDocument> updated() {
        final Map<String, BsonDocument> updated = new LinkedHashMap<>();
        for (Map.Entry<String, BsonValue> entry : readMap("updated").entrySet()) {
            final BsonValue value = entry.getValue();
            updated.put(entry.getKey(), value.isDocument() ? value.asDocument().clone() : new BsonDocument());
        }
        return Collections.unmodifiableMap(updated);
    }

    public Map<String, SetError> notUpdated() {
        return readErrors("notUpdated");
    }

    public Set<String> destroyed() {
        final Set<String> destroyed = new LinkedHashSet<>();
        final BsonValue value = arguments.get("destroyed");
        if (value != null && value.isArray()) {
            for (BsonValue id : value.asArray()) {
                if (id.isString()) {
                    destroyed.add(id.asString().getValue());
                }
            }
        }
        return Collections.unmodifiableSet(destroyed);
    }

    public Map<String, SetError> notDestroyed() {
        return readErrors("notDestroyed");
    }

    private Map<String, SetError> readErrors(final String key) {
        final Map<String, SetError> errors = new LinkedHashMap<>();
        for (Map.Entry<String, BsonValue> entry : readMap(key).entrySet()) {
            errors.put(entry.getKey(), SetError.from(entry.getValue()));
        }
        return Collections.unmodifiableMap(errors);
    }

    private BsonDocument readMap(final String key) {
        final BsonDocument map = JsonValues.readDocument(arguments, key);
        return map == null ? new BsonDocument() : map;
    }
}
