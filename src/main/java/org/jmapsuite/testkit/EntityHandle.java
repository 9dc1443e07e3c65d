package org.jmapsuite.testkit;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.jmapsuite.batch.EntityKind;
import org.jmapsuite.batch.SetError;
import org.jmapsuite.batch.SetResponseView;
import org.jmapsuite.wire.MethodNames;
import org.jmapsuite.wire.MethodResponse;

/**
 * Server entity with its last-known property bag.
 *
 * <p>{@link #update(Map)} refreshes the cached properties after a successful update and
 * {@link #destroy()} invalidates the handle; any later access throws {@link IllegalStateException}.
 * Properties outside the kind's allowlist are kept and listed by {@link #unknownProperties()}; the
 * batch invariant report is where strict mode flags them.
 */
public final class EntityHandle {
    private final AccountHandle account;
    private final EntityKind kind;
    private final String id;
    private BsonDocument properties;
    private boolean destroyed;

    EntityHandle(final AccountHandle account, final EntityKind kind, final String id, final BsonDocument properties) {
        this.account = Objects.requireNonNull(account, "account");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.id = Objects.requireNonNull(id, "id");
        this.properties = Objects.requireNonNull(properties, "properties").clone();
    }

    public EntityKind kind() {
        return kind;
    }

    public String id() {
        return id;
    }

    public AccountHandle account() {
        return account;
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    public BsonDocument properties() {
        requireLive();
        return properties.clone();
    }

    /**
     * Cached value of one allowlisted property; empty when the server did not return it.
     *
     * @throws IllegalArgumentException for a property the entity kind does not define
     */
    public Optional<BsonValue> property(final String name) {
        requireLive();
        if (!kind.isKnownProperty(name)) {
            throw new IllegalArgumentException(kind.typeName() + " has no property " + name);
        }
        return Optional.ofNullable(properties.get(name));
    }

    /**
     * Cached property names the entity kind does not define, sorted.
     */
    public List<String> unknownProperties() {
        requireLive();
        return List.copyOf(kind.unknownProperties(properties));
    }

    public Optional<String> stringProperty(final String name) {
        return property(name).filter(BsonValue::isString).map(value -> value.asString().getValue());
    }

    public EntityHandle refresh() {
        requireLive();
        final BsonDocument current = account.fetch(kind, id);
        if (current == null) {
            throw new ConformanceAssertionError(kind.typeName() + " " + id + " no longer exists");
        }
        properties = current.clone();
        return this;
    }

    public EntityHandle update(final Map<String, ?> patch) {
        requireLive();
        Objects.requireNonNull(patch, "patch");
        final MethodResponse response = account.call(
                kind.typeName() + "/" + MethodNames.SET, Map.of("update", Map.of(id, patch)));
        final SetResponseView view = new SetResponseView(response.arguments());
        final SetError error = view.notUpdated().get(id);
        if (error != null) {
            throw new ConformanceAssertionError(
                    "could not update " + kind.typeName() + " " + id + ": " + AccountHandle.describe(error));
        }
        if (!view.updated().containsKey(id)) {
            throw new ConformanceAssertionError(kind.typeName() + "/set did not report " + id + " as updated");
        }
        return refresh();
    }

    public void destroy() {
        requireLive();
        final MethodResponse response = account.call(
                kind.typeName() + "/" + MethodNames.SET, Map.of("destroy", List.of(id)));
        final SetResponseView view = new SetResponseView(response.arguments());
        final SetError error = view.notDestroyed().get(id);
        if (error != null) {
            throw new ConformanceAssertionError(
                    "could not destroy " + kind.typeName() + " " + id + ": " + AccountHandle.describe(error));
        }
        if (!view.destroyed().contains(id)) {
            throw new ConformanceAssertionError(kind.typeName() + "/set did not report " + id + " as destroyed");
        }
        destroyed = true;
        properties = new BsonDocument();
    }

    private void requireLive() {
        if (destroyed) {
            throw new IllegalStateException(kind.typeName() + " " + id + " has been destroyed");
        }
    }
}
