package org.jmapsuite.testkit;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.jmapsuite.batch.Batch;
import org.jmapsuite.batch.CreationResults;
import org.jmapsuite.batch.EntityKind;
import org.jmapsuite.batch.SetError;
import org.jmapsuite.batch.UnresolvedCreationReferenceException;
import org.jmapsuite.client.BatchRequest;
import org.jmapsuite.client.BatchResult;
import org.jmapsuite.client.RequestOrchestrator;
import org.jmapsuite.json.JsonValues;
import org.jmapsuite.wire.MethodNames;
import org.jmapsuite.wire.MethodResponse;

/**
 * One account on the server under test.
 *
 * <p>Every request sent through a handle carries its {@code accountId} unless the caller set one.
 */
public final class AccountHandle {
    private static final String CREATION_ID = "new";

    private final String accountId;
    private final RequestOrchestrator orchestrator;
    private final List<String> capabilities;

    public AccountHandle(final String accountId, final RequestOrchestrator orchestrator) {
        this(accountId, orchestrator, List.of());
    }

    /**
     * @param capabilities extra capability URIs added to the {@code using} list of every request
     */
    public AccountHandle(final String accountId, final RequestOrchestrator orchestrator, final List<String> capabilities) {
        this.accountId = requireText(accountId, "accountId");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.capabilities = List.copyOf(Objects.requireNonNull(capabilities, "capabilities"));
    }

    public String accountId() {
        return accountId;
    }

    public RequestOrchestrator orchestrator() {
        return orchestrator;
    }

    public List<String> capabilities() {
        return capabilities;
    }

    public ConformanceAsserter asserter() {
        return new ConformanceAsserter(orchestrator, this::prepare);
    }

    /**
     * Adds this account's id to calls that do not name an account, and its extra capabilities.
     */
    public BatchRequest prepare(final BatchRequest request) {
        Objects.requireNonNull(request, "request");
        final BatchRequest withAccount = request.withDefaultAccount(accountId);
        return capabilities.isEmpty() ? withAccount : withAccount.withCapabilities(capabilities);
    }

    public BatchResult send(final BatchRequest request) {
        return orchestrator.send(prepare(request));
    }

    /**
     * Creates one entity and returns a handle holding its full server-side property bag.
     *
     * @throws ConformanceAssertionError when the server does not create it
     */
    public EntityHandle create(final EntityKind kind, final Map<String, ?> properties) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(properties, "properties");
        final Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("create", Map.of(CREATION_ID, properties));
        final MethodResponse response = call(kind.typeName() + "/" + MethodNames.SET, arguments);

        final CreationResults results = CreationResults.from(response.arguments());
        final String serverId;
        try {
            serverId = results.createdId(CREATION_ID);
        } catch (UnresolvedCreationReferenceException e) {
            throw new ConformanceAssertionError("could not create " + kind.typeName() + ": " + e.getMessage());
        }
        return get(kind, serverId).orElseThrow(() -> new ConformanceAssertionError(
                kind.typeName() + " " + serverId + " was created but cannot be fetched"));
    }

    public EntityHandle createMailbox(final Map<String, ?> properties) {
        return create(EntityKind.MAILBOX, properties);
    }

    /**
     * Fetches one entity by server id; empty when the server lists it as {@code notFound}.
     */
    public Optional<EntityHandle> get(final EntityKind kind, final String id) {
        final BsonDocument properties = fetch(kind, id);
        if (properties == null) {
            return Optional.empty();
        }
        return Optional.of(new EntityHandle(this, kind, id, properties));
    }

    BsonDocument fetch(final EntityKind kind, final String id) {
        Objects.requireNonNull(kind, "kind");
        requireText(id, "id");
        final MethodResponse response = call(kind.typeName() + "/" + MethodNames.GET, Map.of("ids", List.of(id)));
        final BsonValue list = response.arguments().get("list");
        if (list != null && list.isArray()) {
            for (BsonValue entry : list.asArray()) {
                if (entry.isDocument() && new BsonString(id).equals(entry.asDocument().get("id"))) {
                    return entry.asDocument().clone();
                }
            }
        }
        final BsonValue notFound = response.arguments().get("notFound");
        if (notFound != null && notFound.isArray() && notFound.asArray().contains(new BsonString(id))) {
            return null;
        }
        throw new ConformanceAssertionError(
                kind.typeName() + "/get neither listed nor reported notFound for " + id
                        + ": " + JsonValues.render(response.arguments()));
    }

    /**
     * Sends one call and returns its non-error response.
     *
     * @throws ConformanceAssertionError on transport failure, missing response or method error
     */
    MethodResponse call(final String methodName, final Map<String, ?> arguments) {
        final BatchResult result = send(BatchRequest.single(methodName, arguments));
        if (!result.isSuccess()) {
            throw new ConformanceAssertionError(methodName + " failed: " + result.failureMessage().orElse(""));
        }
        final Batch batch = result.requireBatch();
        final MethodResponse response = batch.responseFor(batch.calls().get(0).correlationId())
                .orElseThrow(() -> new ConformanceAssertionError(methodName + " got no matching response"));
        if (response.isError()) {
            throw new ConformanceAssertionError(
                    methodName + " returned error " + response.errorType().orElse("<untyped>"));
        }
        return response;
    }

    static String describe(final SetError error) {
        return error.type() + error.descriptionText().map(text -> " (" + text + ")").orElse("");
    }

    private static String requireText(final String value, final String fieldName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value.trim();
    }
}
