package org.jmapsuite.batch;

import java.util.Objects;

/**
 * Thrown when a caller asks for the server id of a creation id that was not created.
 *
 * <p>This signals a test-author error, not server non-conformance.
 */
public final class UnresolvedCreationReferenceException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** The creation id appears in no {@code created} or {@code notCreated} map. */
        NOT_FOUND,
        /** The server rejected the creation and listed it in {@code notCreated}. */
        NOT_CREATED,
        /** The creation id is in {@code created} but without a string {@code id}. */
        MISSING_SERVER_ID
    }

    private final String creationId;
    private final Kind kind;

    public UnresolvedCreationReferenceException(final String creationId, final Kind kind, final String message) {
        super(message);
        this.creationId = Objects.requireNonNull(creationId, "creationId");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public String creationId() {
        return creationId;
    }

    public Kind kind() {
        return kind;
    }
}
