package org.jmapsuite.batch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.bson.BsonDocument;
import org.jmapsuite.wire.MethodNames;

/**
 * JMAP mail data types with the properties a compliant server may return for each.
 */
public enum EntityKind {
    MAILBOX("Mailbox", Set.of(
            "id", "name", "parentId", "role", "sortOrder", "totalEmails", "unreadEmails",
            "totalThreads", "unreadThreads", "myRights", "isSubscribed")),
    EMAIL("Email", Set.of(
            "id", "blobId", "threadId", "mailboxIds", "keywords", "size", "receivedAt",
            "messageId", "inReplyTo", "references", "sender", "from", "to", "cc", "bcc", "replyTo",
            "subject", "sentAt", "hasAttachment", "preview", "bodyStructure", "bodyValues",
            "textBody", "htmlBody", "attachments", "headers")),
    THREAD("Thread", Set.of("id", "emailIds")),
    IDENTITY("Identity", Set.of(
            "id", "name", "email", "replyTo", "bcc", "textSignature", "htmlSignature", "mayDelete")),
    EMAIL_SUBMISSION("EmailSubmission", Set.of(
            "id", "identityId", "emailId", "threadId", "envelope", "sendAt", "undoStatus",
            "deliveryStatus", "dsnBlobIds", "mdnBlobIds")),
    VACATION_RESPONSE("VacationResponse", Set.of(
            "id", "isEnabled", "fromDate", "toDate", "subject", "textBody", "htmlBody")),
    SEARCH_SNIPPET("SearchSnippet", Set.of("emailId", "subject", "preview"));

    // Email header fetches such as "header:List-Id:asText" are open-ended
    private static final String HEADER_PROPERTY_PREFIX = "header:";

    private final String typeName;
    private final Set<String> properties;

    EntityKind(final String typeName, final Set<String> properties) {
        this.typeName = typeName;
        this.properties = properties;
    }

    public String typeName() {
        return typeName;
    }

    public Set<String> properties() {
        return properties;
    }

    public boolean isKnownProperty(final String property) {
        if (properties.contains(property)) {
            return true;
        }
        return this == EMAIL && property.startsWith(HEADER_PROPERTY_PREFIX);
    }

    /**
     * Keys of {@code returned} outside this kind's allowlist, sorted.
     */
    public List<String> unknownProperties(final BsonDocument returned) {
        Objects.requireNonNull(returned, "returned");
        final TreeSet<String> unknown = new TreeSet<>();
        for (String key : returned.keySet()) {
            if (!isKnownProperty(key)) {
                unknown.add(key);
            }
        }
        return new ArrayList<>(unknown);
    }

    public static Optional<EntityKind> forTypeName(final String typeName) {
        for (EntityKind kind : values()) {
            if (kind.typeName.equals(typeName)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public static Optional<EntityKind> forMethod(final String methodName) {
        return forTypeName(MethodNames.entityType(methodName));
    }
}
