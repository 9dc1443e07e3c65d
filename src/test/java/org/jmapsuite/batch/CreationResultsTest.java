package org.jmapsuite.batch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Set;
import org.bson.BsonDocument;
import org.junit.jupiter.api.Test;

class CreationResultsTest {
    private static final BsonDocument SET_RESPONSE = BsonDocument.parse("{"
            + "\"accountId\":\"u1\",\"oldState\":\"1\",\"newState\":\"2\","
            + "\"created\":{\"k1\":{\"id\":\"mb7\",\"sortOrder\":0},\"k3\":{\"sortOrder\":0}},"
            + "\"notCreated\":{\"k2\":{\"type\":\"invalidProperties\",\"description\":\"unknown parentId\","
            + "\"properties\":[\"parentId\"]}}}");

    @Test
    void resolvesServerIdRepeatably() {
        final CreationResults results = CreationResults.from(SET_RESPONSE);

        assertEquals("mb7", results.createdId("k1"));
        assertEquals("mb7", results.createdId("k1"));
        assertEquals(Set.of("k1", "k2", "k3"), results.resultIds());
    }

    @Test
    void classifiesUnresolvableCreationIds() {
        final CreationResults results = CreationResults.from(SET_RESPONSE);

        final UnresolvedCreationReferenceException rejected =
                assertThrows(UnresolvedCreationReferenceException.class, () -> results.createdId("k2"));
        assertEquals(UnresolvedCreationReferenceException.Kind.NOT_CREATED, rejected.kind());
        assertEquals("k2", rejected.creationId());
        assertEquals("'k2' was not created: invalidProperties (unknown parentId)", rejected.getMessage());

        final UnresolvedCreationReferenceException unknown =
                assertThrows(UnresolvedCreationReferenceException.class, () -> results.createdId("k9"));
        assertEquals(UnresolvedCreationReferenceException.Kind.NOT_FOUND, unknown.kind());
        assertEquals("no creation result for 'k9'", unknown.getMessage());

        final UnresolvedCreationReferenceException noId =
                assertThrows(UnresolvedCreationReferenceException.class, () -> results.createdId("k3"));
        assertEquals(UnresolvedCreationReferenceException.Kind.MISSING_SERVER_ID, noId.kind());
        assertEquals("created entry for 'k3' has no string id", noId.getMessage());
    }

    @Test
    void readsSetErrorDetails() {
        final SetError error = CreationResults.from(SET_RESPONSE).notCreated().get("k2");

        assertEquals("invalidProperties", error.type());
        assertEquals(List.of("parentId"), error.properties());
    }

    @Test
    void treatsNullResultMapsAsEmpty() {
        final CreationResults results = CreationResults.from(
                BsonDocument.parse("{\"created\":null,\"notCreated\":null}"));

        assertEquals(Set.of(), results.resultIds());
    }
}
