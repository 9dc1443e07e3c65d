package org.jmapsuite.wire;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.bson.BsonDocument;
import org.jmapsuite.json.JsonValues;
import org.jmapsuite.match.Expect;
import org.jmapsuite.match.StructuralMatcher;
import org.junit.jupiter.api.Test;

class JmapCodecTest {
    private final JmapCodec codec = new JmapCodec();

    @Test
    void encodesRequestEnvelopeWithDefaultCapabilities() {
        final JmapRequest request = new JmapRequest(
                JmapRequest.DEFAULT_USING,
                List.of(new MethodCall("Mailbox/get", BsonDocument.parse("{\"accountId\":\"u1\",\"ids\":null}"), "a")));

        final BsonDocument encoded = BsonDocument.parse(codec.encode(request));
        assertEquals(
                BsonDocument.parse("{\"using\":[\"urn:ietf:params:jmap:core\",\"urn:ietf:params:jmap:mail\"],"
                        + "\"methodCalls\":[[\"Mailbox/get\",{\"accountId\":\"u1\",\"ids\":null},\"a\"]]}"),
                encoded);
    }

    @Test
    void decodesResponsesKeepingOrderAndSessionState() {
        final JmapResponse response = codec.decodeResponse("{\"methodResponses\":["
                + "[\"Mailbox/get\",{\"list\":[]},\"r2\"],"
                + "[\"error\",{\"type\":\"unknownMethod\"},\"r1\"]],"
                + "\"sessionState\":\"s42\",\"createdIds\":{\"k1\":\"m9\"}}");

        assertEquals(2, response.methodResponses().size());
        assertEquals("r2", response.methodResponses().get(0).correlationId());
        assertEquals(Optional.empty(), response.methodResponses().get(0).errorType());
        final MethodResponse error = response.methodResponses().get(1);
        assertTrue(error.isError());
        assertEquals(Optional.of("unknownMethod"), error.errorType());
        assertEquals(Optional.of("s42"), response.sessionState());
        assertEquals(Optional.of(Map.of("k1", "m9")), response.createdIds());
    }

    @Test
    void requestSurvivesAnEncodeDecodeCycle() {
        final JmapRequest request = new JmapRequest(
                List.of(JmapRequest.CORE_CAPABILITY, JmapRequest.CORE_CAPABILITY),
                List.of(
                        new MethodCall("Mailbox/set", BsonDocument.parse("{\"create\":{\"k\":{\"name\":\"X\"}}}"), "c1"),
                        new MethodCall("Mailbox/get", BsonDocument.parse("{\"ids\":[\"#k\"]}"), "c2")),
                Map.of("k0", "m0"));

        final JmapRequest decoded = codec.decodeRequest(codec.encode(request));
        assertEquals(List.of(JmapRequest.CORE_CAPABILITY), decoded.using());
        assertEquals("c2", decoded.methodCalls().get(1).correlationId());
        assertEquals(request.toDocument(), decoded.toDocument());
    }

    @Test
    void rejectsUndecodablePayloads() {
        assertCodecError("", "response body is empty");
        assertCodecError("{not json", "response body is not valid JSON");
        assertCodecError("[]", "response body must be a JSON object");
        assertCodecError("{}", "methodResponses must be an array");
        assertCodecError("{\"methodResponses\":[[\"Mailbox/get\",{}]]}",
                "methodResponses[0] must be a [name, arguments, callId] array");
        assertCodecError("{\"methodResponses\":[[\"Mailbox/get\",[],\"a\"]]}",
                "methodResponses[0] arguments must be an object");
        assertCodecError("{\"methodResponses\":[[\"Mailbox/get\",{},7]]}",
                "methodResponses[0] callId must be a string");
        assertCodecError("{\"methodResponses\":[],\"sessionState\":1}", "sessionState must be a string");
    }

    @Test
    void rejectsLenientJsonSyntax() {
        assertCodecError("{methodResponses: [['Mailbox/get', {}, 'a']], sessionState: 's'}",
                "response body is not valid JSON");
        assertCodecError("{\"methodResponses\": []}}", "response body is not valid JSON");
    }

    @Test
    void keepsTypeWrappersAsPlainObjects() {
        final JmapResponse response = codec.decodeResponse(
                "{\"methodResponses\":[[\"Mailbox/get\",{\"n\":{\"$numberLong\":\"5\"}},\"a\"]]}");

        final BsonDocument arguments = response.methodResponses().get(0).arguments();
        assertTrue(arguments.get("n").isDocument());
        assertEquals("{\"n\": {\"$numberLong\": \"5\"}}", JsonValues.render(arguments));
        assertTrue(StructuralMatcher.matches(arguments, Expect.supersetOf("n", Expect.number())).diagnostics()
                .get(0).contains("expected JSON number but found object"));
    }

    @Test
    void splitsMethodNames() {
        assertEquals("Mailbox", MethodNames.entityType("Mailbox/set"));
        assertEquals("set", MethodNames.operation("Mailbox/set"));
        assertTrue(MethodNames.isGet("Email/get"));
        assertEquals("", MethodNames.entityType("error"));
        assertEquals("error", MethodNames.operation("error"));
    }

    private void assertCodecError(final String json, final String expectedPrefix) {
        final JmapCodecException error = assertThrows(JmapCodecException.class, () -> codec.decodeResponse(json));
        assertTrue(error.getMessage().startsWith(expectedPrefix), error.getMessage());
    }
}
