package org.jmapsuite.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.bson.BsonDocument;
import org.jmapsuite.wire.JmapRequest;
import org.jmapsuite.wire.JmapResponse;
import org.jmapsuite.wire.MethodCall;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class HttpJmapTransportTest {
    private static final JmapRequest REQUEST = new JmapRequest(
            JmapRequest.DEFAULT_USING,
            List.of(new MethodCall("Mailbox/get", BsonDocument.parse("{\"accountId\":\"u1\"}"), "a")));

    private HttpServer server;

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void postsJsonWithBearerToken() throws Exception {
        final AtomicReference<String> authorization = new AtomicReference<>();
        final AtomicReference<String> body = new AtomicReference<>();
        final URI url = serve(200, "{\"methodResponses\":[[\"Mailbox/get\",{\"list\":[]},\"a\"]],\"sessionState\":\"s0\"}",
                authorization, body);

        final JmapResponse response = new HttpJmapTransport(url, "secret").send(REQUEST);

        assertEquals("Bearer secret", authorization.get());
        assertEquals("Mailbox/get", BsonDocument.parse(body.get()).getArray("methodCalls").get(0).asArray()
                .get(0).asString().getValue());
        assertEquals("a", response.methodResponses().get(0).correlationId());
        assertEquals("s0", response.sessionState().orElseThrow());
    }

    @Test
    void nonSuccessStatusIsTransportFailure() throws Exception {
        final URI url = serve(401, "unauthorized", new AtomicReference<>(), new AtomicReference<>());

        final JmapTransportException error =
                assertThrows(JmapTransportException.class, () -> new HttpJmapTransport(url, null).send(REQUEST));
        assertEquals("POST " + url + " returned HTTP 401: unauthorized", error.getMessage());
    }

    @Test
    void undecodableBodyIsTransportFailure() throws Exception {
        final URI url = serve(200, "{\"methodResponses\":{}}", new AtomicReference<>(), new AtomicReference<>());

        final JmapTransportException error =
                assertThrows(JmapTransportException.class, () -> new HttpJmapTransport(url, "t").send(REQUEST));
        assertTrue(error.getMessage().startsWith("undecodable response from " + url), error.getMessage());
    }

    @Test
    void rejectsNonHttpUrls() {
        assertThrows(IllegalArgumentException.class,
                () -> new HttpJmapTransport(URI.create("ftp://example.test/jmap"), null));
    }

    private URI serve(
            final int status,
            final String responseBody,
            final AtomicReference<String> authorization,
            final AtomicReference<String> requestBody) throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/jmap", exchange -> {
            authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            final byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/jmap");
    }
}
