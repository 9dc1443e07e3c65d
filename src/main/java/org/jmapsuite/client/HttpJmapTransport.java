package org.jmapsuite.client;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import org.jmapsuite.wire.JmapCodec;
import org.jmapsuite.wire.JmapCodecException;
import org.jmapsuite.wire.JmapRequest;
import org.jmapsuite.wire.JmapResponse;

/**
 * Posts JMAP requests as JSON to a server's API URL.
 */
public final class HttpJmapTransport implements JmapTransport {
    private static final String JSON_MEDIA_TYPE = "application/json";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    private static final int BODY_EXCERPT_LIMIT = 512;

    private final URI apiUrl;
    private final String bearerToken;
    private final HttpClient httpClient;
    private final JmapCodec codec;
    private final Duration requestTimeout;

    public HttpJmapTransport(final URI apiUrl, final String bearerToken) {
        this(apiUrl, bearerToken, HttpClient.newBuilder().connectTimeout(DEFAULT_TIMEOUT).build(), DEFAULT_TIMEOUT);
    }

    HttpJmapTransport(
            final URI apiUrl,
            final String bearerToken,
            final HttpClient httpClient,
            final Duration requestTimeout) {
        this.apiUrl = Objects.requireNonNull(apiUrl, "apiUrl");
        if (!"http".equalsIgnoreCase(apiUrl.getScheme()) && !"https".equalsIgnoreCase(apiUrl.getScheme())) {
            throw new IllegalArgumentException("apiUrl must use http or https: " + apiUrl);
        }
        this.bearerToken = bearerToken == null || bearerToken.isBlank() ? null : bearerToken.trim();
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.codec = new JmapCodec();
    }

    @Override
    public String name() {
        return "http:" + apiUrl;
    }

    public URI apiUrl() {
        return apiUrl;
    }

    @Override
    public JmapResponse send(final JmapRequest request) throws JmapTransportException {
        Objects.requireNonNull(request, "request");
        final HttpRequest.Builder builder = HttpRequest.newBuilder(apiUrl)
                .timeout(requestTimeout)
                .header("Content-Type", JSON_MEDIA_TYPE)
                .header("Accept", JSON_MEDIA_TYPE)
                .POST(HttpRequest.BodyPublishers.ofString(codec.encode(request), StandardCharsets.UTF_8));
        if (bearerToken != null) {
            builder.header("Authorization", "Bearer " + bearerToken);
        }

        final HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new JmapTransportException("POST " + apiUrl + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JmapTransportException("POST " + apiUrl + " interrupted", e);
        }

        if (response.statusCode() != 200) {
            throw new JmapTransportException(
                    "POST " + apiUrl + " returned HTTP " + response.statusCode() + ": " + excerpt(response.body()));
        }
        try {
            return codec.decodeResponse(response.body());
        } catch (JmapCodecException e) {
            throw new JmapTransportException("undecodable response from " + apiUrl + ": " + e.getMessage(), e);
        }
    }

    private static String excerpt(final String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= BODY_EXCERPT_LIMIT ? body : body.substring(0, BODY_EXCERPT_LIMIT) + "...";
    }
}
