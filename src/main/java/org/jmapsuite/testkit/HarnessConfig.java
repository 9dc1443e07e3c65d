package org.jmapsuite.testkit;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.bson.BsonValue;
import org.jmapsuite.json.JsonValues;
import org.yaml.snakeyaml.Yaml;

/**
 * Connection and behaviour settings for a conformance run.
 *
 * <p>Values come from an optional JSON or YAML file, then environment variables, then explicit
 * overrides, each layer replacing the previous one key by key.
 */
public record HarnessConfig(
        URI apiUrl,
        String bearerToken,
        String accountId,
        String pristineAccountId,
        boolean strictProperties,
        List<String> using) {
    public static final String API_URL = "apiUrl";
    public static final String BEARER_TOKEN = "bearerToken";
    public static final String ACCOUNT_ID = "accountId";
    public static final String PRISTINE_ACCOUNT_ID = "pristineAccountId";
    public static final String STRICT_PROPERTIES = "strictProperties";
    public static final String USING = "using";

    private static final Set<String> KNOWN_KEYS = Set.of(
            API_URL, BEARER_TOKEN, ACCOUNT_ID, PRISTINE_ACCOUNT_ID, STRICT_PROPERTIES, USING);
    private static final Map<String, String> ENVIRONMENT_KEYS = Map.of(
            "JMAP_API_URL", API_URL,
            "JMAP_BEARER_TOKEN", BEARER_TOKEN,
            "JMAP_ACCOUNT_ID", ACCOUNT_ID,
            "JMAP_PRISTINE_ACCOUNT_ID", PRISTINE_ACCOUNT_ID,
            "JMAP_STRICT_PROPERTIES", STRICT_PROPERTIES);

    public HarnessConfig {
        Objects.requireNonNull(apiUrl, API_URL);
        if (!"http".equalsIgnoreCase(apiUrl.getScheme()) && !"https".equalsIgnoreCase(apiUrl.getScheme())) {
            throw new IllegalArgumentException(API_URL + " must be an http or https URL: " + apiUrl);
        }
        bearerToken = optionalText(bearerToken);
        accountId = requireText(accountId, ACCOUNT_ID);
        pristineAccountId = optionalText(pristineAccountId);
        using = List.copyOf(Objects.requireNonNull(using, USING));
    }

    /**
     * Resolves the file (when given) and the process environment.
     */
    public static HarnessConfig load(final Path configPath, final Map<String, String> environment) throws IOException {
        return load(configPath, environment, Map.of());
    }

    public static HarnessConfig load(
            final Path configPath,
            final Map<String, String> environment,
            final Map<String, ?> overrides) throws IOException {
        Objects.requireNonNull(overrides, "overrides");
        final Map<String, Object> values = new LinkedHashMap<>();
        if (configPath != null) {
            values.putAll(readFile(configPath));
        }
        values.putAll(environmentValues(environment));
        values.putAll(overrides);
        return fromMap(values);
    }

    static Map<String, Object> readFile(final Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath");
        final Path normalized = configPath.toAbsolutePath().normalize();
        if (!Files.isRegularFile(normalized)) {
            throw new IllegalArgumentException("config path must be a file: " + normalized);
        }
        return parse(Files.readString(normalized, StandardCharsets.UTF_8), normalized.getFileName().toString());
    }

    static Map<String, Object> parse(final String content, final String sourceName) {
        Objects.requireNonNull(content, "content");
        final String normalizedName = Objects.requireNonNull(sourceName, "sourceName")
                .trim()
                .toLowerCase(Locale.ROOT);
        final Object root;
        if (normalizedName.endsWith(".yaml") || normalizedName.endsWith(".yml")) {
            root = new Yaml().load(content);
        } else {
            final BsonValue parsed = JsonValues.parse(content);
            root = JsonValues.toJava(parsed);
        }
        if (root == null) {
            return Map.of();
        }
        if (!(root instanceof Map<?, ?> rawMap)) {
            throw new IllegalArgumentException("config root must be an object");
        }
        final Map<String, Object> normalized = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : rawMap.entrySet()) {
            normalized.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return normalized;
    }

    static Map<String, Object> environmentValues(final Map<String, String> environment) {
        Objects.requireNonNull(environment, "environment");
        final Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : ENVIRONMENT_KEYS.entrySet()) {
            final String value = environment.get(entry.getKey());
            if (value != null) {
                values.put(entry.getValue(), value);
            }
        }
        return values;
    }

    public static HarnessConfig fromMap(final Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        for (String key : values.keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                throw new IllegalArgumentException("unknown configuration key: " + key);
            }
        }
        return new HarnessConfig(
                parseUrl(values.get(API_URL)),
                text(values.get(BEARER_TOKEN), BEARER_TOKEN),
                text(values.get(ACCOUNT_ID), ACCOUNT_ID),
                text(values.get(PRISTINE_ACCOUNT_ID), PRISTINE_ACCOUNT_ID),
                parseFlag(values.get(STRICT_PROPERTIES)),
                parseUsing(values.get(USING)));
    }

    /**
     * Same configuration with the given keys replaced.
     */
    public HarnessConfig withOverrides(final Map<String, ?> overrides) {
        Objects.requireNonNull(overrides, "overrides");
        final Map<String, Object> values = toMap();
        values.putAll(overrides);
        return fromMap(values);
    }

    public Map<String, Object> toMap() {
        final Map<String, Object> values = new LinkedHashMap<>();
        values.put(API_URL, apiUrl.toString());
        values.put(BEARER_TOKEN, bearerToken);
        values.put(ACCOUNT_ID, accountId);
        values.put(PRISTINE_ACCOUNT_ID, pristineAccountId);
        values.put(STRICT_PROPERTIES, strictProperties);
        values.put(USING, using);
        return values;
    }

    /**
     * Any non-empty value other than {@code 0} or {@code false} enables a flag; absence disables it.
     */
    static boolean parseFlag(final Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0;
        }
        final String text = String.valueOf(value).trim();
        return !text.isEmpty() && !"0".equals(text) && !"false".equalsIgnoreCase(text);
    }

    private static URI parseUrl(final Object value) {
        final String text = requireText(text(value, API_URL), API_URL);
        try {
            return new URI(text);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException(API_URL + " is not a valid URI: " + text, e);
        }
    }

    private static List<String> parseUsing(final Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof String single) {
            return single.isBlank() ? List.of() : List.of(single.trim());
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException(USING + " must be a list of capability URIs");
        }
        final List<String> capabilities = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof String capability) || capability.isBlank()) {
                throw new IllegalArgumentException(USING + " entries must be non-blank strings");
            }
            capabilities.add(capability.trim());
        }
        return capabilities;
    }

    private static String text(final Object value, final String key) {
        if (value == null) {
            return null;
        }
        if (value instanceof String || value instanceof Number) {
            return String.valueOf(value);
        }
        throw new IllegalArgumentException(key + " must be a string");
    }

    private static String optionalText(final String value) {
        if (value == null) {
            return null;
        }
        final String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String requireText(final String value, final String fieldName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value.trim();
    }
}
