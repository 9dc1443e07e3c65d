package org.jmapsuite.testkit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HarnessConfigTest {
    @TempDir
    Path tempDir;

    @Test
    void loadsYamlAndLetsEnvironmentOverrideIt() throws IOException {
        final Path file = tempDir.resolve("jmap.yaml");
        Files.writeString(file, String.join("\n",
                "apiUrl: https://jmap.example.test/api/",
                "bearerToken: file-token",
                "accountId: from-file",
                "strictProperties: false",
                "using:",
                "  - urn:ietf:params:jmap:submission",
                ""), StandardCharsets.UTF_8);

        final HarnessConfig fromFile = HarnessConfig.load(file, Map.of());
        assertEquals(URI.create("https://jmap.example.test/api/"), fromFile.apiUrl());
        assertEquals("file-token", fromFile.bearerToken());
        assertEquals("from-file", fromFile.accountId());
        assertNull(fromFile.pristineAccountId());
        assertFalse(fromFile.strictProperties());
        assertEquals(List.of("urn:ietf:params:jmap:submission"), fromFile.using());

        final HarnessConfig overridden = HarnessConfig.load(file, Map.of(
                "JMAP_ACCOUNT_ID", "from-env",
                "JMAP_PRISTINE_ACCOUNT_ID", "empty-account",
                "JMAP_STRICT_PROPERTIES", "1"));
        assertEquals("from-env", overridden.accountId());
        assertEquals("empty-account", overridden.pristineAccountId());
        assertTrue(overridden.strictProperties());
        assertEquals("file-token", overridden.bearerToken());
    }

    @Test
    void loadsJsonFiles() throws IOException {
        final Path file = tempDir.resolve("jmap.json");
        Files.writeString(
                file,
                "{\"apiUrl\":\"http://localhost:8080/jmap\",\"accountId\":\"u1\",\"strictProperties\":true}",
                StandardCharsets.UTF_8);

        final HarnessConfig config = HarnessConfig.load(file, Map.of());
        assertEquals("http://localhost:8080/jmap", config.apiUrl().toString());
        assertTrue(config.strictProperties());
        assertNull(config.bearerToken());
        assertEquals(List.of(), config.using());
    }

    @Test
    void environmentAloneIsEnough() throws IOException {
        final HarnessConfig config = HarnessConfig.load(null, Map.of(
                "JMAP_API_URL", "https://jmap.example.test/api/",
                "JMAP_BEARER_TOKEN", "secret",
                "JMAP_ACCOUNT_ID", "u1"));

        assertEquals("secret", config.bearerToken());
        assertFalse(config.strictProperties());
    }

    @Test
    void explicitOverridesWinOverEnvironment() throws IOException {
        final HarnessConfig config = HarnessConfig.load(
                null,
                Map.of("JMAP_ACCOUNT_ID", "from-env", "JMAP_STRICT_PROPERTIES", "false"),
                Map.of(HarnessConfig.API_URL, "https://cli.example.test/api", HarnessConfig.ACCOUNT_ID, "from-cli"));

        assertEquals("from-cli", config.accountId());
        assertEquals("https://cli.example.test/api", config.apiUrl().toString());
        assertFalse(config.strictProperties());
    }

    @Test
    void strictFlagFollowsTheEnvironmentConvention() {
        assertFalse(HarnessConfig.parseFlag(null));
        assertFalse(HarnessConfig.parseFlag(""));
        assertFalse(HarnessConfig.parseFlag("0"));
        assertFalse(HarnessConfig.parseFlag("false"));
        assertFalse(HarnessConfig.parseFlag("FALSE"));
        assertTrue(HarnessConfig.parseFlag("1"));
        assertTrue(HarnessConfig.parseFlag("yes"));
        assertTrue(HarnessConfig.parseFlag(Boolean.TRUE));
    }

    @Test
    void overridesReplaceSingleKeys() {
        final HarnessConfig base = HarnessConfig.fromMap(Map.of(
                HarnessConfig.API_URL, "https://a.example.test/api",
                HarnessConfig.ACCOUNT_ID, "u1"));

        final HarnessConfig changed = base.withOverrides(Map.of(HarnessConfig.STRICT_PROPERTIES, true));
        assertTrue(changed.strictProperties());
        assertEquals("u1", changed.accountId());
        assertEquals(base.apiUrl(), changed.apiUrl());
    }

    @Test
    void rejectsInvalidConfigurationNamingTheKey() {
        final IllegalArgumentException missingUrl = assertThrows(
                IllegalArgumentException.class,
                () -> HarnessConfig.fromMap(Map.of(HarnessConfig.ACCOUNT_ID, "u1")));
        assertEquals("apiUrl must not be blank", missingUrl.getMessage());

        final IllegalArgumentException missingAccount = assertThrows(
                IllegalArgumentException.class,
                () -> HarnessConfig.fromMap(Map.of(HarnessConfig.API_URL, "https://a.example.test/api")));
        assertEquals("accountId must not be blank", missingAccount.getMessage());

        final IllegalArgumentException badScheme = assertThrows(
                IllegalArgumentException.class,
                () -> HarnessConfig.fromMap(Map.of(
                        HarnessConfig.API_URL, "ftp://a.example.test/api",
                        HarnessConfig.ACCOUNT_ID, "u1")));
        assertTrue(badScheme.getMessage().startsWith("apiUrl must be an http or https URL"));

        final IllegalArgumentException unknownKey = assertThrows(
                IllegalArgumentException.class,
                () -> HarnessConfig.fromMap(Map.of("apiURL", "https://a.example.test/api")));
        assertEquals("unknown configuration key: apiURL", unknownKey.getMessage());

        final IllegalArgumentException badUsing = assertThrows(
                IllegalArgumentException.class,
                () -> HarnessConfig.fromMap(Map.of(
                        HarnessConfig.API_URL, "https://a.example.test/api",
                        HarnessConfig.ACCOUNT_ID, "u1",
                        HarnessConfig.USING, List.of(1))));
        assertEquals("using entries must be non-blank strings", badUsing.getMessage());
    }
}
