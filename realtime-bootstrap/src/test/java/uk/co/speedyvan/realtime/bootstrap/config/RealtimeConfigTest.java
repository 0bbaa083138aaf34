package uk.co.speedyvan.realtime.bootstrap.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.co.speedyvan.realtime.core.RealtimeSettings;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RealtimeConfigTest {

    private final ClassLoader loader = RealtimeConfigTest.class.getClassLoader();

    @Test
    void loadsEverySection() {
        RealtimeConfig config = RealtimeConfig.loadResource(loader, "realtime-test.yml");

        RedisYamlConfig redis = config.redis();
        assertEquals("redis.internal", redis.host());
        assertEquals(6390, redis.port());
        assertTrue(redis.ssl());
        assertEquals("s3cret", redis.password());
        assertEquals(2500L, redis.timeoutMs());
        assertEquals(3, redis.database());
        assertFalse(redis.toString().contains("s3cret"));

        RedisYamlConfig publicRedis = config.publicRedis().orElseThrow();
        assertEquals("public.redis.internal", publicRedis.host());
        assertEquals(6391, publicRedis.port());
        assertFalse(publicRedis.ssl());

        EndpointYamlConfig endpoints = config.endpoints();
        assertEquals("https://app.example.com/api/broadcasting/auth", endpoints.authUrl().toString());
        assertEquals("https://app.example.com/api/realtime/poll", endpoints.pollUrl().toString());
        assertEquals("token-123", endpoints.accessToken());
        assertEquals(10_000L, endpoints.authTimeoutMs());
    }

    @Test
    void clientSectionOverridesOnlyGivenKeys() {
        RealtimeSettings settings = RealtimeConfig.loadResource(loader, "realtime-test.yml").client().toSettings();

        assertEquals(3, settings.maxReconnectAttempts());
        assertEquals(Duration.ofMillis(500), settings.reconnectBaseDelay());
        assertEquals(Duration.ofSeconds(60), settings.reconnectMaxDelay());
        assertEquals(Duration.ofSeconds(30), settings.defaultPollingInterval());
        assertFalse(settings.pollingEnabled());
    }

    @Test
    void bundledDefaultsMatchDefaultSettings() {
        RealtimeConfig config = RealtimeConfig.load(null, loader);
        RealtimeSettings settings = config.client().toSettings();
        RealtimeSettings defaults = RealtimeSettings.defaults();

        assertTrue(config.publicRedis().isEmpty());
        assertEquals("127.0.0.1", config.redis().host());
        assertEquals(defaults.maxReconnectAttempts(), settings.maxReconnectAttempts());
        assertEquals(defaults.reconnectBaseDelay(), settings.reconnectBaseDelay());
        assertEquals(defaults.defaultPollingInterval(), settings.defaultPollingInterval());
        assertEquals(defaults.pollRequestTimeout(), settings.pollRequestTimeout());
    }

    @Test
    void fileTakesPrecedenceOverBundledResource(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("realtime.yml");
        Files.writeString(file, String.join("\n",
                "redis:",
                "  host: file.redis",
                "endpoints:",
                "  base-url: http://localhost:8080/",
                ""), StandardCharsets.UTF_8);

        RealtimeConfig config = RealtimeConfig.load(file, loader);

        assertEquals("file.redis", config.redis().host());
        assertEquals(6379, config.redis().port());
        assertEquals(RealtimeSettings.defaults().maxReconnectAttempts(), config.client().maxReconnectAttempts());
    }

    @Test
    void missingFileFallsBackToBundledResource(@TempDir Path dir) {
        RealtimeConfig config = RealtimeConfig.load(dir.resolve("absent.yml"), loader);

        assertEquals("127.0.0.1", config.redis().host());
    }

    @Test
    void disabledPublicRedisIsIgnored() {
        Map<String, Object> root = minimalRoot();
        Map<String, Object> publicRedis = new HashMap<>();
        publicRedis.put("enabled", false);
        publicRedis.put("host", "");
        root.put("public-redis", publicRedis);

        assertTrue(RealtimeConfig.fromMap(root).publicRedis().isEmpty());
    }

    @Test
    void validationErrorsNameTheOffendingKey() {
        Map<String, Object> blankHost = minimalRoot();
        redis(blankHost).put("host", " ");
        assertMessage(blankHost, "redis.host must not be blank");

        Map<String, Object> badPort = minimalRoot();
        redis(badPort).put("port", 0);
        assertMessage(badPort, "redis.port must be positive");

        Map<String, Object> missingEndpoints = minimalRoot();
        missingEndpoints.remove("endpoints");
        assertMessage(missingEndpoints, "endpoints section is missing");

        Map<String, Object> badUrl = minimalRoot();
        badUrl.put("endpoints", Map.of("base-url", "not a url"));
        assertMessage(badUrl, "endpoints.base-url is not a valid http(s) URL: not a url");

        Map<String, Object> badPolling = minimalRoot();
        badPolling.put("client", Map.of("default-polling-interval-ms", 0));
        assertMessage(badPolling, "client.default-polling-interval-ms must be positive");
    }

    @Test
    void sectionThatIsNotAMapIsRejected() {
        Map<String, Object> root = minimalRoot();
        root.put("client", "fast");

        assertThrows(IllegalArgumentException.class, () -> RealtimeConfig.fromMap(root));
    }

    private static Map<String, Object> minimalRoot() {
        Map<String, Object> redis = new HashMap<>();
        redis.put("host", "localhost");
        Map<String, Object> endpoints = new HashMap<>();
        endpoints.put("base-url", "http://localhost:3000/api/");
        Map<String, Object> root = new HashMap<>();
        root.put("redis", redis);
        root.put("endpoints", endpoints);
        return root;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> redis(Map<String, Object> root) {
        return (Map<String, Object>) root.get("redis");
    }

    private static void assertMessage(Map<String, Object> root, String expected) {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, () -> RealtimeConfig.fromMap(root));
        assertEquals(expected, error.getMessage());
    }
}
