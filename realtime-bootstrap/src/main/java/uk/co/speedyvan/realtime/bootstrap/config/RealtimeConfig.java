package uk.co.speedyvan.realtime.bootstrap.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static uk.co.speedyvan.realtime.bootstrap.config.YamlValues.section;
import static uk.co.speedyvan.realtime.bootstrap.config.YamlValues.toBoolean;

/**
 * Parsed {@code realtime.yml}.
 * <p>
 * {@code public-redis} is optional and only used when {@code enabled: true}; every other section is required
 * except {@code client}, which falls back to the default settings.
 */
public final class RealtimeConfig {

    public static final String DEFAULT_RESOURCE = "realtime.yml";

    private final RedisYamlConfig redis;
    private final RedisYamlConfig publicRedis;
    private final EndpointYamlConfig endpoints;
    private final ClientYamlConfig client;

    private RealtimeConfig(RedisYamlConfig redis, RedisYamlConfig publicRedis, EndpointYamlConfig endpoints, ClientYamlConfig client) {
        this.redis = redis;
        this.publicRedis = publicRedis;
        this.endpoints = endpoints;
        this.client = client;
    }

    /**
     * Loads {@code file} when it exists, otherwise the {@value #DEFAULT_RESOURCE} resource of {@code loader}.
     */
    public static RealtimeConfig load(Path file, ClassLoader loader) {
        Objects.requireNonNull(loader, "loader");
        try {
            if (file != null && Files.exists(file)) {
                try (InputStream in = Files.newInputStream(file)) {
                    return fromMap(readRoot(in));
                }
            }
            return loadResource(loader, DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + (file == null ? DEFAULT_RESOURCE : file), e);
        }
    }

    public static RealtimeConfig loadResource(ClassLoader loader, String resource) {
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Resource " + resource + " is missing from the classpath");
            }
            return fromMap(readRoot(in));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resource, e);
        }
    }

    public static RealtimeConfig fromMap(Map<String, Object> root) {
        Objects.requireNonNull(root, "root");
        RedisYamlConfig redis = RedisYamlConfig.fromMap("redis", section(root.get("redis")));
        Map<String, Object> publicSection = section(root.get("public-redis"));
        RedisYamlConfig publicRedis = publicSection != null && toBoolean(publicSection.get("enabled"), false)
                ? RedisYamlConfig.fromMap("public-redis", publicSection)
                : null;
        EndpointYamlConfig endpoints = EndpointYamlConfig.fromMap(section(root.get("endpoints")));
        ClientYamlConfig client = ClientYamlConfig.fromMap(section(root.get("client")));
        return new RealtimeConfig(redis, publicRedis, endpoints, client);
    }

    public RedisYamlConfig redis() {
        return redis;
    }

    public Optional<RedisYamlConfig> publicRedis() {
        return Optional.ofNullable(publicRedis);
    }

    public EndpointYamlConfig endpoints() {
        return endpoints;
    }

    public ClientYamlConfig client() {
        return client;
    }

    private static Map<String, Object> readRoot(InputStream in) {
        Object loaded = new Yaml().load(in);
        Map<String, Object> root = section(loaded);
        return root == null ? new HashMap<>() : root;
    }
}
