package uk.co.speedyvan.realtime.bootstrap.config;

import uk.co.speedyvan.realtime.core.transport.RedisClientFactory;

import java.time.Duration;
import java.util.Map;

import static uk.co.speedyvan.realtime.bootstrap.config.YamlValues.toBoolean;
import static uk.co.speedyvan.realtime.bootstrap.config.YamlValues.toInt;
import static uk.co.speedyvan.realtime.bootstrap.config.YamlValues.toLong;
import static uk.co.speedyvan.realtime.bootstrap.config.YamlValues.trimToEmpty;

public record RedisYamlConfig(String host, int port, boolean ssl, String password, long timeoutMs, int database) {

    public static RedisYamlConfig fromMap(String name, Map<String, Object> section) {
        if (section == null) {
            throw new IllegalArgumentException(name + " section is missing");
        }
        String host = trimToEmpty(section.get("host"));
        int port = toInt(section.get("port"), 6379);
        boolean ssl = toBoolean(section.get("ssl"), false);
        String password = section.get("password") == null ? "" : section.get("password").toString();
        long timeout = toLong(section.get("timeout-ms"), 5000L);
        int database = toInt(section.get("database"), 0);
        if (host.isBlank()) {
            throw new IllegalArgumentException(name + ".host must not be blank");
        }
        if (port <= 0) {
            throw new IllegalArgumentException(name + ".port must be positive");
        }
        if (timeout <= 0) {
            throw new IllegalArgumentException(name + ".timeout-ms must be positive");
        }
        if (database < 0) {
            throw new IllegalArgumentException(name + ".database must not be negative");
        }
        return new RedisYamlConfig(host, port, ssl, password, timeout, database);
    }

    public RedisClientFactory toClientFactory() {
        return new RedisClientFactory(host, port, ssl, password, Duration.ofMillis(timeoutMs), database);
    }

    @Override
    public String toString() {
        return "RedisYamlConfig[host=" + host + ", port=" + port + ", ssl=" + ssl + ", database=" + database
                + ", timeoutMs=" + timeoutMs + "]";
    }
}
