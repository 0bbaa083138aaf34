package uk.co.speedyvan.realtime.bootstrap.config;

import okhttp3.HttpUrl;

import java.util.Map;

import static uk.co.speedyvan.realtime.bootstrap.config.YamlValues.toLong;
import static uk.co.speedyvan.realtime.bootstrap.config.YamlValues.trimToEmpty;

/**
 * HTTP collaborators of the realtime client: the channel auth endpoint and the poll endpoint.
 */
public record EndpointYamlConfig(HttpUrl baseUrl, String authPath, String pollPath, String accessToken, long authTimeoutMs) {

    public static EndpointYamlConfig fromMap(Map<String, Object> section) {
        if (section == null) {
            throw new IllegalArgumentException("endpoints section is missing");
        }
        String rawBaseUrl = trimToEmpty(section.get("base-url"));
        if (rawBaseUrl.isBlank()) {
            throw new IllegalArgumentException("endpoints.base-url must not be blank");
        }
        HttpUrl baseUrl = HttpUrl.parse(rawBaseUrl);
        if (baseUrl == null) {
            throw new IllegalArgumentException("endpoints.base-url is not a valid http(s) URL: " + rawBaseUrl);
        }
        String authPath = pathOrDefault(section.get("auth-path"), "realtime/auth");
        String pollPath = pathOrDefault(section.get("poll-path"), "realtime/poll");
        String accessToken = trimToEmpty(section.get("access-token"));
        long authTimeout = toLong(section.get("auth-timeout-ms"), 10_000L);
        if (authTimeout <= 0) {
            throw new IllegalArgumentException("endpoints.auth-timeout-ms must be positive");
        }
        return new EndpointYamlConfig(baseUrl, authPath, pollPath, accessToken, authTimeout);
    }

    public HttpUrl authUrl() {
        return baseUrl.newBuilder().addPathSegments(authPath).build();
    }

    public HttpUrl pollUrl() {
        return baseUrl.newBuilder().addPathSegments(pollPath).build();
    }

    private static String pathOrDefault(Object value, String defaultValue) {
        String path = trimToEmpty(value);
        while (path.startsWith("/")) {
            path = path.substring(1);
        }
        return path.isEmpty() ? defaultValue : path;
    }

    @Override
    public String toString() {
        return "EndpointYamlConfig[baseUrl=" + baseUrl + ", authPath=" + authPath + ", pollPath=" + pollPath
                + ", authTimeoutMs=" + authTimeoutMs + "]";
    }
}
