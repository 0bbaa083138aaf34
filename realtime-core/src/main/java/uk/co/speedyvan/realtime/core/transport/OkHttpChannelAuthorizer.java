package uk.co.speedyvan.realtime.core.transport;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import uk.co.speedyvan.realtime.api.Preconditions;
import uk.co.speedyvan.realtime.api.transport.ChannelAuthorization;
import uk.co.speedyvan.realtime.api.transport.ChannelAuthorizationException;
import uk.co.speedyvan.realtime.api.transport.ChannelAuthorizer;
import uk.co.speedyvan.realtime.core.codec.PayloadCodec;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Posts {@code {"socket_id", "channel_name"}} to the back end auth endpoint and reads the {@code auth} signature.
 */
public final class OkHttpChannelAuthorizer implements ChannelAuthorizer {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient http;
    private final HttpUrl authUrl;
    private final String accessToken;
    private final PayloadCodec codec;

    public OkHttpChannelAuthorizer(OkHttpClient http, HttpUrl authUrl, String accessToken, PayloadCodec codec) {
        this.http = Objects.requireNonNull(http, "http");
        this.authUrl = Objects.requireNonNull(authUrl, "authUrl");
        this.accessToken = accessToken;
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public CompletableFuture<ChannelAuthorization> authorize(String socketId, String channel) {
        Preconditions.checkNotBlank(socketId, "socketId");
        Preconditions.checkNotBlank(channel, "channel");

        Map<String, String> body = new LinkedHashMap<>();
        body.put("socket_id", socketId);
        body.put("channel_name", channel);
        Request.Builder request = new Request.Builder()
                .url(authUrl)
                .header("Accept", "application/json")
                .post(RequestBody.create(codec.encode(body), JSON));
        if (accessToken != null && !accessToken.isBlank()) {
            request.header("Authorization", "Bearer " + accessToken);
        }

        CompletableFuture<ChannelAuthorization> result = new CompletableFuture<>();
        http.newCall(request.build()).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                result.completeExceptionally(new ChannelAuthorizationException("Auth request for '" + channel + "' failed", e));
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    result.complete(parse(channel, response));
                } catch (ChannelAuthorizationException e) {
                    result.completeExceptionally(e);
                } catch (RuntimeException | IOException e) {
                    result.completeExceptionally(new ChannelAuthorizationException("Unreadable auth response for '" + channel + "'", e));
                }
            }
        });
        return result;
    }

    private ChannelAuthorization parse(String channel, Response response) throws IOException {
        if (!response.isSuccessful()) {
            throw new ChannelAuthorizationException("Access to '" + channel + "' denied with HTTP " + response.code(),
                    response.code());
        }
        ResponseBody body = response.body();
        JsonNode auth = body == null ? null : codec.readTree(body.string()).get("auth");
        if (auth == null || !auth.isTextual() || auth.asText().isBlank()) {
            throw new ChannelAuthorizationException("Auth response for '" + channel + "' has no signature", response.code());
        }
        return new ChannelAuthorization(channel, auth.asText());
    }
}
