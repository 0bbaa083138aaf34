package uk.co.speedyvan.realtime.core.polling;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import uk.co.speedyvan.realtime.api.Preconditions;
import uk.co.speedyvan.realtime.api.channel.SubscriptionKey;
import uk.co.speedyvan.realtime.api.poll.PollClient;
import uk.co.speedyvan.realtime.api.poll.PollFetchException;
import uk.co.speedyvan.realtime.api.poll.PollResponse;
import uk.co.speedyvan.realtime.core.codec.PayloadCodec;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Reads {@code GET {pollUrl}?channel=..&event=..} and maps the {@code {"hasUpdate", "payload"}} body.
 * Every call carries its own timeout, so a hung request never blocks the next tick.
 */
public final class OkHttpPollClient implements PollClient {

    private final OkHttpClient http;
    private final HttpUrl pollUrl;
    private final String accessToken;
    private final Duration requestTimeout;
    private final PayloadCodec codec;

    public OkHttpPollClient(OkHttpClient http, HttpUrl pollUrl, String accessToken, Duration requestTimeout, PayloadCodec codec) {
        this.http = Objects.requireNonNull(http, "http");
        this.pollUrl = Objects.requireNonNull(pollUrl, "pollUrl");
        this.accessToken = accessToken;
        this.requestTimeout = Preconditions.checkPositive(requestTimeout, "requestTimeout");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public CompletableFuture<PollResponse> fetch(SubscriptionKey key) {
        Preconditions.checkNotNull(key, "key");
        HttpUrl url = pollUrl.newBuilder()
                .addQueryParameter("channel", key.channel())
                .addQueryParameter("event", key.event())
                .build();
        Request.Builder request = new Request.Builder()
                .url(url)
                .header("Accept", "application/json")
                .get();
        if (accessToken != null && !accessToken.isBlank()) {
            request.header("Authorization", "Bearer " + accessToken);
        }

        CompletableFuture<PollResponse> result = new CompletableFuture<>();
        Call call = http.newCall(request.build());
        call.timeout().timeout(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failed, IOException e) {
                result.completeExceptionally(new PollFetchException("Poll request for '" + key + "' failed", e));
            }

            @Override
            public void onResponse(Call completed, Response response) {
                try (response) {
                    result.complete(parse(key, response));
                } catch (RuntimeException | IOException e) {
                    result.completeExceptionally(e instanceof PollFetchException
                            ? e
                            : new PollFetchException("Unreadable poll response for '" + key + "'", e));
                }
            }
        });
        return result;
    }

    private PollResponse parse(SubscriptionKey key, Response response) throws IOException {
        if (!response.isSuccessful()) {
            throw new PollFetchException("Poll endpoint returned HTTP " + response.code() + " for '" + key + "'",
                    response.code());
        }
        ResponseBody body = response.body();
        if (body == null) {
            return PollResponse.noUpdate();
        }
        String text = body.string();
        if (text.isBlank()) {
            return PollResponse.noUpdate();
        }
        JsonNode root = codec.readTree(text);
        if (!root.path("hasUpdate").asBoolean(false)) {
            return PollResponse.noUpdate();
        }
        JsonNode payload = root.get("payload");
        if (payload == null || payload.isNull()) {
            throw new PollFetchException("Poll response for '" + key + "' has an update but no payload", response.code());
        }
        return PollResponse.update(codec.encode(payload));
    }
}
