package uk.co.speedyvan.realtime.core.polling;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uk.co.speedyvan.realtime.api.channel.SubscriptionKey;
import uk.co.speedyvan.realtime.api.poll.PollFetchException;
import uk.co.speedyvan.realtime.api.poll.PollResponse;
import uk.co.speedyvan.realtime.core.codec.PayloadCodec;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OkHttpPollClientTest {

    private static final SubscriptionKey KEY = new SubscriptionKey("orders-SV1", "order.updated");

    private MockWebServer server;
    private OkHttpClient http;
    private OkHttpPollClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        http = new OkHttpClient();
        client = new OkHttpPollClient(http, server.url("/api/realtime/poll"), "token-123", Duration.ofSeconds(5),
                new PayloadCodec());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
        http.dispatcher().executorService().shutdown();
    }

    @Test
    void sendsChannelAndEventWithBearerToken() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"hasUpdate\":false}"));

        client.fetch(KEY).get(5, TimeUnit.SECONDS);

        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("GET", request.getMethod());
        assertEquals("/api/realtime/poll", request.getRequestUrl().encodedPath());
        assertEquals("orders-SV1", request.getRequestUrl().queryParameter("channel"));
        assertEquals("order.updated", request.getRequestUrl().queryParameter("event"));
        assertEquals("Bearer token-123", request.getHeader("Authorization"));
    }

    @Test
    void updateCarriesPayloadAsJson() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"hasUpdate\":true,\"payload\":{\"orderId\":\"o-1\",\"status\":\"DELIVERED\"}}"));

        PollResponse response = client.fetch(KEY).get(5, TimeUnit.SECONDS);

        assertTrue(response.hasUpdate());
        assertEquals("{\"orderId\":\"o-1\",\"status\":\"DELIVERED\"}", response.payloadJson());
    }

    @Test
    void noUpdateHasNoPayload() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"hasUpdate\":false,\"payload\":null}"));

        PollResponse response = client.fetch(KEY).get(5, TimeUnit.SECONDS);

        assertFalse(response.hasUpdate());
        assertNull(response.payloadJson());
    }

    @Test
    void serverErrorFailsWithStatus() {
        server.enqueue(new MockResponse().setResponseCode(503));

        ExecutionException failure = assertThrows(ExecutionException.class,
                () -> client.fetch(KEY).get(5, TimeUnit.SECONDS));

        PollFetchException cause = assertInstanceOf(PollFetchException.class, failure.getCause());
        assertEquals(503, cause.statusCode());
    }

    @Test
    void updateWithoutPayloadIsRejected() {
        server.enqueue(new MockResponse().setBody("{\"hasUpdate\":true}"));

        ExecutionException failure = assertThrows(ExecutionException.class,
                () -> client.fetch(KEY).get(5, TimeUnit.SECONDS));

        assertInstanceOf(PollFetchException.class, failure.getCause());
    }

    @Test
    void malformedBodyIsRejected() {
        server.enqueue(new MockResponse().setBody("<html>gateway</html>"));

        ExecutionException failure = assertThrows(ExecutionException.class,
                () -> client.fetch(KEY).get(5, TimeUnit.SECONDS));

        assertInstanceOf(PollFetchException.class, failure.getCause());
    }
}
