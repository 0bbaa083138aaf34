package uk.co.speedyvan.realtime.core.registry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uk.co.speedyvan.realtime.api.channel.SubscriptionKey;
import uk.co.speedyvan.realtime.api.channel.SubscriptionOptions;
import uk.co.speedyvan.realtime.api.event.OrderUpdate;
import uk.co.speedyvan.realtime.core.codec.PayloadCodec;
import uk.co.speedyvan.realtime.core.support.RecordingDiagnosticsSink;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionRegistryTest {

    private static final SubscriptionKey KEY = new SubscriptionKey("orders-SV1", "order.updated");
    private static final String PAYLOAD = "{\"orderId\":\"o-1\",\"reference\":\"SV1\",\"status\":\"EN_ROUTE\"}";

    private RecordingDiagnosticsSink diagnostics;
    private List<String> activations;
    private SubscriptionRegistry registry;

    @BeforeEach
    void setUp() {
        diagnostics = new RecordingDiagnosticsSink();
        activations = new ArrayList<>();
        registry = new SubscriptionRegistry(new PayloadCodec(), diagnostics, new KeyActivationListener() {
            @Override
            public void keyActivated(SubscriptionKey key) {
                activations.add("+" + key);
            }

            @Override
            public void keyDeactivated(SubscriptionKey key) {
                activations.add("-" + key);
            }
        });
    }

    @Test
    void dispatchFansOutToEveryHandler() {
        List<String> first = new ArrayList<>();
        List<String> second = new ArrayList<>();
        registry.addHandler(KEY, OrderUpdate.class, u -> first.add(u.status()), SubscriptionOptions.defaults());
        registry.addHandler(KEY, OrderUpdate.class, u -> second.add(u.reference()), SubscriptionOptions.defaults());

        int delivered = registry.dispatch(KEY, PAYLOAD);

        assertEquals(2, delivered);
        assertEquals(List.of("EN_ROUTE"), first);
        assertEquals(List.of("SV1"), second);
    }

    @Test
    void failingHandlerDoesNotStopTheOthers() {
        List<String> received = new ArrayList<>();
        registry.addHandler(KEY, OrderUpdate.class, u -> {
            throw new IllegalStateException("boom");
        }, SubscriptionOptions.defaults());
        registry.addHandler(KEY, OrderUpdate.class, u -> received.add(u.orderId()), SubscriptionOptions.defaults());

        int delivered = registry.dispatch(KEY, PAYLOAD);

        assertEquals(1, delivered);
        assertEquals(List.of("o-1"), received);
        assertEquals(1, diagnostics.handlerFailures.size());
        assertEquals("boom", diagnostics.handlerFailures.get(0).getMessage());
    }

    @Test
    void removedHandlerIsNeverInvokedAgain() {
        List<String> received = new ArrayList<>();
        HandlerEntry<OrderUpdate> entry = registry.addHandler(KEY, OrderUpdate.class, u -> received.add("removed"),
                SubscriptionOptions.defaults());
        registry.addHandler(KEY, OrderUpdate.class, u -> received.add("kept"), SubscriptionOptions.defaults());

        assertTrue(registry.removeHandler(entry));
        registry.dispatch(KEY, PAYLOAD);

        assertEquals(List.of("kept"), received);
        assertFalse(entry.isActive());
    }

    @Test
    void handlerRemovedDuringDispatchIsSkipped() {
        List<String> received = new ArrayList<>();
        AtomicReference<HandlerEntry<OrderUpdate>> victim = new AtomicReference<>();
        registry.addHandler(KEY, OrderUpdate.class, u -> {
            received.add("first");
            registry.removeHandler(victim.get());
        }, SubscriptionOptions.defaults());
        victim.set(registry.addHandler(KEY, OrderUpdate.class, u -> received.add("victim"), SubscriptionOptions.defaults()));

        registry.dispatch(KEY, PAYLOAD);

        assertEquals(List.of("first"), received);
    }

    @Test
    void removeIsIdempotent() {
        HandlerEntry<OrderUpdate> entry = registry.addHandler(KEY, OrderUpdate.class, u -> { }, SubscriptionOptions.defaults());

        assertTrue(registry.removeHandler(entry));
        assertFalse(registry.removeHandler(entry));
        assertEquals(List.of("+" + KEY, "-" + KEY), activations);
    }

    @Test
    void activationIsSignalledForFirstAndLastHandlerOnly() {
        HandlerEntry<OrderUpdate> a = registry.addHandler(KEY, OrderUpdate.class, u -> { }, SubscriptionOptions.defaults());
        HandlerEntry<OrderUpdate> b = registry.addHandler(KEY, OrderUpdate.class, u -> { }, SubscriptionOptions.defaults());
        assertEquals(List.of("+" + KEY), activations);

        registry.removeHandler(a);
        assertEquals(1, registry.handlerCount(KEY));
        assertEquals(List.of("+" + KEY), activations);

        registry.removeHandler(b);
        assertEquals(List.of("+" + KEY, "-" + KEY), activations);
        assertTrue(registry.activeKeys().isEmpty());
    }

    @Test
    void sameHandlerRegisteredTwiceIsTwoEntries() {
        List<String> received = new ArrayList<>();
        uk.co.speedyvan.realtime.api.RealtimeHandler<OrderUpdate> handler = u -> received.add(u.orderId());
        HandlerEntry<OrderUpdate> first = registry.addHandler(KEY, OrderUpdate.class, handler, SubscriptionOptions.defaults());
        registry.addHandler(KEY, OrderUpdate.class, handler, SubscriptionOptions.defaults());

        registry.dispatch(KEY, PAYLOAD);
        registry.removeHandler(first);
        registry.dispatch(KEY, PAYLOAD);

        assertEquals(List.of("o-1", "o-1", "o-1"), received);
    }

    @Test
    void firstExplicitPollingIntervalWinsAndAuthIsSticky() {
        registry.addHandler(KEY, OrderUpdate.class, u -> { }, SubscriptionOptions.defaults());
        registry.addHandler(KEY, OrderUpdate.class, u -> { }, SubscriptionOptions.polling(Duration.ofSeconds(15)).withAuth());
        registry.addHandler(KEY, OrderUpdate.class, u -> { }, SubscriptionOptions.polling(Duration.ofSeconds(60)));

        assertEquals(Duration.ofSeconds(15), registry.pollingInterval(KEY).orElseThrow());
        assertTrue(registry.requiresAuth(KEY));
    }

    @Test
    void undecodablePayloadIsReportedPerHandler() {
        registry.addHandler(KEY, OrderUpdate.class, u -> fail("must not be called"), SubscriptionOptions.defaults());

        int delivered = registry.dispatch(KEY, "not json");

        assertEquals(0, delivered);
        assertEquals(1, diagnostics.handlerFailures.size());
    }

    @Test
    void dispatchToUnknownKeyIsANoOp() {
        assertEquals(0, registry.dispatch(new SubscriptionKey("orders", "order.created"), PAYLOAD));
    }

    @Test
    void clearDeactivatesWithoutSignalling() {
        HandlerEntry<OrderUpdate> entry = registry.addHandler(KEY, OrderUpdate.class, u -> { }, SubscriptionOptions.defaults());

        registry.clear();

        assertFalse(entry.isActive());
        assertTrue(registry.isEmpty());
        assertEquals(List.of("+" + KEY), activations);
    }
}
