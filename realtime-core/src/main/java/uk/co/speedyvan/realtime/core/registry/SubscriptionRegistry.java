package uk.co.speedyvan.realtime.core.registry;

import uk.co.speedyvan.realtime.api.Preconditions;
import uk.co.speedyvan.realtime.api.RealtimeHandler;
import uk.co.speedyvan.realtime.api.channel.SubscriptionKey;
import uk.co.speedyvan.realtime.api.channel.SubscriptionOptions;
import uk.co.speedyvan.realtime.core.codec.PayloadCodec;
import uk.co.speedyvan.realtime.core.diagnostics.DiagnosticsSink;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Handlers per {@link SubscriptionKey}, plus the delivery options the key was first registered with.
 * <p>
 * The registry owns no network resources. It signals key activation and deactivation to its
 * {@link KeyActivationListener}, and the owner creates or tears down bindings and timers in response.
 * <p>
 * {@link #dispatch} iterates over a snapshot and re-checks each entry before invoking it, so an entry removed
 * during a dispatch is skipped. Handler failures are isolated and reported to the {@link DiagnosticsSink}.
 */
public final class SubscriptionRegistry {

    private final Map<SubscriptionKey, KeyHandlers> handlers = new ConcurrentHashMap<>();
    private final PayloadCodec codec;
    private final DiagnosticsSink diagnostics;
    private final KeyActivationListener activationListener;

    public SubscriptionRegistry(PayloadCodec codec, DiagnosticsSink diagnostics, KeyActivationListener activationListener) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.activationListener = Objects.requireNonNull(activationListener, "activationListener");
    }

    public <T> HandlerEntry<T> addHandler(SubscriptionKey key,
                                          Class<T> payloadType,
                                          RealtimeHandler<T> handler,
                                          SubscriptionOptions options) {
        Preconditions.checkNotNull(key, "key");
        Preconditions.checkNotNull(handler, "handler");
        SubscriptionOptions effective = options == null ? SubscriptionOptions.defaults() : options;

        HandlerEntry<T> entry = new HandlerEntry<>(key, payloadType, handler);
        KeyHandlers keyHandlers = handlers.computeIfAbsent(key, ignored -> new KeyHandlers());
        boolean keyWasEmpty = keyHandlers.entries.isEmpty();
        keyHandlers.merge(effective);
        keyHandlers.entries.add(entry);

        if (keyWasEmpty) {
            activationListener.keyActivated(key);
        }
        return entry;
    }

    /**
     * Removes exactly this entry. Returns {@code false} if it had already been removed.
     */
    public boolean removeHandler(HandlerEntry<?> entry) {
        Preconditions.checkNotNull(entry, "entry");
        entry.deactivate();
        KeyHandlers keyHandlers = handlers.get(entry.key());
        if (keyHandlers == null || !keyHandlers.entries.remove(entry)) {
            return false;
        }
        if (keyHandlers.entries.isEmpty()) {
            handlers.remove(entry.key());
            activationListener.keyDeactivated(entry.key());
        }
        return true;
    }

    /**
     * Decodes {@code payloadJson} once per payload type and hands it to every active handler of {@code key}.
     *
     * @return number of handlers that completed without throwing
     */
    public int dispatch(SubscriptionKey key, String payloadJson) {
        KeyHandlers keyHandlers = handlers.get(key);
        if (keyHandlers == null) {
            return 0;
        }
        List<HandlerEntry<?>> snapshot = List.copyOf(keyHandlers.entries);
        Map<Class<?>, Object> decoded = new HashMap<>();
        int delivered = 0;
        for (HandlerEntry<?> entry : snapshot) {
            if (!entry.isActive()) {
                continue;
            }
            try {
                Object payload = decoded.computeIfAbsent(entry.payloadType(), type -> codec.decode(payloadJson, type));
                entry.deliver(payload);
                delivered++;
            } catch (Exception e) {
                diagnostics.handlerFailed(key, e);
            }
        }
        return delivered;
    }

    public Set<SubscriptionKey> activeKeys() {
        return Set.copyOf(handlers.keySet());
    }

    public int handlerCount(SubscriptionKey key) {
        KeyHandlers keyHandlers = handlers.get(key);
        return keyHandlers == null ? 0 : keyHandlers.entries.size();
    }

    public boolean isEmpty() {
        return handlers.isEmpty();
    }

    public Optional<Duration> pollingInterval(SubscriptionKey key) {
        KeyHandlers keyHandlers = handlers.get(key);
        return keyHandlers == null ? Optional.empty() : Optional.ofNullable(keyHandlers.pollingInterval);
    }

    public boolean requiresAuth(SubscriptionKey key) {
        KeyHandlers keyHandlers = handlers.get(key);
        return keyHandlers != null && keyHandlers.requiresAuth;
    }

    /**
     * Deactivates and drops every entry without signalling deactivation; the owner tears down its own state.
     */
    public void clear() {
        for (KeyHandlers keyHandlers : handlers.values()) {
            keyHandlers.entries.forEach(HandlerEntry::deactivate);
        }
        handlers.clear();
    }

    private static final class KeyHandlers {

        private final CopyOnWriteArrayList<HandlerEntry<?>> entries = new CopyOnWriteArrayList<>();
        private volatile Duration pollingInterval;
        private volatile boolean requiresAuth;

        // First explicit interval wins; auth is sticky once any subscriber asks for it.
        private void merge(SubscriptionOptions options) {
            if (pollingInterval == null) {
                pollingInterval = options.pollingInterval();
            }
            requiresAuth = requiresAuth || options.requiresAuth();
        }
    }
}
