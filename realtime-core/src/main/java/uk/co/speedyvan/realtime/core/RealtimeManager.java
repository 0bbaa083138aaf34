package uk.co.speedyvan.realtime.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.co.speedyvan.realtime.api.ConnectionState;
import uk.co.speedyvan.realtime.api.ConnectionStateChange;
import uk.co.speedyvan.realtime.api.ConnectionStateListener;
import uk.co.speedyvan.realtime.api.Preconditions;
import uk.co.speedyvan.realtime.api.RealtimeClient;
import uk.co.speedyvan.realtime.api.RealtimeHandler;
import uk.co.speedyvan.realtime.api.RealtimeInitializationException;
import uk.co.speedyvan.realtime.api.Registration;
import uk.co.speedyvan.realtime.api.Subscription;
import uk.co.speedyvan.realtime.api.channel.ChannelKey;
import uk.co.speedyvan.realtime.api.channel.SubscriptionKey;
import uk.co.speedyvan.realtime.api.channel.SubscriptionOptions;
import uk.co.speedyvan.realtime.api.event.RealtimeEvent;
import uk.co.speedyvan.realtime.api.poll.PollClient;
import uk.co.speedyvan.realtime.api.transport.EventBinding;
import uk.co.speedyvan.realtime.api.transport.TransportLifecycleListener;
import uk.co.speedyvan.realtime.api.transport.TransportSession;
import uk.co.speedyvan.realtime.core.codec.PayloadCodec;
import uk.co.speedyvan.realtime.core.diagnostics.DiagnosticsSink;
import uk.co.speedyvan.realtime.core.diagnostics.Slf4jDiagnosticsSink;
import uk.co.speedyvan.realtime.core.polling.PollingFallbackScheduler;
import uk.co.speedyvan.realtime.core.reconnect.ExponentialBackoff;
import uk.co.speedyvan.realtime.core.reconnect.ReconnectionController;
import uk.co.speedyvan.realtime.core.registry.HandlerEntry;
import uk.co.speedyvan.realtime.core.registry.KeyActivationListener;
import uk.co.speedyvan.realtime.core.registry.SubscriptionRegistry;
import uk.co.speedyvan.realtime.core.schedule.TaskScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Realtime facade: owns the transport session(s), the subscription registry, the polling fallback and the
 * reconnection controller, and keeps them consistent with the connection state.
 * <p>
 * While {@link ConnectionState#CONNECTED} every active key has a live binding, or is polled if binding it failed.
 * In every other state every active key is polled. Keys subscribed with an explicit polling interval keep their
 * timer while bound, but its ticks are suppressed.
 * <p>
 * All mutable state is guarded by one monitor. Handlers and state listeners run while it is held, so a handler
 * never observes a half-applied transition and is never invoked after its subscription was removed. Sessions are
 * connected and closed outside the monitor.
 */
public final class RealtimeManager implements RealtimeClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(RealtimeManager.class);

    private final Object lock = new Object();
    private final TransportSession privateSession;
    private final TransportSession publicSession;
    private final RealtimeSettings settings;
    private final DiagnosticsSink diagnostics;
    private final SubscriptionRegistry registry;
    private final PollingFallbackScheduler polling;
    private final ReconnectionController reconnection;
    private final Map<SubscriptionKey, LiveBinding> liveBindings = new HashMap<>();
    private final Map<ChannelRef, Integer> channelRefs = new HashMap<>();
    private final List<ConnectionStateListener> stateListeners = new CopyOnWriteArrayList<>();
    private final TransportLifecycleListener lifecycleListener = new SessionLifecycle();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private boolean started;
    private boolean initializing;

    private RealtimeManager(Builder builder) {
        this.privateSession = Objects.requireNonNull(builder.privateSession, "transport");
        this.publicSession = builder.publicSession;
        this.settings = builder.settings == null ? RealtimeSettings.defaults() : builder.settings;
        this.diagnostics = builder.diagnostics == null
                ? new Slf4jDiagnosticsSink(settings.transportFailureLogInterval())
                : builder.diagnostics;
        TaskScheduler scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");
        PollClient pollClient = Objects.requireNonNull(builder.pollClient, "pollClient");
        PayloadCodec codec = builder.codec == null ? new PayloadCodec() : builder.codec;

        this.registry = new SubscriptionRegistry(codec, diagnostics, new RegistryListener());
        this.polling = new PollingFallbackScheduler(scheduler, pollClient, this::hasLiveBinding, this::onPolledUpdate, diagnostics);
        this.reconnection = new ReconnectionController(
                new ExponentialBackoff(settings.reconnectBaseDelay(), settings.reconnectMaxDelay()),
                settings.maxReconnectAttempts(),
                scheduler,
                this::reconnect);

        for (TransportSession session : sessions()) {
            session.addLifecycleListener(lifecycleListener);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void initialize() {
        List<TransportSession> toConnect;
        synchronized (lock) {
            if (started && state == ConnectionState.CONNECTED) {
                return;
            }
            started = true;
            initializing = true;
            reconnection.reset();
            transitionState(ConnectionState.CONNECTING, "Connecting realtime transport");
            armFallbackForActiveKeys();
            toConnect = disconnectedSessions();
        }

        try {
            for (TransportSession session : toConnect) {
                session.connect();
            }
        } catch (RuntimeException e) {
            synchronized (lock) {
                initializing = false;
                started = false;
                diagnostics.transportFailed("Initial connect failed", e);
                transitionState(ConnectionState.ERROR, "Realtime transport could not be initialized");
            }
            closeSessionsQuietly();
            throw new RealtimeInitializationException("Failed to initialize realtime transport", e);
        }

        boolean raced;
        synchronized (lock) {
            initializing = false;
            raced = !started;
            if (!raced) {
                if (allSessionsConnected()) {
                    enterConnected(true);
                } else {
                    // a concurrent disconnect() closed a session after it connected
                    onConnectionLost(ConnectionState.DISCONNECTED, "Realtime transport closed while initializing");
                }
            }
        }
        if (raced) {
            closeSessionsQuietly();
        }
    }

    @Override
    public <T> Subscription subscribe(ChannelKey channelKey,
                                      RealtimeEvent<T> event,
                                      RealtimeHandler<T> handler,
                                      SubscriptionOptions options) {
        Preconditions.checkNotNull(channelKey, "channelKey");
        Preconditions.checkNotNull(event, "event");
        Preconditions.checkNotNull(handler, "handler");
        if (channelKey.namespace() != event.namespace()) {
            throw new IllegalArgumentException("Event '" + event.name() + "' belongs to namespace "
                    + event.namespace().wireName() + ", not " + channelKey.namespace().wireName());
        }
        SubscriptionOptions effective = options == null ? SubscriptionOptions.defaults() : options;
        SubscriptionKey key = SubscriptionKey.of(channelKey, event.name());

        synchronized (lock) {
            HandlerEntry<T> entry = registry.addHandler(key, event.payloadType(), handler, effective);
            if (settings.pollingEnabled() && effective.pollingInterval() != null) {
                polling.arm(key, effective.pollingInterval());
            }
            LOGGER.debug("Subscribed to '{}' ({} handler(s))", key, registry.handlerCount(key));
            return new ManagedSubscription(entry);
        }
    }

    @Override
    public Registration onConnectionStateChange(ConnectionStateListener listener) {
        Preconditions.checkNotNull(listener, "listener");
        stateListeners.add(listener);
        return () -> stateListeners.remove(listener);
    }

    @Override
    public ConnectionState connectionState() {
        return state;
    }

    @Override
    public void disconnect() {
        synchronized (lock) {
            boolean idle = !started && registry.isEmpty() && liveBindings.isEmpty()
                    && polling.armedKeys().isEmpty() && state == ConnectionState.DISCONNECTED;
            if (idle) {
                return;
            }
            started = false;
            reconnection.reset();
            polling.disarmAll();
            teardownLiveBindings();
            registry.clear();
            transitionState(ConnectionState.DISCONNECTED, "Realtime client disconnected");
        }
        closeSessionsQuietly();
    }

    public boolean hasLiveBinding(SubscriptionKey key) {
        synchronized (lock) {
            return liveBindings.containsKey(key);
        }
    }

    /**
     * {@code true} when {@code key} is currently delivered by polling: its timer is armed and ticks are not suppressed.
     */
    public boolean isPollingActive(SubscriptionKey key) {
        synchronized (lock) {
            return polling.isArmed(key) && !liveBindings.containsKey(key);
        }
    }

    public boolean isPollingArmed(SubscriptionKey key) {
        synchronized (lock) {
            return polling.isArmed(key);
        }
    }

    public int handlerCount(SubscriptionKey key) {
        synchronized (lock) {
            return registry.handlerCount(key);
        }
    }

    public Set<SubscriptionKey> activeKeys() {
        synchronized (lock) {
            return registry.activeKeys();
        }
    }

    public int reconnectAttempts() {
        synchronized (lock) {
            return reconnection.attempts();
        }
    }

    public boolean isReconnectExhausted() {
        synchronized (lock) {
            return reconnection.isExhausted();
        }
    }

    public RealtimeSettings settings() {
        return settings;
    }

    private void reconnect(int attempt) {
        List<TransportSession> toConnect;
        synchronized (lock) {
            if (!started || !reconnection.beginAttempt(attempt)) {
                return;
            }
            transitionState(ConnectionState.RECONNECTING,
                    "Reconnecting realtime transport (attempt " + attempt + "/" + settings.maxReconnectAttempts() + ")");
            toConnect = disconnectedSessions();
        }

        RuntimeException failure = null;
        try {
            for (TransportSession session : toConnect) {
                session.connect();
            }
        } catch (RuntimeException e) {
            failure = e;
        }

        boolean closeAfter = false;
        synchronized (lock) {
            if (!started) {
                // disconnect() ran while connecting and may have closed the sessions before they opened
                closeAfter = true;
            } else if (failure == null && allSessionsConnected()) {
                if (toConnect.isEmpty()) {
                    // nothing was reconnected, so whatever degraded the client was not the connection itself
                    reconnection.attemptCompleted();
                    enterConnected(false);
                } else {
                    enterConnected(true);
                }
            } else if (state != ConnectionState.CONNECTED) {
                diagnostics.transportFailed("Reconnect attempt " + attempt + " failed", failure);
                transitionState(ConnectionState.ERROR, "Reconnect attempt " + attempt + " failed");
                if (!reconnection.attemptFailed()) {
                    announceExhausted();
                }
            }
        }
        if (closeAfter) {
            closeSessionsQuietly();
        }
    }

    private void enterConnected(boolean resetAttempts) {
        if (resetAttempts) {
            reconnection.reset();
        }
        for (SubscriptionKey key : registry.activeKeys()) {
            ensureLiveBinding(key);
            if (liveBindings.containsKey(key) && !keepsDedicatedTimer(key)) {
                polling.disarm(key);
            }
        }
        transitionState(ConnectionState.CONNECTED, "Realtime transport connected");
    }

    private void enterDegraded(ConnectionState degradedState, String message) {
        teardownLiveBindings();
        armFallbackForActiveKeys();
        transitionState(degradedState, message);
    }

    private void onConnectionLost(ConnectionState degradedState, String message) {
        if (!started || initializing || reconnection.isExhausted()) {
            return;
        }
        if (reconnection.isAttemptInFlight()) {
            // the scheduled attempt reports its own outcome
            return;
        }
        enterDegraded(degradedState, message);
        if (!reconnection.onConnectionLost() && reconnection.isExhausted()) {
            announceExhausted();
        }
    }

    private void armFallbackForActiveKeys() {
        for (SubscriptionKey key : registry.activeKeys()) {
            polling.arm(key, pollingIntervalFor(key));
        }
    }

    private boolean keepsDedicatedTimer(SubscriptionKey key) {
        return settings.pollingEnabled() && registry.pollingInterval(key).isPresent();
    }

    private Duration pollingIntervalFor(SubscriptionKey key) {
        return registry.pollingInterval(key).orElse(settings.defaultPollingInterval());
    }

    private void ensureLiveBinding(SubscriptionKey key) {
        if (liveBindings.containsKey(key)) {
            return;
        }
        TransportSession session = sessionFor(key);
        ChannelRef ref = new ChannelRef(session, key.channel());
        try {
            retainChannel(ref);
            EventBinding binding = session.bindEvent(key.channel(), key.event(), this::onLiveMessage);
            liveBindings.put(key, new LiveBinding(ref, binding));
        } catch (RuntimeException e) {
            releaseChannel(ref);
            diagnostics.transportFailed("Failed to bind '" + key + "', polling instead", e);
            polling.arm(key, pollingIntervalFor(key));
        }
    }

    private void teardownLiveBinding(SubscriptionKey key) {
        LiveBinding live = liveBindings.remove(key);
        if (live == null) {
            return;
        }
        try {
            live.binding().unbind();
        } catch (RuntimeException e) {
            diagnostics.transportFailed("Failed to unbind '" + key + "'", e);
        }
        releaseChannel(live.channel());
    }

    private void teardownLiveBindings() {
        for (SubscriptionKey key : new ArrayList<>(liveBindings.keySet())) {
            teardownLiveBinding(key);
        }
        channelRefs.clear();
    }

    private void retainChannel(ChannelRef ref) {
        int count = channelRefs.merge(ref, 1, Integer::sum);
        if (count == 1) {
            ref.session().subscribeChannel(ref.channel());
        }
    }

    private void releaseChannel(ChannelRef ref) {
        Integer count = channelRefs.get(ref);
        if (count == null) {
            return;
        }
        if (count > 1) {
            channelRefs.put(ref, count - 1);
            return;
        }
        channelRefs.remove(ref);
        try {
            ref.session().unsubscribeChannel(ref.channel());
        } catch (RuntimeException e) {
            diagnostics.transportFailed("Failed to unsubscribe '" + ref.channel() + "'", e);
        }
    }

    private TransportSession sessionFor(SubscriptionKey key) {
        if (publicSession == null || registry.requiresAuth(key)) {
            return privateSession;
        }
        return publicSession;
    }

    private void onLiveMessage(String channel, String event, String payloadJson) {
        synchronized (lock) {
            SubscriptionKey key = new SubscriptionKey(channel, event);
            if (!state.isLive() || !liveBindings.containsKey(key)) {
                return;
            }
            registry.dispatch(key, payloadJson);
        }
    }

    private void onPolledUpdate(SubscriptionKey key, String payloadJson) {
        synchronized (lock) {
            if (liveBindings.containsKey(key) || !polling.isArmed(key)) {
                return;
            }
            registry.dispatch(key, payloadJson);
        }
    }

    private void unsubscribe(HandlerEntry<?> entry) {
        synchronized (lock) {
            if (registry.removeHandler(entry)) {
                LOGGER.debug("Unsubscribed from '{}' ({} handler(s) left)", entry.key(), registry.handlerCount(entry.key()));
            }
        }
    }

    private void announceExhausted() {
        LOGGER.warn("Realtime transport unreachable after {} reconnect attempt(s); polling only until re-initialized",
                reconnection.attempts());
        notifyListeners(new ConnectionStateChange(state, state, reconnection.attempts(),
                settings.maxReconnectAttempts(), true));
    }

    private void transitionState(ConnectionState newState, String message) {
        ConnectionState previous = state;
        if (previous == newState) {
            return;
        }
        state = newState;
        switch (newState) {
            case CONNECTED, CONNECTING -> LOGGER.info("{}", message);
            case RECONNECTING, DISCONNECTED -> LOGGER.info("{} ({} -> {})", message, previous, newState);
            case ERROR -> LOGGER.warn("{} (ERROR)", message);
        }
        notifyListeners(new ConnectionStateChange(previous, newState, reconnection.attempts(),
                settings.maxReconnectAttempts(), reconnection.isExhausted()));
    }

    private void notifyListeners(ConnectionStateChange change) {
        for (ConnectionStateListener listener : stateListeners) {
            try {
                listener.onStateChange(change);
            } catch (Exception e) {
                diagnostics.listenerFailed(e);
            }
        }
    }

    private List<TransportSession> sessions() {
        return publicSession == null ? List.of(privateSession) : List.of(privateSession, publicSession);
    }

    private List<TransportSession> disconnectedSessions() {
        List<TransportSession> result = new ArrayList<>();
        for (TransportSession session : sessions()) {
            if (!session.isConnected()) {
                result.add(session);
            }
        }
        return result;
    }

    private boolean allSessionsConnected() {
        for (TransportSession session : sessions()) {
            if (!session.isConnected()) {
                return false;
            }
        }
        return true;
    }

    private void closeSessionsQuietly() {
        for (TransportSession session : sessions()) {
            try {
                session.disconnect();
            } catch (RuntimeException e) {
                diagnostics.transportFailed("Failed to close transport session", e);
            }
        }
    }

    private record ChannelRef(TransportSession session, String channel) {
    }

    private record LiveBinding(ChannelRef channel, EventBinding binding) {
    }

    private final class RegistryListener implements KeyActivationListener {

        @Override
        public void keyActivated(SubscriptionKey key) {
            if (state.isLive()) {
                ensureLiveBinding(key);
            } else {
                polling.arm(key, pollingIntervalFor(key));
            }
        }

        @Override
        public void keyDeactivated(SubscriptionKey key) {
            teardownLiveBinding(key);
            polling.disarm(key);
        }
    }

    private final class SessionLifecycle implements TransportLifecycleListener {

        @Override
        public void onConnected() {
            synchronized (lock) {
                if (!started || initializing || state.isLive() || !allSessionsConnected()) {
                    return;
                }
                enterConnected(true);
            }
        }

        @Override
        public void onDisconnected() {
            synchronized (lock) {
                onConnectionLost(ConnectionState.DISCONNECTED, "Realtime transport disconnected");
            }
        }

        @Override
        public void onReconnecting() {
            synchronized (lock) {
                if (!started || initializing || state == ConnectionState.RECONNECTING
                        || reconnection.isAttemptInFlight()) {
                    return;
                }
                teardownLiveBindings();
                armFallbackForActiveKeys();
                transitionState(ConnectionState.RECONNECTING, "Realtime transport reconnecting");
            }
        }

        @Override
        public void onError(Throwable cause) {
            synchronized (lock) {
                diagnostics.transportFailed("Realtime transport error", cause);
                onConnectionLost(ConnectionState.ERROR, "Realtime transport error");
            }
        }
    }

    private final class ManagedSubscription implements Subscription {

        private final HandlerEntry<?> entry;

        private ManagedSubscription(HandlerEntry<?> entry) {
            this.entry = entry;
        }

        @Override
        public SubscriptionKey key() {
            return entry.key();
        }

        @Override
        public void unsubscribe() {
            RealtimeManager.this.unsubscribe(entry);
        }

        @Override
        public boolean isActive() {
            return entry.isActive();
        }
    }

    public static final class Builder {

        private TransportSession privateSession;
        private TransportSession publicSession;
        private PollClient pollClient;
        private TaskScheduler scheduler;
        private RealtimeSettings settings;
        private DiagnosticsSink diagnostics;
        private PayloadCodec codec;

        private Builder() {
        }

        /** Authenticated session. Drives the connection state together with the public session, if any. */
        public Builder transport(TransportSession session) {
            this.privateSession = session;
            return this;
        }

        /** Optional session for channels that need no authorization. */
        public Builder publicTransport(TransportSession session) {
            this.publicSession = session;
            return this;
        }

        public Builder pollClient(PollClient pollClient) {
            this.pollClient = pollClient;
            return this;
        }

        public Builder scheduler(TaskScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder settings(RealtimeSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder diagnostics(DiagnosticsSink diagnostics) {
            this.diagnostics = diagnostics;
            return this;
        }

        public Builder codec(PayloadCodec codec) {
            this.codec = codec;
            return this;
        }

        public RealtimeManager build() {
            return new RealtimeManager(this);
        }
    }
}
