package uk.co.speedyvan.realtime.core.transport;

import io.lettuce.core.RedisChannelHandler;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisConnectionStateListener;
import io.lettuce.core.pubsub.RedisPubSubAdapter;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.co.speedyvan.realtime.api.Preconditions;
import uk.co.speedyvan.realtime.api.transport.ChannelAuthorizer;
import uk.co.speedyvan.realtime.api.transport.EventBinding;
import uk.co.speedyvan.realtime.api.transport.TransportException;
import uk.co.speedyvan.realtime.api.transport.TransportLifecycleListener;
import uk.co.speedyvan.realtime.api.transport.TransportMessageHandler;
import uk.co.speedyvan.realtime.api.transport.TransportSession;
import uk.co.speedyvan.realtime.core.codec.PayloadCodec;
import uk.co.speedyvan.realtime.core.codec.TransportEnvelope;

import java.net.SocketAddress;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * {@link TransportSession} over one Redis pub/sub connection.
 * <p>
 * Every published message is a JSON {@link TransportEnvelope}; the envelope's {@code event} selects the bindings of
 * the channel it arrived on. When a {@link ChannelAuthorizer} is configured the session is private: each channel is
 * authorized for the current socket id before SUBSCRIBE is sent.
 * <p>
 * Messages and asynchronous lifecycle events never run on the Lettuce I/O thread. They are handed to the callback
 * executor, and events raised by a connection that has since been replaced or closed are discarded.
 * <p>
 * The session never reconnects on its own. A dropped connection is reported once through
 * {@link TransportLifecycleListener#onDisconnected()}.
 */
public class LettuceTransportSession implements TransportSession {

    private static final Logger LOGGER = LoggerFactory.getLogger(LettuceTransportSession.class);

    private final String name;
    private final RedisClientFactory clientFactory;
    private final ChannelAuthorizer authorizer;
    private final PayloadCodec codec;
    private final Executor callbackExecutor;
    private final List<TransportLifecycleListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, Map<String, CopyOnWriteArrayList<Binding>>> bindings = new ConcurrentHashMap<>();
    private final Set<String> channels = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean connected = new AtomicBoolean(false);
    private final AtomicBoolean closing = new AtomicBoolean(false);
    private final AtomicLong generation = new AtomicLong();

    private volatile String socketId;
    private volatile StatefulRedisPubSubConnection<String, String> connection;
    private RedisClient client;

    public LettuceTransportSession(String name, RedisClientFactory clientFactory, PayloadCodec codec, Executor callbackExecutor) {
        this(name, clientFactory, null, codec, callbackExecutor);
    }

    public LettuceTransportSession(String name,
                                   RedisClientFactory clientFactory,
                                   ChannelAuthorizer authorizer,
                                   PayloadCodec codec,
                                   Executor callbackExecutor) {
        this.name = Preconditions.checkNotBlank(name, "name");
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
        this.authorizer = authorizer;
        this.codec = Objects.requireNonNull(codec, "codec");
        this.callbackExecutor = Objects.requireNonNull(callbackExecutor, "callbackExecutor");
    }

    @Override
    public void connect() {
        String connectedSocket = openConnection();
        LOGGER.info("[{}] Realtime transport connected (socket {})", name, connectedSocket);
        // fired outside the monitor: listeners may call back into their owner's lock
        fire(TransportLifecycleListener::onConnected);
    }

    private synchronized String openConnection() {
        resetState();
        long current = generation.get();
        LOGGER.info("[{}] Connecting realtime transport to {}", name, clientFactory.describe());
        try {
            client = clientFactory.createClient();
            client.addListener(new ConnectionStateListener(current));
            StatefulRedisPubSubConnection<String, String> pubSub = client.connectPubSub();
            pubSub.addListener(new RedisPubSubAdapter<>() {
                @Override
                public void message(String channel, String message) {
                    receive(channel, message);
                }
            });
            connection = pubSub;
            socketId = UUID.randomUUID().toString();
            connected.set(true);
        } catch (RuntimeException e) {
            closing.set(true);
            try {
                cleanup();
            } catch (RuntimeException suppressed) {
                e.addSuppressed(suppressed);
            } finally {
                closing.set(false);
            }
            throw new TransportException("[" + name + "] Failed to connect to " + clientFactory.describe(), e);
        }
        return socketId;
    }

    @Override
    public synchronized void disconnect() {
        resetState();
    }

    @Override
    public boolean isConnected() {
        return connected.get();
    }

    public String socketId() {
        return socketId;
    }

    public boolean isPrivate() {
        return authorizer != null;
    }

    /**
     * Channels this session currently wants, authorized or not yet.
     */
    public Set<String> subscribedChannels() {
        return Set.copyOf(channels);
    }

    @Override
    public void subscribeChannel(String channel) {
        Preconditions.checkNotBlank(channel, "channel");
        if (!channels.add(channel)) {
            return;
        }
        if (authorizer == null) {
            sendSubscribe(channel);
            return;
        }
        String currentSocket = socketId;
        if (currentSocket == null) {
            return;
        }
        long current = generation.get();
        authorizer.authorize(currentSocket, channel).whenComplete((authorization, error) -> {
            if (error != null) {
                channels.remove(channel);
                fireError(current, new TransportException("[" + name + "] Authorization for '" + channel + "' failed", error));
                return;
            }
            if (!currentSocket.equals(socketId) || !channels.contains(channel)) {
                return;
            }
            LOGGER.debug("[{}] Channel '{}' authorized", name, channel);
            sendSubscribe(channel);
        });
    }

    @Override
    public void unsubscribeChannel(String channel) {
        if (!channels.remove(channel)) {
            return;
        }
        bindings.remove(channel);
        StatefulRedisPubSubConnection<String, String> current = connection;
        if (current == null || !connected.get()) {
            return;
        }
        current.async().unsubscribe(channel).whenComplete((ignored, error) -> {
            if (error != null) {
                LOGGER.warn("[{}] UNSUBSCRIBE '{}' failed", name, channel, error);
            }
        });
    }

    @Override
    public EventBinding bindEvent(String channel, String event, TransportMessageHandler handler) {
        Preconditions.checkNotBlank(channel, "channel");
        Preconditions.checkNotBlank(event, "event");
        Objects.requireNonNull(handler, "handler");
        Binding binding = new Binding(channel, event, handler);
        bindings.computeIfAbsent(channel, ignored -> new ConcurrentHashMap<>())
                .computeIfAbsent(event, ignored -> new CopyOnWriteArrayList<>())
                .add(binding);
        return binding;
    }

    @Override
    public void addLifecycleListener(TransportLifecycleListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeLifecycleListener(TransportLifecycleListener listener) {
        listeners.remove(listener);
    }

    /**
     * Entry point for raw pub/sub messages. Routing and handler calls happen on the callback executor.
     */
    void receive(String channel, String json) {
        long current = generation.get();
        execute(() -> {
            if (current == generation.get()) {
                dispatchMessage(channel, json);
            }
        });
    }

    /**
     * Marks the session connected under {@code socketId} without opening a Redis connection.
     */
    synchronized void assumeSocket(String socketId) {
        resetState();
        this.socketId = Preconditions.checkNotBlank(socketId, "socketId");
        connected.set(true);
    }

    private void resetState() {
        closing.set(true);
        try {
            generation.incrementAndGet();
            connected.set(false);
            channels.clear();
            bindings.clear();
            cleanup();
        } finally {
            closing.set(false);
        }
    }

    private void sendSubscribe(String channel) {
        StatefulRedisPubSubConnection<String, String> current = connection;
        if (current == null || !connected.get()) {
            return;
        }
        long currentGeneration = generation.get();
        current.async().subscribe(channel).whenComplete((ignored, error) -> {
            if (error != null) {
                channels.remove(channel);
                fireError(currentGeneration, new TransportException("[" + name + "] SUBSCRIBE '" + channel + "' failed", error));
            } else {
                LOGGER.debug("[{}] Subscribed to '{}'", name, channel);
            }
        });
    }

    private void dispatchMessage(String channel, String json) {
        TransportEnvelope envelope;
        try {
            envelope = codec.decodeEnvelope(json);
        } catch (RuntimeException e) {
            LOGGER.warn("[{}] Dropping malformed message on '{}'", name, channel, e);
            return;
        }
        Map<String, CopyOnWriteArrayList<Binding>> channelBindings = bindings.get(channel);
        if (channelBindings == null) {
            return;
        }
        List<Binding> eventBindings = channelBindings.get(envelope.event());
        if (eventBindings == null || eventBindings.isEmpty()) {
            return;
        }
        String payload = codec.encode(envelope.data());
        for (Binding binding : List.copyOf(eventBindings)) {
            if (!binding.active) {
                continue;
            }
            try {
                binding.handler.onMessage(channel, envelope.event(), payload);
            } catch (Exception e) {
                LOGGER.warn("[{}] Binding for '{}/{}' failed", name, channel, envelope.event(), e);
            }
        }
    }

    private void fireError(long expectedGeneration, Throwable cause) {
        fireLater(expectedGeneration, listener -> listener.onError(cause));
    }

    private void fireLater(long expectedGeneration, Consumer<TransportLifecycleListener> callback) {
        if (closing.get() || expectedGeneration != generation.get()) {
            return;
        }
        execute(() -> {
            if (expectedGeneration == generation.get()) {
                fire(callback);
            }
        });
    }

    private void execute(Runnable task) {
        try {
            callbackExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            LOGGER.debug("[{}] Callback executor is shut down, dropping event", name);
        }
    }

    private void fire(Consumer<TransportLifecycleListener> callback) {
        for (TransportLifecycleListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (Exception e) {
                LOGGER.warn("[{}] Lifecycle listener failed", name, e);
            }
        }
    }

    private void cleanup() {
        StatefulRedisPubSubConnection<String, String> current = connection;
        connection = null;
        socketId = null;
        try {
            if (current != null) {
                current.close();
            }
        } finally {
            if (client != null) {
                client.shutdown();
                client = null;
            }
        }
    }

    private final class ConnectionStateListener implements RedisConnectionStateListener {

        private final long connectionGeneration;

        private ConnectionStateListener(long connectionGeneration) {
            this.connectionGeneration = connectionGeneration;
        }

        @Override
        public void onRedisConnected(RedisChannelHandler<?, ?> handler, SocketAddress socketAddress) {
            LOGGER.debug("[{}] Socket connected to {}", name, socketAddress);
        }

        @Override
        public void onRedisDisconnected(RedisChannelHandler<?, ?> handler) {
            if (closing.get() || connectionGeneration != generation.get() || !connected.compareAndSet(true, false)) {
                return;
            }
            channels.clear();
            LOGGER.warn("[{}] Realtime transport connection lost", name);
            fireLater(connectionGeneration, TransportLifecycleListener::onDisconnected);
        }

        @Override
        public void onRedisExceptionCaught(RedisChannelHandler<?, ?> handler, Throwable cause) {
            fireError(connectionGeneration, cause);
        }
    }

    private final class Binding implements EventBinding {

        private final String channel;
        private final String event;
        private final TransportMessageHandler handler;
        private volatile boolean active = true;

        private Binding(String channel, String event, TransportMessageHandler handler) {
            this.channel = channel;
            this.event = event;
            this.handler = handler;
        }

        @Override
        public String channel() {
            return channel;
        }

        @Override
        public String event() {
            return event;
        }

        @Override
        public void unbind() {
            active = false;
            Map<String, CopyOnWriteArrayList<Binding>> channelBindings = bindings.get(channel);
            if (channelBindings == null) {
                return;
            }
            CopyOnWriteArrayList<Binding> eventBindings = channelBindings.get(event);
            if (eventBindings != null) {
                eventBindings.remove(this);
            }
        }
    }
}
