package uk.co.speedyvan.realtime.core.support;

import uk.co.speedyvan.realtime.api.transport.EventBinding;
import uk.co.speedyvan.realtime.api.transport.TransportException;
import uk.co.speedyvan.realtime.api.transport.TransportLifecycleListener;
import uk.co.speedyvan.realtime.api.transport.TransportMessageHandler;
import uk.co.speedyvan.realtime.api.transport.TransportSession;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory session. Connects synchronously unless told to fail, and lets tests drive drops, errors and messages.
 */
public final class FakeTransportSession implements TransportSession {

    private final List<TransportLifecycleListener> listeners = new CopyOnWriteArrayList<>();
    private final List<FakeBinding> bindings = new CopyOnWriteArrayList<>();
    private final Set<String> channels = new LinkedHashSet<>();
    private final Deque<RuntimeException> connectFailures = new ArrayDeque<>();
    private final Set<String> throwingChannels = new LinkedHashSet<>();
    private final Set<String> rejectedChannels = new LinkedHashSet<>();
    private final List<String> pendingRejections = new ArrayList<>();
    private volatile boolean connected;
    private volatile Runnable disconnectHook;
    private boolean refuseConnects;
    private int connectCalls;
    private int disconnectCalls;

    @Override
    public void connect() {
        synchronized (this) {
            connectCalls++;
            if (refuseConnects) {
                throw new TransportException("connection refused");
            }
            RuntimeException failure = connectFailures.poll();
            if (failure != null) {
                throw failure;
            }
            channels.clear();
            connected = true;
        }
        fire(TransportLifecycleListener::onConnected);
    }

    @Override
    public synchronized void disconnect() {
        disconnectCalls++;
        Runnable hook = disconnectHook;
        if (hook != null) {
            hook.run();
        }
        connected = false;
        channels.clear();
        bindings.clear();
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public synchronized void subscribeChannel(String channel) {
        if (throwingChannels.contains(channel)) {
            throw new TransportException("cannot subscribe to '" + channel + "'");
        }
        if (rejectedChannels.contains(channel)) {
            pendingRejections.add(channel);
        }
        channels.add(channel);
    }

    @Override
    public synchronized void unsubscribeChannel(String channel) {
        channels.remove(channel);
    }

    @Override
    public EventBinding bindEvent(String channel, String event, TransportMessageHandler handler) {
        FakeBinding binding = new FakeBinding(channel, event, handler);
        bindings.add(binding);
        return binding;
    }

    @Override
    public void addLifecycleListener(TransportLifecycleListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeLifecycleListener(TransportLifecycleListener listener) {
        listeners.remove(listener);
    }

    public synchronized void failNextConnect() {
        connectFailures.add(new TransportException("connection refused"));
    }

    public synchronized void refuseConnects(boolean refuse) {
        this.refuseConnects = refuse;
    }

    /** Runs {@code hook} on the closing thread each time the session is closed. */
    public void onDisconnect(Runnable hook) {
        this.disconnectHook = hook;
    }

    /** Makes {@link #subscribeChannel(String)} throw for {@code channel}. */
    public synchronized void throwOnSubscribe(String channel) {
        throwingChannels.add(channel);
    }

    /**
     * Accepts subscriptions to {@code channel} but remembers them as refused, the way a failed channel
     * authorization is reported later. {@link #deliverRejections()} reports them.
     */
    public synchronized void rejectChannel(String channel) {
        rejectedChannels.add(channel);
    }

    /**
     * Reports every refused subscription through {@code onError}, leaving the session connected.
     *
     * @return number of errors reported
     */
    public int deliverRejections() {
        List<String> rejected;
        synchronized (this) {
            rejected = new ArrayList<>(pendingRejections);
            pendingRejections.clear();
            channels.removeAll(rejected);
        }
        for (String channel : rejected) {
            TransportException error = new TransportException("Authorization for '" + channel + "' failed");
            fire(listener -> listener.onError(error));
        }
        return rejected.size();
    }

    public void simulateDrop() {
        synchronized (this) {
            connected = false;
            channels.clear();
        }
        fire(TransportLifecycleListener::onDisconnected);
    }

    public void simulateError(Throwable cause) {
        synchronized (this) {
            connected = false;
            channels.clear();
        }
        fire(listener -> listener.onError(cause));
    }

    public void simulateReconnecting() {
        fire(TransportLifecycleListener::onReconnecting);
    }

    /**
     * Delivers a message to every binding of {@code channel}/{@code event}, as a connected transport would.
     *
     * @return number of bindings invoked
     */
    public int publish(String channel, String event, String payloadJson) {
        if (!connected || !isSubscribed(channel)) {
            return 0;
        }
        int invoked = 0;
        for (FakeBinding binding : new ArrayList<>(bindings)) {
            if (binding.channel.equals(channel) && binding.event.equals(event)) {
                binding.handler.onMessage(channel, event, payloadJson);
                invoked++;
            }
        }
        return invoked;
    }

    public int bindingCount(String channel, String event) {
        int count = 0;
        for (FakeBinding binding : bindings) {
            if (binding.channel.equals(channel) && binding.event.equals(event)) {
                count++;
            }
        }
        return count;
    }

    public synchronized boolean isSubscribed(String channel) {
        return channels.contains(channel);
    }

    public synchronized int connectCalls() {
        return connectCalls;
    }

    public synchronized int disconnectCalls() {
        return disconnectCalls;
    }

    private void fire(Consumer<TransportLifecycleListener> callback) {
        for (TransportLifecycleListener listener : listeners) {
            callback.accept(listener);
        }
    }

    private final class FakeBinding implements EventBinding {

        private final String channel;
        private final String event;
        private final TransportMessageHandler handler;

        private FakeBinding(String channel, String event, TransportMessageHandler handler) {
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
            bindings.remove(this);
        }
    }
}
