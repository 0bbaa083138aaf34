package uk.co.speedyvan.realtime.core;

import uk.co.speedyvan.realtime.api.Preconditions;
import uk.co.speedyvan.realtime.api.RealtimeClient;
import uk.co.speedyvan.realtime.api.RealtimeHandler;
import uk.co.speedyvan.realtime.api.Subscription;
import uk.co.speedyvan.realtime.api.channel.ChannelKey;
import uk.co.speedyvan.realtime.api.channel.ChannelNamespace;
import uk.co.speedyvan.realtime.api.channel.SubscriptionOptions;
import uk.co.speedyvan.realtime.api.event.DriverStatusUpdate;
import uk.co.speedyvan.realtime.api.event.JobUpdate;
import uk.co.speedyvan.realtime.api.event.OrderUpdate;
import uk.co.speedyvan.realtime.api.event.PaymentUpdate;
import uk.co.speedyvan.realtime.api.event.RealtimeEvents;

import java.time.Duration;
import java.util.Objects;

/**
 * Ready-made subscriptions for the screens that track a single order, a driver, the dispatch board and finance.
 * Dispatch and finance streams are bound through the authenticated session.
 */
public final class RealtimeSubscriptions {

    public static final Duration ORDER_POLLING_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DRIVER_POLLING_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DISPATCH_POLLING_INTERVAL = Duration.ofSeconds(15);
    public static final Duration FINANCE_POLLING_INTERVAL = Duration.ofSeconds(60);

    private final RealtimeClient client;

    public RealtimeSubscriptions(RealtimeClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public Subscription subscribeToOrder(String orderId, RealtimeHandler<OrderUpdate> handler) {
        Preconditions.checkNotBlank(orderId, "orderId");
        return client.subscribe(ChannelKey.of(ChannelNamespace.ORDERS, orderId), RealtimeEvents.ORDER_UPDATED, handler,
                SubscriptionOptions.polling(ORDER_POLLING_INTERVAL));
    }

    public Subscription subscribeToDriver(String driverId, RealtimeHandler<DriverStatusUpdate> handler) {
        Preconditions.checkNotBlank(driverId, "driverId");
        return client.subscribe(ChannelKey.of(ChannelNamespace.DRIVERS, driverId), RealtimeEvents.DRIVER_STATUS, handler,
                SubscriptionOptions.polling(DRIVER_POLLING_INTERVAL));
    }

    public Subscription subscribeToDispatch(RealtimeHandler<JobUpdate> handler) {
        return client.subscribe(ChannelKey.of(ChannelNamespace.DISPATCH), RealtimeEvents.JOB_OFFERED, handler,
                SubscriptionOptions.polling(DISPATCH_POLLING_INTERVAL).withAuth());
    }

    public Subscription subscribeToFinance(RealtimeHandler<PaymentUpdate> handler) {
        return client.subscribe(ChannelKey.of(ChannelNamespace.FINANCE), RealtimeEvents.PAYMENT_RECEIVED, handler,
                SubscriptionOptions.polling(FINANCE_POLLING_INTERVAL).withAuth());
    }
}
