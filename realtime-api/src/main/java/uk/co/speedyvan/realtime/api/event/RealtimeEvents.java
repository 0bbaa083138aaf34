package uk.co.speedyvan.realtime.api.event;

import uk.co.speedyvan.realtime.api.channel.ChannelNamespace;

import java.util.List;

/**
 * Catalog of every event producers publish, keyed by namespace.
 * <p>
 * Event names follow {@code "<domain>.<action>"} with lowercase segments, e.g. {@code order.status_changed}.
 */
public final class RealtimeEvents {

    public static final RealtimeEvent<OrderUpdate> ORDER_CREATED = order("order.created");
    public static final RealtimeEvent<OrderUpdate> ORDER_UPDATED = order("order.updated");
    public static final RealtimeEvent<OrderUpdate> ORDER_STATUS_CHANGED = order("order.status_changed");
    public static final RealtimeEvent<OrderUpdate> ORDER_ASSIGNED = order("order.assigned");
    public static final RealtimeEvent<OrderUpdate> ORDER_CANCELLED = order("order.cancelled");

    public static final RealtimeEvent<DriverStatusUpdate> DRIVER_ONLINE = driver("driver.online");
    public static final RealtimeEvent<DriverStatusUpdate> DRIVER_OFFLINE = driver("driver.offline");
    public static final RealtimeEvent<DriverLocationUpdate> DRIVER_LOCATION =
            RealtimeEvent.of(ChannelNamespace.DRIVERS, "driver.location", DriverLocationUpdate.class);
    public static final RealtimeEvent<DriverStatusUpdate> DRIVER_STATUS = driver("driver.status");
    public static final RealtimeEvent<DriverStatusUpdate> DRIVER_APPROVED = driver("driver.approved");
    public static final RealtimeEvent<DriverStatusUpdate> DRIVER_SUSPENDED = driver("driver.suspended");

    public static final RealtimeEvent<JobUpdate> JOB_OFFERED = job("job.offered");
    public static final RealtimeEvent<JobUpdate> JOB_CLAIMED = job("job.claimed");
    public static final RealtimeEvent<JobUpdate> JOB_STARTED = job("job.started");
    public static final RealtimeEvent<JobUpdate> JOB_COMPLETED = job("job.completed");
    public static final RealtimeEvent<JobUpdate> JOB_CANCELLED = job("job.cancelled");

    public static final RealtimeEvent<PaymentUpdate> PAYMENT_RECEIVED = finance("payment.received");
    public static final RealtimeEvent<PaymentUpdate> PAYMENT_FAILED = finance("payment.failed");
    public static final RealtimeEvent<PaymentUpdate> REFUND_ISSUED = finance("refund.issued");
    public static final RealtimeEvent<PaymentUpdate> PAYOUT_PROCESSED = finance("payout.processed");

    public static final RealtimeEvent<NotificationUpdate> NOTIFICATION_SENT = notification("notification.sent");
    public static final RealtimeEvent<NotificationUpdate> NOTIFICATION_READ = notification("notification.read");

    private static final List<RealtimeEvent<?>> ALL = List.of(
            ORDER_CREATED, ORDER_UPDATED, ORDER_STATUS_CHANGED, ORDER_ASSIGNED, ORDER_CANCELLED,
            DRIVER_ONLINE, DRIVER_OFFLINE, DRIVER_LOCATION, DRIVER_STATUS, DRIVER_APPROVED, DRIVER_SUSPENDED,
            JOB_OFFERED, JOB_CLAIMED, JOB_STARTED, JOB_COMPLETED, JOB_CANCELLED,
            PAYMENT_RECEIVED, PAYMENT_FAILED, REFUND_ISSUED, PAYOUT_PROCESSED,
            NOTIFICATION_SENT, NOTIFICATION_READ
    );

    private RealtimeEvents() {
    }

    public static List<RealtimeEvent<?>> all() {
        return ALL;
    }

    private static RealtimeEvent<OrderUpdate> order(String name) {
        return RealtimeEvent.of(ChannelNamespace.ORDERS, name, OrderUpdate.class);
    }

    private static RealtimeEvent<DriverStatusUpdate> driver(String name) {
        return RealtimeEvent.of(ChannelNamespace.DRIVERS, name, DriverStatusUpdate.class);
    }

    private static RealtimeEvent<JobUpdate> job(String name) {
        return RealtimeEvent.of(ChannelNamespace.DISPATCH, name, JobUpdate.class);
    }

    private static RealtimeEvent<PaymentUpdate> finance(String name) {
        return RealtimeEvent.of(ChannelNamespace.FINANCE, name, PaymentUpdate.class);
    }

    private static RealtimeEvent<NotificationUpdate> notification(String name) {
        return RealtimeEvent.of(ChannelNamespace.NOTIFICATIONS, name, NotificationUpdate.class);
    }
}
