package uk.co.speedyvan.realtime.api.event;

/**
 * Snapshot of an order as pushed to tracking pages and admin dashboards.
 */
public record OrderUpdate(String orderId,
                          String reference,
                          String status,
                          String driverId,
                          String estimatedArrival,
                          long updatedAtEpochMillis) {
}
