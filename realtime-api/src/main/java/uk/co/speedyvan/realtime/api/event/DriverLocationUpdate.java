package uk.co.speedyvan.realtime.api.event;

/**
 * Last known driver position. {@code heading} and {@code speedKph} are absent when the device did not report them.
 */
public record DriverLocationUpdate(String driverId,
                                   String orderId,
                                   double latitude,
                                   double longitude,
                                   Double heading,
                                   Double speedKph,
                                   long recordedAtEpochMillis) {
}
