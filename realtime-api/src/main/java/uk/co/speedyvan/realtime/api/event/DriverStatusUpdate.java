package uk.co.speedyvan.realtime.api.event;

public record DriverStatusUpdate(String driverId,
                                 String status,
                                 boolean online,
                                 String reason,
                                 long updatedAtEpochMillis) {
}
