package uk.co.speedyvan.realtime.api.event;

public record JobUpdate(String jobId,
                        String orderId,
                        String driverId,
                        String status,
                        long updatedAtEpochMillis) {
}
