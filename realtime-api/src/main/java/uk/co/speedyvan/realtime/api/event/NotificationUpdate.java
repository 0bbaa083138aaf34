package uk.co.speedyvan.realtime.api.event;

public record NotificationUpdate(String notificationId,
                                 String recipientId,
                                 String title,
                                 String message,
                                 String priority,
                                 String category) {
}
