package uk.co.speedyvan.realtime.api.event;

/**
 * Finance event payload. Amounts are in minor units of {@code currency} (pence for GBP).
 */
public record PaymentUpdate(String paymentId,
                            String orderId,
                            long amountMinor,
                            String currency,
                            String status,
                            long processedAtEpochMillis) {
}
