package io.smsclient.core;

import java.time.Instant;

/**
 * A stored SMS message as recorded by the gateway database.
 *
 * @param messageId unique identifier assigned by the gateway
 * @param phoneNumber the remote phone number of this message
 * @param messageContent the text content
 * @param messageReference modem assigned reference, only present for outgoing messages
 * @param isOutgoing true if the message was sent, false if it was received
 * @param status current status (e.g. "sent", "delivered", "failed")
 * @param createdAt unix timestamp (seconds) when the message was stored, may be null
 * @param completedAt unix timestamp (seconds) when the message was completed or delivered, may be null
 */
public record SmsStoredMessage(
        long messageId,
        String phoneNumber,
        String messageContent,
        Integer messageReference,
        boolean isOutgoing,
        String status,
        Long createdAt,
        Long completedAt
) {

    /**
     * The time the gateway stored the message, or {@code null} if the gateway did not report it.
     */
    public Instant receivedAt() {
        return createdAt == null ? null : Instant.ofEpochSecond(createdAt);
    }
}
