package io.smsclient.client.http;

/**
 * A stored delivery report for a sent message.
 *
 * @param reportId the report's id, may be null
 * @param status delivery status code from the network
 * @param isFinal whether no further reports will follow for this message
 * @param createdAt unix timestamp (seconds), may be null
 */
public record SmsDeliveryReport(Long reportId, int status, boolean isFinal, Long createdAt) {}
