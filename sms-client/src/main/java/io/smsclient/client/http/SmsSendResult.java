package io.smsclient.client.http;

/**
 * @param messageId the gateway's id for the stored message
 * @param referenceId the modem's message reference, matched against delivery reports
 */
public record SmsSendResult(long messageId, int referenceId) {}
