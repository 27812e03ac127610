package io.smsclient.core;

/**
 * A delivery report as it arrives from the modem, before it is matched to a stored message.
 *
 * @param phoneNumber the phone number that received the message
 * @param referenceId modem assigned message reference, only useful for short-term tracking
 * @param status the SMS TP-Status value
 */
public record SmsPartialDeliveryReport(String phoneNumber, int referenceId, int status) {}
