package io.smsclient.client.http;

import java.util.Objects;

/**
 * An SMS message to send.
 *
 * @param to the target phone number, in international format
 * @param content the full message text; the gateway splits it into parts when needed
 * @param validityPeriod relative validity period while undelivered; the gateway default (24 hours) when null
 * @param flash send as a flash (class 0) message, shown as a popup on the recipient's device
 * @param timeout seconds the gateway waits for the modem to accept the message; the HTTP timeout is extended to match
 */
public record OutgoingSmsMessage(String to, String content, Integer validityPeriod, Boolean flash, Integer timeout) {

    public OutgoingSmsMessage {
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(content, "content");
        if (validityPeriod != null && (validityPeriod < 0 || validityPeriod > 255)) {
            throw new IllegalArgumentException("validityPeriod must be 0..255, got: " + validityPeriod);
        }
        if (timeout != null && timeout <= 0) {
            throw new IllegalArgumentException("timeout must be > 0, got: " + timeout);
        }
    }

    public static OutgoingSmsMessage simple(String to, String content) {
        return new OutgoingSmsMessage(to, content, null, null, null);
    }

    public OutgoingSmsMessage withFlash(boolean flash) {
        return new OutgoingSmsMessage(to, content, validityPeriod, flash, timeout);
    }

    public OutgoingSmsMessage withValidityPeriod(int validityPeriod) {
        return new OutgoingSmsMessage(to, content, validityPeriod, flash, timeout);
    }

    public OutgoingSmsMessage withTimeout(int timeoutSeconds) {
        return new OutgoingSmsMessage(to, content, validityPeriod, flash, timeoutSeconds);
    }
}
