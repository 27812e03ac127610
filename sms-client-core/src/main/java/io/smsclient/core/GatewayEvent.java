package io.smsclient.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Events received over the gateway event channel.
 *
 * <p>The gateway tags each message with a {@code type} and carries its payload in {@code data}.
 * Message types this client does not model are delivered as {@link Unrecognized}, untouched.
 * {@link ConnectionUpdate} is generated locally by the client on connect and disconnect.
 */
public sealed interface GatewayEvent permits GatewayEvent.IncomingMessage, GatewayEvent.OutgoingMessage,
        GatewayEvent.DeliveryReport, GatewayEvent.ModemStatusUpdate, GatewayEvent.GnssPosition,
        GatewayEvent.ConnectionUpdate, GatewayEvent.Unrecognized {

    /**
     * A new SMS message was received by the gateway.
     *
     * @param message the stored message
     */
    record IncomingMessage(SmsStoredMessage message) implements GatewayEvent {
        public IncomingMessage {
            Objects.requireNonNull(message, "message");
        }

        public String phoneNumber() {
            return message.phoneNumber();
        }

        public String messageContent() {
            return message.messageContent();
        }

        public Instant receivedAt() {
            return message.receivedAt();
        }
    }

    /**
     * An SMS message is being sent, by the HTTP API or by another connected client.
     *
     * @param message the stored message
     */
    record OutgoingMessage(SmsStoredMessage message) implements GatewayEvent {
        public OutgoingMessage {
            Objects.requireNonNull(message, "message");
        }
    }

    /**
     * A delivery report arrived for a previously sent message.
     *
     * @param messageId the stored message the report was matched to
     * @param report the report as received from the modem
     */
    record DeliveryReport(long messageId, SmsPartialDeliveryReport report) implements GatewayEvent {
        public DeliveryReport {
            Objects.requireNonNull(report, "report");
        }
    }

    /**
     * The modem changed connection state.
     *
     * @param previous the state before the update
     * @param current the state after the update
     */
    record ModemStatusUpdate(ModemState previous, ModemState current) implements GatewayEvent {
        public ModemStatusUpdate {
            Objects.requireNonNull(previous, "previous");
            Objects.requireNonNull(current, "current");
        }
    }

    /**
     * An unsolicited GNSS position report.
     *
     * @param report the position report
     */
    record GnssPosition(GnssPositionReport report) implements GatewayEvent {
        public GnssPosition {
            Objects.requireNonNull(report, "report");
        }
    }

    /**
     * The event channel connected or disconnected.
     *
     * @param connected true on connect, false on disconnect
     * @param reconnect on disconnect, whether the client will attempt to reconnect
     */
    record ConnectionUpdate(boolean connected, boolean reconnect) implements GatewayEvent {}

    /**
     * A gateway message of a type this client does not model.
     *
     * @param type the gateway's type tag
     * @param rawJson the complete message text
     */
    record Unrecognized(String type, String rawJson) implements GatewayEvent {
        public Unrecognized {
            Objects.requireNonNull(rawJson, "rawJson");
        }
    }
}
