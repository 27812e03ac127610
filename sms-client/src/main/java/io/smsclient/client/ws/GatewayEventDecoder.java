package io.smsclient.client.ws;

import io.smsclient.core.GatewayEvent;
import io.smsclient.core.GnssPositionReport;
import io.smsclient.core.ModemState;
import io.smsclient.core.Protocol;
import io.smsclient.core.SmsPartialDeliveryReport;
import io.smsclient.core.SmsStoredMessage;
import io.smsclient.json.spi.JsonCodec;
import io.smsclient.json.spi.JsonException;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Decodes event channel text frames of the form {@code {"type": ..., "data": ...}}.
 *
 * <p>Internal implementation; not intended to be used directly by clients.
 */
public final class GatewayEventDecoder {

    private final JsonCodec codec;

    public GatewayEventDecoder(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * @throws JsonException if the frame is not JSON, has no type, or a known type has a malformed payload
     */
    public GatewayEvent decode(String text) throws JsonException {
        byte[] data = text.getBytes(StandardCharsets.UTF_8);
        String type = codec.readAt(data, Protocol.P_TYPE, String.class)
                .orElseThrow(() -> JsonException.at(Protocol.P_TYPE, "Event has no type"));

        switch (type) {
            case Protocol.EV_INCOMING:
                return new GatewayEvent.IncomingMessage(required(data, Protocol.P_DATA, SmsStoredMessage.class));
            case Protocol.EV_OUTGOING:
                return new GatewayEvent.OutgoingMessage(required(data, Protocol.P_DATA, SmsStoredMessage.class));
            case Protocol.EV_DELIVERY:
                return new GatewayEvent.DeliveryReport(
                        required(data, "/data/message_id", Long.class),
                        required(data, "/data/report", SmsPartialDeliveryReport.class));
            case Protocol.EV_MODEM_STATUS:
                return new GatewayEvent.ModemStatusUpdate(
                        modemState(required(data, "/data/previous", String.class)),
                        modemState(required(data, "/data/current", String.class)));
            case Protocol.EV_GNSS_POSITION:
                return new GatewayEvent.GnssPosition(required(data, Protocol.P_DATA, GnssPositionReport.class));
            default:
                return new GatewayEvent.Unrecognized(type, text);
        }
    }

    private <T> T required(byte[] data, String pointer, Class<T> type) throws JsonException {
        return codec.readAt(data, pointer, type)
                .orElseThrow(() -> JsonException.at(pointer, "Event field missing"));
    }

    private static ModemState modemState(String wire) throws JsonException {
        try {
            return ModemState.fromWire(wire);
        } catch (IllegalArgumentException e) {
            throw new JsonException("Invalid modem state", e);
        }
    }
}
