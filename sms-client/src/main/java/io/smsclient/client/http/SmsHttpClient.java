package io.smsclient.client.http;

import io.smsclient.core.HttpConfig;
import io.smsclient.core.PaginationOptions;
import io.smsclient.core.Protocol;
import io.smsclient.core.SmsStoredMessage;
import io.smsclient.core.Urls;
import io.smsclient.json.spi.JsonCodec;
import io.smsclient.json.spi.JsonException;
import io.smsclient.transport.spi.HttpClientAdapter;
import io.smsclient.transport.spi.HttpClientException;
import io.smsclient.transport.spi.HttpClientRequest;
import io.smsclient.transport.spi.HttpClientResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Request/response commands against the gateway's HTTP API.
 *
 * <p>Every response is a JSON envelope {@code {"success": bool, "response": ..., "error": ...}}. Modem queries
 * wrap their payload once more as {@code {"type": ..., "data": ...}} and the type is checked against the route.
 *
 * <p>Thread-safe; one instance can be shared.
 */
public final class SmsHttpClient {

    private static final Logger log = LoggerFactory.getLogger(SmsHttpClient.class);

    /** Added to a message's own timeout; the gateway enforces that timeout, this covers the network. */
    static final Duration SEND_TIMEOUT_MARGIN = Duration.ofSeconds(5);

    private final HttpConfig config;
    private final HttpClientAdapter http;
    private final JsonCodec codec;

    public SmsHttpClient(HttpConfig config, HttpClientAdapter http, JsonCodec codec) {
        this.config = Objects.requireNonNull(config, "config");
        this.http = Objects.requireNonNull(http, "http");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public HttpConfig config() {
        return config;
    }

    // ===== Database =====

    /**
     * Sets the friendly name of a phone number; a {@code null} name removes it.
     */
    public boolean setFriendlyName(String phoneNumber, String friendlyName) throws SmsHttpException {
        Objects.requireNonNull(phoneNumber, "phoneNumber");
        HttpClientResponse resp = post(Protocol.R_FRIENDLY_NAME_SET, new FriendlyNameUpdate(phoneNumber, friendlyName), false);
        return required(resp, Protocol.P_RESPONSE, "response", Boolean.class);
    }

    public Optional<String> getFriendlyName(String phoneNumber) throws SmsHttpException {
        Objects.requireNonNull(phoneNumber, "phoneNumber");
        HttpClientResponse resp = post(Protocol.R_FRIENDLY_NAME_GET, new PhoneNumberQuery(phoneNumber), false);
        return optional(resp, Protocol.P_RESPONSE, String.class);
    }

    /**
     * Messages sent to and received from a phone number.
     *
     * @param pagination page options, or null for the gateway's defaults
     */
    public List<SmsStoredMessage> getMessages(String phoneNumber, PaginationOptions pagination) throws SmsHttpException {
        Objects.requireNonNull(phoneNumber, "phoneNumber");
        PaginationOptions p = pagination == null ? PaginationOptions.defaults() : pagination;
        MessagesQuery body = new MessagesQuery(phoneNumber, p.limit(), p.offset(), p.reverse());
        return requiredList(post(Protocol.R_MESSAGES, body, false), SmsStoredMessage.class);
    }

    /**
     * Phone numbers most recently in contact with the gateway, senders and receivers alike.
     *
     * @param pagination page options, or null to send no body
     */
    public List<LatestNumber> getLatestNumbers(PaginationOptions pagination) throws SmsHttpException {
        return requiredList(post(Protocol.R_LATEST_NUMBERS, pagination, false), LatestNumber.class);
    }

    public List<SmsDeliveryReport> getDeliveryReports(long messageId, PaginationOptions pagination) throws SmsHttpException {
        PaginationOptions p = pagination == null ? PaginationOptions.defaults() : pagination;
        DeliveryReportsQuery body = new DeliveryReportsQuery(messageId, p.limit(), p.offset(), p.reverse());
        return requiredList(post(Protocol.R_DELIVERY_REPORTS, body, false), SmsDeliveryReport.class);
    }

    // ===== Pagination =====

    public Paginator<SmsStoredMessage> paginateMessages(String phoneNumber) {
        return paginateMessages(phoneNumber, PaginationOptions.defaults());
    }

    public Paginator<SmsStoredMessage> paginateMessages(String phoneNumber, PaginationOptions options) {
        Objects.requireNonNull(phoneNumber, "phoneNumber");
        return new Paginator<>(p -> Page.of(getMessages(phoneNumber, p)), options);
    }

    public Paginator<LatestNumber> paginateLatestNumbers() {
        return paginateLatestNumbers(PaginationOptions.defaults());
    }

    public Paginator<LatestNumber> paginateLatestNumbers(PaginationOptions options) {
        return new Paginator<>(p -> Page.of(getLatestNumbers(p)), options);
    }

    public Paginator<SmsDeliveryReport> paginateDeliveryReports(long messageId) {
        return paginateDeliveryReports(messageId, PaginationOptions.defaults());
    }

    public Paginator<SmsDeliveryReport> paginateDeliveryReports(long messageId, PaginationOptions options) {
        return new Paginator<>(p -> Page.of(getDeliveryReports(messageId, p)), options);
    }

    // ===== Modem =====

    /**
     * Sends an SMS. When the message carries its own timeout the request waits that long plus a small margin,
     * otherwise the modem timeout applies.
     */
    public SmsSendResult sendSms(OutgoingSmsMessage message) throws SmsHttpException {
        Objects.requireNonNull(message, "message");
        Duration timeout = message.timeout() != null
                ? Duration.ofSeconds(message.timeout()).plus(SEND_TIMEOUT_MARGIN)
                : modemTimeout();
        HttpClientResponse resp = execute(HttpClientRequest.post(Urls.route(config.url(), Protocol.R_SEND_SMS))
                .jsonBody(encode(message))
                .timeout(timeout));
        return required(resp, Protocol.P_RESPONSE, "response", SmsSendResult.class);
    }

    public NetworkStatus getNetworkStatus() throws SmsHttpException {
        return modemRequest("modem-status", "NetworkStatus", NetworkStatus.class);
    }

    public SignalStrength getSignalStrength() throws SmsHttpException {
        return modemRequest("signal-strength", "SignalStrength", SignalStrength.class);
    }

    /** The network operator, often shared by several providers in a region. */
    public NetworkOperator getNetworkOperator() throws SmsHttpException {
        return modemRequest("network-operator", "NetworkOperator", NetworkOperator.class);
    }

    /** The SIM's service provider, the brand managing the contract. */
    public String getServiceProvider() throws SmsHttpException {
        return modemRequest("service-provider", "ServiceProvider", String.class);
    }

    public BatteryLevel getBatteryLevel() throws SmsHttpException {
        return modemRequest("battery-level", "BatteryLevel", BatteryLevel.class);
    }

    // ===== System =====

    /** The gateway's configured sender number, if it has one. */
    public Optional<String> getPhoneNumber() throws SmsHttpException {
        return optional(get(Protocol.R_PHONE_NUMBER, false), Protocol.P_RESPONSE, String.class);
    }

    /** The gateway version, e.g. {@code 0.0.1+sentry}. */
    public String getVersion() throws SmsHttpException {
        return required(get(Protocol.R_VERSION, false), Protocol.P_RESPONSE, "response", String.class);
    }

    // ===== Internals =====

    private <T> T modemRequest(String route, String expectedType, Class<T> type) throws SmsHttpException {
        HttpClientResponse resp = get(Protocol.R_MODEM_PREFIX + route, true);
        String actual = required(resp, Protocol.P_RESPONSE_TYPE, "type", String.class);
        if (!expectedType.equals(actual)) {
            throw new SmsHttpException.TypeMismatch(expectedType, actual);
        }
        return required(resp, Protocol.P_RESPONSE_DATA, "data", type);
    }

    private HttpClientResponse get(String route, boolean modem) throws SmsHttpException {
        return execute(HttpClientRequest.get(Urls.route(config.url(), route))
                .timeout(modem ? modemTimeout() : config.baseTimeout()));
    }

    /** Posts {@code body} as JSON; a null body sends an empty request. */
    private HttpClientResponse post(String route, Object body, boolean modem) throws SmsHttpException {
        HttpClientRequest.Builder req = HttpClientRequest.post(Urls.route(config.url(), route))
                .timeout(modem ? modemTimeout() : config.baseTimeout());
        if (body != null) {
            req.jsonBody(encode(body));
        }
        return execute(req);
    }

    private HttpClientResponse execute(HttpClientRequest.Builder req) throws SmsHttpException {
        config.authorization().ifPresent(req::authorization);
        HttpClientRequest request = req.build();
        log.debug("Sending {}", request);
        try {
            HttpClientResponse resp = http.send(request);
            log.debug("{} {} -> {}", request.method(), request.uri(), resp.statusCode());
            return resp;
        } catch (HttpClientException e) {
            throw new SmsHttpException.RequestFailed(request.method() + " " + request.uri() + " failed", e);
        }
    }

    private Duration modemTimeout() {
        return config.modemTimeout().orElse(config.baseTimeout());
    }

    private byte[] encode(Object body) throws SmsHttpException {
        try {
            return codec.writeBytes(body);
        } catch (JsonException e) {
            throw new SmsHttpException.Decode("Failed to encode request body", e);
        }
    }

    /**
     * Checks the envelope and returns the body. Only JSON responses are inspected; anything else is a
     * status failure when non-2xx and a missing response otherwise.
     */
    private byte[] envelope(HttpClientResponse resp) throws SmsHttpException {
        byte[] body = resp.body();
        if (!resp.isJson()) {
            if (!resp.isSuccess()) {
                throw new SmsHttpException.Status(resp.statusCode(), resp.bodyText());
            }
            throw new SmsHttpException.MissingField("response");
        }

        boolean success;
        try {
            success = codec.readAt(body, Protocol.P_SUCCESS, Boolean.class).orElse(false);
        } catch (JsonException e) {
            throw new SmsHttpException.Decode("Invalid JSON response", e);
        }
        if (!success) {
            String error;
            try {
                error = codec.readAt(body, Protocol.P_ERROR, String.class).orElse("Unknown API error!");
            } catch (JsonException e) {
                error = "Unknown API error!";
                log.debug("Unreadable error field", e);
            }
            throw new SmsHttpException.ApiError(error);
        }
        return body;
    }

    private <T> T required(HttpClientResponse resp, String pointer, String field, Class<T> type) throws SmsHttpException {
        return optional(resp, pointer, type).orElseThrow(() -> new SmsHttpException.MissingField(field));
    }

    private <T> Optional<T> optional(HttpClientResponse resp, String pointer, Class<T> type) throws SmsHttpException {
        byte[] body = envelope(resp);
        try {
            return codec.readAt(body, pointer, type);
        } catch (JsonException e) {
            throw new SmsHttpException.Decode("Failed to decode " + pointer + " as " + type.getSimpleName(), e);
        }
    }

    private <T> List<T> requiredList(HttpClientResponse resp, Class<T> elementType) throws SmsHttpException {
        byte[] body = envelope(resp);
        try {
            return codec.readListAt(body, Protocol.P_RESPONSE, elementType)
                    .orElseThrow(() -> new SmsHttpException.MissingField("response"));
        } catch (JsonException e) {
            throw new SmsHttpException.Decode("Failed to decode response as List<" + elementType.getSimpleName() + ">", e);
        }
    }

    record FriendlyNameUpdate(String phoneNumber, String friendlyName) {}

    record PhoneNumberQuery(String phoneNumber) {}

    record MessagesQuery(String phoneNumber, Long limit, Long offset, Boolean reverse) {}

    record DeliveryReportsQuery(long messageId, Long limit, Long offset, Boolean reverse) {}
}
