package io.smsclient.client.http;

import io.smsclient.core.HttpConfig;
import io.smsclient.core.PaginationOptions;
import io.smsclient.core.SmsStoredMessage;
import io.smsclient.json.spi.JsonCodec;
import io.smsclient.json.spi.JsonCodecs;
import io.smsclient.transport.spi.HttpClientAdapter;
import io.smsclient.transport.spi.HttpClientException;
import io.smsclient.transport.spi.HttpClientRequest;
import io.smsclient.transport.spi.HttpClientResponse;
import io.smsclient.transport.spi.HttpTimeoutException;
import io.smsclient.transport.spi.JdkHttpClientAdapter;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SmsHttpClientTest {

    private static final JsonCodec CODEC = JsonCodecs.load();

    private MockWebServer server;
    private SmsHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        HttpConfig config = HttpConfig.builder(server.url("/").toString())
                .authorization("secret-token")
                .build();
        client = new SmsHttpClient(config, JdkHttpClientAdapter.create(), CODEC);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void sendSmsPostsMessageWithAuthorization() throws Exception {
        server.enqueue(json("{\"success\":true,\"response\":{\"message_id\":42,\"reference_id\":7}}"));

        SmsSendResult result = client.sendSms(OutgoingSmsMessage.simple("+441234567890", "hello").withFlash(true));

        assertThat(result).isEqualTo(new SmsSendResult(42, 7));
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/sms/send");
        assertThat(request.getHeader("authorization")).isEqualTo("secret-token");
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");
        assertThat(request.getBody().readUtf8())
                .isEqualTo("{\"to\":\"+441234567890\",\"content\":\"hello\",\"flash\":true}");
    }

    @Test
    void apiErrorCarriesGatewayMessage() {
        server.enqueue(json("{\"success\":false,\"error\":\"Modem is offline\"}").setResponseCode(500));

        assertThatThrownBy(() -> client.getVersion())
                .isInstanceOf(SmsHttpException.ApiError.class)
                .satisfies(e -> assertThat(((SmsHttpException.ApiError) e).error()).isEqualTo("Modem is offline"));
    }

    @Test
    void apiErrorWithoutMessageUsesFallback() {
        server.enqueue(json("{\"success\":false}"));

        assertThatThrownBy(() -> client.getVersion())
                .isInstanceOf(SmsHttpException.ApiError.class)
                .satisfies(e -> assertThat(((SmsHttpException.ApiError) e).error()).isEqualTo("Unknown API error!"));
    }

    @Test
    void nonJsonErrorIsReportedWithStatusAndBody() {
        server.enqueue(new MockResponse()
                .setResponseCode(502)
                .addHeader("Content-Type", "text/plain")
                .setBody("Bad gateway"));

        assertThatThrownBy(() -> client.getVersion())
                .isInstanceOf(SmsHttpException.Status.class)
                .satisfies(e -> {
                    SmsHttpException.Status status = (SmsHttpException.Status) e;
                    assertThat(status.status()).isEqualTo(502);
                    assertThat(status.body()).isEqualTo("Bad gateway");
                });
    }

    @Test
    void nonJsonSuccessIsMissingResponse() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("ok"));

        assertThatThrownBy(() -> client.getVersion())
                .isInstanceOf(SmsHttpException.MissingField.class)
                .satisfies(e -> assertThat(((SmsHttpException.MissingField) e).field()).isEqualTo("response"));
    }

    @Test
    void modemResponseOfWrongTypeIsRejected() {
        server.enqueue(json("{\"success\":true,\"response\":{\"type\":\"SignalStrength\",\"data\":{\"rssi\":20,\"ber\":99}}}"));

        assertThatThrownBy(() -> client.getNetworkStatus())
                .isInstanceOf(SmsHttpException.TypeMismatch.class)
                .satisfies(e -> {
                    SmsHttpException.TypeMismatch mismatch = (SmsHttpException.TypeMismatch) e;
                    assertThat(mismatch.expected()).isEqualTo("NetworkStatus");
                    assertThat(mismatch.actual()).isEqualTo("SignalStrength");
                });
    }

    @Test
    void modemRequestsDecodeTypedData() throws Exception {
        server.enqueue(json("{\"success\":true,\"response\":{\"type\":\"SignalStrength\",\"data\":{\"rssi\":20,\"ber\":99}}}"));
        server.enqueue(json("{\"success\":true,\"response\":{\"type\":\"BatteryLevel\",\"data\":{\"status\":0,\"charge\":87,\"voltage\":4.1}}}"));
        server.enqueue(json("{\"success\":true,\"response\":{\"type\":\"ServiceProvider\",\"data\":\"giffgaff\"}}"));

        assertThat(client.getSignalStrength()).isEqualTo(new SignalStrength(20, 99));
        assertThat(client.getBatteryLevel().charge()).isEqualTo(87);
        assertThat(client.getServiceProvider()).isEqualTo("giffgaff");

        assertThat(server.takeRequest().getPath()).isEqualTo("/sms/signal-strength");
        assertThat(server.takeRequest().getPath()).isEqualTo("/sms/battery-level");
        assertThat(server.takeRequest().getPath()).isEqualTo("/sms/service-provider");
    }

    @Test
    void modemResponseWithoutDataIsMissingField() {
        server.enqueue(json("{\"success\":true,\"response\":{\"type\":\"NetworkStatus\"}}"));

        assertThatThrownBy(() -> client.getNetworkStatus())
                .isInstanceOf(SmsHttpException.MissingField.class)
                .satisfies(e -> assertThat(((SmsHttpException.MissingField) e).field()).isEqualTo("data"));
    }

    @Test
    void latestNumbersWithoutPaginationSendsNoBody() throws Exception {
        server.enqueue(json("{\"success\":true,\"response\":[{\"phone_number\":\"+441234567890\",\"friendly_name\":\"Alice\"},"
                + "{\"phone_number\":\"+449876543210\"}]}"));

        List<LatestNumber> numbers = client.getLatestNumbers(null);

        assertThat(numbers).containsExactly(
                new LatestNumber("+441234567890", "Alice"),
                new LatestNumber("+449876543210", null));
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/db/latest-numbers");
        assertThat(request.getBodySize()).isZero();
    }

    @Test
    void friendlyNameAbsentWhenGatewayReturnsNull() throws Exception {
        server.enqueue(json("{\"success\":true,\"response\":null}"));

        Optional<String> name = client.getFriendlyName("+441234567890");

        assertThat(name).isEmpty();
        assertThat(server.takeRequest().getBody().readUtf8()).isEqualTo("{\"phone_number\":\"+441234567890\"}");
    }

    @Test
    void paginateMessagesRequestsSuccessivePages() throws Exception {
        server.enqueue(json("{\"success\":true,\"response\":[" + message(1) + "," + message(2) + "]}"));
        server.enqueue(json("{\"success\":true,\"response\":[" + message(3) + "]}"));

        List<SmsStoredMessage> all = client.paginateMessages("+441234567890", PaginationOptions.firstPage(2).withReverse(true))
                .collectAll();

        assertThat(all).extracting(SmsStoredMessage::messageId).containsExactly(1L, 2L, 3L);
        assertThat(all.get(0).isOutgoing()).isTrue();
        assertThat(server.takeRequest().getBody().readUtf8())
                .isEqualTo("{\"phone_number\":\"+441234567890\",\"limit\":2,\"offset\":0,\"reverse\":true}");
        assertThat(server.takeRequest().getBody().readUtf8())
                .isEqualTo("{\"phone_number\":\"+441234567890\",\"limit\":2,\"offset\":2,\"reverse\":true}");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void sendSmsExtendsRequestTimeoutByMessageTimeout() throws Exception {
        RecordingAdapter adapter = new RecordingAdapter(
                "{\"success\":true,\"response\":{\"message_id\":1,\"reference_id\":1}}");
        SmsHttpClient recording = new SmsHttpClient(HttpConfig.of("http://gateway:3000"), adapter, CODEC);

        recording.sendSms(OutgoingSmsMessage.simple("+441234567890", "hi").withTimeout(30));
        assertThat(adapter.lastRequest.timeout()).isEqualTo(Duration.ofSeconds(35));

        recording.sendSms(OutgoingSmsMessage.simple("+441234567890", "hi"));
        assertThat(adapter.lastRequest.timeout()).isEqualTo(HttpConfig.DEFAULT_MODEM_TIMEOUT);

        recording.getVersion();
        assertThat(adapter.lastRequest.timeout()).isEqualTo(HttpConfig.DEFAULT_BASE_TIMEOUT);
        assertThat(adapter.lastRequest.header("authorization")).isEmpty();
    }

    @Test
    void transportTimeoutIsReportedAsTimeout() {
        HttpClientAdapter timingOut = request -> {
            throw new HttpTimeoutException("Request timed out");
        };
        SmsHttpClient failing = new SmsHttpClient(HttpConfig.of("http://gateway:3000"), timingOut, CODEC);

        assertThatThrownBy(failing::getPhoneNumber)
                .isInstanceOf(SmsHttpException.RequestFailed.class)
                .satisfies(e -> assertThat(((SmsHttpException.RequestFailed) e).isTimeout()).isTrue());
    }

    private static MockResponse json(String body) {
        return new MockResponse()
                .setResponseCode(200)
                .addHeader("Content-Type", "application/json")
                .setBody(body);
    }

    private static String message(long id) {
        return "{\"message_id\":" + id + ",\"phone_number\":\"+441234567890\",\"message_content\":\"m" + id
                + "\",\"is_outgoing\":true,\"status\":\"sent\",\"created_at\":1700000000}";
    }

    private static final class RecordingAdapter implements HttpClientAdapter {
        private final byte[] body;
        private HttpClientRequest lastRequest;

        RecordingAdapter(String body) {
            this.body = body.getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
            lastRequest = request;
            return new HttpClientResponse() {
                @Override
                public int statusCode() {
                    return 200;
                }

                @Override
                public Optional<String> header(String name) {
                    return "Content-Type".equalsIgnoreCase(name) ? Optional.of("application/json") : Optional.empty();
                }

                @Override
                public byte[] body() {
                    return body;
                }
            };
        }
    }
}
