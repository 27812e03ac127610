package io.smsclient.json.jackson;

import io.smsclient.core.PaginationOptions;
import io.smsclient.core.SmsStoredMessage;
import io.smsclient.json.spi.JsonCodec;
import io.smsclient.json.spi.JsonCodecs;
import io.smsclient.json.spi.JsonException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonJsonCodecTest {

    private final JacksonJsonCodec codec = new JacksonJsonCodec();

    @Test
    void serviceLoaderFindsJacksonCodec() {
        JsonCodec loaded = JsonCodecs.load();

        assertThat(loaded).isInstanceOf(JacksonJsonCodec.class);
        assertThat(JsonCodecs.load()).isSameAs(loaded);
    }

    @Test
    void readsSnakeCaseIntoRecords() throws Exception {
        String json = "{\"message_id\":3,\"phone_number\":\"+441234567890\",\"message_content\":\"hi\","
                + "\"message_reference\":null,\"is_outgoing\":true,\"status\":\"delivered\","
                + "\"created_at\":1700000000,\"completed_at\":1700000060,\"unknown_field\":1}";

        SmsStoredMessage message = codec.readValue(json, SmsStoredMessage.class);

        assertThat(message.messageId()).isEqualTo(3L);
        assertThat(message.isOutgoing()).isTrue();
        assertThat(message.messageReference()).isNull();
        assertThat(message.completedAt()).isEqualTo(1_700_000_060L);
    }

    @Test
    void omitsNullFieldsOnWrite() throws Exception {
        assertThat(codec.writeString(new PaginationOptions(10L, null, null))).isEqualTo("{\"limit\":10}");
        assertThat(codec.writeString(new PaginationOptions(null, 5L, true))).isEqualTo("{\"offset\":5,\"reverse\":true}");
    }

    @Test
    void readAtTreatsMissingAndNullAlike() throws Exception {
        byte[] data = bytes("{\"success\":true,\"response\":null,\"nested\":{\"value\":\"x\"}}");

        assertThat(codec.readAt(data, "/success", Boolean.class)).contains(true);
        assertThat(codec.readAt(data, "/nested/value", String.class)).contains("x");
        assertThat(codec.readAt(data, "/response", String.class)).isEmpty();
        assertThat(codec.readAt(data, "/error", String.class)).isEmpty();
    }

    @Test
    void readListAtDecodesElements() throws Exception {
        byte[] data = bytes("{\"response\":[{\"limit\":1},{\"offset\":2}]}");

        assertThat(codec.readListAt(data, "/response", PaginationOptions.class)).contains(List.of(
                new PaginationOptions(1L, null, null),
                new PaginationOptions(null, 2L, null)));
        assertThat(codec.readListAt(data, "/missing", PaginationOptions.class)).isEmpty();
    }

    @Test
    void readListAtRejectsNonArray() {
        byte[] data = bytes("{\"response\":{\"limit\":1}}");

        assertThatThrownBy(() -> codec.readListAt(data, "/response", PaginationOptions.class))
                .isInstanceOfSatisfying(JsonException.class, e -> {
                    assertThat(e).hasMessageContaining("Expected an array");
                    assertThat(e.pointer()).contains("/response");
                });
    }

    @Test
    void rejectsEmptyAndMalformedInput() {
        assertThatThrownBy(() -> codec.readAt(new byte[0], "/type", String.class)).isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readAt(bytes("{\"type\":"), "/type", String.class)).isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readAt(bytes("{\"limit\":\"ten\"}"), "", PaginationOptions.class))
                .isInstanceOf(JsonException.class);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
