package io.smsclient.core;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebSocketConfigTest {

    @Test
    void defaults() {
        WebSocketConfig config = WebSocketConfig.of("ws://gateway:3000/ws");

        assertThat(config.autoReconnect()).isTrue();
        assertThat(config.reconnectInterval()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.maxReconnectInterval()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.pingInterval()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.pingTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.filteredEvents()).isEmpty();
        assertThat(config.connectUrl()).isEqualTo(URI.create("ws://gateway:3000/ws"));
    }

    @Test
    void connectUrlCarriesEventFilter() {
        WebSocketConfig config = WebSocketConfig.builder("ws://gateway:3000/ws")
                .filteredEvents(List.of("incoming", "modem_status_update"))
                .build();

        assertThat(config.connectUrl().getQuery()).isEqualTo("events=incoming,modem_status_update");
        assertThat(config.url()).isEqualTo(URI.create("ws://gateway:3000/ws"));
    }

    @Test
    void toBuilderCopiesEverySetting() {
        WebSocketConfig original = WebSocketConfig.builder("ws://gateway:3000/ws")
                .autoReconnect(false)
                .pingInterval(Duration.ofSeconds(3))
                .maxReconnectAttempts(4)
                .filteredEvents(List.of("incoming"))
                .build();

        WebSocketConfig copy = original.withAuth("token");

        assertThat(copy.authorization()).contains("token");
        assertThat(copy.autoReconnect()).isFalse();
        assertThat(copy.pingInterval()).isEqualTo(Duration.ofSeconds(3));
        assertThat(copy.maxReconnectAttempts()).contains(4);
        assertThat(copy.filteredEvents()).contains(List.of("incoming"));
        assertThat(original.authorization()).isEmpty();
    }

    @Test
    void rejectsInvalidIntervals() {
        assertThatThrownBy(() -> WebSocketConfig.builder("ws://gateway:3000/ws").pingInterval(Duration.ZERO).build())
                .isInstanceOf(SmsClientException.InvalidConfig.class);
        assertThatThrownBy(() -> WebSocketConfig.builder("ws://gateway:3000/ws")
                .reconnectInterval(Duration.ofSeconds(10))
                .maxReconnectInterval(Duration.ofSeconds(5))
                .build())
                .isInstanceOf(SmsClientException.InvalidConfig.class);
        assertThatThrownBy(() -> WebSocketConfig.builder("ws://gateway:3000/ws").maxReconnectAttempts(-1).build())
                .isInstanceOf(SmsClientException.InvalidConfig.class);
    }

    @Test
    void httpConfigModemTimeoutFallsBackToBase() {
        HttpConfig defaults = HttpConfig.of("http://gateway:3000");
        HttpConfig noModem = defaults.toBuilder().modemTimeout(null).build();

        assertThat(defaults.baseTimeout()).isEqualTo(HttpConfig.DEFAULT_BASE_TIMEOUT);
        assertThat(defaults.modemTimeout()).contains(HttpConfig.DEFAULT_MODEM_TIMEOUT);
        assertThat(noModem.modemTimeout()).isEmpty();
        assertThatThrownBy(() -> HttpConfig.builder("http://gateway:3000").baseTimeout(Duration.ofSeconds(-1)).build())
                .isInstanceOf(SmsClientException.InvalidConfig.class);
    }
}
