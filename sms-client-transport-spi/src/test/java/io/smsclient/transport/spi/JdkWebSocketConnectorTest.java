package io.smsclient.transport.spi;

import okhttp3.WebSocketListener;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JdkWebSocketConnectorTest extends EventChannelConnectorContractTest {

    @Override
    EventChannelConnector createConnector() {
        return JdkWebSocketConnector.create();
    }

    @Test
    void pongRefreshesIdleTime() throws Exception {
        server.enqueue(upgrade(new WebSocketListener() {}));
        EventChannel channel = connector.connect(wsUri("/ws"), Map.of(), WAIT);
        try {
            Thread.sleep(300);
            assertThat(channel.idleNanos()).isGreaterThanOrEqualTo(Duration.ofMillis(300).toNanos());

            channel.ping();

            long deadline = System.nanoTime() + WAIT.toNanos();
            while (channel.idleNanos() >= Duration.ofMillis(300).toNanos() && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertThat(channel.idleNanos()).isLessThan(Duration.ofMillis(300).toNanos());
        } finally {
            channel.abort();
        }
    }
}
