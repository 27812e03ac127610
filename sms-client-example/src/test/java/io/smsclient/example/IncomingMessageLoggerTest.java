package io.smsclient.example;

import io.smsclient.core.ClientConfig;
import io.smsclient.core.GatewayEvent;
import io.smsclient.core.SmsStoredMessage;
import io.smsclient.core.WebSocketConfig;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IncomingMessageLoggerTest {

    @Test
    void environmentMapsToIncomingOnlyConfig() {
        Properties props = IncomingMessageLogger.propertiesFrom(Map.of(
                IncomingMessageLogger.ENV_WS_URL, "ws://192.168.1.2:3000/ws",
                IncomingMessageLogger.ENV_AUTH, "token"));

        WebSocketConfig ws = ClientConfig.fromProperties(props).websocket().orElseThrow();

        assertThat(ws.authorization()).contains("token");
        assertThat(ws.filteredEvents()).contains(List.of("incoming"));
        assertThat(ws.connectUrl().toString()).isEqualTo("ws://192.168.1.2:3000/ws?events=incoming");
    }

    @Test
    void missingUrlIsRejected() {
        assertThatThrownBy(() -> IncomingMessageLogger.propertiesFrom(Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(IncomingMessageLogger.ENV_WS_URL);
    }

    @Test
    void incomingMessagesAreHandedToWorkers() {
        RecordingExecutor workers = new RecordingExecutor();
        IncomingMessageLogger logger = new IncomingMessageLogger(workers);
        SmsStoredMessage message = new SmsStoredMessage(1, "+441234567890", "hello", null, false, "received", null, null);

        logger.onEvent(new GatewayEvent.IncomingMessage(message));
        logger.onEvent(new GatewayEvent.ConnectionUpdate(true, false));

        assertThat(workers.submitted).hasSize(1);
    }

    /** Records tasks instead of running them. */
    private static final class RecordingExecutor extends AbstractExecutorService {
        private final List<Runnable> submitted = new ArrayList<>();

        @Override
        public void execute(Runnable command) {
            submitted.add(command);
        }

        @Override
        public void shutdown() {
        }

        @Override
        public List<Runnable> shutdownNow() {
            return List.of();
        }

        @Override
        public boolean isShutdown() {
            return false;
        }

        @Override
        public boolean isTerminated() {
            return false;
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) {
            return true;
        }
    }
}
