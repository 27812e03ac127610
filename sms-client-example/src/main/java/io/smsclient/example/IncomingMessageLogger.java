package io.smsclient.example;

import io.smsclient.client.SmsClient;
import io.smsclient.client.ws.GatewayEventListener;
import io.smsclient.core.ClientConfig;
import io.smsclient.core.GatewayEvent;
import io.smsclient.core.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Listens for incoming SMS messages and logs each one from a worker thread.
 *
 * <p>Configured from the environment:
 * <ul>
 *   <li>{@code SMS_GATEWAY_WS_URL} (required), e.g. {@code ws://192.168.1.2:3000/ws}</li>
 *   <li>{@code SMS_GATEWAY_AUTH} (optional)</li>
 *   <li>{@code SMS_GATEWAY_CERTIFICATE} (optional) path to the gateway's certificate</li>
 * </ul>
 */
public final class IncomingMessageLogger implements GatewayEventListener {

    private static final Logger log = LoggerFactory.getLogger(IncomingMessageLogger.class);

    static final String ENV_WS_URL = "SMS_GATEWAY_WS_URL";
    static final String ENV_AUTH = "SMS_GATEWAY_AUTH";
    static final String ENV_CERTIFICATE = "SMS_GATEWAY_CERTIFICATE";

    private final ExecutorService workers;

    IncomingMessageLogger(ExecutorService workers) {
        this.workers = workers;
    }

    @Override
    public void onEvent(GatewayEvent event) {
        if (event instanceof GatewayEvent.IncomingMessage incoming) {
            workers.execute(() -> log.info("SMS from {}: {}", incoming.phoneNumber(), incoming.messageContent()));
        } else if (event instanceof GatewayEvent.ConnectionUpdate update) {
            log.info("Connected: {} (reconnecting: {})", update.connected(), update.reconnect());
        }
    }

    /**
     * Maps the example's environment variables to {@code sms.*} properties, receiving incoming messages only.
     */
    static Properties propertiesFrom(Map<String, String> env) {
        String url = env.get(ENV_WS_URL);
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Missing required environment variable " + ENV_WS_URL);
        }
        Properties props = new Properties();
        props.setProperty(ClientConfig.PREFIX + "ws.url", url);
        props.setProperty(ClientConfig.PREFIX + "ws.events", String.join(",", List.of(Protocol.EV_INCOMING)));
        String auth = env.get(ENV_AUTH);
        if (auth != null) {
            props.setProperty(ClientConfig.PREFIX + "auth", auth);
        }
        String certificate = env.get(ENV_CERTIFICATE);
        if (certificate != null) {
            props.setProperty(ClientConfig.PREFIX + "tls.certificate", certificate);
        }
        return props;
    }

    public static void main(String[] args) {
        ClientConfig config = ClientConfig.fromProperties(propertiesFrom(System.getenv()));
        SmsClient client = SmsClient.create(config);

        AtomicInteger ids = new AtomicInteger();
        ExecutorService workers = Executors.newFixedThreadPool(4, r -> {
            Thread t = new Thread(r, "sms-example-worker-" + ids.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        Runtime.getRuntime().addShutdownHook(new Thread(client::stop, "sms-example-shutdown"));

        client.onMessage(new IncomingMessageLogger(workers));
        log.info("Listening on {}", config.websocket().orElseThrow().connectUrl());
        try {
            client.startBlocking();
        } finally {
            workers.shutdown();
        }
    }
}
