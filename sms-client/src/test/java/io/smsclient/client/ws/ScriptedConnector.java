package io.smsclient.client.ws;

import io.smsclient.transport.spi.EventChannel;
import io.smsclient.transport.spi.EventChannelConnector;
import io.smsclient.transport.spi.HttpClientException;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Connector that plays back a script of outcomes, one per connect attempt: a {@link ScriptedChannel} to open
 * or an {@link HttpClientException} to throw. An exhausted script refuses every further connect.
 */
final class ScriptedConnector implements EventChannelConnector {

    private final BlockingQueue<Object> script = new LinkedBlockingQueue<>();
    final List<URI> uris = new CopyOnWriteArrayList<>();
    final List<Map<String, String>> headers = new CopyOnWriteArrayList<>();

    ScriptedConnector open(ScriptedChannel channel) {
        script.add(channel);
        return this;
    }

    ScriptedConnector fail(HttpClientException failure) {
        script.add(failure);
        return this;
    }

    ScriptedConnector refuse(int times) {
        for (int i = 0; i < times; i++) {
            fail(new HttpClientException("Connection refused"));
        }
        return this;
    }

    int attempts() {
        return uris.size();
    }

    @Override
    public EventChannel connect(URI uri, Map<String, String> headers, Duration timeout) throws HttpClientException {
        this.uris.add(uri);
        this.headers.add(headers);
        Object next = script.poll();
        if (next == null) {
            throw new HttpClientException("Connection refused");
        }
        if (next instanceof HttpClientException) {
            throw (HttpClientException) next;
        }
        return (ScriptedChannel) next;
    }
}
