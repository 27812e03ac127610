package io.smsclient.json.jackson;

import io.smsclient.json.spi.JsonCodec;
import io.smsclient.json.spi.JsonCodecProvider;

/**
 * Registers {@link JacksonJsonCodec} for {@code JsonCodecs.load()}. Every lookup shares one codec.
 */
public final class JacksonJsonCodecProvider implements JsonCodecProvider {

    private static final JacksonJsonCodec SHARED = new JacksonJsonCodec();

    @Override
    public JsonCodec codec() {
        return SHARED;
    }
}
