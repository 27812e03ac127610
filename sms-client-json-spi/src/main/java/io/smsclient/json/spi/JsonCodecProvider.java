package io.smsclient.json.spi;

/**
 * ServiceLoader hook for contributing a {@link JsonCodec}.
 *
 * <p>Register implementations in {@code META-INF/services/io.smsclient.json.spi.JsonCodecProvider}.
 */
public interface JsonCodecProvider {

    JsonCodec codec();
}
