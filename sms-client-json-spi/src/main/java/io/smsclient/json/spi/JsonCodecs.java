package io.smsclient.json.spi;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Locates the {@link JsonCodec} on the classpath.
 */
public final class JsonCodecs {

    private JsonCodecs() {
    }

    /**
     * Returns the codec of the first registered {@link JsonCodecProvider}.
     *
     * @throws IllegalStateException if no provider is registered
     */
    public static JsonCodec load() {
        return load(JsonCodecs.class.getClassLoader());
    }

    public static JsonCodec load(ClassLoader classLoader) {
        Iterator<JsonCodecProvider> it = ServiceLoader.load(JsonCodecProvider.class, classLoader).iterator();
        if (!it.hasNext()) {
            throw new IllegalStateException("No JsonCodecProvider found on the classpath; add sms-client-json-jackson "
                    + "or pass a JsonCodec explicitly");
        }
        return it.next().codec();
    }
}
