package io.smsclient.core;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * TLS configuration shared by the event and request channels.
 *
 * <p>The certificate is trusted in addition to nothing else: when set, it replaces the default trust store.
 * Without a {@code TlsConfig} the default trust store is used.
 *
 * @param certificate canonical path of a {@code .pem}, {@code .crt} or {@code .der} certificate file
 */
public record TlsConfig(Path certificate) {

    public TlsConfig {
        certificate = verifyPath(certificate);
    }

    public static TlsConfig of(Path certificate) {
        return new TlsConfig(certificate);
    }

    static Path verifyPath(Path path) {
        Objects.requireNonNull(path, "certificate");
        if (!Files.exists(path)) {
            throw new SmsClientException.InvalidConfig("Certificate filepath does not exist: " + path);
        }
        if (!Files.isRegularFile(path)) {
            throw new SmsClientException.InvalidConfig("Certificate filepath is not a file: " + path);
        }

        Path canonical;
        try {
            canonical = path.toRealPath();
        } catch (IOException e) {
            throw new SmsClientException.InvalidConfig("Invalid certificate path: " + path, e);
        }

        String name = canonical.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".pem") || name.endsWith(".crt") || name.endsWith(".der")) {
            return canonical;
        }
        throw new SmsClientException.InvalidConfig("Invalid certificate file extension: " + path);
    }
}
