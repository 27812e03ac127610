package io.smsclient.transport.spi;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.util.Collection;

/**
 * Builds TLS trust material from a certificate file, for gateways with self-signed certificates.
 *
 * <p>Accepts PEM (one or more certificates) and DER encodings.
 */
public final class TlsContexts {

    private TlsContexts() {
    }

    /**
     * Returns an {@link SSLContext} that trusts exactly the certificates in {@code certificate}.
     */
    public static SSLContext fromCertificate(Path certificate) throws IOException, GeneralSecurityException {
        SSLContext context = SSLContext.getInstance("TLS");
        context.init(null, new TrustManager[]{trustManager(certificate)}, null);
        return context;
    }

    /**
     * Returns a trust manager that trusts exactly the certificates in {@code certificate}.
     */
    public static X509TrustManager trustManager(Path certificate) throws IOException, GeneralSecurityException {
        Collection<? extends Certificate> certificates;
        try (InputStream in = Files.newInputStream(certificate)) {
            certificates = CertificateFactory.getInstance("X.509").generateCertificates(in);
        }
        if (certificates.isEmpty()) {
            throw new GeneralSecurityException("No certificates found in " + certificate);
        }

        KeyStore keyStore = KeyStore.getInstance(KeyStore.getDefaultType());
        keyStore.load(null, null);
        int i = 0;
        for (Certificate c : certificates) {
            keyStore.setCertificateEntry("gateway-" + i++, c);
        }

        TrustManagerFactory factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        factory.init(keyStore);
        for (TrustManager tm : factory.getTrustManagers()) {
            if (tm instanceof X509TrustManager x509) {
                return x509;
            }
        }
        throw new GeneralSecurityException("No X509TrustManager available");
    }
}
