package io.smsclient.transport.spi;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link HttpClientAdapter} implementation using OkHttp.
 */
public final class OkHttpClientAdapter implements HttpClientAdapter {

    private final OkHttpClient httpClient;

    public OkHttpClientAdapter(OkHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static OkHttpClientAdapter create() {
        return new OkHttpClientAdapter(new OkHttpClient());
    }

    public static OkHttpClientAdapter create(OkHttpClient httpClient) {
        return new OkHttpClientAdapter(httpClient);
    }

    /**
     * An adapter whose client trusts only the gateway certificate at {@code certificate},
     * for gateways running with a self-signed certificate.
     */
    public static OkHttpClientAdapter trusting(Path certificate) throws IOException, GeneralSecurityException {
        X509TrustManager trustManager = TlsContexts.trustManager(certificate);
        SSLContext context = SSLContext.getInstance("TLS");
        context.init(null, new TrustManager[]{trustManager}, null);
        return new OkHttpClientAdapter(new OkHttpClient.Builder()
                .sslSocketFactory(context.getSocketFactory(), trustManager)
                .build());
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        OkHttpClient client = clientWithTimeout(request);
        Request okRequest = toOkHttpRequest(request);
        try (Response response = client.newCall(okRequest).execute()) {
            return new ByteArrayResponse(response);
        } catch (SocketTimeoutException e) {
            throw new HttpTimeoutException(request.uri(), request.timeout(), e);
        } catch (InterruptedIOException e) {
            // OkHttp reports an expired call timeout as a bare InterruptedIOException.
            throw new HttpTimeoutException(request.uri(), request.timeout(), e);
        } catch (IOException e) {
            throw new HttpClientException(request.uri(), request.method() + " failed", e);
        }
    }

    private OkHttpClient clientWithTimeout(HttpClientRequest request) {
        if (request.timeout() == null) {
            return httpClient;
        }
        long millis = request.timeout().toMillis();
        return httpClient.newBuilder()
                .readTimeout(millis, TimeUnit.MILLISECONDS)
                .writeTimeout(millis, TimeUnit.MILLISECONDS)
                .callTimeout(millis, TimeUnit.MILLISECONDS)
                .build();
    }

    private static Request toOkHttpRequest(HttpClientRequest request) {
        Request.Builder builder = new Request.Builder().url(request.uri().toString());
        request.headers().forEach(builder::header);
        if ("GET".equals(request.method())) {
            return builder.get().build();
        }
        // OkHttp refuses a POST without a body; the gateway accepts an empty one.
        MediaType mediaType = request.header(HttpClientRequest.CONTENT_TYPE).map(MediaType::parse).orElse(null);
        byte[] content = request.hasBody() ? request.body() : new byte[0];
        return builder.method(request.method(), RequestBody.create(content, mediaType)).build();
    }

    private static final class ByteArrayResponse implements HttpClientResponse {
        private final int statusCode;
        private final okhttp3.Headers headers;
        private final byte[] body;

        ByteArrayResponse(Response response) throws IOException {
            this.statusCode = response.code();
            this.headers = response.headers();
            ResponseBody responseBody = response.body();
            this.body = responseBody != null ? responseBody.bytes() : new byte[0];
        }

        @Override public int statusCode() { return statusCode; }
        @Override public Optional<String> header(String name) { return Optional.ofNullable(headers.get(name)); }
        @Override public byte[] body() { return body; }
    }
}
