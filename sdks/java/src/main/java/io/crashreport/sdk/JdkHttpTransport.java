package io.crashreport.sdk;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/** {@link HttpTransport} backed by {@link java.net.http.HttpClient}. */
public class JdkHttpTransport implements HttpTransport {

    private final HttpClient httpClient;
    private final Duration timeout;

    public JdkHttpTransport(Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), timeout);
    }

    public JdkHttpTransport(HttpClient httpClient, Duration timeout) {
        this.httpClient = httpClient;
        this.timeout = timeout;
    }

    @Override
    public TransportResponse send(String method, URI uri, Map<String, String> headers, byte[] body)
            throws IOException, InterruptedException {
        HttpRequest.Builder reqBuilder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout);
        headers.forEach(reqBuilder::header);
        if (body != null) {
            reqBuilder.method(method, HttpRequest.BodyPublishers.ofByteArray(body));
        } else {
            reqBuilder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        HttpResponse<String> response = httpClient.send(reqBuilder.build(), HttpResponse.BodyHandlers.ofString());
        return new TransportResponse(response.statusCode(), response.headers().map(), response.body());
    }

    @Override
    public void close() {
        // HttpClient doesn't need explicit close in Java 17
    }
}
