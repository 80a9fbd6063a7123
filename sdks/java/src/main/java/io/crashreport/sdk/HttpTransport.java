package io.crashreport.sdk;

import java.io.IOException;
import java.net.URI;
import java.util.Map;

/**
 * Sends one HTTP request and returns the raw response.
 *
 * <p>Connection pooling, TLS and timeouts belong to the implementation. The client calls
 * {@link #close()} when it is closed itself.
 */
public interface HttpTransport extends AutoCloseable {

    TransportResponse send(String method, URI uri, Map<String, String> headers, byte[] body)
            throws IOException, InterruptedException;

    @Override
    default void close() {}
}
