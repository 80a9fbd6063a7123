package io.crashreport.sdk;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Status, headers and body of an HTTP response. Header lookup ignores case. */
public final class TransportResponse {
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;

    public TransportResponse(int statusCode, Map<String, List<String>> headers, String body) {
        this.statusCode = statusCode;
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, values) -> {
                if (name != null) copy.put(name, List.copyOf(values));
            });
        }
        this.headers = Collections.unmodifiableMap(copy);
        this.body = body;
    }

    public static TransportResponse of(int statusCode, String body) {
        return new TransportResponse(statusCode, Map.of(), body);
    }

    public int statusCode() { return statusCode; }
    public Map<String, List<String>> headers() { return headers; }
    public String body() { return body; }

    /** First value of the named header, or null. */
    public String header(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
