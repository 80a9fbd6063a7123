package io.crashreport.sdk;

import io.crashreport.sdk.exception.*;
import io.crashreport.sdk.model.*;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TransportFailureTest {

    private static final String DSN = "https://pub@sentry.example.com/123";

    private static CrashReportClientBuilder base(HttpTransport transport) {
        return CrashReportClient.builder()
                .dsn(DSN)
                .transport(transport)
                .clock(Clock.fixed(Instant.parse("2020-05-01T12:30:45.123Z"), ZoneOffset.UTC))
                .uuidGenerator(() -> "0123456789abcdef0123456789abcdef");
    }

    @Test
    void testIoErrorIsThrownAsConnectionException() {
        CrashReportClient client = base((method, uri, headers, body) -> {
            throw new IOException("connection refused");
        }).build();

        ConnectionException e = assertThrows(ConnectionException.class,
                () -> client.capture(Event.builder().message("boom").build()));
        assertEquals("CONNECTION_ERROR", e.getCode());
        assertTrue(e.getMessage().contains("connection refused"));
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void testFailOpenReturnsFailureAndReportsError() {
        List<Exception> errors = new CopyOnWriteArrayList<>();
        CrashReportClient client = base((method, uri, headers, body) -> {
            throw new IOException("connection reset");
        }).failOpen(errors::add).build();

        CaptureResponse response = client.capture(Event.builder().message("boom").build());
        assertFalse(response.isSuccessful());
        assertTrue(response.getError().contains("connection reset"));
        assertEquals(1, errors.size());
        assertInstanceOf(ConnectionException.class, errors.get(0));
    }

    @Test
    void testInterruptedSendRestoresInterruptFlag() {
        CrashReportClient client = base((method, uri, headers, body) -> {
            throw new InterruptedException();
        }).build();

        assertThrows(ConnectionException.class, () -> client.capture(Event.builder().message("boom").build()));
        assertTrue(Thread.interrupted());
    }

    @Test
    void testPublicKeyOnlyDsnOmitsSecret() {
        AtomicReference<Map<String, String>> sentHeaders = new AtomicReference<>();
        AtomicReference<URI> sentUri = new AtomicReference<>();
        CrashReportClient client = base((method, uri, headers, body) -> {
            sentHeaders.set(headers);
            sentUri.set(uri);
            return TransportResponse.of(200, "{\"id\":\"abc123\"}");
        }).compressPayload(false).build();

        CaptureResponse response = client.capture(Event.builder().message("boom").build());
        assertEquals("abc123", response.getEventId());
        assertEquals(URI.create("https://sentry.example.com/api/123/store/"), sentUri.get());

        String auth = sentHeaders.get().get("X-Sentry-Auth");
        assertEquals("Sentry sentry_version=6, sentry_client=" + SdkInfo.CLIENT_ID
                + ", sentry_timestamp=1588336245123, sentry_key=pub", auth);
        assertFalse(auth.contains("sentry_secret"));
        assertFalse(sentHeaders.get().containsKey("Content-Encoding"));
    }

    @Test
    void testCloseReleasesTransport() {
        AtomicBoolean closed = new AtomicBoolean();
        HttpTransport transport = new HttpTransport() {
            @Override
            public TransportResponse send(String method, URI uri, Map<String, String> headers, byte[] body) {
                return TransportResponse.of(200, "{\"id\":\"1\"}");
            }

            @Override
            public void close() {
                closed.set(true);
            }
        };
        try (CrashReportClient client = base(transport).build()) {
            assertTrue(client.capture(Event.builder().message("boom").build()).isSuccessful());
        }
        assertTrue(closed.get());
    }
}
