package io.crashreport.sdk;

import io.crashreport.sdk.exception.*;
import io.crashreport.sdk.model.*;
import io.crashreport.sdk.stacktrace.StackFrameFilter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Reports crashes and events to a Sentry-compatible ingestion endpoint.
 *
 * <p>Each capture sends exactly one HTTP request and returns a {@link CaptureResponse}. Non-200
 * responses become failed responses; transport errors are thrown as {@link ConnectionException}
 * unless the client was built with {@link CrashReportClientBuilder#failOpen(Consumer)}.
 * Use {@link #builder()} or {@link #fromEnv()} to create instances.
 *
 * <p>Implements {@link AutoCloseable} for use with try-with-resources.
 */
public class CrashReportClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CrashReportClient.class);

    private final Dsn dsn;
    private final PayloadAssembler assembler;
    private final PayloadCodec codec;
    private final HttpTransport transport;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final UuidGenerator uuidGenerator;
    private final Executor executor;
    private final boolean failOpen;
    private final Consumer<Exception> onError;

    private volatile User userContext;

    CrashReportClient(CrashReportClientBuilder b) {
        if (b.dsn == null) {
            throw new ConfigurationException("A DSN is required");
        }
        this.dsn = Dsn.parse(b.dsn);
        this.assembler = new PayloadAssembler(b.environmentAttributes);
        this.objectMapper = b.objectMapper != null ? b.objectMapper : createDefaultMapper();
        this.codec = new PayloadCodec(objectMapper, b.compressPayload);
        this.transport = b.transport != null ? b.transport
                : b.httpClient != null ? new JdkHttpTransport(b.httpClient, b.timeout)
                : new JdkHttpTransport(b.timeout);
        this.clock = b.clock != null ? b.clock : Clock.systemUTC();
        this.uuidGenerator = b.uuidGenerator != null ? b.uuidGenerator : UuidGenerator.randomWithoutDashes();
        this.executor = b.executor;
        this.failOpen = b.failOpen;
        this.onError = b.onError != null ? b.onError : e -> log.error("CrashReport error: {}", e.getMessage(), e);
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    /** Create a new builder. */
    public static CrashReportClientBuilder builder() {
        return new CrashReportClientBuilder();
    }

    /**
     * Create a client from environment variables.
     * Reads {@code CRASHREPORT_DSN} (required), and {@code CRASHREPORT_ENVIRONMENT},
     * {@code CRASHREPORT_RELEASE} and {@code CRASHREPORT_SERVER_NAME} as environment attributes.
     */
    public static CrashReportClient fromEnv() {
        return fromEnv(System.getenv());
    }

    static CrashReportClient fromEnv(Map<String, String> env) {
        String dsn = env.get("CRASHREPORT_DSN");
        if (dsn == null || dsn.isBlank()) {
            throw new ConfigurationException("CRASHREPORT_DSN is not set");
        }
        Event attributes = Event.builder()
                .environment(env.get("CRASHREPORT_ENVIRONMENT"))
                .release(env.get("CRASHREPORT_RELEASE"))
                .serverName(env.get("CRASHREPORT_SERVER_NAME"))
                .build();
        return builder()
                .dsn(dsn)
                .environmentAttributes(attributes)
                .build();
    }

    @Override
    public void close() {
        transport.close();
    }

    // ─── User context ──────────────────────────────────────────

    /** User attached to every event that does not carry its own. */
    public User getUserContext() { return userContext; }

    /**
     * Replace the client-level user. Captures that read the context after this call use the
     * new value; captures already assembling their payload may still use the old one.
     */
    public void setUserContext(User userContext) {
        this.userContext = userContext;
    }

    // ─── Capture ───────────────────────────────────────────────

    /** Report an event. */
    public CaptureResponse capture(Event event) {
        return capture(event, null);
    }

    /**
     * Report an event.
     *
     * @param stackFrameFilter receives the normalized frames just before they are encoded
     */
    public CaptureResponse capture(Event event, StackFrameFilter stackFrameFilter) {
        Objects.requireNonNull(event, "event");
        Instant now = clock.instant();
        String eventId = uuidGenerator.generate();

        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("project", dsn.getProjectId());
        envelope.put("event_id", eventId);
        envelope.put("timestamp", SdkInfo.TIMESTAMP_FORMAT.format(now));

        Map<String, Object> payload = assembler.assemble(envelope, userContext, event, stackFrameFilter);
        byte[] body = codec.encode(payload);

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", SdkInfo.CLIENT_ID);
        headers.put("Content-Type", PayloadCodec.CONTENT_TYPE);
        headers.put(AuthHeader.NAME, AuthHeader.build(SdkInfo.CLIENT_ID, now, dsn.getPublicKey(), dsn.getSecretKey()));
        if (codec.isCompressing()) {
            headers.put("Content-Encoding", codec.contentEncoding());
        }

        log.debug("Submitting event {} to {} ({} bytes)", eventId, dsn.getStoreUri(), body.length);
        try {
            return send(dsn.getStoreUri(), headers, body);
        } catch (ConnectionException e) {
            if (failOpen) {
                onError.accept(e);
                return CaptureResponse.failure(e.getMessage());
            }
            throw e;
        }
    }

    /** Report an event (async). */
    public CompletableFuture<CaptureResponse> captureAsync(Event event) {
        return captureAsync(event, null);
    }

    public CompletableFuture<CaptureResponse> captureAsync(Event event, StackFrameFilter stackFrameFilter) {
        return executor != null
                ? CompletableFuture.supplyAsync(() -> capture(event, stackFrameFilter), executor)
                : CompletableFuture.supplyAsync(() -> capture(event, stackFrameFilter));
    }

    /** Report a throwable together with its own stack trace. */
    public CaptureResponse captureException(Throwable throwable) {
        return captureException(throwable, null);
    }

    public CaptureResponse captureException(Throwable throwable, StackFrameFilter stackFrameFilter) {
        Event event = Event.builder()
                .exception(throwable)
                .stackTrace(throwable)
                .build();
        return capture(event, stackFrameFilter);
    }

    /**
     * Report an error described by {@code exception}.
     *
     * @param stackTrace a {@code StackTraceElement[]}, {@code Throwable}, {@code String} or null
     */
    public CaptureResponse captureException(ExceptionInfo exception, Object stackTrace, StackFrameFilter stackFrameFilter) {
        Event.Builder builder = Event.builder().exception(exception);
        if (stackTrace instanceof StackTraceElement[]) {
            builder.stackTrace((StackTraceElement[]) stackTrace);
        } else if (stackTrace instanceof Throwable) {
            builder.stackTrace((Throwable) stackTrace);
        } else if (stackTrace != null) {
            builder.stackTrace(stackTrace.toString());
        }
        return capture(builder.build(), stackFrameFilter);
    }

    public CompletableFuture<CaptureResponse> captureExceptionAsync(Throwable throwable) {
        return captureAsync(Event.builder().exception(throwable).stackTrace(throwable).build());
    }

    /** Report a plain message. */
    public CaptureResponse captureMessage(String message, SeverityLevel level) {
        return capture(Event.builder().message(message).level(level).build());
    }

    public CompletableFuture<CaptureResponse> captureMessageAsync(String message, SeverityLevel level) {
        return captureAsync(Event.builder().message(message).level(level).build());
    }

    // ─── Accessors ─────────────────────────────────────────────

    public Dsn getDsn() { return dsn; }

    /** Endpoint events are POSTed to. */
    public URI getStoreUri() { return dsn.getStoreUri(); }

    public Event getEnvironmentAttributes() { return assembler.getEnvironmentAttributes(); }

    public boolean isCompressPayload() { return codec.isCompressing(); }

    @Override
    public String toString() {
        return "CrashReportClient(\"" + dsn.getStoreUri() + "\")";
    }

    // ─── Internal ──────────────────────────────────────────────

    private CaptureResponse send(URI uri, Map<String, String> headers, byte[] body) {
        TransportResponse response;
        try {
            response = transport.send("POST", uri, headers, body);
        } catch (IOException e) {
            throw new ConnectionException("Failed to connect to " + uri + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("Request interrupted", e);
        }

        if (response.statusCode() != 200) {
            String errorMessage = "Sentry.io responded with HTTP " + response.statusCode();
            String reason = response.header("x-sentry-error");
            if (reason != null) {
                errorMessage += ": " + reason;
            }
            log.warn("Event rejected: {}", errorMessage);
            return CaptureResponse.failure(errorMessage);
        }

        String eventId;
        try {
            JsonNode node = objectMapper.readTree(response.body());
            eventId = node != null && node.hasNonNull("id") ? node.get("id").asText() : null;
        } catch (Exception e) {
            throw new CrashReportException("Failed to parse response: " + e.getMessage(), e, response.statusCode(), "PARSE_ERROR");
        }
        log.debug("Event accepted with id {}", eventId);
        return CaptureResponse.success(eventId);
    }
}
