package io.crashreport.sdk.model;

import io.crashreport.sdk.SdkInfo;
import io.crashreport.sdk.stacktrace.StackFrameFilter;
import io.crashreport.sdk.stacktrace.StackTraceNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An event to be reported to the ingestion service.
 *
 * <p>Generally an event carries either a {@link #getMessage() message} or an
 * {@link #getException() exception}; every field is optional. Instances are immutable, use
 * {@link #builder()} to create them.
 *
 * <pre>{@code
 * Event event = Event.builder()
 *     .message("Payment declined")
 *     .level(SeverityLevel.WARNING)
 *     .tags(Map.of("gateway", "stripe"))
 *     .build();
 * }</pre>
 */
public final class Event {

    /**
     * Refers to the default fingerprinting algorithm. Only needed when supplementing the
     * default fingerprint with custom values, e.g. {@code List.of(DEFAULT_FINGERPRINT, "foo")}.
     */
    public static final String DEFAULT_FINGERPRINT = "{{ default }}";

    private final String loggerName;
    private final String serverName;
    private final String release;
    private final String environment;
    private final String message;
    private final String transaction;
    private final ExceptionInfo exception;
    private final Object stackTrace;
    private final SeverityLevel level;
    private final String culprit;
    private final Map<String, String> tags;
    private final Map<String, Object> extra;
    private final List<String> fingerprint;
    private final User userContext;
    private final List<Breadcrumb> breadcrumbs;

    private Event(Builder b) {
        this.loggerName = b.loggerName;
        this.serverName = b.serverName;
        this.release = b.release;
        this.environment = b.environment;
        this.message = b.message;
        this.transaction = b.transaction;
        this.exception = b.exception;
        this.stackTrace = b.stackTrace;
        this.level = b.level;
        this.culprit = b.culprit;
        this.tags = b.tags != null ? Collections.unmodifiableMap(new LinkedHashMap<>(b.tags)) : null;
        this.extra = b.extra != null ? Collections.unmodifiableMap(new LinkedHashMap<>(b.extra)) : null;
        this.fingerprint = b.fingerprint != null ? List.copyOf(b.fingerprint) : null;
        this.userContext = b.userContext;
        this.breadcrumbs = b.breadcrumbs != null ? List.copyOf(b.breadcrumbs) : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** The logger that logged the event. */
    public String getLoggerName() { return loggerName; }
    /** Identifies the server that logged the event. */
    public String getServerName() { return serverName; }
    /** Version of the application that logged the event. */
    public String getRelease() { return release; }
    /** Deployment environment, e.g. "production" or "staging". */
    public String getEnvironment() { return environment; }
    public String getMessage() { return message; }
    /** Name of the transaction that generated the event, e.g. a route {@code "/users/<username>/"}. */
    public String getTransaction() { return transaction; }
    public ExceptionInfo getException() { return exception; }
    /** A {@code StackTraceElement[]}, {@code Throwable} or {@code String}, or null. */
    public Object getStackTrace() { return stackTrace; }
    public SeverityLevel getLevel() { return level; }
    /** What caused the event to be logged. */
    public String getCulprit() { return culprit; }
    public Map<String, String> getTags() { return tags; }
    public Map<String, Object> getExtra() { return extra; }
    public List<String> getFingerprint() { return fingerprint; }
    /** Overrides the client-level user for this event. */
    public User getUserContext() { return userContext; }
    public List<Breadcrumb> getBreadcrumbs() { return breadcrumbs; }

    /** Copy this event into a builder, e.g. to change one field. */
    public Builder toBuilder() {
        Builder b = new Builder()
                .loggerName(loggerName)
                .serverName(serverName)
                .release(release)
                .environment(environment)
                .message(message)
                .transaction(transaction)
                .exception(exception)
                .level(level)
                .culprit(culprit)
                .tags(tags)
                .extra(extra)
                .fingerprint(fingerprint)
                .userContext(userContext)
                .breadcrumbs(breadcrumbs);
        b.stackTrace = stackTrace;
        return b;
    }

    public Map<String, Object> toJson() {
        return toJson(null);
    }

    /**
     * Wire representation of this event. Absent fields and empty collections are left out.
     *
     * @param stackFrameFilter optional filter applied to the normalized frames
     */
    public Map<String, Object> toJson(StackFrameFilter stackFrameFilter) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("platform", SdkInfo.PLATFORM);
        json.put("sdk", SdkInfo.toJson());

        if (loggerName != null) json.put("logger", loggerName);
        if (serverName != null) json.put("server_name", serverName);
        if (release != null) json.put("release", release);
        if (environment != null) json.put("environment", environment);
        if (message != null) json.put("message", message);
        if (transaction != null) json.put("transaction", transaction);

        if (exception != null) {
            Map<String, Object> value = new LinkedHashMap<>();
            if (exception.getType() != null) value.put("type", exception.getType());
            if (exception.getValue() != null) value.put("value", exception.getValue());
            json.put("exception", List.of(value));
        }

        if (stackTrace != null) {
            json.put("stacktrace", Map.of("frames", StackTraceNormalizer.encode(stackTrace, stackFrameFilter)));
        }

        if (level != null) json.put("level", level.getName());
        if (culprit != null) json.put("culprit", culprit);
        if (tags != null && !tags.isEmpty()) json.put("tags", tags);
        if (extra != null && !extra.isEmpty()) json.put("extra", extra);

        if (userContext != null) {
            Map<String, Object> user = userContext.toJson();
            if (!user.isEmpty()) json.put("user", user);
        }

        if (fingerprint != null && !fingerprint.isEmpty()) json.put("fingerprint", fingerprint);

        if (breadcrumbs != null && !breadcrumbs.isEmpty()) {
            List<Map<String, Object>> values = new ArrayList<>(breadcrumbs.size());
            for (Breadcrumb breadcrumb : breadcrumbs) {
                values.add(breadcrumb.toJson());
            }
            json.put("breadcrumbs", Map.of("values", values));
        }
        return json;
    }

    /** Builder for {@link Event}. */
    public static final class Builder {
        private String loggerName;
        private String serverName;
        private String release;
        private String environment;
        private String message;
        private String transaction;
        private ExceptionInfo exception;
        private Object stackTrace;
        private SeverityLevel level;
        private String culprit;
        private Map<String, String> tags;
        private Map<String, Object> extra;
        private List<String> fingerprint;
        private User userContext;
        private List<Breadcrumb> breadcrumbs;

        private Builder() {}

        public Builder loggerName(String v) { this.loggerName = v; return this; }
        public Builder serverName(String v) { this.serverName = v; return this; }
        public Builder release(String v) { this.release = v; return this; }
        public Builder environment(String v) { this.environment = v; return this; }
        public Builder message(String v) { this.message = v; return this; }
        public Builder transaction(String v) { this.transaction = v; return this; }
        public Builder exception(ExceptionInfo v) { this.exception = v; return this; }

        /** Shorthand for {@code exception(ExceptionInfo.of(throwable))}; does not set the stack trace. */
        public Builder exception(Throwable throwable) {
            this.exception = throwable != null ? ExceptionInfo.of(throwable) : null;
            return this;
        }

        public Builder stackTrace(StackTraceElement[] v) { this.stackTrace = v; return this; }
        public Builder stackTrace(Throwable v) { this.stackTrace = v; return this; }
        /** A trace in {@link Throwable#printStackTrace()} format. */
        public Builder stackTrace(String v) { this.stackTrace = v; return this; }
        public Builder level(SeverityLevel v) { this.level = v; return this; }
        public Builder culprit(String v) { this.culprit = v; return this; }
        public Builder tags(Map<String, String> v) { this.tags = v; return this; }
        /** Values must be serializable to JSON. */
        public Builder extra(Map<String, Object> v) { this.extra = v; return this; }
        public Builder fingerprint(List<String> v) { this.fingerprint = v; return this; }
        public Builder userContext(User v) { this.userContext = v; return this; }
        public Builder breadcrumbs(List<Breadcrumb> v) { this.breadcrumbs = v; return this; }

        public Event build() {
            return new Event(this);
        }
    }
}
