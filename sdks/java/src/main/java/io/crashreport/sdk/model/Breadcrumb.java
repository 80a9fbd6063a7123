package io.crashreport.sdk.model;

import io.crashreport.sdk.SdkInfo;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A timestamped trail entry describing something that happened before an event was captured.
 *
 * <pre>{@code
 * {
 *   "timestamp": "2017-01-02T00:00:00",
 *   "message": "message",
 *   "category": "ui.click",
 *   "data": {"key": "value"},
 *   "level": "info",
 *   "type": "default"
 * }
 * }</pre>
 */
public final class Breadcrumb {

    private final String message;
    private final String category;
    private final Map<String, String> data;
    private final SeverityLevel level;
    private final String type;
    private final Instant timestamp;

    private Breadcrumb(Builder b) {
        this.timestamp = Objects.requireNonNull(b.timestamp, "Breadcrumb timestamp is required");
        this.message = b.message;
        this.category = b.category;
        this.data = b.data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(b.data)) : null;
        this.level = b.level;
        this.type = b.type;
    }

    /** Shorthand for a breadcrumb with just a message and a timestamp. */
    public static Breadcrumb of(String message, Instant timestamp) {
        return builder(timestamp).message(message).build();
    }

    public static Builder builder(Instant timestamp) {
        return new Builder(timestamp);
    }

    public String getMessage() { return message; }
    public String getCategory() { return category; }
    public Map<String, String> getData() { return data; }
    public SeverityLevel getLevel() { return level; }
    public String getType() { return type; }
    public Instant getTimestamp() { return timestamp; }

    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("timestamp", SdkInfo.TIMESTAMP_FORMAT.format(timestamp));
        if (message != null) json.put("message", message);
        if (category != null) json.put("category", category);
        if (data != null && !data.isEmpty()) json.put("data", new LinkedHashMap<>(data));
        if (level != null) json.put("level", level.getName());
        if (type != null) json.put("type", type);
        return json;
    }

    /** Builder for {@link Breadcrumb}. Level defaults to {@link SeverityLevel#INFO}. */
    public static final class Builder {
        private final Instant timestamp;
        private String message;
        private String category;
        private Map<String, String> data;
        private SeverityLevel level = SeverityLevel.INFO;
        private String type;

        private Builder(Instant timestamp) {
            this.timestamp = timestamp;
        }

        public Builder message(String message) { this.message = message; return this; }
        /** A dot-separated source, e.g. {@code "ui.click"}. */
        public Builder category(String category) { this.category = category; return this; }
        public Builder data(Map<String, String> data) { this.data = data; return this; }
        public Builder level(SeverityLevel level) { this.level = level; return this; }
        /** One of {@code "default"}, {@code "http"}, {@code "navigation"}. */
        public Builder type(String type) { this.type = type; return this; }

        public Breadcrumb build() {
            return new Breadcrumb(this);
        }
    }
}
