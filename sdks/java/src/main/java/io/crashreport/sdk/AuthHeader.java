package io.crashreport.sdk;

import java.time.Instant;

/** Builds the {@code X-Sentry-Auth} header value. */
public final class AuthHeader {

    public static final String NAME = "X-Sentry-Auth";
    public static final int PROTOCOL_VERSION = 6;

    private AuthHeader() {}

    /**
     * {@code Sentry sentry_version=6, sentry_client=<client>, sentry_timestamp=<millis>,
     * sentry_key=<publicKey>[, sentry_secret=<secretKey>]}
     */
    public static String build(String clientId, Instant timestamp, String publicKey, String secretKey) {
        StringBuilder sb = new StringBuilder("Sentry ")
                .append("sentry_version=").append(PROTOCOL_VERSION)
                .append(", sentry_client=").append(clientId)
                .append(", sentry_timestamp=").append(timestamp.toEpochMilli())
                .append(", sentry_key=").append(publicKey);
        if (secretKey != null) {
            sb.append(", sentry_secret=").append(secretKey);
        }
        return sb.toString();
    }
}
