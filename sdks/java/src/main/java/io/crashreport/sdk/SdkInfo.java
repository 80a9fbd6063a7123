package io.crashreport.sdk;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/** Identity of this SDK as reported to the ingestion service. */
public final class SdkInfo {

    public static final String PLATFORM = "java";
    public static final String NAME = "crashreport.java";
    public static final String VERSION = "1.0.0";

    /** Client identifier used in {@code User-Agent} and {@code sentry_client}. */
    public static final String CLIENT_ID = NAME + "/" + VERSION;

    /** Protocol timestamps: UTC, second precision, no zone suffix, e.g. {@code 2017-01-02T00:00:00}. */
    public static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss").withZone(ZoneOffset.UTC);

    private SdkInfo() {}

    /** The {@code sdk} object of the event payload. */
    public static Map<String, Object> toJson() {
        Map<String, Object> sdk = new LinkedHashMap<>();
        sdk.put("name", NAME);
        sdk.put("version", VERSION);
        return sdk;
    }
}
