package io.crashreport.sdk;

import io.crashreport.sdk.model.Event;
import io.crashreport.sdk.model.User;
import io.crashreport.sdk.stacktrace.StackFrameFilter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the event payload from its layered sources, lowest precedence first:
 * <ol>
 *   <li>submission envelope ({@code project}, {@code event_id}, {@code timestamp})</li>
 *   <li>protocol fields ({@code platform}, {@code sdk}, default {@code logger})</li>
 *   <li>environment attributes</li>
 *   <li>the client-level user, under {@code user}</li>
 *   <li>the event itself; its own user replaces the client-level one as a whole</li>
 * </ol>
 */
public final class PayloadAssembler {

    /** Logger name used when neither the environment nor the event sets one. */
    public static final String DEFAULT_LOGGER_NAME = "CrashReportClient";

    private final Event environmentAttributes;

    public PayloadAssembler(Event environmentAttributes) {
        this.environmentAttributes = environmentAttributes;
    }

    /**
     * @param envelope    submission fields, may be null
     * @param ambientUser client-level user, may be null
     */
    public Map<String, Object> assemble(Map<String, Object> envelope, User ambientUser, Event event,
                                        StackFrameFilter stackFrameFilter) {
        List<Map<String, Object>> overlays = new ArrayList<>(5);
        overlays.add(envelope);
        overlays.add(protocolFields());
        if (environmentAttributes != null) {
            overlays.add(environmentAttributes.toJson());
        }
        if (ambientUser != null) {
            overlays.add(Map.of("user", ambientUser.toJson()));
        }
        overlays.add(event.toJson(stackFrameFilter));
        return AttributeMerger.merge(overlays);
    }

    public Event getEnvironmentAttributes() { return environmentAttributes; }

    private static Map<String, Object> protocolFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("platform", SdkInfo.PLATFORM);
        fields.put("sdk", SdkInfo.toJson());
        fields.put("logger", DEFAULT_LOGGER_NAME);
        return fields;
    }
}
