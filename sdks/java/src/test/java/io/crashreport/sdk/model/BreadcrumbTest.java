package io.crashreport.sdk.model;

import io.crashreport.sdk.SdkInfo;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BreadcrumbTest {

    private static final Instant TIME = Instant.parse("2017-01-02T00:00:00.750Z");

    @Test
    void testFullJson() {
        Breadcrumb breadcrumb = Breadcrumb.builder(TIME)
                .message("clicked")
                .category("ui.click")
                .data(Map.of("button", "save"))
                .level(SeverityLevel.WARNING)
                .type("navigation")
                .build();
        assertEquals(Map.of(
                "timestamp", "2017-01-02T00:00:00",
                "message", "clicked",
                "category", "ui.click",
                "data", Map.of("button", "save"),
                "level", "warning",
                "type", "navigation"), breadcrumb.toJson());
    }

    @Test
    void testDefaultsToInfoLevel() {
        Breadcrumb breadcrumb = Breadcrumb.of("hello", TIME);
        assertEquals(SeverityLevel.INFO, breadcrumb.getLevel());
        assertEquals(Map.of("timestamp", "2017-01-02T00:00:00", "message", "hello", "level", "info"),
                breadcrumb.toJson());
    }

    @Test
    void testTimestampIsRequired() {
        assertThrows(NullPointerException.class, () -> Breadcrumb.builder(null).message("x").build());
    }

    @Test
    void testTimestampUsesProtocolFormat() {
        assertEquals(SdkInfo.TIMESTAMP_FORMAT.format(TIME), Breadcrumb.of("x", TIME).toJson().get("timestamp"));
    }
}
