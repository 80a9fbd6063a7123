package io.crashreport.sdk;

import io.crashreport.sdk.model.*;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PayloadAssemblerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testEmptyEventHasOnlyProtocolFields() {
        Map<String, Object> payload = new PayloadAssembler(null)
                .assemble(null, null, Event.builder().build(), null);
        assertEquals(Set.of("platform", "sdk", "logger"), payload.keySet());
        assertEquals(PayloadAssembler.DEFAULT_LOGGER_NAME, payload.get("logger"));
    }

    @Test
    void testMessageOnlyEventOmitsEmptySections() throws Exception {
        Map<String, Object> payload = new PayloadAssembler(null)
                .assemble(null, null, Event.builder().message("boom").build(), null);
        String json = mapper.writeValueAsString(payload);
        assertTrue(json.contains("\"message\":\"boom\""));
        assertFalse(json.contains("\"tags\""));
        assertFalse(json.contains("\"extra\""));
        assertFalse(json.contains("\"breadcrumbs\""));
    }

    @Test
    void testEventFieldsBeatEnvironmentAttributes() {
        Event environment = Event.builder()
                .loggerName("env-logger")
                .serverName("env-server")
                .release("1.0")
                .environment("staging")
                .tags(Map.of("region", "eu", "tier", "free"))
                .build();
        Event event = Event.builder()
                .serverName("event-server")
                .environment("production")
                .tags(Map.of("region", "us"))
                .build();

        Map<String, Object> payload = new PayloadAssembler(environment).assemble(null, null, event, null);
        assertEquals("env-logger", payload.get("logger"));
        assertEquals("event-server", payload.get("server_name"));
        assertEquals("1.0", payload.get("release"));
        assertEquals("production", payload.get("environment"));
        assertEquals(Map.of("region", "us"), payload.get("tags"));
    }

    @Test
    void testEventUserReplacesAmbientUserWhole() {
        User ambient = new User("ambient-id", "ambient", "a@example.com", "10.0.0.1", Map.of("plan", "gold"));
        User eventUser = User.withIpAddress("192.168.0.1");

        Map<String, Object> payload = new PayloadAssembler(null)
                .assemble(null, ambient, Event.builder().userContext(eventUser).build(), null);
        assertEquals(Map.of("ip_address", "192.168.0.1"), payload.get("user"));
    }

    @Test
    void testAmbientUserUsedWithoutEventUser() {
        User ambient = User.withId("ambient-id");
        Map<String, Object> payload = new PayloadAssembler(null)
                .assemble(null, ambient, Event.builder().message("m").build(), null);
        assertEquals(Map.of("id", "ambient-id"), payload.get("user"));
    }

    @Test
    void testEnvelopeHasLowestPrecedence() {
        Map<String, Object> envelope = Map.of("event_id", "e1", "project", "7", "logger", "envelope");
        Map<String, Object> payload = new PayloadAssembler(null)
                .assemble(envelope, null, Event.builder().build(), null);
        assertEquals("e1", payload.get("event_id"));
        assertEquals("7", payload.get("project"));
        assertEquals(PayloadAssembler.DEFAULT_LOGGER_NAME, payload.get("logger"));
    }

    @Test
    void testStackFrameFilterIsApplied() {
        Event event = Event.builder()
                .stackTrace(new StackTraceElement[]{
                        new StackTraceElement("com.example.Inner", "fail", "Inner.java", 10),
                        new StackTraceElement("com.example.Outer", "run", "Outer.java", 20)})
                .build();

        Map<String, Object> payload = new PayloadAssembler(null)
                .assemble(null, null, event, frames -> List.of(frames.get(0)));

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> frames =
                (List<Map<String, Object>>) ((Map<String, Object>) payload.get("stacktrace")).get("frames");
        assertEquals(1, frames.size());
        assertEquals("com.example.Outer", frames.get(0).get("module"));
    }
}
