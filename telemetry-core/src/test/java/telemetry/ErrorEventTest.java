package telemetry;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ErrorEventTest {

    // ── ErrorEvent ──────────────────────────────────────────────────

    @Test
    void appliesDefaults() {
        ErrorEvent event = ErrorEvent.builder("boom").build();
        assertEquals("boom", event.message());
        assertEquals(ErrorEvent.UNKNOWN_COMPONENT, event.component());
        assertEquals(ErrorCategory.GENERIC.value(), event.category());
        assertTrue(event.context().isEmpty());
        assertNull(event.error());
        assertEquals("message", event.errorType());
        assertFalse(event.isReported());
        assertEquals(26, event.eventId().length());
    }

    @Test
    void messageFallsBackToErrorClass() {
        ErrorEvent event = ErrorEvent.of(new IllegalStateException());
        assertEquals("java.lang.IllegalStateException", event.message());
        assertEquals("java.lang.IllegalStateException", event.errorType());
    }

    @Test
    void eventIdsAreUnique() {
        assertNotEquals(ErrorEvent.builder("a").build().eventId(), ErrorEvent.builder("a").build().eventId());
    }

    @Test
    void blankComponentBecomesUnknown() {
        assertEquals(ErrorEvent.UNKNOWN_COMPONENT, ErrorEvent.builder("x").component("  ").build().component());
    }

    @Test
    void markReportedIsOneWay() {
        ErrorEvent event = ErrorEvent.builder("x").build();
        assertTrue(event.markReported());
        assertFalse(event.markReported());
        assertTrue(event.isReported());
    }

    @Test
    void contextIsCopiedAndImmutable() {
        Map<String, Object> context = new HashMap<>();
        context.put("operation", "save");
        ErrorEvent event = ErrorEvent.builder("x").context(context).timestamp(Instant.EPOCH).build();
        context.put("later", "ignored");

        assertEquals(Map.of("operation", "save"), event.context());
        assertThrows(UnsupportedOperationException.class, () -> event.context().put("k", "v"));
        assertEquals(Instant.EPOCH, event.timestamp());
    }

    @Test
    void toStringOmitsMessage() {
        ErrorEvent event = ErrorEvent.builder("password=hunter2").build();
        assertFalse(event.toString().contains("hunter2"));
    }

    // ── ErrorEvents ─────────────────────────────────────────────────

    @Test
    void fromPlainThrowableUsesDefaults() {
        ErrorEvent event = ErrorEvents.from(new RuntimeException("disk full"), "datastore");
        assertEquals("datastore", event.component());
        assertEquals("generic", event.category());
        assertEquals("disk full", event.message());
        assertTrue(event.context().isEmpty());
    }

    @Test
    void fromTelemetryExceptionReadsCapabilities() {
        TelemetryException error = new TelemetryException("datastore", ErrorCategory.DATABASE, "insert failed")
                .with("operation", "save_detection");

        ErrorEvent event = ErrorEvents.from(error, "ignored");

        assertEquals("datastore", event.component());
        assertEquals("database", event.category());
        assertEquals("save_detection", event.context().get("operation"));
        assertEquals(error, event.error());
    }

    @Test
    void capabilitiesAreFoundOnCause() {
        TelemetryException cause = new TelemetryException("mqtt", ErrorCategory.MQTT_PUBLISH, "publish failed");
        ErrorEvent event = ErrorEvents.from(new RuntimeException("wrapped", cause));

        assertEquals("mqtt", event.component());
        assertEquals("mqtt-publish", event.category());
        assertEquals("wrapped", event.message());
    }

    @Test
    void fromWithoutComponentIsUnknown() {
        assertEquals(ErrorEvent.UNKNOWN_COMPONENT, ErrorEvents.from(new RuntimeException("x")).component());
    }

    // ── ErrorCategory ───────────────────────────────────────────────

    @Test
    void categoryLookups() {
        assertEquals(ErrorCategory.NETWORK, ErrorCategory.fromValue("network").orElseThrow());
        assertTrue(ErrorCategory.fromValue("nope").isEmpty());
        assertEquals("Database Error", ErrorCategory.titleOf("database"));
        assertEquals("custom", ErrorCategory.titleOf("custom"));
        assertEquals(Severity.INFO, ErrorCategory.severityOf("not-found"));
        assertEquals(Severity.ERROR, ErrorCategory.severityOf("custom"));
    }
}
