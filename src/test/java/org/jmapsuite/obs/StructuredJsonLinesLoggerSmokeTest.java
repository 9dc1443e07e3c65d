package org.jmapsuite.obs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.bson.Document;
import org.junit.jupiter.api.Test;

class StructuredJsonLinesLoggerSmokeTest {
    @Test
    void emitsCorrelationAndCustomFieldsAsJsonLines() {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        Clock fixedClock = Clock.fixed(Instant.parse("2026-03-01T09:00:00Z"), ZoneOffset.UTC);
        StructuredJsonLinesLogger logger = new StructuredJsonLinesLogger(output, fixedClock, true);

        CorrelationContext context = CorrelationContext.builder("req-1", "Mailbox/set")
            .callId("c1")
            .accountId("u1")
            .build();
        logger.warn("jmap.request.violations", context, Map.of("violations", 2, "diagnostics", List.of("x", "y")));

        CorrelationContext bare = CorrelationContext.of("req-2", "Mailbox/get");
        logger.info("jmap.request.completed", bare, Map.of("requestId", "spoofed"));
        logger.close();

        String[] lines = output.toString(StandardCharsets.UTF_8).trim().split("\\R");
        assertEquals(2, lines.length);
        assertEquals(
            List.of("accountId", "callId", "diagnostics", "level", "message", "methodName", "requestId", "timestamp",
                "violations"),
            List.copyOf(Document.parse(lines[0]).keySet()));

        Document first = Document.parse(lines[0]);
        assertEquals("2026-03-01T09:00:00Z", first.getString("timestamp"));
        assertEquals("WARN", first.getString("level"));
        assertEquals("jmap.request.violations", first.getString("message"));
        assertEquals("req-1", first.getString("requestId"));
        assertEquals("Mailbox/set", first.getString("methodName"));
        assertEquals("c1", first.getString("callId"));
        assertEquals("u1", first.getString("accountId"));
        assertEquals(2, ((Number) first.get("violations")).intValue());
        assertEquals(List.of("x", "y"), first.getList("diagnostics", String.class));

        Document second = Document.parse(lines[1]);
        assertEquals("INFO", second.getString("level"));
        assertEquals("req-2", second.getString("requestId"));
        assertNull(second.get("callId"));
        assertFalse(second.containsKey("accountId"));
    }
}
