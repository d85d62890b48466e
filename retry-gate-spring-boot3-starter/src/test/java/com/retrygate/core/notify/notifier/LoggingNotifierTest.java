package com.retrygate.core.notify.notifier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.retrygate.core.notify.NotifyContexts;
import com.retrygate.model.AdmissionDecision;
import com.retrygate.model.ctx.NotifyContext;
import com.retrygate.model.enums.Severity;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class LoggingNotifierTest {

    @Test
    void test_renders_limit_reached_as_json() throws Exception {
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);
        NotifyContext ctx = NotifyContexts.ctxForLimitReached("node-1", "file-1",
                AdmissionDecision.denied(3, 3, "Maximum retry attempts reached (3/3)"), clock);

        JsonNode json = new ObjectMapper().readTree(new LoggingNotifier().render(ctx));

        assertEquals("LIMIT_REACHED", json.get("type").asText());
        assertEquals("file-1", json.get("entityId").asText());
        assertEquals(3, json.get("attemptCount").asInt());
        assertEquals("2024-06-01T12:00:00Z", json.get("when").asText());
        assertEquals("LimitReached", json.get("attributes").get("reason").asText());
    }

    @Test
    void test_notify_never_throws_for_any_severity() {
        NotifyContext ctx = new NotifyContext();
        LoggingNotifier n = new LoggingNotifier();
        for (Severity sev : Severity.values()) {
            assertDoesNotThrow(() -> n.notify(ctx, sev));
        }
        assertEquals("log", n.name());
    }
}
