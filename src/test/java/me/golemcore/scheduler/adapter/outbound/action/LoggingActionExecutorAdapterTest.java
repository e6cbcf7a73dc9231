package me.golemcore.scheduler.adapter.outbound.action;

import me.golemcore.scheduler.domain.model.ActionResult;
import me.golemcore.scheduler.domain.model.InboxEvent;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class LoggingActionExecutorAdapterTest {

    @Test
    void shouldReportSuccessWithMeasuredDuration() {
        Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
        LoggingActionExecutorAdapter adapter = new LoggingActionExecutorAdapter(clock);
        InboxEvent event = InboxEvent.builder().id("e1").contextId("room-1").priority(0.4).build();

        ActionResult result = adapter.execute("helper", event);

        assertTrue(result.isSuccess());
        assertEquals(Duration.ZERO, result.getDuration());
        assertNull(result.getComplexity());
    }
}
