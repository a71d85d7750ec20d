package me.golemcore.agent.tools;

import me.golemcore.agent.domain.model.RiskLevel;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DateTimeToolTest {

    private DateTimeTool tool;
    private ToolContext context;

    @BeforeEach
    void setUp() {
        tool = new DateTimeTool(Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC));
        context = ToolContext.builder().build();
    }

    @Test
    void shouldBeLowRiskDatetimeTool() {
        assertEquals("datetime", tool.getToolName());
        assertEquals(RiskLevel.LOW, tool.getRiskLevel());
    }

    @Test
    void shouldUseClockZoneByDefault() {
        ToolResult result = tool.execute(Map.of(), context).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().startsWith("2026-03-01 10:15:30"));
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) result.getData();
        assertEquals("SUNDAY", data.get("dayOfWeek"));
        assertEquals(2026, data.get("year"));
        assertEquals(10, data.get("hour"));
        assertEquals(Instant.parse("2026-03-01T10:15:30Z").toEpochMilli(), data.get("timestamp"));
    }

    @Test
    void shouldConvertToRequestedTimezone() {
        ToolResult result = tool.execute(Map.of("timezone", "Asia/Tokyo"), context).join();

        assertTrue(result.getOutput().startsWith("2026-03-01 19:15:30"));
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) result.getData();
        assertEquals("Asia/Tokyo", data.get("timezone"));
    }

    @Test
    void shouldRejectInvalidTimezone() {
        ToolResult result = tool.execute(Map.of("timezone", "Mars/Olympus"), context).join();

        assertFalse(result.isSuccess());
        assertEquals("Invalid timezone: Mars/Olympus", result.getError());
    }
}
