package me.golemcore.agent.domain.service;

import me.golemcore.agent.adapter.outbound.audit.JdbcAuditStoreAdapter;
import me.golemcore.agent.domain.model.AuditDailyStats;
import me.golemcore.agent.domain.model.AuditEntry;
import me.golemcore.agent.domain.model.IntegrityReport;
import me.golemcore.agent.domain.model.RiskLevel;
import me.golemcore.agent.domain.model.SecurityScore;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.infrastructure.config.AutoConfiguration;
import me.golemcore.agent.port.outbound.AuditStorePort;
import me.golemcore.agent.security.AuditHmacSigner;
import me.golemcore.agent.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class AuditLogTest {

    private static final String SESSION_ID = "sess-1";
    private static final String TOOL_SHELL = "shell_execute";
    private static final String TOOL_FILESYSTEM = "filesystem";
    private static final LocalDate TODAY = LocalDate.of(2026, 3, 1);

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private JdbcAuditStoreAdapter store;
    private AuditHmacSigner signer;
    private AuditLog auditLog;

    @BeforeEach
    void setUp() {
        AgentProperties properties = new AgentProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        properties.getAudit().setHmacSecret("test-secret");
        clock = new MutableClock(Instant.parse("2026-03-01T10:15:00Z"));
        store = new JdbcAuditStoreAdapter(properties);
        signer = new AuditHmacSigner(properties);
        auditLog = new AuditLog(store, signer, AutoConfiguration.objectMapper(), clock);
    }

    @Test
    void shouldWriteSignedToolExecutionRow() {
        auditLog.logToolExecution(SESSION_ID, "agent", TOOL_SHELL, Map.of("command", "ls"), true, RiskLevel.HIGH,
                "ok (12ms)");

        List<AuditEntry> entries = auditLog.queryRecent(10, null, null);

        assertEquals(1, entries.size());
        AuditEntry entry = entries.get(0);
        assertEquals("2026-03-01T10:15:00.000Z", entry.getTimestamp());
        assertEquals(AuditLog.EVENT_TOOL_EXECUTION, entry.getEventType());
        assertEquals(SESSION_ID, entry.getSessionId());
        assertEquals(TOOL_SHELL, entry.getToolName());
        assertEquals("{\"command\":\"ls\"}", entry.getParameters());
        assertEquals(AuditLog.STATUS_APPROVED, entry.getApprovalStatus());
        assertEquals("high", entry.getRiskLevel());
        assertEquals(16, entry.getHmac().length());
        assertTrue(signer.verify(entry.signaturePayload(), entry.getHmac()));
    }

    @Test
    void shouldRedactSensitiveParametersAndSortKeys() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("url", "https://example.com");
        params.put("api_key", "abc");
        params.put("body", "sk-abcdefghijklmnopqrstuvwxyz");

        auditLog.logToolExecution(SESSION_ID, "agent", "http", params, true, RiskLevel.LOW, "ok");

        String stored = auditLog.queryRecent(1, null, null).get(0).getParameters();
        assertEquals("{\"api_key\":\"***\",\"body\":\"sk-abc***\",\"url\":\"https://example.com\"}", stored);
    }

    @Test
    void shouldRedactNestedStructures() {
        Object redacted = auditLog.redactSensitive(List.of(
                Map.of("password", "hunter2"),
                "token-0123456789abcdefghij",
                "plain"));

        assertEquals(List.of(Map.of("password", "***"), "token-***", "plain"), redacted);
    }

    @Test
    void shouldTruncateLongResultSummary() {
        auditLog.logToolExecution(SESSION_ID, "agent", TOOL_SHELL, Map.of(), true, RiskLevel.HIGH, "x".repeat(900));

        assertEquals(500, auditLog.queryRecent(1, null, null).get(0).getResultSummary().length());
    }

    @Test
    void shouldPrefixSecurityEvents() {
        auditLog.logSecurityEvent("injection_detected", SESSION_ID, "matched: ignore previous instructions");

        AuditEntry entry = auditLog.queryRecent(1, null, "security:injection_detected").get(0);
        assertEquals("security", entry.getSource());
        assertEquals("", entry.getToolName());
        assertEquals("", entry.getRiskLevel());
    }

    @Test
    void shouldReturnNewestFirstWithFilters() {
        auditLog.logToolExecution("a", "agent", TOOL_SHELL, Map.of(), true, RiskLevel.HIGH, "first");
        clock.advance(java.time.Duration.ofSeconds(1));
        auditLog.logToolExecution("b", "agent", TOOL_SHELL, Map.of(), true, RiskLevel.HIGH, "second");
        clock.advance(java.time.Duration.ofSeconds(1));
        auditLog.logToolExecution("a", "agent", TOOL_FILESYSTEM, Map.of(), false, RiskLevel.MEDIUM, "third");

        List<AuditEntry> all = auditLog.queryRecent(10, null, null);
        List<AuditEntry> sessionA = auditLog.queryRecent(10, "a", null);

        assertEquals(List.of("third", "second", "first"), all.stream().map(AuditEntry::getResultSummary).toList());
        assertEquals(List.of("third", "first"), sessionA.stream().map(AuditEntry::getResultSummary).toList());
        assertEquals(1, auditLog.queryRecent(1, null, null).size());
    }

    @Test
    void shouldVerifyIntactLog() {
        auditLog.logToolExecution(SESSION_ID, "agent", TOOL_SHELL, Map.of("command", "ls"), true, RiskLevel.HIGH,
                "ok");
        auditLog.logSecurityEvent("sandbox_block", SESSION_ID, "blocked");

        IntegrityReport report = auditLog.verifyIntegrity(100);

        assertEquals(2, report.checked());
        assertEquals(0, report.tampered());
        assertTrue(report.isIntact());
    }

    @Test
    void shouldDetectRowEditedOutsideTheLog() {
        // GIVEN
        auditLog.logToolExecution(SESSION_ID, "agent", TOOL_SHELL, Map.of("command", "ls"), false, RiskLevel.HIGH,
                "User denied");
        auditLog.logToolExecution(SESSION_ID, "agent", "datetime", Map.of(), true, RiskLevel.LOW, "ok");

        // WHEN
        JdbcTemplate raw = new JdbcTemplate(new DriverManagerDataSource("jdbc:sqlite:" + store.getDatabasePath()));
        raw.update("UPDATE audit_log SET approval_status = 'approved' WHERE tool_name = ?", TOOL_SHELL);

        // THEN
        IntegrityReport report = auditLog.verifyIntegrity(100);
        assertEquals(2, report.checked());
        assertTrue(report.tampered() >= 1);
        assertFalse(report.isIntact());
    }

    @Test
    void shouldSwallowStoreFailures() {
        AuditStorePort failingStore = mock(AuditStorePort.class);
        doThrow(new IllegalStateException("disk full")).when(failingStore).append(any());
        AuditLog failing = new AuditLog(failingStore, signer, AutoConfiguration.objectMapper(), clock);

        assertDoesNotThrow(() -> failing.logSecurityEvent("test", SESSION_ID, "details"));
    }

    @Test
    void shouldComputeDailyStats() {
        auditLog.logToolExecution(SESSION_ID, "agent", TOOL_SHELL, Map.of(), true, RiskLevel.HIGH, "ok");
        auditLog.logToolExecution(SESSION_ID, "agent", TOOL_SHELL, Map.of(), true, RiskLevel.HIGH, "ok");
        auditLog.logToolExecution(SESSION_ID, "agent", TOOL_FILESYSTEM, Map.of(), false, RiskLevel.MEDIUM,
                "User denied");
        auditLog.logSecurityEvent("injection_detected", SESSION_ID, "details");

        AuditDailyStats stats = auditLog.getDailyStats(TODAY);

        assertEquals("2026-03-01", stats.date());
        assertEquals(4, stats.totalEvents());
        assertEquals(3, stats.toolCalls());
        assertEquals(2, stats.approved());
        assertEquals(1, stats.denied());
        assertEquals(1, stats.securityEvents());
        assertEquals(2, stats.riskDistribution().get("high"));
        assertEquals(1, stats.riskDistribution().get("medium"));
        assertEquals(new AuditDailyStats.ToolCount(TOOL_SHELL, 2), stats.topTools().get(0));
        assertEquals(4, stats.hourlyActivity().get(10));
        assertEquals(24, stats.hourlyActivity().size());
    }

    @Test
    void shouldIgnoreEntriesFromOtherDays() {
        auditLog.logToolExecution(SESSION_ID, "agent", TOOL_SHELL, Map.of(), true, RiskLevel.HIGH, "ok");

        assertEquals(0, auditLog.getDailyStats(TODAY.plusDays(1)).totalEvents());
        assertEquals(0, auditLog.getDailyStats(TODAY.minusDays(1)).totalEvents());
    }

    @Test
    void shouldGradeCleanLogAsA() {
        auditLog.logToolExecution(SESSION_ID, "agent", TOOL_SHELL, Map.of(), true, RiskLevel.HIGH, "ok");

        SecurityScore score = auditLog.getSecurityScore();

        assertEquals(100, score.score());
        assertEquals("A", score.grade());
        assertTrue(score.recommendations().isEmpty());
    }

    @Test
    void shouldPenalizeTamperingAndHighDenialRate() {
        auditLog.logToolExecution(SESSION_ID, "agent", TOOL_SHELL, Map.of(), false, RiskLevel.HIGH, "User denied");
        auditLog.logToolExecution(SESSION_ID, "agent", TOOL_SHELL, Map.of(), true, RiskLevel.HIGH, "ok");
        JdbcTemplate raw = new JdbcTemplate(new DriverManagerDataSource("jdbc:sqlite:" + store.getDatabasePath()));
        raw.update("UPDATE audit_log SET session_id = 'forged' WHERE id = 1");

        SecurityScore score = auditLog.getSecurityScore();

        assertEquals(60, score.score());
        assertEquals("C", score.grade());
        assertEquals(2, score.recommendations().size());
    }
}
