/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.agent.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.AuditDailyStats;
import me.golemcore.agent.domain.model.AuditEntry;
import me.golemcore.agent.domain.model.AuditEvent;
import me.golemcore.agent.domain.model.IntegrityReport;
import me.golemcore.agent.domain.model.RiskLevel;
import me.golemcore.agent.domain.model.SecurityScore;
import me.golemcore.agent.port.outbound.AuditStorePort;
import me.golemcore.agent.security.AuditHmacSigner;
import me.golemcore.agent.security.SensitiveKeyRedactor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tamper-evident record of tool executions and security events.
 *
 * <p>
 * Every row is signed with a truncated HMAC over its timestamp, event type,
 * session, tool, parameters and approval status, so later edits to those
 * columns are detected by {@link #verifyIntegrity(int)}. Parameters are
 * redacted before they are serialized. Rows are only ever appended.
 *
 * <p>
 * A failed write is logged and dropped: auditing never breaks the agent loop.
 */
@Service
@Slf4j
public class AuditLog {

    public static final String EVENT_TOOL_EXECUTION = "tool_execution";
    public static final String SECURITY_EVENT_PREFIX = "security:";
    public static final String STATUS_APPROVED = "approved";
    public static final String STATUS_DENIED = "denied";

    private static final int MAX_RESULT_SUMMARY = 500;
    private static final int INTEGRITY_SAMPLE = 50;
    private static final int DENY_RATIO_DAYS = 7;
    private static final double DENY_RATIO_THRESHOLD = 0.3;
    private static final int HIGH_RISK_THRESHOLD = 10;
    private static final int TOP_TOOLS = 10;

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter
            .ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'")
            .withZone(ZoneOffset.UTC);

    private final AuditStorePort store;
    private final AuditHmacSigner signer;
    private final ObjectWriter parametersWriter;
    private final Clock clock;

    public AuditLog(AuditStorePort store, AuditHmacSigner signer, ObjectMapper objectMapper, Clock clock) {
        this.store = store;
        this.signer = signer;
        this.parametersWriter = objectMapper.writer()
                .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .without(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    /**
     * Writes one signed row. Storage failures are logged and swallowed.
     */
    public void log(AuditEvent event) {
        try {
            AuditEntry entry = AuditEntry.builder()
                    .timestamp(formatTimestamp(clock.instant()))
                    .eventType(nz(event.getEventType()))
                    .sessionId(nz(event.getSessionId()))
                    .source(nz(event.getSource()))
                    .toolName(nz(event.getToolName()))
                    .parameters(serializeParameters(event.getParameters()))
                    .resultSummary(truncate(nz(event.getResultSummary()), MAX_RESULT_SUMMARY))
                    .approvalStatus(nz(event.getApprovalStatus()))
                    .riskLevel(event.getRiskLevel() != null ? event.getRiskLevel().getValue() : "")
                    .build();
            entry.setHmac(signer.sign(entry.signaturePayload()));
            store.append(entry);
        } catch (RuntimeException e) {
            log.error("[Audit] Failed to write audit entry: event={}, tool={}", event.getEventType(),
                    event.getToolName(), e);
        }
    }

    public void logToolExecution(String sessionId, String source, String toolName, Map<String, Object> parameters,
            boolean approved, RiskLevel riskLevel, String resultSummary) {
        log(AuditEvent.builder()
                .eventType(EVENT_TOOL_EXECUTION)
                .sessionId(sessionId)
                .source(source)
                .toolName(toolName)
                .parameters(parameters)
                .resultSummary(resultSummary)
                .approvalStatus(approved ? STATUS_APPROVED : STATUS_DENIED)
                .riskLevel(riskLevel)
                .build());
    }

    public void logSecurityEvent(String eventType, String sessionId, String details) {
        log(AuditEvent.builder()
                .eventType(SECURITY_EVENT_PREFIX + eventType)
                .sessionId(sessionId)
                .source("security")
                .resultSummary(details)
                .build());
    }

    /**
     * Newest entries first, optionally filtered by session and event type.
     */
    public List<AuditEntry> queryRecent(int limit, String sessionId, String eventType) {
        return store.findRecent(limit, sessionId, eventType);
    }

    /**
     * Recomputes the signature of the newest {@code limit} rows.
     */
    public IntegrityReport verifyIntegrity(int limit) {
        List<AuditEntry> entries = store.findRecent(limit, null, null);
        int tampered = 0;
        for (AuditEntry entry : entries) {
            if (!signer.verify(entry.signaturePayload(), entry.getHmac())) {
                tampered++;
                log.warn("[Audit] Integrity check failed for entry {} ({})", entry.getId(), entry.getTimestamp());
            }
        }
        return new IntegrityReport(entries.size(), tampered);
    }

    public AuditDailyStats getDailyStats(LocalDate date) {
        List<AuditEntry> entries = store.findBetween(startOfDay(date), startOfDay(date.plusDays(1)));

        int toolCalls = 0;
        int approved = 0;
        int denied = 0;
        int securityEvents = 0;
        Map<String, Integer> riskDistribution = new LinkedHashMap<>();
        for (RiskLevel level : RiskLevel.values()) {
            riskDistribution.put(level.getValue(), 0);
        }
        Map<String, Integer> toolCounts = new HashMap<>();
        List<Integer> hourly = new ArrayList<>(Collections.nCopies(24, 0));

        for (AuditEntry entry : entries) {
            if (EVENT_TOOL_EXECUTION.equals(entry.getEventType())) {
                toolCalls++;
                if (STATUS_APPROVED.equals(entry.getApprovalStatus())) {
                    approved++;
                } else if (STATUS_DENIED.equals(entry.getApprovalStatus())) {
                    denied++;
                }
            }
            if (entry.getEventType() != null && entry.getEventType().startsWith(SECURITY_EVENT_PREFIX)) {
                securityEvents++;
            }
            if (entry.getRiskLevel() != null && riskDistribution.containsKey(entry.getRiskLevel())) {
                riskDistribution.merge(entry.getRiskLevel(), 1, Integer::sum);
            }
            if (entry.getToolName() != null && !entry.getToolName().isEmpty()) {
                toolCounts.merge(entry.getToolName(), 1, Integer::sum);
            }
            int hour = hourOf(entry.getTimestamp());
            if (hour >= 0) {
                hourly.set(hour, hourly.get(hour) + 1);
            }
        }

        List<AuditDailyStats.ToolCount> topTools = toolCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_TOOLS)
                .map(e -> new AuditDailyStats.ToolCount(e.getKey(), e.getValue()))
                .toList();

        return new AuditDailyStats(date.toString(), entries.size(), toolCalls, approved, denied,
                riskDistribution, topTools, securityEvents, hourly);
    }

    public SecurityScore getSecurityScore() {
        int score = 100;
        List<SecurityScore.Factor> factors = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();

        IntegrityReport integrity = verifyIntegrity(INTEGRITY_SAMPLE);
        if (integrity.isIntact()) {
            factors.add(SecurityScore.Factor.ok("integrity",
                    "All " + integrity.checked() + " recent entries verified"));
        } else {
            score -= 30;
            factors.add(SecurityScore.Factor.warning("integrity",
                    integrity.tampered() + "/" + integrity.checked() + " entries have invalid HMAC"));
            recommendations.add("Audit log integrity compromised - investigate immediately");
        }

        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        int approvedOps = 0;
        int deniedOps = 0;
        for (AuditEntry entry : store.findBetween(startOfDay(today.minusDays(DENY_RATIO_DAYS - 1L)),
                startOfDay(today.plusDays(1)))) {
            if (EVENT_TOOL_EXECUTION.equals(entry.getEventType())) {
                if (STATUS_APPROVED.equals(entry.getApprovalStatus())) {
                    approvedOps++;
                } else if (STATUS_DENIED.equals(entry.getApprovalStatus())) {
                    deniedOps++;
                }
            }
        }
        int totalOps = approvedOps + deniedOps;
        if (totalOps > 0) {
            double denyRatio = (double) deniedOps / totalOps;
            String percent = Math.round(denyRatio * 100) + "%";
            if (denyRatio > DENY_RATIO_THRESHOLD) {
                score -= 10;
                factors.add(SecurityScore.Factor.warning("deny_ratio",
                        percent + " operations denied in last " + DENY_RATIO_DAYS + " days"));
                recommendations.add("High denial rate - review blocked operations");
            } else {
                factors.add(SecurityScore.Factor.ok("deny_ratio", percent + " operations denied"));
            }
        }

        AuditDailyStats stats = getDailyStats(today);
        int highRisk = stats.riskDistribution().getOrDefault(RiskLevel.HIGH.getValue(), 0)
                + stats.riskDistribution().getOrDefault(RiskLevel.CRITICAL.getValue(), 0);
        String detail = highRisk + " high/critical operations today";
        if (highRisk > HIGH_RISK_THRESHOLD) {
            score -= 10;
            factors.add(SecurityScore.Factor.warning("high_risk_ops", detail));
        } else {
            factors.add(SecurityScore.Factor.ok("high_risk_ops", detail));
        }

        score = Math.max(0, Math.min(100, score));
        return new SecurityScore(score, SecurityScore.gradeFor(score), factors, recommendations);
    }

    /**
     * Timestamps use a fixed-width UTC format so they sort lexicographically.
     */
    public static String formatTimestamp(Instant instant) {
        return TIMESTAMP_FORMAT.format(instant);
    }

    /**
     * Masks secret-looking keys and values the same way stored parameters are
     * masked.
     */
    public Object redactSensitive(Object data) {
        return SensitiveKeyRedactor.AUDIT.redactValue(data);
    }

    private String serializeParameters(Map<String, Object> parameters) {
        Map<String, Object> redacted = SensitiveKeyRedactor.AUDIT.redact(parameters);
        try {
            return parametersWriter.writeValueAsString(redacted);
        } catch (JsonProcessingException e) {
            log.warn("[Audit] Could not serialize parameters, storing keys only: {}", e.getMessage());
            return String.valueOf(redacted.keySet());
        }
    }

    private static String startOfDay(LocalDate date) {
        return formatTimestamp(date.atStartOfDay(ZoneOffset.UTC).toInstant());
    }

    private static int hourOf(String timestamp) {
        if (timestamp == null || timestamp.length() < 13) {
            return -1;
        }
        try {
            int hour = Integer.parseInt(timestamp.substring(11, 13));
            return hour >= 0 && hour < 24 ? hour : -1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static String truncate(String value, int max) {
        return value.length() > max ? value.substring(0, max) : value;
    }

    private static String nz(String value) {
        return value != null ? value : "";
    }
}
