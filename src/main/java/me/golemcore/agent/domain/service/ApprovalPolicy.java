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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.ApprovalDecision;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.RiskLevel;
import me.golemcore.agent.domain.model.SessionTrust;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decides whether a tool call may run without asking the user.
 *
 * <p>
 * Decision order:
 * <ol>
 * <li>tools listed in {@code require-approval-for} always need approval</li>
 * <li>risk levels listed in {@code auto-approve-levels} are approved</li>
 * <li>the session trust ceiling (LOW without a live grant) at or above the
 * risk approves</li>
 * <li>anything else needs approval</li>
 * </ol>
 *
 * <p>
 * Session trust grants are kept per session id and expire lazily.
 */
@Service
@Slf4j
public class ApprovalPolicy {

    private static final int COMMAND_LENGTH_THRESHOLD = 80;
    private static final String UNKNOWN = "unknown";

    private final AgentProperties.SecurityProperties config;
    private final Clock clock;
    private final Map<String, SessionTrust> sessionTrusts = new ConcurrentHashMap<>();

    public ApprovalPolicy(AgentProperties properties, Clock clock) {
        this.config = properties.getSecurity();
        this.clock = clock;
    }

    public ApprovalDecision check(String toolName, RiskLevel riskLevel, String sessionId) {
        if (config.getRequireApprovalFor().contains(toolName)) {
            return ApprovalDecision.pending("Tool '" + toolName + "' always requires approval");
        }

        if (config.getAutoApproveLevels().contains(riskLevel)) {
            return ApprovalDecision.auto("Risk level " + riskLevel + " is auto-approved");
        }

        if (config.isSessionTrustEnabled() && sessionId != null) {
            // Every session is trusted at least up to LOW, with or without a grant.
            RiskLevel ceiling = getSessionTrustLevel(sessionId);
            if (riskLevel.isAtMost(ceiling)) {
                return ApprovalDecision.sessionTrust("Session trusted up to " + ceiling);
            }
        }

        return ApprovalDecision.pending("Risk level " + riskLevel + " requires approval");
    }

    /**
     * Raises the session's trust ceiling and restarts its timeout window.
     */
    public void elevateSessionTrust(String sessionId, RiskLevel level) {
        Duration timeout = Duration.ofMinutes(config.getTrustTimeoutMinutes());
        sessionTrusts.compute(sessionId, (id, existing) -> {
            SessionTrust trust = existing != null ? existing : new SessionTrust(clock, timeout);
            trust.elevate(level, timeout);
            return trust;
        });
        log.info("[Approval] Session {} trusted up to {} for {} min", sessionId, level,
                config.getTrustTimeoutMinutes());
    }

    /**
     * Current trust ceiling of a session; LOW when it never had a grant or the
     * grant expired.
     */
    public RiskLevel getSessionTrustLevel(String sessionId) {
        SessionTrust trust = sessionId != null ? sessionTrusts.get(sessionId) : null;
        return trust != null ? trust.currentLevel() : RiskLevel.LOW;
    }

    /**
     * Removes expired trust grants.
     *
     * @return number of sessions removed
     */
    public int cleanupExpired() {
        AtomicInteger removed = new AtomicInteger();
        for (String sessionId : sessionTrusts.keySet()) {
            // Same per-key lock as elevateSessionTrust, so a grant being renewed is never dropped.
            sessionTrusts.computeIfPresent(sessionId, (id, trust) -> {
                if (trust.isExpired()) {
                    removed.incrementAndGet();
                    return null;
                }
                return trust;
            });
        }
        if (removed.get() > 0) {
            log.debug("[Approval] Removed {} expired session trust grant(s)", removed.get());
        }
        return removed.get();
    }

    int trackedSessions() {
        return sessionTrusts.size();
    }

    /**
     * One line describing a tool call for an approval prompt.
     */
    public String describeAction(Message.ToolCall toolCall) {
        String toolName = toolCall.getName();
        Map<String, Object> args = toolCall.getArguments() != null ? toolCall.getArguments() : Map.of();

        return switch (toolName) {
        case "filesystem" -> describeFileAction(args);
        case "shell_execute" -> describeShellAction(args);
        default -> toolName + ": " + args;
        };
    }

    private String describeFileAction(Map<String, Object> args) {
        Object operation = args.getOrDefault("operation", UNKNOWN);
        Object path = args.getOrDefault("path", UNKNOWN);
        if ("delete".equals(operation)) {
            return "Delete file: " + path;
        }
        return "File operation: " + operation + " on " + path;
    }

    private String describeShellAction(Map<String, Object> args) {
        String command = String.valueOf(args.getOrDefault("command", UNKNOWN));
        if (command.length() > COMMAND_LENGTH_THRESHOLD) {
            command = command.substring(0, COMMAND_LENGTH_THRESHOLD) + "...";
        }
        return "Run command: " + command;
    }
}
