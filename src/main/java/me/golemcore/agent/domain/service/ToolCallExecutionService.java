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
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.AgentSession;
import me.golemcore.agent.domain.model.ApprovalDecision;
import me.golemcore.agent.domain.model.ApprovalRequest;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.RiskLevel;
import me.golemcore.agent.domain.model.SandboxTarget;
import me.golemcore.agent.domain.model.SandboxVerdict;
import me.golemcore.agent.domain.model.ToolCallLogEntry;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.ActionLogPort;
import me.golemcore.agent.security.Sandbox;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Runs a single tool call through the security pipeline:
 *
 * <ol>
 * <li>unknown tool</li>
 * <li>disabled tool</li>
 * <li>sandbox validation of the target the tool declares</li>
 * <li>approval policy, and a human prompt when the policy says so</li>
 * <li>execution</li>
 * </ol>
 *
 * <p>
 * Each attempt writes exactly one audit row, whichever step ends it. A call
 * that is denied never reaches {@link ToolSystem#execute}.
 */
@Service
@Slf4j
public class ToolCallExecutionService {

    private static final String DEFAULT_SOURCE = "agent";

    private final ToolRegistry toolRegistry;
    private final ToolSystem toolSystem;
    private final Sandbox sandbox;
    private final ApprovalPolicy approvalPolicy;
    private final ApprovalRouter approvalRouter;
    private final AuditLog auditLog;
    private final ActionLogPort actionLog;
    private final AgentProperties properties;
    private final Clock clock;

    public ToolCallExecutionService(ToolRegistry toolRegistry, ToolSystem toolSystem, Sandbox sandbox,
            ApprovalPolicy approvalPolicy, ApprovalRouter approvalRouter, AuditLog auditLog,
            ActionLogPort actionLog, AgentProperties properties, Clock clock) {
        this.toolRegistry = toolRegistry;
        this.toolSystem = toolSystem;
        this.sandbox = sandbox;
        this.approvalPolicy = approvalPolicy;
        this.approvalRouter = approvalRouter;
        this.auditLog = auditLog;
        this.actionLog = actionLog;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Audit source of a session: the channel it arrived on.
     */
    public static String auditSource(AgentSession session) {
        String channelType = session != null ? session.getChannelType() : null;
        return channelType != null && !channelType.isBlank() ? channelType : DEFAULT_SOURCE;
    }

    public ToolCallExecutionResult execute(AgentSession session, Message.ToolCall toolCall) {
        String toolName = ToolSystem.sanitizeToolName(toolCall.getName());
        Map<String, Object> args = toolCall.getArguments() != null ? toolCall.getArguments() : Map.of();
        String sessionId = session.getId();
        String source = auditSource(session);

        ToolComponent tool = toolRegistry.get(toolName);
        if (tool == null) {
            ToolResult result = toolSystem.unknownTool(toolName);
            auditLog.logToolExecution(sessionId, source, toolName, args, false, null, "Unknown tool");
            return new ToolCallExecutionResult(toolCall.getId(), toolName, result, null, 0);
        }

        RiskLevel risk = tool.getRiskLevel(args);

        if (properties.getSecurity().getDisabledTools().contains(toolName) || !tool.isEnabled()) {
            log.info("[Security] Tool '{}' is disabled", toolName);
            auditLog.logToolExecution(sessionId, source, toolName, args, false, risk, "Tool disabled");
            return denied(toolCall, toolName, risk, ToolFailureKind.TOOL_DISABLED, "Tool '" + toolName
                    + "' is disabled");
        }

        Optional<SandboxTarget> target = tool.sandboxTarget(args);
        if (target.isPresent()) {
            SandboxVerdict verdict = sandbox.validate(target.get());
            if (!verdict.allowed()) {
                log.warn("[Security] Sandbox blocked '{}': {}", toolName, verdict.reason());
                auditLog.logToolExecution(sessionId, source, toolName, args, false, risk,
                        "Blocked: " + verdict.reason());
                return denied(toolCall, toolName, risk, ToolFailureKind.SANDBOX_BLOCKED, verdict.reason());
            }
        }

        ApprovalDecision decision = approvalPolicy.check(toolName, risk, sessionId);
        if (!decision.approved()) {
            ApprovalRequest request = new ApprovalRequest(toolName, args, risk, session,
                    approvalPolicy.describeAction(Message.ToolCall.builder().name(toolName).arguments(args).build()));
            boolean approved = approvalRouter.requestApproval(request);
            if (!approved) {
                log.info("[Security] User denied '{}' ({})", toolName, risk);
                auditLog.logToolExecution(sessionId, source, toolName, args, false, risk, "User denied");
                recordAction(ToolCallLogEntry.builder()
                        .sessionId(sessionId)
                        .toolName(toolName)
                        .parameters(args)
                        .status(ToolCallLogEntry.STATUS_DENIED)
                        .build());
                return denied(toolCall, toolName, risk, ToolFailureKind.USER_DENIED, "User denied the action");
            }
            session.setTrustLevel(approvalPolicy.getSessionTrustLevel(sessionId));
        } else {
            log.debug("[Security] '{}' approved: {} ({})", toolName, decision.reason(), decision.method().getValue());
        }

        long start = clock.millis();
        ToolResult result = toolSystem.execute(toolName, args, buildContext(sessionId));
        long durationMs = clock.millis() - start;

        String status = result.isSuccess() ? ToolCallLogEntry.STATUS_OK : ToolCallLogEntry.STATUS_ERROR;
        auditLog.logToolExecution(sessionId, source, toolName, args, true, risk,
                status + " (" + durationMs + "ms)");
        recordAction(ToolCallLogEntry.builder()
                .sessionId(sessionId)
                .toolName(toolName)
                .parameters(args)
                .result(result.getOutput())
                .status(status)
                .durationMs(durationMs)
                .error(result.getError())
                .build());

        return new ToolCallExecutionResult(toolCall.getId(), toolName, result, risk, durationMs);
    }

    /**
     * Context for a tool call made on behalf of a session.
     */
    public ToolContext buildContext(String sessionId) {
        AgentProperties.SandboxProperties sandboxConfig = properties.getSandbox();
        return ToolContext.builder()
                .sessionId(sessionId)
                .allowedDirectories(sandbox.getAllowedDirectories().stream().map(Path::toString).toList())
                .maxExecutionTime(sandboxConfig.getMaxExecutionTime())
                .maxOutputSize(sandboxConfig.getMaxOutputSize())
                .build();
    }

    private ToolCallExecutionResult denied(Message.ToolCall toolCall, String toolName, RiskLevel risk,
            ToolFailureKind kind, String reason) {
        return new ToolCallExecutionResult(toolCall.getId(), toolName, ToolResult.denied(kind, reason), risk, 0);
    }

    private void recordAction(ToolCallLogEntry entry) {
        try {
            actionLog.logToolCall(entry);
        } catch (RuntimeException e) {
            log.warn("[Tools] Failed to write action log for '{}': {}", entry.getToolName(), e.getMessage());
        }
    }
}
