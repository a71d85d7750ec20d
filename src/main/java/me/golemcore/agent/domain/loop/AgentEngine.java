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

package me.golemcore.agent.domain.loop;

import me.golemcore.agent.domain.component.SanitizerComponent;
import me.golemcore.agent.domain.exception.ToolExecutionException;
import me.golemcore.agent.domain.model.AgentSession;
import me.golemcore.agent.domain.model.InjectionCheck;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.service.AuditLog;
import me.golemcore.agent.domain.service.ToolCallExecutionResult;
import me.golemcore.agent.domain.service.ToolCallExecutionService;
import me.golemcore.agent.domain.service.ToolRegistry;
import me.golemcore.agent.domain.service.ToolSystem;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.ActionLogPort;
import me.golemcore.agent.port.outbound.ContextBuilderPort;
import me.golemcore.agent.port.outbound.LlmPort;
import me.golemcore.agent.port.outbound.SessionPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Agent loop (one user message in, one answer out).
 *
 * <p>
 * Each round asks the model for a completion. Plain text ends the turn; tool
 * calls are run one after another through {@link ToolCallExecutionService},
 * their sanitized output is appended to the context, and the next round
 * starts. When the round budget is spent, one last completion without tools
 * produces the answer.
 *
 * <p>
 * Callers must not run two turns of the same session concurrently.
 */
public class AgentEngine {

    private static final Logger log = LoggerFactory.getLogger(AgentEngine.class);

    static final String MAX_ROUNDS_MESSAGE = "I've reached the maximum number of tool call rounds. "
            + "Please try a simpler request.";
    static final String MODEL_UNAVAILABLE_MESSAGE = "Sorry, I couldn't reach any language model. "
            + "Please try again later.";
    static final String SCHEDULER_SESSION_ID = "scheduler";

    private final LlmPort llmPort;
    private final ToolRegistry toolRegistry;
    private final ToolSystem toolSystem;
    private final ToolCallExecutionService toolCallExecutionService;
    private final SanitizerComponent sanitizer;
    private final AuditLog auditLog;
    private final ActionLogPort actionLog;
    private final ContextBuilderPort contextBuilder;
    private final SessionPort sessionPort;
    private final HistoryWriter historyWriter;
    private final AgentProperties.EngineProperties settings;

    public AgentEngine(LlmPort llmPort, ToolRegistry toolRegistry, ToolSystem toolSystem,
            ToolCallExecutionService toolCallExecutionService, SanitizerComponent sanitizer, AuditLog auditLog,
            ActionLogPort actionLog, ContextBuilderPort contextBuilder, SessionPort sessionPort,
            HistoryWriter historyWriter, AgentProperties.EngineProperties settings) {
        this.llmPort = llmPort;
        this.toolRegistry = toolRegistry;
        this.toolSystem = toolSystem;
        this.toolCallExecutionService = toolCallExecutionService;
        this.sanitizer = sanitizer;
        this.auditLog = auditLog;
        this.actionLog = actionLog;
        this.contextBuilder = contextBuilder;
        this.sessionPort = sessionPort;
        this.historyWriter = historyWriter;
        this.settings = settings;
    }

    public String processMessage(String userText, AgentSession session) {
        return processMessage(userText, session, null);
    }

    /**
     * Runs one turn and returns the assistant's answer. Model failures end the
     * turn with an apology; nothing is thrown to the caller.
     *
     * @param model
     *            model override, or null for the configured default
     */
    public String processMessage(String userText, AgentSession session, String model) {
        String text = sanitizer.sanitizeUserInput(userText);
        String targetModel = model != null && !model.isBlank() ? model : settings.getDefaultModel();

        TurnContext context = TurnContext.builder()
                .session(session)
                .model(targetModel)
                .build();
        historyWriter.appendUserMessage(context, text);
        recordConversation(session.getId(), "user", text);
        context.setMessages(buildContext(session));

        List<ToolDefinition> tools = toolRegistry.getDefinitions();
        int maxRounds = Math.max(1, settings.getMaxToolRounds());

        for (int round = 1; round <= maxRounds; round++) {
            LlmResponse response;
            try {
                response = complete(context, tools);
            } catch (RuntimeException e) {
                log.error("[Engine] Model call failed for session {} in round {}", session.getId(), round, e);
                return finishTurn(context, MODEL_UNAVAILABLE_MESSAGE);
            }

            if (response == null || !response.hasToolCalls()) {
                String content = response != null && response.getContent() != null ? response.getContent() : "";
                return finishTurn(context, content);
            }

            log.debug("[Engine] Round {}: {} tool call(s)", round, response.getToolCalls().size());
            historyWriter.appendAssistantToolCalls(context, response);
            for (Message.ToolCall toolCall : response.getToolCalls()) {
                handleToolCall(context, toolCall);
            }
        }

        return forceFinalAnswer(context);
    }

    /**
     * Runs a tool directly, without approval, for scheduled jobs and workflows.
     *
     * @return the tool output
     * @throws ToolExecutionException
     *             if the tool reports a failure
     */
    public String executeTool(String toolName, Map<String, Object> parameters) {
        ToolResult result = toolSystem.execute(toolName, parameters,
                toolCallExecutionService.buildContext(SCHEDULER_SESSION_ID));
        if (!result.isSuccess()) {
            throw new ToolExecutionException(toolName, result.getError() != null ? result.getError()
                    : result.contentForModel());
        }
        return result.getOutput();
    }

    private void handleToolCall(TurnContext context, Message.ToolCall toolCall) {
        String sessionId = context.getSession().getId();
        ToolResult result;
        try {
            ToolCallExecutionResult execution = toolCallExecutionService.execute(context.getSession(), toolCall);
            result = execution.toolResult();
        } catch (RuntimeException e) {
            log.error("[Engine] Tool call '{}' failed outside the tool", toolCall.getName(), e);
            auditLog.logToolExecution(sessionId, ToolCallExecutionService.auditSource(context.getSession()),
                    toolCall.getName(), toolCall.getArguments(), false, null, "error: " + e.getMessage());
            result = ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool execution failed: " + e.getMessage());
        }

        String content = sanitizer.sanitizeToolOutput(result.contentForModel());
        InjectionCheck injection = sanitizer.checkInjection(content);
        if (injection.suspicious()) {
            auditLog.logSecurityEvent("injection_detected", sessionId,
                    "Tool '" + toolCall.getName() + "' output matched: " + injection.matched());
        }
        historyWriter.appendToolResult(context, toolCall, content);
    }

    private String forceFinalAnswer(TurnContext context) {
        log.warn("[Engine] Reached {} tool rounds for session {}, asking for a final answer",
                settings.getMaxToolRounds(), context.getSession().getId());
        String content = null;
        try {
            LlmResponse response = complete(context, List.of());
            content = response != null ? response.getContent() : null;
        } catch (RuntimeException e) {
            log.error("[Engine] Final model call failed for session {}", context.getSession().getId(), e);
        }
        if (content == null || content.isBlank()) {
            content = MAX_ROUNDS_MESSAGE;
        }
        return finishTurn(context, content);
    }

    private LlmResponse complete(TurnContext context, List<ToolDefinition> tools) {
        LlmRequest request = LlmRequest.builder()
                .model(context.getModel())
                .messages(new ArrayList<>(context.getMessages()))
                .tools(tools)
                .temperature(settings.getTemperature())
                .maxTokens(settings.getMaxTokens())
                .sessionId(context.getSession().getId())
                .build();
        LlmResponse response = llmPort.chat(request).join();
        if (response != null && response.getUsage() != null) {
            log.debug("[Engine] Model {} used {} input / {} output tokens", response.getModel(),
                    response.getUsage().getInputTokens(), response.getUsage().getOutputTokens());
        }
        return response;
    }

    private String finishTurn(TurnContext context, String content) {
        historyWriter.appendFinalAssistantAnswer(context, content);
        recordConversation(context.getSession().getId(), "assistant", content);
        saveSession(context.getSession());
        return content;
    }

    private List<Message> buildContext(AgentSession session) {
        try {
            List<Message> messages = contextBuilder.buildContext(session, settings.getSystemPrompt(),
                    settings.getCorePrompt(), settings.getActiveSkills());
            return new ArrayList<>(messages);
        } catch (RuntimeException e) {
            log.warn("[Engine] Context builder failed, using session history: {}", e.getMessage());
            List<Message> messages = new ArrayList<>();
            messages.add(Message.builder()
                    .role("system")
                    .content(settings.getSystemPrompt())
                    .build());
            messages.addAll(session.getMessages());
            return messages;
        }
    }

    private void recordConversation(String sessionId, String role, String content) {
        try {
            actionLog.logConversation(sessionId, role, content);
        } catch (RuntimeException e) {
            log.warn("[Engine] Failed to write conversation to action log: {}", e.getMessage());
        }
    }

    private void saveSession(AgentSession session) {
        try {
            sessionPort.save(session);
        } catch (RuntimeException e) {
            log.warn("[Engine] Failed to save session {}: {}", session.getId(), e.getMessage());
        }
    }
}
