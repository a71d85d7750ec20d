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

package me.golemcore.agent.adapter.outbound.actionlog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.domain.component.SanitizerComponent;
import me.golemcore.agent.domain.model.ToolCallLogEntry;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.ActionLogPort;
import me.golemcore.agent.port.outbound.StoragePort;
import me.golemcore.agent.security.SensitiveKeyRedactor;
import me.golemcore.agent.tools.FileSystemTool;
import me.golemcore.agent.tools.ShellTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Operation history written as one JSON object per line to
 * {@code action_logs/actions-YYYY-MM-DD.jsonl} (UTC day). No model tokens are
 * involved; this is a plain hook around tool execution.
 *
 * <p>
 * Modes ({@code agent.action-log.mode}):
 * <ul>
 * <li>{@code tools_only} - every tool call
 * <li>{@code full} - tool calls plus user/assistant turns
 * <li>{@code mutations_only} - only calls with side effects
 * </ul>
 *
 * <p>
 * Parameters, results, errors and previews are secret-redacted before writing.
 */
@Component
@Slf4j
public class JsonlActionLogAdapter implements ActionLogPort {

    static final String LOG_DIR = "action_logs";

    private static final int MAX_ERROR_LENGTH = 500;
    private static final int MAX_RESULT_LENGTH = 10_000;
    private static final int MAX_PREVIEW_LENGTH = 200;

    private static final Set<String> MUTATION_TOOLS = Set.of(
            ShellTool.TOOL_NAME, FileSystemTool.TOOL_NAME, "send_message",
            "clipboard_write", "calendar_write", "memory_store");

    private final AgentProperties.ActionLogProperties config;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final SanitizerComponent sanitizer;
    private final Clock clock;

    public JsonlActionLogAdapter(AgentProperties properties, StoragePort storagePort, ObjectMapper objectMapper,
            SanitizerComponent sanitizer, Clock clock) {
        this.config = properties.getActionLog();
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.sanitizer = sanitizer;
        this.clock = clock;
    }

    @Override
    public void logToolCall(ToolCallLogEntry entry) {
        if (!config.isEnabled() || !shouldLog(entry)) {
            return;
        }

        Map<String, Object> line = new LinkedHashMap<>();
        line.put("ts", Instant.now(clock).toString());
        line.put("sid", entry.getSessionId());
        line.put("type", "tool_call");
        line.put("tool", entry.getToolName());
        line.put("params", sanitizer.redactForLog(SensitiveKeyRedactor.ACTION_LOG.redact(
                entry.getParameters() != null ? entry.getParameters() : Map.of())));
        line.put("status", entry.getStatus());
        line.put("duration_ms", entry.getDurationMs());

        if (entry.getError() != null && !entry.getError().isEmpty()) {
            line.put("error", truncate(redact(entry.getError()), MAX_ERROR_LENGTH));
        }

        String result = entry.getResult() != null ? entry.getResult() : "";
        if (config.isIncludeFullResult()) {
            line.put("result", truncate(redact(result), MAX_RESULT_LENGTH));
        } else {
            line.put("result_size", result.getBytes(StandardCharsets.UTF_8).length);
        }

        write(line);
    }

    @Override
    public void logConversation(String sessionId, String role, String content) {
        if (!config.isEnabled() || config.getMode() != AgentProperties.ActionLogMode.FULL) {
            return;
        }
        String text = content != null ? content : "";

        Map<String, Object> line = new LinkedHashMap<>();
        line.put("ts", Instant.now(clock).toString());
        line.put("sid", sessionId);
        line.put("type", "message");
        line.put("role", role);
        line.put("content_size", text.getBytes(StandardCharsets.UTF_8).length);
        line.put("content_preview", truncate(redact(text), MAX_PREVIEW_LENGTH));

        write(line);
    }

    boolean shouldLog(ToolCallLogEntry entry) {
        if (config.getMode() != AgentProperties.ActionLogMode.MUTATIONS_ONLY) {
            return true;
        }
        String tool = entry.getToolName();
        if (!MUTATION_TOOLS.contains(tool)) {
            return false;
        }
        return !FileSystemTool.TOOL_NAME.equals(tool)
                || entry.getParameters() == null
                || !FileSystemTool.isReadOnly(entry.getParameters());
    }

    String currentFileName() {
        return "actions-" + Instant.now(clock).atZone(ZoneOffset.UTC).toLocalDate() + ".jsonl";
    }

    private void write(Map<String, Object> line) {
        String json;
        try {
            json = objectMapper.writeValueAsString(line);
        } catch (JsonProcessingException e) {
            log.error("[ActionLog] Failed to serialize entry: {}", e.getOriginalMessage());
            return;
        }
        String fileName = currentFileName();
        storagePort.appendText(LOG_DIR, fileName, json + "\n")
                .exceptionally(e -> {
                    log.error("[ActionLog] Failed to write {}: {}", fileName, e.getMessage());
                    return null;
                });
    }

    // Secrets are masked before truncation so a cut never leaves part of one behind.
    private String redact(String text) {
        return String.valueOf(sanitizer.redactForLog(text));
    }

    private static String truncate(String text, int max) {
        return text.length() > max ? text.substring(0, max) : text;
    }
}
