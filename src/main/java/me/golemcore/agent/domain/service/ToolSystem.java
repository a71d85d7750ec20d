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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Dispatches a call to a registered tool and converts every fault into a failed
 * {@link ToolResult}. The tool enforces its own timeout; the dispatcher waits
 * for completion and never pre-empts a running tool.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToolSystem {

    private final ToolRegistry toolRegistry;

    public ToolResult execute(String name, Map<String, Object> parameters, ToolContext context) {
        String toolName = sanitizeToolName(name);
        ToolComponent tool = toolRegistry.get(toolName);
        if (tool == null) {
            return unknownTool(toolName);
        }

        ToolResult result;
        try {
            CompletableFuture<ToolResult> future = tool.execute(parameters != null ? parameters : Map.of(), context);
            result = future.join();
        } catch (RuntimeException e) {
            log.error("[Tools] Tool execution failed: {}", toolName, e);
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool execution failed: " + safeCauseMessage(e));
        }

        if (result == null) {
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool execution failed: no result");
        }
        int maxOutputSize = context != null ? context.getMaxOutputSize() : 0;
        result.setOutput(truncateOutput(result.getOutput(), maxOutputSize, toolName));
        return result;
    }

    public ToolResult unknownTool(String toolName) {
        String available = String.join(", ", toolRegistry.getNames());
        return ToolResult.failure(ToolFailureKind.UNKNOWN_TOOL,
                "Unknown tool: " + toolName + ". Available tools: " + available);
    }

    /**
     * Strip special tokens and garbage from tool names. Some models leak special
     * tokens like {@code <|channel|>} into tool call names.
     */
    public static String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }

    static String truncateOutput(String output, int maxChars, String toolName) {
        if (output == null || maxChars <= 0 || output.length() <= maxChars) {
            return output;
        }
        String suffix = "\n\n[OUTPUT TRUNCATED: " + output.length() + " chars total, showing first "
                + maxChars + " chars]";
        log.warn("[Tools] Truncating '{}' result: {} chars -> {} chars", toolName, output.length(), maxChars);
        return output.substring(0, maxChars) + suffix;
    }

    static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
