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

import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.Message;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

public class DefaultHistoryWriter implements HistoryWriter {

    private final Clock clock;

    public DefaultHistoryWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void appendUserMessage(TurnContext context, String text) {
        Message user = Message.builder()
                .id(UUID.randomUUID().toString())
                .role("user")
                .content(text)
                .timestamp(now())
                .build();

        // The context is built from the session afterwards, so only the session gets it.
        context.getSession().addMessage(user);
    }

    @Override
    public void appendAssistantToolCalls(TurnContext context, LlmResponse llmResponse) {
        Message assistant = Message.builder()
                .id(UUID.randomUUID().toString())
                .role("assistant")
                .content(llmResponse.getContent())
                .toolCalls(llmResponse.getToolCalls())
                .metadata(buildAssistantMetadata(context))
                .timestamp(now())
                .build();

        append(context, assistant);
    }

    @Override
    public void appendToolResult(TurnContext context, Message.ToolCall toolCall, String content) {
        Message toolMsg = Message.builder()
                .id(UUID.randomUUID().toString())
                .role("tool")
                .toolCallId(toolCall.getId())
                .toolName(toolCall.getName())
                .content(content)
                .timestamp(now())
                .build();

        append(context, toolMsg);
    }

    @Override
    public void appendFinalAssistantAnswer(TurnContext context, String finalText) {
        Message assistant = Message.builder()
                .id(UUID.randomUUID().toString())
                .role("assistant")
                .content(finalText)
                .metadata(buildAssistantMetadata(context))
                .timestamp(now())
                .build();

        append(context, assistant);
    }

    private void append(TurnContext context, Message message) {
        context.getMessages().add(message);
        if (context.getSession() != null) {
            context.getSession().addMessage(message);
        }
    }

    private Instant now() {
        return clock.instant();
    }

    private Map<String, Object> buildAssistantMetadata(TurnContext context) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        String model = context.getModel();
        if (model != null && !model.isBlank()) {
            metadata.put("model", model);
        }
        return metadata;
    }
}
