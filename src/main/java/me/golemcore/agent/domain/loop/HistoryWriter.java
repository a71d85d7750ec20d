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

/**
 * Appends turn messages to both the rolling model context and the session
 * history, keeping the two in the same order.
 */
public interface HistoryWriter {

    void appendUserMessage(TurnContext context, String text);

    void appendAssistantToolCalls(TurnContext context, LlmResponse llmResponse);

    void appendToolResult(TurnContext context, Message.ToolCall toolCall, String content);

    void appendFinalAssistantAnswer(TurnContext context, String finalText);
}
