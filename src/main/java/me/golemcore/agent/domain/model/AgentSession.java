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

package me.golemcore.agent.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A conversation with one user on one channel. Messages are appended by the
 * engine; the trust level mirrors the session trust granted through approval
 * prompts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentSession {

    private String id;
    private String channelType;
    private String userId;
    private String chatId;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    @Builder.Default
    private RiskLevel trustLevel = RiskLevel.LOW;

    private Instant createdAt;
    private Instant updatedAt;

    public void addMessage(Message message) {
        messages.add(message);
        updatedAt = message.getTimestamp() != null ? message.getTimestamp() : updatedAt;
    }

    /**
     * Chat identifier used by transports; falls back to the user id.
     */
    public String getTransportChatId() {
        return chatId != null ? chatId : userId;
    }
}
