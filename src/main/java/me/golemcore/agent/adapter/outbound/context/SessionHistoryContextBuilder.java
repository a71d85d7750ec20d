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

package me.golemcore.agent.adapter.outbound.context;

import me.golemcore.agent.domain.model.AgentSession;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.port.outbound.ContextBuilderPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the model context from the session history.
 *
 * <p>
 * Order:
 * <ol>
 * <li>core prompt (when configured), always first</li>
 * <li>system prompt, with the active skills appended as a section</li>
 * <li>the conversation, without stored system messages</li>
 * </ol>
 */
@Component
@Slf4j
public class SessionHistoryContextBuilder implements ContextBuilderPort {

    private static final String ROLE_SYSTEM = "system";
    private static final String DOUBLE_NEWLINE = "\n\n";

    @Override
    public List<Message> buildContext(AgentSession session, String systemPrompt, String corePrompt,
            List<String> activeSkills) {
        List<Message> context = new ArrayList<>();

        if (corePrompt != null && !corePrompt.isBlank()) {
            context.add(systemMessage(corePrompt));
        }

        StringBuilder sb = new StringBuilder(systemPrompt != null ? systemPrompt : "");
        if (activeSkills != null && !activeSkills.isEmpty()) {
            if (!sb.isEmpty()) {
                sb.append(DOUBLE_NEWLINE);
            }
            sb.append("# Active Skills\n");
            for (String skill : activeSkills) {
                sb.append("- ").append(skill).append("\n");
            }
        }
        if (!sb.isEmpty()) {
            context.add(systemMessage(sb.toString().strip()));
        }

        for (Message message : session.getMessages()) {
            if (!message.isSystemMessage()) {
                context.add(message);
            }
        }

        log.debug("[Context] Built {} messages for session {}", context.size(), session.getId());
        return context;
    }

    private static Message systemMessage(String content) {
        return Message.builder()
                .role(ROLE_SYSTEM)
                .content(content)
                .build();
    }
}
