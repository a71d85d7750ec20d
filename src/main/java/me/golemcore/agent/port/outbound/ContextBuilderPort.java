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

package me.golemcore.agent.port.outbound;

import me.golemcore.agent.domain.model.AgentSession;
import me.golemcore.agent.domain.model.Message;

import java.util.List;

/**
 * Port for assembling the conversation context sent to the model. Memory and
 * retrieval live behind this port; the engine treats the result as an opaque
 * ordered message list.
 */
public interface ContextBuilderPort {

    List<Message> buildContext(AgentSession session, String systemPrompt, String corePrompt,
            List<String> activeSkills);
}
