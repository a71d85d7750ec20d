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

import lombok.Builder;
import lombok.Data;
import me.golemcore.agent.domain.model.AgentSession;
import me.golemcore.agent.domain.model.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Rolling state of one {@code processMessage} call: the session and the
 * message list sent to the model, which grows as tool calls are answered.
 */
@Data
@Builder
public class TurnContext {

    private AgentSession session;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    private String model;
}
