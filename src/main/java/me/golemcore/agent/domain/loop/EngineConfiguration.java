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
import me.golemcore.agent.domain.service.AuditLog;
import me.golemcore.agent.domain.service.ToolCallExecutionService;
import me.golemcore.agent.domain.service.ToolRegistry;
import me.golemcore.agent.domain.service.ToolSystem;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.ActionLogPort;
import me.golemcore.agent.port.outbound.ContextBuilderPort;
import me.golemcore.agent.port.outbound.LlmPort;
import me.golemcore.agent.port.outbound.SessionPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EngineConfiguration {

    @Bean
    public HistoryWriter engineHistoryWriter(Clock clock) {
        return new DefaultHistoryWriter(clock);
    }

    @Bean
    public AgentEngine agentEngine(LlmPort llmPort, ToolRegistry toolRegistry, ToolSystem toolSystem,
            ToolCallExecutionService toolCallExecutionService, SanitizerComponent sanitizer, AuditLog auditLog,
            ActionLogPort actionLog, ContextBuilderPort contextBuilder, SessionPort sessionPort,
            HistoryWriter historyWriter, AgentProperties properties) {
        return new AgentEngine(llmPort, toolRegistry, toolSystem, toolCallExecutionService, sanitizer, auditLog,
                actionLog, contextBuilder, sessionPort, historyWriter, properties.getEngine());
    }
}
