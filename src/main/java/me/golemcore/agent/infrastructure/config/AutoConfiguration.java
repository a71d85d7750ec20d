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

package me.golemcore.agent.infrastructure.config;

import me.golemcore.agent.domain.service.ToolRegistry;
import me.golemcore.agent.port.outbound.ApprovalPort;
import me.golemcore.agent.port.outbound.LlmPort;
import me.golemcore.agent.security.Sandbox;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.util.List;

/**
 * Shared infrastructure beans and the startup summary.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the {@link Clock} and {@link ObjectMapper} used across the
 * agent</li>
 * <li>Logs startup information (provider, tools, sandbox, approval
 * channels)</li>
 * </ul>
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final AgentProperties properties;
    private final ToolRegistry toolRegistry;
    private final Sandbox sandbox;
    private final LlmPort llmPort;
    private final List<ApprovalPort> approvalPorts;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("GolemCore Agent v{} starting...", version);
        log.info("LLM Provider: {} (model: {})", llmPort.getProviderId(), llmPort.getCurrentModel());
        log.info("Tools: {}", toolRegistry.getNames());
        log.info("Sandbox directories: {}", sandbox.getAllowedDirectories());
        log.info("Auto-approve levels: {}, always ask for: {}",
                properties.getSecurity().getAutoApproveLevels(),
                properties.getSecurity().getRequireApprovalFor());
        log.info("Approval channels: {}", approvalPorts.stream()
                .filter(ApprovalPort::isAvailable)
                .map(ApprovalPort::getChannelType)
                .toList());
        log.info("Storage Path: {}", properties.resolveStorageBasePath());
    }
}
