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

import lombok.Data;
import me.golemcore.agent.domain.model.RiskLevel;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the agent, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code agent.*} prefix:
 * <ul>
 * <li>{@link EngineProperties} - agent loop and prompts</li>
 * <li>{@link LlmProperties} - provider selection and model fallback chain</li>
 * <li>{@link SecurityProperties} - approval policy and session trust</li>
 * <li>{@link SandboxProperties} - path allow-list and command block-list</li>
 * <li>{@link AuditProperties} - tamper-evident audit database</li>
 * <li>{@link ActionLogProperties} - JSONL action log</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private EngineProperties engine = new EngineProperties();
    private LlmProperties llm = new LlmProperties();
    private SecurityProperties security = new SecurityProperties();
    private SandboxProperties sandbox = new SandboxProperties();
    private ApprovalProperties approval = new ApprovalProperties();
    private AuditProperties audit = new AuditProperties();
    private ActionLogProperties actionLog = new ActionLogProperties();
    private StorageProperties storage = new StorageProperties();
    private ToolsProperties tools = new ToolsProperties();
    private Map<String, ChannelProperties> channels = new HashMap<>();

    /**
     * Replaces a literal {@code ${user.home}} left in a default value.
     */
    public static String expandUserHome(String path) {
        return path.replace("${user.home}", System.getProperty("user.home"));
    }

    public Path resolveStorageBasePath() {
        return Paths.get(expandUserHome(storage.getLocal().getBasePath())).toAbsolutePath().normalize();
    }

    @Data
    public static class EngineProperties {
        private int maxToolRounds = 10;
        private String systemPrompt = "You are a helpful personal assistant. Use the available tools when an action "
                + "is needed, and explain what you did.";
        private String corePrompt = "";
        private String defaultModel = "";
        private double temperature = 0.7;
        private int maxTokens = 4096;
        private List<String> activeSkills = new ArrayList<>();
    }

    @Data
    public static class LlmProperties {
        private String provider = "none";
        private List<String> fallbackChain = new ArrayList<>();
    }

    @Data
    public static class SecurityProperties {
        private List<RiskLevel> autoApproveLevels = new ArrayList<>(List.of(RiskLevel.LOW));
        private List<String> requireApprovalFor = new ArrayList<>(List.of("shell_execute", "send_message"));
        private List<String> disabledTools = new ArrayList<>();
        private boolean sessionTrustEnabled = true;
        private int trustTimeoutMinutes = 30;
        private long trustCleanupIntervalMs = 300_000;
    }

    @Data
    public static class SandboxProperties {
        private List<String> allowedDirectories = new ArrayList<>(List.of("~/Documents", "~/Desktop"));
        private List<String> blockedCommands = new ArrayList<>(List.of(
                "rm -rf /", "format", "del /f /s /q C:\\", "reg delete", "rmdir /s /q C:\\"));
        private int maxExecutionTime = 30;
        private int maxOutputSize = 100_000;
    }

    @Data
    public static class ApprovalProperties {
        private int timeoutSeconds = 60;
    }

    @Data
    public static class AuditProperties {
        private String databasePath = "audit.db";
        private String hmacSecret = "";
    }

    public enum ActionLogMode {
        TOOLS_ONLY, FULL, MUTATIONS_ONLY
    }

    @Data
    public static class ActionLogProperties {
        private boolean enabled = true;
        private ActionLogMode mode = ActionLogMode.TOOLS_ONLY;
        private boolean includeFullResult = false;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/agent";
    }

    @Data
    public static class ToolsProperties {
        private ShellToolProperties shell = new ShellToolProperties();
    }

    @Data
    public static class ShellToolProperties {
        private String workspace = "${user.home}";
        private String allowedEnvVars = "";
    }

    @Data
    public static class ChannelProperties {
        private boolean enabled = false;
        private String token;
    }
}
