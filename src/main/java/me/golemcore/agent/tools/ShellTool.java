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

package me.golemcore.agent.tools;

import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.RiskLevel;
import me.golemcore.agent.domain.model.SandboxTarget;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.security.Sandbox;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Tool for executing shell commands.
 *
 * <p>
 * Command screening is done by the {@link Sandbox} before the call reaches
 * this tool (the tool declares a {@link SandboxTarget#command} target). The
 * tool itself enforces the process timeout and output cap taken from the
 * {@link ToolContext}, and strips the child environment down to an allow-list
 * so that variables such as {@code LD_PRELOAD} never reach the command.
 *
 * <p>
 * Commands execute via {@code /bin/sh -c} (or {@code cmd.exe /c} on Windows)
 * in the requested working directory, falling back to the configured
 * workspace.
 */
@Component
@Slf4j
public class ShellTool implements ToolComponent {

    public static final String TOOL_NAME = "shell_execute";

    private static final String PARAM_TYPE = "type";
    private static final String PARAM_COMMAND = "command";
    private static final String PARAM_WORKING_DIRECTORY = "working_directory";
    private static final String TYPE_STRING = "string";
    private static final String TYPE_OBJECT = "object";

    private static final Set<String> DEFAULT_ALLOWED_ENV_VARS = Set.of(
            "PATH", "LANG", "LC_ALL", "LC_CTYPE", "TERM", "TMPDIR",
            "TZ", "SHELL", "USER", "LOGNAME");

    private final Path workspaceRoot;
    private final Set<String> allowedEnvVars;
    private final ExecutorService executor;

    public ShellTool(AgentProperties properties) {
        AgentProperties.ShellToolProperties config = properties.getTools().getShell();
        this.workspaceRoot = Paths.get(AgentProperties.expandUserHome(config.getWorkspace()))
                .toAbsolutePath().normalize();
        this.allowedEnvVars = buildAllowedEnvVars(config.getAllowedEnvVars());
        this.executor = Executors.newCachedThreadPool();

        try {
            Files.createDirectories(workspaceRoot);
            log.info("[Shell] Workspace: {}", workspaceRoot);
        } catch (IOException e) {
            log.error("[Shell] Failed to create workspace directory: {}", workspaceRoot, e);
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Shell] Executor did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("""
                        Execute a shell command and return its combined stdout/stderr output.
                        Commands are subject to sandbox restrictions and a timeout.
                        """)
                .inputSchema(Map.of(
                        PARAM_TYPE, TYPE_OBJECT,
                        "properties", Map.of(
                                PARAM_COMMAND, Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        "description", "The shell command to execute"),
                                PARAM_WORKING_DIRECTORY, Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        "description", "Working directory for the command (default: workspace)")),
                        "required", List.of(PARAM_COMMAND)))
                .build();
    }

    @Override
    public RiskLevel getRiskLevel() {
        return RiskLevel.HIGH;
    }

    @Override
    public Optional<SandboxTarget> sandboxTarget(Map<String, Object> parameters) {
        Object command = parameters != null ? parameters.get(PARAM_COMMAND) : null;
        return Optional.of(SandboxTarget.command(command != null ? command.toString() : ""));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolContext context) {
        return CompletableFuture.supplyAsync(() -> {
            Object commandValue = parameters.get(PARAM_COMMAND);
            String command = commandValue != null ? commandValue.toString() : null;
            if (command == null || command.isBlank()) {
                log.warn("[Shell] Missing command parameter");
                return ToolResult.failure("Command is required");
            }
            log.info("[Shell] Command: '{}'", truncate(command, 200));

            Path workDir = resolveWorkDir(parameters.get(PARAM_WORKING_DIRECTORY), context);
            if (!Files.isDirectory(workDir)) {
                log.warn("[Shell] Working directory not found: {}", workDir);
                return ToolResult.failure("Working directory not found: " + workDir);
            }

            ToolResult result = executeCommand(command, workDir, context.getMaxExecutionTime(),
                    context.getMaxOutputSize());
            log.info("[Shell] Command result: status={}", result.getStatus());
            return result;
        }, executor);
    }

    private Path resolveWorkDir(Object requested, ToolContext context) {
        if (requested != null && !requested.toString().isBlank()) {
            return resolveAgainstWorkspace(requested.toString());
        }
        if (context.getWorkingDirectory() != null && !context.getWorkingDirectory().isBlank()) {
            return resolveAgainstWorkspace(context.getWorkingDirectory());
        }
        return workspaceRoot;
    }

    // Relative directories are taken from the workspace, not the process directory.
    private Path resolveAgainstWorkspace(String dir) {
        Path path = Paths.get(Sandbox.expandPath(dir));
        return (path.isAbsolute() ? path : workspaceRoot.resolve(path)).normalize();
    }

    private ToolResult executeCommand(String command, Path workDir, int timeoutSeconds, int maxOutput) {
        ProcessBuilder pb = new ProcessBuilder();

        String os = System.getProperty("os.name").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            pb.command("cmd.exe", "/c", command);
        } else {
            pb.command("/bin/sh", "-c", command);
        }

        pb.directory(workDir.toFile());
        pb.redirectErrorStream(true);

        Map<String, String> env = pb.environment();
        env.keySet().retainAll(allowedEnvVars);
        env.put("HOME", workspaceRoot.toString());
        env.put("PWD", workDir.toString());

        long startTime = System.currentTimeMillis();

        try {
            Process process = pb.start();

            Future<String> outputFuture = executor.submit(() -> {
                StringBuilder output = new StringBuilder();
                try (BufferedReader reader = new BufferedReader(
                        new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                    String line = reader.readLine();
                    while (line != null) {
                        if (output.length() <= maxOutput) {
                            output.append(line).append("\n");
                        }
                        line = reader.readLine();
                    }
                }
                return output.toString();
            });

            boolean completed = process.waitFor(Math.max(timeoutSeconds, 1), TimeUnit.SECONDS);
            long duration = System.currentTimeMillis() - startTime;

            if (!completed) {
                process.destroyForcibly();
                outputFuture.cancel(true);
                log.warn("[Shell] Command timed out after {}s: {}", timeoutSeconds, truncate(command, 100));
                return ToolResult.failure("Command timed out after " + timeoutSeconds + " seconds");
            }

            String output;
            try {
                output = outputFuture.get(1, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                output = "[Output read timeout]";
            }

            if (output.length() > maxOutput) {
                output = output.substring(0, maxOutput) + "\n... (output truncated)";
            }

            int exitCode = process.exitValue();
            Map<String, Object> data = Map.of(
                    "exitCode", exitCode,
                    "duration", duration,
                    PARAM_COMMAND, command,
                    "workdir", workDir.toString());

            if (exitCode == 0) {
                return ToolResult.success(output.isEmpty() ? "(no output)" : output, data);
            }
            return ToolResult.builder()
                    .status(ToolResult.Status.FAILED)
                    .output("Exit code: " + exitCode + "\n" + output)
                    .error("Command failed with exit code " + exitCode)
                    .data(data)
                    .build();

        } catch (IOException e) {
            log.error("[Shell] Failed to start command: {}", e.getMessage());
            return ToolResult.failure("Failed to execute command: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure("Command interrupted");
        } catch (ExecutionException e) {
            log.error("[Shell] Failed to read command output", e);
            return ToolResult.failure("Failed to read output: " + e.getMessage());
        }
    }

    private static Set<String> buildAllowedEnvVars(String configValue) {
        if (configValue == null || configValue.isBlank()) {
            return DEFAULT_ALLOWED_ENV_VARS;
        }
        Set<String> merged = new HashSet<>(DEFAULT_ALLOWED_ENV_VARS);
        Set<String> custom = Arrays.stream(configValue.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
        merged.addAll(custom);
        return Collections.unmodifiableSet(merged);
    }

    private static String truncate(String text, int maxLen) {
        if (text.length() <= maxLen) {
            return text;
        }
        return text.substring(0, maxLen) + "...";
    }
}
