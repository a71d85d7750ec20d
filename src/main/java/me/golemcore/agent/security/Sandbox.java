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

package me.golemcore.agent.security;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.SandboxTarget;
import me.golemcore.agent.domain.model.SandboxVerdict;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Constrains tool operations to safe boundaries: a directory allow-list for file
 * operations and a command block-list for shell execution.
 *
 * <p>
 * Besides the configurable block-list, every command is matched against a
 * fixed table of destructive patterns that configuration cannot relax. The
 * sandbox has no side effects; it only answers whether an operation may run.
 */
@Component
@Slf4j
public class Sandbox {

    private static final int MAX_LOGGED_COMMAND = 100;
    private static final Set<String> WRITE_OPERATIONS = Set.of("write", "create");
    private static final Pattern ENV_VAR = Pattern.compile("\\$(?:\\{([A-Za-z_][A-Za-z0-9_]*)}|([A-Za-z_][A-Za-z0-9_]*))");

    private static final List<Pattern> DANGEROUS_PATTERNS = List.of(
            Pattern.compile("\\brm\\s+(-[a-z-]+\\s+)*/(\\*|\\s|;|&|\\||$)"),
            Pattern.compile("\\brm\\s+.*--no-preserve-root"),
            Pattern.compile("\\bformat\\s+[a-z]:"),
            Pattern.compile("\\bdel\\s+(/[a-z]\\s+)+[a-z]:\\\\"),
            Pattern.compile("\\brmdir\\s+/s\\s+/q\\s+[a-z]:\\\\"),
            Pattern.compile("\\bmkfs(\\.\\w+)?\\b"),
            Pattern.compile("\\bdd\\s+if=.*of=/dev/"),
            Pattern.compile(">\\s*/dev/(sd[a-z]|hd[a-z]|nvme|disk)"),
            Pattern.compile("\\bchmod\\s+-r\\s+777\\s+/(\\s|$)"),
            Pattern.compile("\\bchown\\s+-r\\s+.*\\s+/\\s*$"),
            Pattern.compile("\\b(curl|wget)\\b.*\\|\\s*(sudo\\s+)?(bash|sh|zsh|python[0-9.]*|powershell)\\b"),
            Pattern.compile("\\breg\\s+delete\\b"),
            Pattern.compile("\\bnet\\s+user\\s+.*\\s+/add\\b"),
            Pattern.compile(":\\(\\)\\s*\\{\\s*:\\s*\\|\\s*:\\s*&\\s*}\\s*;\\s*:"));

    private final AgentProperties.SandboxProperties config;
    private volatile List<Path> resolvedAllowedDirectories;

    public Sandbox(AgentProperties properties) {
        this.config = properties.getSandbox();
    }

    /**
     * Configured allowed directories, expanded and resolved once.
     */
    public List<Path> getAllowedDirectories() {
        List<Path> resolved = resolvedAllowedDirectories;
        if (resolved == null) {
            List<Path> dirs = new ArrayList<>();
            for (String dir : config.getAllowedDirectories()) {
                try {
                    dirs.add(resolveReal(Paths.get(expandPath(dir))));
                } catch (InvalidPathException e) {
                    log.warn("[Sandbox] Ignoring invalid allowed directory '{}': {}", dir, e.getMessage());
                }
            }
            resolved = List.copyOf(dirs);
            resolvedAllowedDirectories = resolved;
        }
        return resolved;
    }

    /**
     * Checks if a file path is within the allowed directories. An empty
     * allow-list allows every path.
     */
    public boolean isPathAllowed(String path) {
        if (config.getAllowedDirectories().isEmpty()) {
            return true;
        }
        if (path == null || path.isBlank()) {
            return false;
        }
        try {
            return isWithinAllowed(resolveReal(Paths.get(expandPath(path))));
        } catch (InvalidPathException e) {
            log.warn("[Sandbox] Invalid path rejected: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Checks a shell command against the configured block-list (case-insensitive
     * substring) and the fixed dangerous-pattern table.
     */
    public boolean isCommandAllowed(String command) {
        if (command == null || command.isBlank()) {
            return false;
        }
        String normalized = command.toLowerCase(Locale.ROOT).strip();

        for (String blocked : config.getBlockedCommands()) {
            if (!blocked.isEmpty() && normalized.contains(blocked.toLowerCase(Locale.ROOT))) {
                log.warn("[Sandbox] Command blocked: command={}, rule={}", abbreviate(command), blocked);
                return false;
            }
        }

        for (Pattern pattern : DANGEROUS_PATTERNS) {
            if (pattern.matcher(normalized).find()) {
                log.warn("[Sandbox] Command blocked: command={}, pattern={}", abbreviate(command),
                        pattern.pattern());
                return false;
            }
        }
        return true;
    }

    /**
     * Validates a file operation: allow-list, symlink escape and, for
     * {@code write}/{@code create}, existence of the parent directory.
     */
    public SandboxVerdict validateFileOperation(String path, String operation) {
        if (!isPathAllowed(path)) {
            String allowed = getAllowedDirectories().stream().map(Path::toString)
                    .collect(Collectors.joining(", "));
            return SandboxVerdict.deny("Path not in allowed directories: " + allowed);
        }

        Path lexical;
        try {
            lexical = Paths.get(expandPath(path)).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            return SandboxVerdict.deny("Invalid path: " + e.getMessage());
        }

        if (Files.isSymbolicLink(lexical) && !config.getAllowedDirectories().isEmpty()) {
            try {
                Path target = lexical.toRealPath();
                if (!isWithinAllowed(target)) {
                    return SandboxVerdict.deny("Symlink target is outside allowed directories");
                }
            } catch (IOException e) {
                return SandboxVerdict.deny("Symlink target cannot be resolved: " + lexical);
            }
        }

        if (operation != null && WRITE_OPERATIONS.contains(operation)) {
            Path parent = resolveReal(lexical).getParent();
            if (parent == null || !Files.isDirectory(parent)) {
                return SandboxVerdict.deny("Parent directory does not exist: " + parent);
            }
        }
        return SandboxVerdict.allow();
    }

    /**
     * Validates a target declared by a tool.
     */
    public SandboxVerdict validate(SandboxTarget target) {
        if (target.kind() == SandboxTarget.Kind.COMMAND) {
            return isCommandAllowed(target.value())
                    ? SandboxVerdict.allow()
                    : SandboxVerdict.deny("Command blocked by sandbox policy");
        }
        return validateFileOperation(target.value(), target.operation());
    }

    /**
     * Expands a leading {@code ~} and {@code $VAR} / {@code ${VAR}} references.
     * Unknown variables are left as written.
     */
    public static String expandPath(String path) {
        String expanded = path.strip();
        Matcher matcher = ENV_VAR.matcher(expanded);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
            String value = System.getenv(name);
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(sb);
        expanded = sb.toString();

        if ("~".equals(expanded)) {
            return System.getProperty("user.home");
        }
        if (expanded.startsWith("~/") || expanded.startsWith("~\\")) {
            return System.getProperty("user.home") + expanded.substring(1);
        }
        return expanded;
    }

    /**
     * Absolute, normalized path with symlinks followed for the part that exists.
     */
    static Path resolveReal(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        Path existing = absolute;
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            return absolute;
        }
        try {
            return existing.toRealPath().resolve(existing.relativize(absolute)).normalize();
        } catch (IOException e) {
            log.debug("[Sandbox] Cannot resolve real path of {}: {}", existing, e.getMessage());
            return absolute;
        }
    }

    private boolean isWithinAllowed(Path target) {
        for (Path allowed : getAllowedDirectories()) {
            if (target.startsWith(allowed)) {
                return true;
            }
        }
        return false;
    }

    private static String abbreviate(String command) {
        return command.length() > MAX_LOGGED_COMMAND ? command.substring(0, MAX_LOGGED_COMMAND) : command;
    }
}
