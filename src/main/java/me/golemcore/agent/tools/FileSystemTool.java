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
import me.golemcore.agent.security.Sandbox;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Tool for file system operations.
 *
 * <p>
 * Paths may be absolute, relative to the working directory, or start with
 * {@code ~} / {@code $VAR}. Which paths are reachable is decided by the
 * {@link Sandbox} from the {@link SandboxTarget} this tool declares, so the
 * tool itself does not re-check the allow-list.
 *
 * <p>
 * Operations and their risk:
 * <ul>
 * <li>read_file - low
 * <li>write_file - medium
 * <li>list_directory - low
 * <li>create_directory - medium
 * <li>delete - critical
 * <li>file_info - low
 * </ul>
 */
@Component
@Slf4j
public class FileSystemTool implements ToolComponent {

    public static final String TOOL_NAME = "filesystem";

    public static final String OP_READ_FILE = "read_file";
    public static final String OP_WRITE_FILE = "write_file";
    public static final String OP_LIST_DIRECTORY = "list_directory";
    public static final String OP_CREATE_DIRECTORY = "create_directory";
    public static final String OP_DELETE = "delete";
    public static final String OP_FILE_INFO = "file_info";

    private static final String PARAM_OPERATION = "operation";
    private static final String PARAM_PATH = "path";
    private static final String PARAM_CONTENT = "content";
    private static final String PARAM_APPEND = "append";
    private static final String TYPE = "type";
    private static final String DESCRIPTION = "description";

    private static final long MAX_FILE_SIZE = 10 * 1024 * 1024; // 10 MB
    private static final int MAX_FILES_LIST = 100;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("""
                        File system operations.
                        Operations: read_file, write_file, list_directory, create_directory, delete, file_info.
                        Paths may be absolute or start with ~. Access is limited to the allowed directories.
                        """)
                .inputSchema(Map.of(
                        TYPE, "object",
                        "properties", Map.of(
                                PARAM_OPERATION, Map.of(
                                        TYPE, "string",
                                        "enum", List.of(OP_READ_FILE, OP_WRITE_FILE, OP_LIST_DIRECTORY,
                                                OP_CREATE_DIRECTORY, OP_DELETE, OP_FILE_INFO),
                                        DESCRIPTION, "Operation to perform"),
                                PARAM_PATH, Map.of(
                                        TYPE, "string",
                                        DESCRIPTION, "File or directory path"),
                                PARAM_CONTENT, Map.of(
                                        TYPE, "string",
                                        DESCRIPTION, "Content to write (for write_file operation)"),
                                PARAM_APPEND, Map.of(
                                        TYPE, "boolean",
                                        DESCRIPTION,
                                        "Append to file instead of overwriting (for write_file, default: false)")),
                        "required", List.of(PARAM_OPERATION, PARAM_PATH)))
                .build();
    }

    @Override
    public RiskLevel getRiskLevel() {
        return RiskLevel.MEDIUM;
    }

    @Override
    public RiskLevel getRiskLevel(Map<String, Object> parameters) {
        String operation = stringParam(parameters, PARAM_OPERATION);
        if (operation == null) {
            return getRiskLevel();
        }
        return switch (operation) {
        case OP_READ_FILE, OP_LIST_DIRECTORY, OP_FILE_INFO -> RiskLevel.LOW;
        case OP_WRITE_FILE, OP_CREATE_DIRECTORY -> RiskLevel.MEDIUM;
        case OP_DELETE -> RiskLevel.CRITICAL;
        default -> getRiskLevel();
        };
    }

    @Override
    public Optional<SandboxTarget> sandboxTarget(Map<String, Object> parameters) {
        String path = stringParam(parameters, PARAM_PATH);
        if (path == null) {
            return Optional.empty();
        }
        return Optional.of(SandboxTarget.path(path, sandboxOperation(stringParam(parameters, PARAM_OPERATION))));
    }

    /**
     * Maps a tool operation to the operation the sandbox validates.
     */
    static String sandboxOperation(String operation) {
        if (operation == null) {
            return "read";
        }
        return switch (operation) {
        case OP_WRITE_FILE -> "write";
        case OP_CREATE_DIRECTORY -> "create";
        case OP_DELETE -> "delete";
        default -> "read";
        };
    }

    /**
     * Operations that leave the filesystem untouched.
     */
    public static boolean isReadOnly(Map<String, Object> parameters) {
        String operation = stringParam(parameters, PARAM_OPERATION);
        return OP_READ_FILE.equals(operation) || OP_LIST_DIRECTORY.equals(operation)
                || OP_FILE_INFO.equals(operation);
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolContext context) {
        return CompletableFuture.supplyAsync(() -> {
            String operation = stringParam(parameters, PARAM_OPERATION);
            String pathStr = stringParam(parameters, PARAM_PATH);
            log.info("[FileSystem] Operation: {}, Path: {}", operation, pathStr);

            if (operation == null || pathStr == null) {
                log.warn("[FileSystem] Missing required parameters");
                return ToolResult.failure("Missing required parameters: operation and path");
            }

            Path path;
            try {
                path = Paths.get(Sandbox.expandPath(pathStr)).toAbsolutePath().normalize();
            } catch (InvalidPathException e) {
                return ToolResult.failure("Invalid path: " + pathStr);
            }

            ToolResult result = switch (operation) {
            case OP_READ_FILE -> readFile(path);
            case OP_WRITE_FILE -> writeFile(path, parameters);
            case OP_LIST_DIRECTORY -> listDirectory(path);
            case OP_CREATE_DIRECTORY -> createDirectory(path);
            case OP_DELETE -> delete(path);
            case OP_FILE_INFO -> fileInfo(path);
            default -> ToolResult.failure("Unknown operation: " + operation);
            };

            log.info("[FileSystem] Operation '{}' result: status={}", operation, result.getStatus());
            return result;
        });
    }

    private ToolResult readFile(Path path) {
        if (!Files.exists(path)) {
            return ToolResult.failure("File not found: " + path);
        }
        if (!Files.isRegularFile(path)) {
            return ToolResult.failure("Not a file: " + path);
        }

        try {
            long size = Files.size(path);
            if (size > MAX_FILE_SIZE) {
                return ToolResult.failure("File too large (max " + (MAX_FILE_SIZE / 1024 / 1024) + " MB)");
            }

            String content = Files.readString(path, StandardCharsets.UTF_8);
            return ToolResult.success(content, Map.of(
                    PARAM_PATH, path.toString(),
                    "size", size,
                    "lines", content.lines().count()));
        } catch (IOException e) {
            return ToolResult.failure("Failed to read file: " + e.getMessage());
        }
    }

    private ToolResult writeFile(Path path, Map<String, Object> params) {
        Object content = params.get(PARAM_CONTENT);
        if (content == null) {
            return ToolResult.failure("Missing content for write_file operation");
        }
        boolean append = Boolean.TRUE.equals(params.get(PARAM_APPEND))
                || "true".equalsIgnoreCase(String.valueOf(params.get(PARAM_APPEND)));

        try {
            if (append) {
                Files.writeString(path, content.toString(), StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } else {
                Files.writeString(path, content.toString(), StandardCharsets.UTF_8);
            }

            long size = Files.size(path);
            String action = append ? "appended to" : "written to";
            return ToolResult.success("Successfully " + action + " file: " + path, Map.of(
                    PARAM_PATH, path.toString(),
                    "size", size,
                    PARAM_OPERATION, append ? "append" : "write"));
        } catch (IOException e) {
            return ToolResult.failure("Failed to write file: " + e.getMessage());
        }
    }

    private ToolResult listDirectory(Path path) {
        if (!Files.exists(path)) {
            return ToolResult.failure("Directory not found: " + path);
        }
        if (!Files.isDirectory(path)) {
            return ToolResult.failure("Not a directory: " + path);
        }

        try (Stream<Path> stream = Files.list(path)) {
            List<Path> children = stream
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .limit(MAX_FILES_LIST)
                    .toList();

            List<Map<String, Object>> entries = new ArrayList<>();
            StringBuilder sb = new StringBuilder();
            sb.append("Directory: ").append(path).append("\n");
            sb.append("Entries: ").append(children.size()).append("\n\n");

            for (Path child : children) {
                String name = child.getFileName().toString();
                BasicFileAttributes attrs = Files.readAttributes(child, BasicFileAttributes.class);
                if (attrs.isDirectory()) {
                    sb.append("[DIR]  ").append(name).append("/\n");
                    entries.add(Map.of("name", name, TYPE, "directory"));
                } else {
                    sb.append("[FILE] ").append(name).append(" (").append(formatSize(attrs.size())).append(")\n");
                    entries.add(Map.of("name", name, TYPE, "file", "size", attrs.size()));
                }
            }

            return ToolResult.success(sb.toString(), Map.of(
                    PARAM_PATH, path.toString(),
                    "entries", entries));
        } catch (IOException e) {
            return ToolResult.failure("Failed to list directory: " + e.getMessage());
        }
    }

    private ToolResult createDirectory(Path path) {
        try {
            if (Files.exists(path)) {
                if (Files.isDirectory(path)) {
                    return ToolResult.success("Directory already exists: " + path);
                }
                return ToolResult.failure("Path exists but is not a directory: " + path);
            }

            Files.createDirectories(path);
            return ToolResult.success("Created directory: " + path, Map.of(PARAM_PATH, path.toString()));
        } catch (IOException e) {
            return ToolResult.failure("Failed to create directory: " + e.getMessage());
        }
    }

    private ToolResult delete(Path path) {
        if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
            return ToolResult.failure("Path not found: " + path);
        }

        try {
            if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
                try (Stream<Path> walk = Files.walk(path)) {
                    walk.sorted(Comparator.reverseOrder()).forEach(FileSystemTool::deleteEntry);
                }
            } else {
                Files.delete(path);
            }
            return ToolResult.success("Deleted: " + path);
        } catch (IOException e) {
            return ToolResult.failure("Failed to delete: " + e.getMessage());
        } catch (UncheckedIOException e) {
            return ToolResult.failure("Failed to delete: " + e.getCause().getMessage());
        }
    }

    private static void deleteEntry(Path entry) {
        try {
            Files.delete(entry);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private ToolResult fileInfo(Path path) {
        if (!Files.exists(path)) {
            return ToolResult.failure("Path not found: " + path);
        }

        try {
            BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);

            Map<String, Object> info = Map.of(
                    PARAM_PATH, path.toString(),
                    TYPE, attrs.isDirectory() ? "directory" : "file",
                    "size", attrs.size(),
                    "sizeFormatted", formatSize(attrs.size()),
                    "created", attrs.creationTime().toString(),
                    "modified", attrs.lastModifiedTime().toString(),
                    "readable", Files.isReadable(path),
                    "writable", Files.isWritable(path));

            StringBuilder sb = new StringBuilder();
            sb.append("Path: ").append(path).append("\n");
            sb.append("Type: ").append(attrs.isDirectory() ? "Directory" : "File").append("\n");
            sb.append("Size: ").append(formatSize(attrs.size())).append("\n");
            sb.append("Created: ").append(attrs.creationTime()).append("\n");
            sb.append("Modified: ").append(attrs.lastModifiedTime()).append("\n");

            return ToolResult.success(sb.toString(), info);
        } catch (IOException e) {
            return ToolResult.failure("Failed to get file info: " + e.getMessage());
        }
    }

    private static String stringParam(Map<String, Object> parameters, String key) {
        if (parameters == null) {
            return null;
        }
        Object value = parameters.get(key);
        return value != null ? value.toString() : null;
    }

    static String formatSize(long bytes) {
        if (bytes < 1024)
            return bytes + " B";
        if (bytes < 1024 * 1024)
            return String.format(Locale.ROOT, "%.1f KB", bytes / 1024.0);
        if (bytes < 1024 * 1024 * 1024)
            return String.format(Locale.ROOT, "%.1f MB", bytes / (1024.0 * 1024));
        return String.format(Locale.ROOT, "%.1f GB", bytes / (1024.0 * 1024 * 1024));
    }
}
