package me.golemcore.agent.adapter.outbound.storage;

import me.golemcore.agent.domain.model.AgentSession;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.RiskLevel;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.infrastructure.config.AutoConfiguration;
import me.golemcore.agent.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LocalSessionAdapterTest {

    @TempDir
    Path tempDir;

    private LocalSessionAdapter adapter;

    @BeforeEach
    void setUp() {
        AgentProperties properties = new AgentProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        adapter = new LocalSessionAdapter(storage, AutoConfiguration.objectMapper());
    }

    @Test
    void shouldSaveAndLoadSession() {
        // GIVEN
        Message.ToolCall call = Message.ToolCall.builder().id("tc-1").name("echo")
                .arguments(Map.of("text", "hi")).build();
        AgentSession session = AgentSession.builder()
                .id("telegram:42")
                .channelType("telegram")
                .chatId("42")
                .trustLevel(RiskLevel.MEDIUM)
                .createdAt(Instant.parse("2026-03-01T10:00:00Z"))
                .messages(new ArrayList<>(List.of(
                        Message.builder().role("user").content("hi").build(),
                        Message.builder().role("assistant").toolCalls(List.of(call)).build())))
                .build();

        // WHEN
        adapter.save(session);
        Optional<AgentSession> loaded = adapter.load("telegram:42");

        // THEN
        assertTrue(Files.exists(tempDir.resolve("sessions/telegram_42.json")));
        assertTrue(loaded.isPresent());
        assertEquals("42", loaded.get().getChatId());
        assertEquals(RiskLevel.MEDIUM, loaded.get().getTrustLevel());
        assertEquals(Instant.parse("2026-03-01T10:00:00Z"), loaded.get().getCreatedAt());
        assertEquals(2, loaded.get().getMessages().size());
        assertEquals("echo", loaded.get().getMessages().get(1).getToolCalls().get(0).getName());
    }

    @Test
    void shouldReturnEmptyForUnknownSession() {
        assertTrue(adapter.load("nobody").isEmpty());
    }

    @Test
    void shouldReturnEmptyForCorruptFile() {
        StoragePort storage = mock(StoragePort.class);
        when(storage.getText(any(), any())).thenReturn(CompletableFuture.completedFuture("{not json"));
        LocalSessionAdapter corrupt = new LocalSessionAdapter(storage, AutoConfiguration.objectMapper());

        assertTrue(corrupt.load("s1").isEmpty());
    }

    @Test
    void shouldMakeSafeFileNames() {
        assertEquals("cli_local.json", LocalSessionAdapter.fileName("cli:local"));
        assertEquals("a.b-c_d.json", LocalSessionAdapter.fileName("a.b-c_d"));
        assertEquals(".._etc_passwd.json", LocalSessionAdapter.fileName("../etc/passwd"));
    }
}
