package me.golemcore.agent.adapter.outbound.approval;

import me.golemcore.agent.domain.model.AgentSession;
import me.golemcore.agent.domain.model.ApprovalRequest;
import me.golemcore.agent.domain.model.RiskLevel;
import me.golemcore.agent.domain.service.ApprovalPolicy;
import me.golemcore.agent.domain.service.PendingApprovalRegistry;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.InputStreamReader;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleApprovalAdapterTest {

    private AgentProperties properties;
    private ApprovalPolicy policy;
    private ConsoleApprovalAdapter adapter;
    private ByteArrayOutputStream output;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        policy = new ApprovalPolicy(properties, new MutableClock(Instant.parse("2026-03-01T10:00:00Z")));
        adapter = new ConsoleApprovalAdapter(properties, new PendingApprovalRegistry(policy));
        output = new ByteArrayOutputStream();
    }

    @AfterEach
    void tearDown() {
        adapter.shutdown();
    }

    private void answerWith(String input) {
        adapter.setConsole(new BufferedReader(new StringReader(input)),
                new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    private static ApprovalRequest request() {
        AgentSession session = AgentSession.builder().id("sess-1").channelType("cli").build();
        return new ApprovalRequest("filesystem", Map.of("operation", "delete", "path", "/tmp/x"),
                RiskLevel.CRITICAL, session, "Delete file: /tmp/x");
    }

    @Test
    void shouldBeAvailableOnlyWhenCliChannelEnabled() {
        assertFalse(adapter.isAvailable());

        AgentProperties.ChannelProperties cli = new AgentProperties.ChannelProperties();
        cli.setEnabled(true);
        properties.getChannels().put("cli", cli);

        assertTrue(adapter.isAvailable());
        assertEquals("cli", adapter.getChannelType());
    }

    @Test
    void shouldPrintPromptAndApproveOnYes() throws Exception {
        answerWith("y\n");

        boolean approved = adapter.requestApproval(request()).get(2, TimeUnit.SECONDS);

        assertTrue(approved);
        String prompt = output.toString(StandardCharsets.UTF_8);
        assertTrue(prompt.contains("Approval required [critical] filesystem"));
        assertTrue(prompt.contains("Delete file: /tmp/x"));
    }

    @Test
    void shouldDenyOnOtherInput() throws Exception {
        answerWith("nope\n");

        assertFalse(adapter.requestApproval(request()).get(2, TimeUnit.SECONDS));
    }

    @Test
    void shouldDenyAtEndOfInput() throws Exception {
        answerWith("");

        assertFalse(adapter.requestApproval(request()).get(2, TimeUnit.SECONDS));
    }

    @Test
    void shouldRouteAnswerToLivePromptAfterEarlierTimeout() throws Exception {
        // GIVEN
        properties.getApproval().setTimeoutSeconds(1);
        PipedOutputStream keyboard = new PipedOutputStream();
        PipedInputStream stdin = new PipedInputStream(keyboard);
        adapter.setConsole(new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8)),
                new PrintStream(output, true, StandardCharsets.UTF_8));

        try {
            boolean first = adapter.requestApproval(request()).get(5, TimeUnit.SECONDS);

            // WHEN
            CompletableFuture<Boolean> second = adapter.requestApproval(request());
            keyboard.write("y\n".getBytes(StandardCharsets.UTF_8));
            keyboard.flush();

            // THEN
            assertFalse(first);
            assertTrue(second.get(5, TimeUnit.SECONDS));
        } finally {
            keyboard.close();
        }
    }

    @Test
    void shouldAnswerQueuedPromptsInOrder() throws Exception {
        answerWith("y\nn\n");

        CompletableFuture<Boolean> first = adapter.requestApproval(request());
        CompletableFuture<Boolean> second = adapter.requestApproval(request());

        assertTrue(first.get(2, TimeUnit.SECONDS));
        assertFalse(second.get(2, TimeUnit.SECONDS));
    }

    @Test
    void shouldDenyLaterPromptsOnceInputIsClosed() throws Exception {
        answerWith("");

        assertFalse(adapter.requestApproval(request()).get(2, TimeUnit.SECONDS));
        assertFalse(adapter.requestApproval(request()).get(2, TimeUnit.SECONDS));
    }

    @Test
    void shouldTrustSessionOnT() throws Exception {
        answerWith("t\n");

        assertTrue(adapter.requestApproval(request()).get(2, TimeUnit.SECONDS));
        assertEquals(RiskLevel.CRITICAL, policy.getSessionTrustLevel("sess-1"));
    }
}
