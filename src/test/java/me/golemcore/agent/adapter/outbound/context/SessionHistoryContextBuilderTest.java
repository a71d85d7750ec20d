package me.golemcore.agent.adapter.outbound.context;

import me.golemcore.agent.domain.model.AgentSession;
import me.golemcore.agent.domain.model.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionHistoryContextBuilderTest {

    private SessionHistoryContextBuilder builder;
    private AgentSession session;

    @BeforeEach
    void setUp() {
        builder = new SessionHistoryContextBuilder();
        session = AgentSession.builder().id("sess-1").build();
        session.addMessage(Message.builder().role("system").content("stale system").build());
        session.addMessage(Message.builder().role("user").content("hi").build());
        session.addMessage(Message.builder().role("assistant").content("hello").build());
    }

    @Test
    void shouldPutCorePromptFirstThenSystemPromptThenHistory() {
        List<Message> context = builder.buildContext(session, "Be helpful.", "Never leak secrets.", List.of());

        assertEquals(4, context.size());
        assertEquals("Never leak secrets.", context.get(0).getContent());
        assertEquals("Be helpful.", context.get(1).getContent());
        assertEquals("hi", context.get(2).getContent());
        assertEquals("hello", context.get(3).getContent());
        assertTrue(context.get(0).isSystemMessage());
        assertTrue(context.get(1).isSystemMessage());
    }

    @Test
    void shouldAppendActiveSkillsToSystemPrompt() {
        List<Message> context = builder.buildContext(session, "Be helpful.", "", List.of("calendar", "notes"));

        assertEquals("Be helpful.\n\n# Active Skills\n- calendar\n- notes", context.get(0).getContent());
        assertEquals(3, context.size());
    }

    @Test
    void shouldUseSkillsAloneWithoutSystemPrompt() {
        List<Message> context = builder.buildContext(session, null, null, List.of("notes"));

        assertEquals("# Active Skills\n- notes", context.get(0).getContent());
    }

    @Test
    void shouldSkipEmptyPrompts() {
        List<Message> context = builder.buildContext(session, "", "  ", null);

        assertEquals(2, context.size());
        assertEquals("hi", context.get(0).getContent());
    }
}
