package me.golemcore.agent.domain.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class ApprovalAnswerTest {

    @ParameterizedTest
    @ValueSource(strings = { "y", "yes", "YES", " approve " })
    void shouldParseApproval(String input) {
        assertEquals(ApprovalAnswer.APPROVE, ApprovalAnswer.parse(input));
    }

    @ParameterizedTest
    @ValueSource(strings = { "t", "trust", "Trust" })
    void shouldParseTrust(String input) {
        ApprovalAnswer answer = ApprovalAnswer.parse(input);
        assertEquals(ApprovalAnswer.TRUST, answer);
        assertTrue(answer.isApproved());
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "n", "no", "maybe", "yess" })
    void shouldTreatEverythingElseAsDenial(String input) {
        assertEquals(ApprovalAnswer.DENY, ApprovalAnswer.parse(input));
        assertFalse(ApprovalAnswer.parse(input).isApproved());
    }

    @Test
    void shouldDenyNull() {
        assertEquals(ApprovalAnswer.DENY, ApprovalAnswer.parse(null));
    }
}
