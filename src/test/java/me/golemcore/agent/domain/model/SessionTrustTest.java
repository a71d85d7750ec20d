package me.golemcore.agent.domain.model;

import me.golemcore.agent.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SessionTrustTest {

    private static final Duration TIMEOUT = Duration.ofMinutes(30);

    private MutableClock clock;
    private SessionTrust trust;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        trust = new SessionTrust(clock, TIMEOUT);
    }

    @Test
    void shouldStartExpiredAtLowLevel() {
        assertTrue(trust.isExpired());
        assertEquals(RiskLevel.LOW, trust.currentLevel());
        assertNull(trust.getGrantedAt());
    }

    @Test
    void shouldKeepGrantUntilTimeoutElapses() {
        trust.elevate(RiskLevel.HIGH, TIMEOUT);

        clock.advance(TIMEOUT);

        assertFalse(trust.isExpired());
        assertEquals(RiskLevel.HIGH, trust.currentLevel());
    }

    @Test
    void shouldResetToLowOnceExpired() {
        trust.elevate(RiskLevel.HIGH, TIMEOUT);

        clock.advance(TIMEOUT.plusSeconds(1));

        assertTrue(trust.isExpired());
        assertEquals(RiskLevel.LOW, trust.currentLevel());
        assertNull(trust.getGrantedAt());
    }

    @Test
    void shouldRestartWindowOnNewGrant() {
        trust.elevate(RiskLevel.MEDIUM, TIMEOUT);
        clock.advance(Duration.ofMinutes(20));

        trust.elevate(RiskLevel.CRITICAL, Duration.ofMinutes(15));
        clock.advance(Duration.ofMinutes(14));

        assertEquals(RiskLevel.CRITICAL, trust.currentLevel());
        assertEquals(Duration.ofMinutes(15), trust.getTimeout());
    }
}
