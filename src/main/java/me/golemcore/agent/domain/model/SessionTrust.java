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

package me.golemcore.agent.domain.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Temporary elevated approval ceiling for one session. Expiry is evaluated
 * lazily: once the grant is older than its timeout, the ceiling reads as
 * {@link RiskLevel#LOW} again.
 */
public class SessionTrust {

    private final Clock clock;
    private RiskLevel level = RiskLevel.LOW;
    private Instant grantedAt;
    private Duration timeout;

    public SessionTrust(Clock clock, Duration timeout) {
        this.clock = clock;
        this.timeout = timeout;
    }

    public synchronized void elevate(RiskLevel newLevel, Duration newTimeout) {
        this.level = newLevel;
        this.timeout = newTimeout;
        this.grantedAt = clock.instant();
    }

    public synchronized boolean isExpired() {
        if (grantedAt == null) {
            return true;
        }
        return Duration.between(grantedAt, clock.instant()).compareTo(timeout) > 0;
    }

    /**
     * Current ceiling; resets the grant when it has expired.
     */
    public synchronized RiskLevel currentLevel() {
        if (isExpired()) {
            level = RiskLevel.LOW;
            grantedAt = null;
        }
        return level;
    }

    public synchronized Instant getGrantedAt() {
        return grantedAt;
    }

    public synchronized Duration getTimeout() {
        return timeout;
    }
}
