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

package me.golemcore.agent.domain.service;

import me.golemcore.agent.infrastructure.config.AgentProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically drops expired session trust grants so the policy's session map
 * does not grow with sessions that are never seen again. Expiry itself is
 * checked lazily on every lookup; this only reclaims memory.
 */
@Service
@Slf4j
public class SessionTrustCleanupService {

    private final ApprovalPolicy approvalPolicy;
    private final long intervalMs;

    private ScheduledExecutorService cleanupExecutor;

    public SessionTrustCleanupService(ApprovalPolicy approvalPolicy, AgentProperties properties) {
        this.approvalPolicy = approvalPolicy;
        this.intervalMs = Math.max(properties.getSecurity().getTrustCleanupIntervalMs(), 1_000L);
    }

    @PostConstruct
    public void init() {
        cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "trust-cleanup");
            t.setDaemon(true);
            return t;
        });
        cleanupExecutor.scheduleWithFixedDelay(this::runCleanup, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * One cleanup pass. Exceptions are logged so the schedule keeps running.
     */
    public int runCleanup() {
        try {
            int removed = approvalPolicy.cleanupExpired();
            if (removed > 0) {
                log.debug("[Approval] Cleaned up {} expired session trust grants", removed);
            }
            return removed;
        } catch (RuntimeException e) {
            log.warn("[Approval] Session trust cleanup failed: {}", e.getMessage());
            return 0;
        }
    }

    @PreDestroy
    public void destroy() {
        if (cleanupExecutor != null) {
            cleanupExecutor.shutdownNow();
            try {
                cleanupExecutor.awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
