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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.ApprovalAnswer;
import me.golemcore.agent.domain.model.ApprovalCallbackEvent;
import me.golemcore.agent.domain.model.RiskLevel;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Correlation table for approval prompts that are waiting for a human answer.
 *
 * <p>
 * Each entry is backed by a future that completes with {@code false} when the
 * timeout elapses. The entry is removed as soon as its future completes, so an
 * answer resolves an approval at most once. A {@link ApprovalAnswer#TRUST}
 * answer approves and raises the session trust ceiling to the request's risk.
 */
@Service
@Slf4j
public class PendingApprovalRegistry {

    private static final int ID_LENGTH = 8;

    private final ApprovalPolicy approvalPolicy;
    private final Map<String, PendingApproval> pending = new ConcurrentHashMap<>();

    public PendingApprovalRegistry(ApprovalPolicy approvalPolicy) {
        this.approvalPolicy = approvalPolicy;
    }

    public record PendingApproval(String id, String sessionId, String toolName, RiskLevel riskLevel,
            CompletableFuture<Boolean> future) {
    }

    public PendingApproval open(String sessionId, String toolName, RiskLevel riskLevel, Duration timeout) {
        CompletableFuture<Boolean> future = new CompletableFuture<>();
        PendingApproval entry;
        String id;
        do {
            id = UUID.randomUUID().toString().substring(0, ID_LENGTH);
            entry = new PendingApproval(id, sessionId, toolName, riskLevel, future);
        } while (pending.putIfAbsent(id, entry) != null);

        String approvalId = id;
        PendingApproval registered = entry;
        future.completeOnTimeout(false, timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((approved, error) -> {
                    if (pending.remove(approvalId, registered)) {
                        log.info("[Approval] Request {} for '{}' timed out, treating as denied", approvalId, toolName);
                    }
                });

        log.debug("[Approval] Opened request {} for '{}' ({})", id, toolName, riskLevel);
        return entry;
    }

    /**
     * Resolves a pending approval.
     *
     * @return true if this call resolved the approval, false if it was unknown,
     *         already answered or timed out
     */
    public boolean resolve(String approvalId, ApprovalAnswer answer) {
        PendingApproval entry = approvalId != null ? pending.remove(approvalId) : null;
        if (entry == null) {
            log.debug("[Approval] No pending request for id: {}", approvalId);
            return false;
        }

        // Trust is granted before the waiting caller wakes up and reads it.
        if (answer == ApprovalAnswer.TRUST && entry.sessionId() != null && !entry.future().isDone()) {
            approvalPolicy.elevateSessionTrust(entry.sessionId(), entry.riskLevel());
        }
        boolean completed = entry.future().complete(answer.isApproved());
        log.info("[Approval] Request {} for '{}' resolved: {}", approvalId, entry.toolName(), answer);
        return completed;
    }

    @EventListener
    public void onApprovalCallback(ApprovalCallbackEvent event) {
        resolve(event.approvalId(), event.answer());
    }

    public boolean isPending(String approvalId) {
        return pending.containsKey(approvalId);
    }

    public int size() {
        return pending.size();
    }
}
