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

package me.golemcore.agent.adapter.outbound.approval;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.ApprovalRequest;
import me.golemcore.agent.domain.model.RiskLevel;
import me.golemcore.agent.port.outbound.ApprovalPort;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Fallback used when the session's channel cannot prompt: low-risk calls are
 * approved, everything else is denied.
 */
@Component
@Slf4j
public class DefaultApprovalAdapter implements ApprovalPort {

    @Override
    public String getChannelType() {
        return DEFAULT_CHANNEL;
    }

    @Override
    public CompletableFuture<Boolean> requestApproval(ApprovalRequest request) {
        boolean approved = request.riskLevel() == RiskLevel.LOW;
        log.info("[Approval] No interactive channel, {} '{}' ({})", approved ? "approving" : "denying",
                request.toolName(), request.riskLevel());
        return CompletableFuture.completedFuture(approved);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
