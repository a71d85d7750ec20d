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
import me.golemcore.agent.domain.model.ApprovalRequest;
import me.golemcore.agent.port.outbound.ApprovalPort;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Sends an approval request to the channel the session came from, falling back
 * to the default policy when that channel cannot prompt. Any failure on the way
 * counts as a denial.
 */
@Service
@Slf4j
public class ApprovalRouter {

    private final List<ApprovalPort> approvalPorts;

    public ApprovalRouter(List<ApprovalPort> approvalPorts) {
        this.approvalPorts = approvalPorts;
    }

    /**
     * Blocks until the user answers or the request times out.
     */
    public boolean requestApproval(ApprovalRequest request) {
        ApprovalPort port = resolvePort(request.session() != null ? request.session().getChannelType() : null);
        if (port == null) {
            log.warn("[Approval] No approval channel available, denying '{}'", request.toolName());
            return false;
        }

        log.info("[Approval] Requesting approval via {}: {}", port.getChannelType(), request.description());
        try {
            CompletableFuture<Boolean> future = port.requestApproval(request);
            return Boolean.TRUE.equals(future.join());
        } catch (RuntimeException e) {
            log.warn("[Approval] Approval request for '{}' failed, denying: {}", request.toolName(), e.getMessage());
            return false;
        }
    }

    ApprovalPort resolvePort(String channelType) {
        ApprovalPort fallback = null;
        for (ApprovalPort port : approvalPorts) {
            if (port.getChannelType().equals(channelType) && port.isAvailable()) {
                return port;
            }
            if (ApprovalPort.DEFAULT_CHANNEL.equals(port.getChannelType())) {
                fallback = port;
            }
        }
        return fallback;
    }
}
