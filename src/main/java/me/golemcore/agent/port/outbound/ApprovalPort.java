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

package me.golemcore.agent.port.outbound;

import me.golemcore.agent.domain.model.ApprovalRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Port for asking a human whether a tool call may run. Each implementation
 * serves one channel type; the future completes with {@code true} when the
 * user approved and {@code false} on denial or timeout.
 */
public interface ApprovalPort {

    String DEFAULT_CHANNEL = "default";

    /**
     * Channel type this port serves (e.g., "telegram", "cli").
     */
    String getChannelType();

    CompletableFuture<Boolean> requestApproval(ApprovalRequest request);

    /**
     * Whether prompts can be delivered right now.
     */
    boolean isAvailable();
}
