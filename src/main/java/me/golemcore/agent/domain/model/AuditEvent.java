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

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Input to the audit log. Timestamp, parameter serialization and signature are
 * added when the event is written.
 */
@Data
@Builder
public class AuditEvent {

    private String eventType;
    private String sessionId;

    @Builder.Default
    private String source = "agent";

    private String toolName;
    private Map<String, Object> parameters;
    private String resultSummary;
    private String approvalStatus;
    private RiskLevel riskLevel;
}
