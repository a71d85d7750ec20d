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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One persisted row of the audit log. {@code parameters} holds the redacted
 * parameters as compact JSON with sorted keys.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEntry {

    private long id;
    private String timestamp;
    private String eventType;
    private String sessionId;
    private String source;
    private String toolName;
    private String parameters;
    private String resultSummary;
    private String approvalStatus;
    private String riskLevel;
    private String hmac;

    /**
     * The fields covered by the row signature, joined with {@code |}.
     */
    public String signaturePayload() {
        return String.join("|", nz(timestamp), nz(eventType), nz(sessionId), nz(toolName), nz(parameters),
                nz(approvalStatus));
    }

    private static String nz(String value) {
        return value != null ? value : "";
    }
}
