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

/**
 * Outcome of the approval policy for one tool call. A decision that is not
 * approved with method {@link Method#PENDING} must be put to the user.
 */
public record ApprovalDecision(boolean approved, String reason, Method method) {

    public enum Method {
        AUTO("auto"), SESSION_TRUST("session_trust"), PENDING("pending");

        private final String value;

        Method(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }
    }

    public static ApprovalDecision auto(String reason) {
        return new ApprovalDecision(true, reason, Method.AUTO);
    }

    public static ApprovalDecision sessionTrust(String reason) {
        return new ApprovalDecision(true, reason, Method.SESSION_TRUST);
    }

    public static ApprovalDecision pending(String reason) {
        return new ApprovalDecision(false, reason, Method.PENDING);
    }

    public boolean isPending() {
        return method == Method.PENDING;
    }
}
