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

import java.util.Locale;

/**
 * Answer to an approval prompt. {@link #TRUST} approves the call and raises the
 * session trust ceiling to the call's risk level.
 */
public enum ApprovalAnswer {
    APPROVE, DENY, TRUST;

    public boolean isApproved() {
        return this != DENY;
    }

    /**
     * Parses short answers from text channels: y/yes, t/trust, anything else
     * denies.
     */
    public static ApprovalAnswer parse(String text) {
        if (text == null) {
            return DENY;
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
        case "y", "yes", "approve" -> APPROVE;
        case "t", "trust" -> TRUST;
        default -> DENY;
        };
    }
}
