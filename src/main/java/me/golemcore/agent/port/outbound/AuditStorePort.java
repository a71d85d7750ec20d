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

import me.golemcore.agent.domain.model.AuditEntry;

import java.util.List;

/**
 * Append-only storage for audit rows. There is deliberately no update or
 * delete operation.
 *
 * <p>
 * Implementations throw {@link me.golemcore.agent.domain.exception.AuditStoreException}
 * on storage failures.
 */
public interface AuditStorePort {

    void append(AuditEntry entry);

    /**
     * Newest first. Null filters match everything.
     */
    List<AuditEntry> findRecent(int limit, String sessionId, String eventType);

    /**
     * Rows with {@code fromInclusive <= timestamp < toExclusive}, oldest first.
     */
    List<AuditEntry> findBetween(String fromInclusive, String toExclusive);
}
