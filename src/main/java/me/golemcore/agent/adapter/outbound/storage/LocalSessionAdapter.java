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

package me.golemcore.agent.adapter.outbound.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.domain.model.AgentSession;
import me.golemcore.agent.port.outbound.SessionPort;
import me.golemcore.agent.port.outbound.StoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Persists sessions as JSON files under {@code sessions/} through the
 * {@link StoragePort}. Writes go through an atomic rename with a backup of the
 * previous version.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalSessionAdapter implements SessionPort {

    private static final String SESSIONS_DIR = "sessions";
    private static final String JSON_EXTENSION = ".json";
    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^A-Za-z0-9._-]");

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    @Override
    public void save(AgentSession session) {
        try {
            String json = objectMapper.writeValueAsString(session);
            storagePort.putTextAtomic(SESSIONS_DIR, fileName(session.getId()), json, true).join();
            log.debug("Saved session: {}", session.getId());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session: " + session.getId(), e);
        }
    }

    @Override
    public Optional<AgentSession> load(String sessionId) {
        String json = storagePort.getText(SESSIONS_DIR, fileName(sessionId)).join();
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, AgentSession.class));
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse session file for {}: {}", sessionId, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    static String fileName(String sessionId) {
        return UNSAFE_CHARS.matcher(sessionId).replaceAll("_") + JSON_EXTENSION;
    }
}
