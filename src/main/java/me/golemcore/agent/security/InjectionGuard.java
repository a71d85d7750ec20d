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

package me.golemcore.agent.security;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.InjectionCheck;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects prompt-injection phrasing in tool output (web pages, files, command
 * output) before it is handed back to the model.
 *
 * <p>
 * Detection only: the text is never modified and nothing is blocked. The engine
 * records a security event when a pattern matches.
 */
@Component
@Slf4j
public class InjectionGuard {

    private static final int MAX_LOGGED_MATCH = 50;

    private static final List<Pattern> INJECTION_PATTERNS = List.of(
            Pattern.compile("ignore\\s+(all\\s+)?previous\\s+instructions", Pattern.CASE_INSENSITIVE),
            Pattern.compile("ignore\\s+(all\\s+)?above\\s+instructions", Pattern.CASE_INSENSITIVE),
            Pattern.compile("you\\s+are\\s+now\\s+(?:a|an)\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("new\\s+instructions?\\s*:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("system\\s*:\\s*you\\s+are", Pattern.CASE_INSENSITIVE),
            Pattern.compile("forget\\s+(all\\s+)?previous", Pattern.CASE_INSENSITIVE),
            Pattern.compile("disregard\\s+(all\\s+)?previous", Pattern.CASE_INSENSITIVE),
            Pattern.compile("override\\s+(all\\s+)?previous", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\[SYSTEM\\]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\[INST\\]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<<SYS>>", Pattern.CASE_INSENSITIVE));

    private final AtomicLong detections = new AtomicLong();

    public InjectionCheck check(String text) {
        if (text == null || text.isBlank()) {
            return InjectionCheck.clean();
        }

        for (Pattern pattern : INJECTION_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                detections.incrementAndGet();
                String matched = matcher.group();
                log.warn("[Security] Prompt injection detected: pattern={}, matched={}", pattern.pattern(),
                        matched.length() > MAX_LOGGED_MATCH ? matched.substring(0, MAX_LOGGED_MATCH) : matched);
                return new InjectionCheck(true, matched);
            }
        }
        return InjectionCheck.clean();
    }

    public long getDetectionCount() {
        return detections.get();
    }
}
