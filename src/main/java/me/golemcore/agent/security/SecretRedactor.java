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

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Masks credentials inside free text: provider API keys, {@code api_key=} and
 * {@code token=} assignments, bearer tokens, passwords embedded in URLs, AWS
 * access keys and PEM private key headers.
 */
@Component
public class SecretRedactor {

    private record Rule(Pattern pattern, String replacement) {
    }

    private static final List<Rule> RULES = List.of(
            new Rule(Pattern.compile("sk-[a-zA-Z0-9]{20,}", Pattern.CASE_INSENSITIVE), "sk-***REDACTED***"),
            new Rule(Pattern.compile("(api[_-]?key\\s*[:=]\\s*)['\"]?([a-zA-Z0-9_-]{20,})['\"]?",
                    Pattern.CASE_INSENSITIVE), "$1***REDACTED***"),
            new Rule(Pattern.compile("Bearer\\s+[A-Za-z0-9\\-._~+/]{8,}=*", Pattern.CASE_INSENSITIVE),
                    "Bearer ***REDACTED***"),
            new Rule(Pattern.compile("(token\\s*[:=]\\s*)['\"]?([a-zA-Z0-9_.-]{20,})['\"]?",
                    Pattern.CASE_INSENSITIVE), "$1***REDACTED***"),
            new Rule(Pattern.compile("(://[^:/\\s@]+:)([^@\\s]+)(@)"), "$1***@"),
            new Rule(Pattern.compile("AKIA[0-9A-Z]{16}", Pattern.CASE_INSENSITIVE), "AKIA***REDACTED***"),
            new Rule(Pattern.compile("-----BEGIN\\s+(\\w+\\s+)?PRIVATE\\s+KEY-----", Pattern.CASE_INSENSITIVE),
                    "[PRIVATE KEY REDACTED]"));

    /**
     * Redact sensitive information from content.
     */
    public String redact(String content) {
        if (content == null) {
            return "";
        }
        String result = content;
        for (Rule rule : RULES) {
            result = rule.pattern().matcher(result).replaceAll(rule.replacement());
        }
        return result;
    }

    /**
     * Redacts strings anywhere inside maps and lists. Other values pass through.
     */
    public Object redactDeep(Object value) {
        if (value instanceof String text) {
            return redact(text);
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> redacted = new LinkedHashMap<>();
            map.forEach((key, item) -> redacted.put(key, redactDeep(item)));
            return redacted;
        }
        if (value instanceof List<?> list) {
            List<Object> redacted = new ArrayList<>(list.size());
            for (Object item : list) {
                redacted.add(redactDeep(item));
            }
            return redacted;
        }
        return value;
    }
}
