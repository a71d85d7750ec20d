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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Masks values of map entries whose key names a credential. Used for tool
 * parameters written to the audit log and the action log.
 */
public final class SensitiveKeyRedactor {

    private static final List<String> AUDIT_KEYS = List.of(
            "api_key", "api-key", "apikey", "password", "passwd", "secret", "token",
            "credential", "auth_token", "access_key", "private_key");

    private static final List<String> ACTION_LOG_KEYS = List.of(
            "password", "passwd", "secret", "token", "api_key", "apikey", "credential", "private_key", "auth");

    private static final List<String> SECRET_PREFIXES = List.of("sk-", "pk-", "api-", "token-");
    private static final int PREFIX_MIN_LENGTH = 20;
    private static final int PREFIX_KEEP = 6;

    /**
     * Audit flavour: masks with {@code ***} and shortens long prefixed secrets to
     * their first characters.
     */
    public static final SensitiveKeyRedactor AUDIT = new SensitiveKeyRedactor(AUDIT_KEYS, "***", true);

    /**
     * Action log flavour: masks with {@code ***REDACTED***}.
     */
    public static final SensitiveKeyRedactor ACTION_LOG = new SensitiveKeyRedactor(ACTION_LOG_KEYS,
            "***REDACTED***", false);

    private final List<String> keyFragments;
    private final String mask;
    private final boolean shortenPrefixedValues;

    private SensitiveKeyRedactor(List<String> keyFragments, String mask, boolean shortenPrefixedValues) {
        this.keyFragments = keyFragments;
        this.mask = mask;
        this.shortenPrefixedValues = shortenPrefixedValues;
    }

    public Map<String, Object> redact(Map<String, Object> data) {
        if (data == null) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        data.forEach((key, value) -> result.put(key, isSensitiveKey(key) ? mask : redactValue(value)));
        return result;
    }

    /**
     * Redacts maps and lists at any depth. Other values only have their secret
     * prefixes shortened.
     */
    public Object redactValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            map.forEach((key, item) -> nested.put(String.valueOf(key), item));
            return redact(nested);
        }
        if (value instanceof List<?> list) {
            List<Object> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(redactValue(item));
            }
            return items;
        }
        if (shortenPrefixedValues && value instanceof String text && text.length() > PREFIX_MIN_LENGTH) {
            String lower = text.toLowerCase(Locale.ROOT);
            for (String prefix : SECRET_PREFIXES) {
                if (lower.startsWith(prefix)) {
                    return text.substring(0, PREFIX_KEEP) + mask;
                }
            }
        }
        return value;
    }

    private boolean isSensitiveKey(String key) {
        if (key == null) {
            return false;
        }
        String lower = key.toLowerCase(Locale.ROOT);
        for (String fragment : keyFragments) {
            if (lower.contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}
