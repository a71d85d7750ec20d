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
 * Risk classification of a tool invocation. The declaration order defines a
 * total ordering: LOW &lt; MEDIUM &lt; HIGH &lt; CRITICAL.
 */
public enum RiskLevel {

    LOW("low"), MEDIUM("medium"), HIGH("high"), CRITICAL("critical");

    private final String value;

    RiskLevel(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isAtMost(RiskLevel other) {
        return compareTo(other) <= 0;
    }

    public boolean isAtLeast(RiskLevel other) {
        return compareTo(other) >= 0;
    }

    public boolean isHigherThan(RiskLevel other) {
        return compareTo(other) > 0;
    }

    public boolean isLowerThan(RiskLevel other) {
        return compareTo(other) < 0;
    }

    /**
     * Parses a configuration value such as {@code "high"} or {@code "HIGH"}.
     *
     * @throws IllegalArgumentException
     *             if the value does not name a risk level
     */
    public static RiskLevel fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Risk level must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RiskLevel level : values()) {
            if (level.value.equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown risk level: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
