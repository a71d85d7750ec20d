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

import java.util.List;
import java.util.Map;

/**
 * Aggregated audit activity for one UTC day.
 */
public record AuditDailyStats(
        String date,
        int totalEvents,
        int toolCalls,
        int approved,
        int denied,
        Map<String, Integer> riskDistribution,
        List<ToolCount> topTools,
        int securityEvents,
        List<Integer> hourlyActivity) {

    public record ToolCount(String toolName, int count) {
    }
}
