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

/**
 * Heuristic security posture derived from recent audit activity.
 */
public record SecurityScore(int score, String grade, List<Factor> factors, List<String> recommendations) {

    public record Factor(String name, String status, String detail) {

        public static Factor ok(String name, String detail) {
            return new Factor(name, "ok", detail);
        }

        public static Factor warning(String name, String detail) {
            return new Factor(name, "warning", detail);
        }
    }

    public static String gradeFor(int score) {
        if (score >= 90) {
            return "A";
        }
        if (score >= 70) {
            return "B";
        }
        if (score >= 50) {
            return "C";
        }
        return "D";
    }
}
