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
 * Result of scanning text for prompt-injection phrasing.
 *
 * @param suspicious
 *            whether any pattern matched
 * @param matched
 *            the first matched text, or null
 */
public record InjectionCheck(boolean suspicious, String matched) {

    public static InjectionCheck clean() {
        return new InjectionCheck(false, null);
    }
}
