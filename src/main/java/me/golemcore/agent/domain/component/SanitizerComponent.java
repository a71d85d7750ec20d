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

package me.golemcore.agent.domain.component;

import me.golemcore.agent.domain.model.InjectionCheck;

/**
 * Component for cleaning text that crosses a trust boundary: user input coming
 * in, tool output going back to the model, and values written to logs.
 */
public interface SanitizerComponent extends Component {

    @Override
    default String getComponentType() {
        return "sanitizer";
    }

    /**
     * Strips NUL bytes, normalizes line endings and trims.
     */
    String sanitizeUserInput(String input);

    /**
     * Masks secrets in tool output before it reaches the model.
     */
    String sanitizeToolOutput(String output);

    /**
     * Masks secrets in strings, maps and lists, recursively.
     */
    Object redactForLog(Object value);

    /**
     * Scans text for prompt-injection phrasing. Detection only, the text is not
     * modified.
     */
    InjectionCheck checkInjection(String text);
}
