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

import lombok.RequiredArgsConstructor;
import me.golemcore.agent.domain.component.SanitizerComponent;
import me.golemcore.agent.domain.model.InjectionCheck;
import org.springframework.stereotype.Component;

/**
 * Sanitizer used by the engine. Delegates to {@link InputSanitizer},
 * {@link SecretRedactor} and {@link InjectionGuard}.
 */
@Component
@RequiredArgsConstructor
public class OutputSanitizer implements SanitizerComponent {

    private final InputSanitizer inputSanitizer;
    private final SecretRedactor secretRedactor;
    private final InjectionGuard injectionGuard;

    @Override
    public String sanitizeUserInput(String input) {
        return inputSanitizer.sanitize(input);
    }

    @Override
    public String sanitizeToolOutput(String output) {
        return secretRedactor.redact(output);
    }

    @Override
    public Object redactForLog(Object value) {
        return secretRedactor.redactDeep(value);
    }

    @Override
    public InjectionCheck checkInjection(String text) {
        return injectionGuard.check(text);
    }
}
