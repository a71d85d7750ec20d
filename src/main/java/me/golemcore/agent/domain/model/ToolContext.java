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

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Per-call execution limits handed to a tool. Built fresh for every call and
 * never persisted.
 */
@Data
@Builder
public class ToolContext {

    private String sessionId;
    private String workingDirectory;

    @Builder.Default
    private List<String> allowedDirectories = List.of();

    @Builder.Default
    private int maxExecutionTime = 30;

    @Builder.Default
    private int maxOutputSize = 100_000;
}
