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

import me.golemcore.agent.domain.model.RiskLevel;
import me.golemcore.agent.domain.model.SandboxTarget;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Component interface for tools that can be called by the LLM. Tools expose a
 * definition (JSON Schema for the model), a risk level for the approval
 * policy, and optionally a sandbox target derived from the call arguments.
 */
public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the tool definition including name, description, and parameter
     * schema.
     */
    ToolDefinition getDefinition();

    /**
     * Baseline risk of the tool.
     */
    RiskLevel getRiskLevel();

    /**
     * Risk of a concrete invocation. Tools with several operations override this
     * to grade each operation separately.
     */
    default RiskLevel getRiskLevel(Map<String, Object> parameters) {
        return getRiskLevel();
    }

    /**
     * What the sandbox must validate before this call runs. Tools that touch
     * neither the filesystem nor the shell return empty and skip the sandbox.
     */
    default Optional<SandboxTarget> sandboxTarget(Map<String, Object> parameters) {
        return Optional.empty();
    }

    /**
     * Executes the tool. Implementations enforce their own timeouts; a thrown
     * exception or failed future is converted to a failed result by the caller.
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolContext context);

    default String getToolName() {
        return getDefinition().getName();
    }
}
