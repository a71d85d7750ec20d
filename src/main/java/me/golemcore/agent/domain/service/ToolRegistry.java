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

package me.golemcore.agent.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.ToolDefinition;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Name-indexed catalog of the tools the model may call.
 *
 * <p>
 * Every {@link ToolComponent} bean is registered at startup. Additional tools
 * can be registered from factories through {@link #discover(List)}; a factory
 * that fails is logged and skipped.
 */
@Service
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools = new ConcurrentHashMap<>();

    public ToolRegistry(List<ToolComponent> toolComponents) {
        for (ToolComponent tool : toolComponents) {
            register(tool);
        }
    }

    /**
     * Registers a tool under its name, replacing any tool already registered with
     * that name.
     */
    public void register(ToolComponent tool) {
        String name = tool.getToolName();
        ToolComponent previous = tools.put(name, tool);
        if (previous != null && previous != tool) {
            log.warn("[Tools] Tool '{}' registered twice, replacing {} with {}", name,
                    previous.getClass().getSimpleName(), tool.getClass().getSimpleName());
        } else {
            log.debug("[Tools] Registered tool: {}", name);
        }
    }

    /**
     * Instantiates and registers tools from factories.
     *
     * @return number of tools registered
     */
    public int discover(List<Supplier<? extends ToolComponent>> factories) {
        int registered = 0;
        for (Supplier<? extends ToolComponent> factory : factories) {
            try {
                ToolComponent tool = factory.get();
                tool.initialize();
                register(tool);
                registered++;
            } catch (RuntimeException e) {
                log.warn("[Tools] Failed to load tool from {}: {}", factory, e.getMessage());
            }
        }
        log.info("[Tools] Discovered {} tool(s), {} total", registered, tools.size());
        return registered;
    }

    public ToolComponent get(String name) {
        return name != null ? tools.get(name) : null;
    }

    public Collection<ToolComponent> getAll() {
        return List.copyOf(tools.values());
    }

    public List<String> getNames() {
        List<String> names = new ArrayList<>(tools.keySet());
        names.sort(null);
        return names;
    }

    public List<ToolDefinition> getDefinitions() {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (String name : getNames()) {
            definitions.add(tools.get(name).getDefinition());
        }
        return definitions;
    }

    /**
     * Function-calling schemas for every registered tool.
     */
    public List<Map<String, Object>> getOpenAiTools() {
        return getDefinitions().stream().map(ToolDefinition::toOpenAiTool).toList();
    }
}
