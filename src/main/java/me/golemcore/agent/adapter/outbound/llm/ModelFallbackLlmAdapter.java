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

package me.golemcore.agent.adapter.outbound.llm;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.exception.LlmUnavailableException;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * The {@link LlmPort} used by the engine.
 *
 * <p>
 * Selects the provider adapter named by {@code agent.llm.provider} (the no-op
 * adapter when it is missing) and tries the requested model first, then each
 * model of {@code agent.llm.fallback-chain} in order. The returned future fails
 * with {@link LlmUnavailableException} only when every model failed.
 */
@Component
@Primary
@Slf4j
public class ModelFallbackLlmAdapter implements LlmPort {

    private final AgentProperties properties;
    private final List<LlmProviderAdapter> adapters;
    private final Map<String, LlmProviderAdapter> adaptersByProvider = new ConcurrentHashMap<>();
    private LlmProviderAdapter activeAdapter;

    public ModelFallbackLlmAdapter(AgentProperties properties, List<LlmProviderAdapter> adapters) {
        this.properties = properties;
        this.adapters = adapters;
    }

    @PostConstruct
    public void init() {
        for (LlmProviderAdapter adapter : adapters) {
            adaptersByProvider.put(adapter.getProviderId(), adapter);
            log.debug("Registered LLM adapter: {}", adapter.getProviderId());
        }

        String provider = properties.getLlm().getProvider();
        activeAdapter = adaptersByProvider.get(provider);
        if (activeAdapter == null) {
            activeAdapter = adaptersByProvider.get(NoOpLlmAdapter.PROVIDER_ID);
            if (activeAdapter == null && !adapters.isEmpty()) {
                activeAdapter = adapters.get(0);
            }
            log.warn("Provider '{}' not found, using: {}", provider,
                    activeAdapter != null ? activeAdapter.getProviderId() : NoOpLlmAdapter.PROVIDER_ID);
        } else {
            log.info("Active LLM provider: {}", provider);
        }
        if (activeAdapter != null) {
            activeAdapter.initialize();
        }
    }

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : NoOpLlmAdapter.PROVIDER_ID;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        if (activeAdapter == null) {
            return CompletableFuture.failedFuture(
                    new LlmUnavailableException("No LLM provider adapter registered", null));
        }
        List<String> models = modelChain(request.getModel());
        return attempt(request, models, 0, null);
    }

    /**
     * Requested model first, then the fallback chain, without duplicates.
     */
    List<String> modelChain(String requestedModel) {
        Set<String> chain = new LinkedHashSet<>();
        String primary = requestedModel != null && !requestedModel.isBlank()
                ? requestedModel
                : activeAdapter.getCurrentModel();
        if (primary != null && !primary.isBlank()) {
            chain.add(primary);
        }
        for (String fallback : properties.getLlm().getFallbackChain()) {
            if (fallback != null && !fallback.isBlank()) {
                chain.add(fallback);
            }
        }
        return new ArrayList<>(chain);
    }

    private CompletableFuture<LlmResponse> attempt(LlmRequest request, List<String> models, int index,
            Throwable lastError) {
        if (index >= models.size()) {
            return CompletableFuture.failedFuture(
                    new LlmUnavailableException("All models failed: " + models, lastError));
        }

        String model = models.get(index);
        CompletableFuture<LlmResponse> future;
        try {
            future = activeAdapter.chat(request.toBuilder().model(model).build());
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }

        return future
                .thenApply(CompletableFuture::completedFuture)
                .exceptionally(error -> {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause()
                            : error;
                    log.warn("[LLM] Model {} failed ({}), {}", model, cause.getMessage(),
                            index + 1 < models.size() ? "trying " + models.get(index + 1) : "no fallback left");
                    return attempt(request, models, index + 1, cause);
                })
                .thenCompose(Function.identity());
    }

    @Override
    public List<String> getSupportedModels() {
        return activeAdapter != null ? activeAdapter.getSupportedModels() : List.of();
    }

    @Override
    public String getCurrentModel() {
        return activeAdapter != null ? activeAdapter.getCurrentModel() : NoOpLlmAdapter.PROVIDER_ID;
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
