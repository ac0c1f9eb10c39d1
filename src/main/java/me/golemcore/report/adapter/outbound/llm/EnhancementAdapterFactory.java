package me.golemcore.report.adapter.outbound.llm;

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

import me.golemcore.report.infrastructure.config.ReportProperties;
import me.golemcore.report.port.outbound.EnhancementPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Selects the enhancement adapter named by {@code report.enhancement.provider}
 * and delegates {@link EnhancementPort} calls to it:
 * <ul>
 * <li>langchain4j - OpenAI-compatible endpoints (Groq, OpenAI, ...) and
 * Anthropic</li>
 * <li>none - no AI, the draft is always used</li>
 * </ul>
 * Unknown provider names fall back to {@code none}.
 *
 * @see EnhancementProviderAdapter
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class EnhancementAdapterFactory implements EnhancementPort {

    private static final String PROVIDER_NONE = "none";

    private final ReportProperties properties;
    private final List<EnhancementProviderAdapter> adapters;

    private final Map<String, EnhancementProviderAdapter> adaptersByProvider = new ConcurrentHashMap<>();
    private EnhancementProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        for (EnhancementProviderAdapter adapter : adapters) {
            adaptersByProvider.put(adapter.getProviderId(), adapter);
            log.debug("Registered enhancement adapter: {}", adapter.getProviderId());
        }

        String provider = properties.getEnhancement().getProvider();
        activeAdapter = adaptersByProvider.get(provider);

        if (activeAdapter == null) {
            activeAdapter = adaptersByProvider.get(PROVIDER_NONE);
            if (activeAdapter == null && !adapters.isEmpty()) {
                activeAdapter = adapters.get(0);
            }
            log.warn("[AI] Provider '{}' not found, using: {}",
                    provider, activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE);
        } else {
            activeAdapter.initialize();
            log.info("[AI] Active enhancement provider: {}", provider);
        }
    }

    public String getActiveProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE;
    }

    @Override
    public CompletableFuture<String> enhance(String draft) {
        return activeAdapter.enhance(draft);
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
