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

import me.golemcore.report.port.outbound.EnhancementPort;

/**
 * Interface for report enhancement provider adapters.
 *
 * <p>
 * Extends {@link EnhancementPort} with provider identification. All provider
 * adapters are collected by {@link EnhancementAdapterFactory}, which picks the
 * one named by {@code report.enhancement.provider}.
 *
 * @see EnhancementAdapterFactory
 */
public interface EnhancementProviderAdapter extends EnhancementPort {

    /**
     * Get the provider ID (e.g., "langchain4j", "none").
     */
    String getProviderId();

    /**
     * Initialize the adapter. Called when the adapter is selected.
     */
    default void initialize() {
        // Default no-op
    }
}
