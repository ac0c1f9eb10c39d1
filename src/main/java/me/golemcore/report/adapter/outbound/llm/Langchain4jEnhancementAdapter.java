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
import me.golemcore.report.port.outbound.EnhancementException;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Enhancement adapter using the langchain4j library.
 *
 * <p>
 * The model id has the form {@code provider/model}, e.g.
 * {@code groq/llama-3.3-70b-versatile}. Credentials come from
 * {@code report.enhancement.providers.<provider>.*}. Anthropic uses its own
 * client; every other provider is treated as an OpenAI-compatible endpoint,
 * with Groq's base URL filled in when none is configured.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jEnhancementAdapter implements EnhancementProviderAdapter {

    static final String PROMPT_FILE = "prompts/report-enhancement.txt";
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String PROVIDER_GROQ = "groq";
    private static final String GROQ_BASE_URL = "https://api.groq.com/openai/v1";

    private final ReportProperties properties;

    private ChatModel chatModel;
    private String systemPrompt;
    private volatile boolean initialized = false;

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        String model = properties.getEnhancement().getModel();
        try {
            this.systemPrompt = loadPrompt();
            this.chatModel = createModel(model);
            initialized = true;
            log.info("[AI] Langchain4j enhancement initialized with model: {}", model);
        } catch (IOException | RuntimeException e) {
            log.warn("[AI] Failed to initialize langchain4j enhancement: {}", e.getMessage());
        }
    }

    @Override
    public boolean isAvailable() {
        ReportProperties.ProviderProperties config = properties.getEnhancement().getProviders()
                .get(providerOf(properties.getEnhancement().getModel()));
        return config != null && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    @Override
    public CompletableFuture<String> enhance(String draft) {
        return CompletableFuture.supplyAsync(() -> {
            if (!initialized) {
                initialize();
            }
            if (chatModel == null) {
                throw new EnhancementException("Langchain4j enhancement not available");
            }
            List<ChatMessage> messages = List.of(
                    SystemMessage.from(systemPrompt),
                    UserMessage.from(draft));
            try {
                ChatResponse response = chatModel.chat(messages);
                String text = response.aiMessage() != null ? response.aiMessage().text() : null;
                if (text == null || text.isBlank()) {
                    throw new EnhancementException("Empty response from model");
                }
                log.debug("[AI] Enhanced report: {} -> {} chars", draft.length(), text.length());
                return text.strip();
            } catch (EnhancementException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new EnhancementException("Enhancement call failed: " + e.getMessage(), e);
            }
        });
    }

    ChatModel createModel(String model) {
        String provider = providerOf(model);
        ReportProperties.ProviderProperties config = properties.getEnhancement().getProviders().get(provider);
        if (config == null) {
            throw new IllegalStateException("Provider not configured: " + provider
                    + ". Add report.enhancement.providers." + provider + ".api-key");
        }
        String modelName = model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
        ReportProperties.EnhancementProperties enhancement = properties.getEnhancement();
        Duration timeout = Duration.ofSeconds(enhancement.getTimeoutSeconds());

        if (PROVIDER_ANTHROPIC.equals(provider)) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(modelName)
                    .temperature(enhancement.getTemperature())
                    .maxTokens(enhancement.getMaxTokens())
                    .maxRetries(0)
                    .timeout(timeout);
            if (config.getBaseUrl() != null) {
                builder.baseUrl(config.getBaseUrl());
            }
            return builder.build();
        }

        String baseUrl = config.getBaseUrl();
        if (baseUrl == null && PROVIDER_GROQ.equals(provider)) {
            baseUrl = GROQ_BASE_URL;
        }
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .temperature(enhancement.getTemperature())
                .maxTokens(enhancement.getMaxTokens())
                .maxRetries(0)
                .timeout(timeout);
        if (baseUrl != null) {
            builder.baseUrl(baseUrl);
        }
        return builder.build();
    }

    static String providerOf(String model) {
        if (model == null || !model.contains("/")) {
            return "openai";
        }
        return model.substring(0, model.indexOf('/'));
    }

    private static String loadPrompt() throws IOException {
        ClassPathResource resource = new ClassPathResource(PROMPT_FILE);
        try (InputStream is = resource.getInputStream()) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
