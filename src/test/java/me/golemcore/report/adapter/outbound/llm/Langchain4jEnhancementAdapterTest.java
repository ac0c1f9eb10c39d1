package me.golemcore.report.adapter.outbound.llm;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import me.golemcore.report.infrastructure.config.ReportProperties;
import me.golemcore.report.port.outbound.EnhancementException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.core.io.ClassPathResource;

import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class Langchain4jEnhancementAdapterTest {

    private ReportProperties properties;
    private Langchain4jEnhancementAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new ReportProperties();
        adapter = new Langchain4jEnhancementAdapter(properties);
    }

    private void configureProvider(String provider, String apiKey) {
        ReportProperties.ProviderProperties config = new ReportProperties.ProviderProperties();
        config.setApiKey(apiKey);
        properties.getEnhancement().getProviders().put(provider, config);
    }

    @ParameterizedTest
    @CsvSource({
            "groq/llama-3.3-70b-versatile, groq",
            "anthropic/claude-sonnet-4-20250514, anthropic",
            "openai/gpt-4o-mini, openai",
            "gpt-4o-mini, openai"
    })
    void shouldDetectProviderFromModelId(String model, String expected) {
        assertEquals(expected, Langchain4jEnhancementAdapter.providerOf(model));
    }

    @Test
    void shouldBeAvailableOnlyWithApiKey() {
        assertFalse(adapter.isAvailable());

        configureProvider("groq", " ");
        assertFalse(adapter.isAvailable());

        configureProvider("groq", "gsk-test");
        assertTrue(adapter.isAvailable());
    }

    @Test
    void shouldCreateOpenAiCompatibleModelForGroq() {
        configureProvider("groq", "gsk-test");

        assertInstanceOf(OpenAiChatModel.class, adapter.createModel("groq/llama-3.3-70b-versatile"));
    }

    @Test
    void shouldCreateAnthropicModel() {
        configureProvider("anthropic", "sk-ant-test");

        assertInstanceOf(AnthropicChatModel.class, adapter.createModel("anthropic/claude-sonnet-4-20250514"));
    }

    @Test
    void shouldRejectUnconfiguredProvider() {
        assertThrows(IllegalStateException.class, () -> adapter.createModel("openai/gpt-4o-mini"));
    }

    @Test
    void shouldFailEnhancementWithoutModel() {
        CompletionException error = assertThrows(CompletionException.class, () -> adapter.enhance("draft").join());

        assertInstanceOf(EnhancementException.class, error.getCause());
    }

    @Test
    void shouldShipEnhancementPrompt() {
        assertTrue(new ClassPathResource(Langchain4jEnhancementAdapter.PROMPT_FILE).exists());
        assertEquals("langchain4j", adapter.getProviderId());
    }
}
