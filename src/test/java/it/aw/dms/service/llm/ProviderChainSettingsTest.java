package it.aw.dms.service.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProviderChainSettingsTest {

    private final ProviderChainSettings settings = new ProviderChainSettings(
            "anthropic/claude-3-sonnet", List.of("openai/gpt-4", "anthropic/claude-3-sonnet", "meta-llama/llama-2-70b-chat"),
            3, Duration.ofSeconds(1), Duration.ofSeconds(8));

    @Test
    @DisplayName("L'ordine dei modelli parte dal preferito ed elimina i duplicati")
    void modelOrder_shouldPutPreferredFirstWithoutDuplicates() {
        assertEquals(List.of("openai/gpt-4", "anthropic/claude-3-sonnet", "meta-llama/llama-2-70b-chat"),
                settings.modelOrder("openai/gpt-4"));
        assertEquals(List.of("anthropic/claude-3-sonnet", "openai/gpt-4", "meta-llama/llama-2-70b-chat"),
                settings.modelOrder(null));
        assertEquals("mistral/large", settings.modelOrder("mistral/large").get(0));
    }

    @Test
    @DisplayName("Il backoff raddoppia ad ogni retry fino al tetto")
    void backoffFor_shouldDoubleUpToCap() {
        assertEquals(Duration.ofSeconds(1), settings.backoffFor(1));
        assertEquals(Duration.ofSeconds(2), settings.backoffFor(2));
        assertEquals(Duration.ofSeconds(4), settings.backoffFor(3));
        assertEquals(Duration.ofSeconds(8), settings.backoffFor(4));
        assertEquals(Duration.ofSeconds(8), settings.backoffFor(10));
    }

    @Test
    @DisplayName("Retry negativi o backoff incoerenti sono rifiutati")
    void constructor_shouldValidate() {
        assertThrows(IllegalArgumentException.class, () -> new ProviderChainSettings("m", List.of(), -1,
                Duration.ofSeconds(1), Duration.ofSeconds(2)));
        assertThrows(IllegalArgumentException.class, () -> new ProviderChainSettings("m", List.of(), 1,
                Duration.ofSeconds(4), Duration.ofSeconds(2)));
        assertThrows(IllegalArgumentException.class, () -> new ProviderChainSettings(" ", List.of(), 1,
                Duration.ofSeconds(1), Duration.ofSeconds(2)));
    }
}
