package it.aw.dms.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * Configurazione applicativa, prefisso {@code dms} in application.yml.
 * <p>
 * I valori di default coincidono con quelli storici del sistema: soglia OCR 50 caratteri
 * per pagina, chunk da 1000 caratteri con 200 di sovrapposizione, tre tentativi per modello.
 * I componenti non leggono mai questa classe direttamente: {@link DmsConfiguration}
 * ne ricava un valore di configurazione dedicato per ciascuno.
 */
@ConfigurationProperties(prefix = "dms")
public record DmsProperties(
        @DefaultValue(".dms") String dataDir,
        @DefaultValue("1000") int chunkSize,
        @DefaultValue("200") int chunkOverlap,
        @DefaultValue Ocr ocr,
        @DefaultValue OpenRouter openrouter,
        @DefaultValue Rag rag,
        @DefaultValue Categorization categorization,
        @DefaultValue Store store
) {

    public record Ocr(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("50") int threshold,
            @DefaultValue("deu") String language,
            @DefaultValue("300") int dpi,
            String datapath
    ) {}

    public record OpenRouter(
            String apiKey,
            @DefaultValue("https://openrouter.ai/api/v1") String baseUrl,
            @DefaultValue("anthropic/claude-3-sonnet") String defaultModel,
            @DefaultValue({"openai/gpt-4", "meta-llama/llama-2-70b-chat"}) List<String> fallbackModels,
            @DefaultValue("30s") Duration timeout,
            @DefaultValue("3") int maxRetries,
            @DefaultValue("1s") Duration initialBackoff,
            @DefaultValue("8s") Duration maxBackoff
    ) {}

    public record Rag(
            @DefaultValue("5") int searchLimit,
            @DefaultValue("6000") int contextBudget,
            @DefaultValue("200") int excerptLength
    ) {}

    public record Categorization(
            @DefaultValue("0.1") double suggestionFloor
    ) {}

    public record Store(
            String embeddingFile,
            String registryPath
    ) {}
}
