package it.aw.dms.config;

import it.aw.dms.model.ChunkingParams;
import it.aw.dms.registry.DocumentRegistry;
import it.aw.dms.service.categorization.CategorizationEngine;
import it.aw.dms.service.extraction.ContentExtractor;
import it.aw.dms.service.extraction.OcrEngine;
import it.aw.dms.service.extraction.OcrSettings;
import it.aw.dms.service.extraction.TesseractOcrEngine;
import it.aw.dms.service.llm.LlmProvider;
import it.aw.dms.service.llm.OpenRouterLlmProvider;
import it.aw.dms.service.llm.ProviderChainSettings;
import it.aw.dms.service.llm.ProviderFallbackChain;
import it.aw.dms.service.rag.AnswerGenerator;
import it.aw.dms.service.rag.AnswerSettings;
import it.aw.dms.service.retrieval.RetrievalAggregator;
import it.aw.dms.service.retrieval.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Ricava da {@link DmsProperties} la configurazione di ciascun componente e crea i bean
 * della pipeline.
 */
@Configuration
public class DmsConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DmsConfiguration.class);

    @Bean
    public OcrSettings ocrSettings(DmsProperties properties) {
        DmsProperties.Ocr ocr = properties.ocr();
        return new OcrSettings(ocr.enabled(), ocr.threshold(), ocr.language(), ocr.dpi(), ocr.datapath());
    }

    @Bean
    public OcrEngine ocrEngine(OcrSettings settings) {
        return new TesseractOcrEngine(settings);
    }

    @Bean
    public ContentExtractor contentExtractor(OcrSettings settings, OcrEngine ocrEngine) {
        return new ContentExtractor(settings, ocrEngine);
    }

    @Bean
    public ChunkingParams chunkingParams(DmsProperties properties) {
        return new ChunkingParams(properties.chunkSize(), properties.chunkOverlap());
    }

    @Bean
    public CategorizationEngine categorizationEngine(DmsProperties properties) {
        return CategorizationEngine.withDefaultDetectors(properties.categorization().suggestionFloor());
    }

    @Bean
    public RetrievalAggregator retrievalAggregator(VectorStore vectorStore, DocumentRegistry registry) {
        return new RetrievalAggregator(vectorStore, registry);
    }

    @Bean
    public LlmProvider llmProvider(DmsProperties properties, WebClient.Builder webClientBuilder) {
        DmsProperties.OpenRouter openRouter = properties.openrouter();
        if (openRouter.apiKey() == null || openRouter.apiKey().isBlank()) {
            log.warn("API key OpenRouter non configurata: le domande falliranno finché non viene impostata");
        }
        return new OpenRouterLlmProvider(webClientBuilder.clone(), openRouter.baseUrl(), openRouter.apiKey(),
                openRouter.timeout());
    }

    @Bean
    public ProviderChainSettings providerChainSettings(DmsProperties properties) {
        DmsProperties.OpenRouter openRouter = properties.openrouter();
        return new ProviderChainSettings(openRouter.defaultModel(), openRouter.fallbackModels(),
                openRouter.maxRetries(), openRouter.initialBackoff(), openRouter.maxBackoff());
    }

    @Bean
    public ProviderFallbackChain providerFallbackChain(LlmProvider provider, ProviderChainSettings settings) {
        log.info("Catena modelli: {}", settings.modelOrder(null));
        return new ProviderFallbackChain(provider, settings);
    }

    @Bean
    public AnswerSettings answerSettings(DmsProperties properties) {
        return new AnswerSettings(properties.rag().contextBudget(), properties.rag().excerptLength());
    }

    @Bean
    public AnswerGenerator answerGenerator(ProviderFallbackChain chain, AnswerSettings settings) {
        return new AnswerGenerator(chain, settings);
    }
}
