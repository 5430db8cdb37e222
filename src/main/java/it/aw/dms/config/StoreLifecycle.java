package it.aw.dms.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Salva su disco l'embedding store allo shutdown dell'applicazione.
 * <p>
 * Il caricamento all'avvio è in {@link LangChain4jConfig#embeddingStore}; il registry
 * DuckDB è già persistente e non richiede salvataggio.
 */
@Component
public class StoreLifecycle {

    private static final Logger log = LoggerFactory.getLogger(StoreLifecycle.class);

    private final InMemoryEmbeddingStore<TextSegment> embeddingStore;
    private final Path embeddingFile;

    public StoreLifecycle(InMemoryEmbeddingStore<TextSegment> embeddingStore, DmsProperties properties) {
        this.embeddingStore = embeddingStore;
        this.embeddingFile = Paths.get(properties.store().embeddingFile());
    }

    @PreDestroy
    public void save() {
        log.info("Shutdown: salvataggio embedding store su disco...");
        try {
            Files.createDirectories(embeddingFile.toAbsolutePath().getParent());
            embeddingStore.serializeToFile(embeddingFile);
            log.info("EmbeddingStore salvato: {}", embeddingFile.toAbsolutePath());
        } catch (IOException | RuntimeException e) {
            log.error("Impossibile salvare l'EmbeddingStore su {}: {}", embeddingFile.toAbsolutePath(), e.getMessage());
        }
    }
}
