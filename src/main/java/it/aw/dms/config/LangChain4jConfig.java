package it.aw.dms.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2q.AllMiniLmL6V2QuantizedEmbeddingModel;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import it.aw.dms.service.retrieval.LangChain4jVectorStore;
import it.aw.dms.service.retrieval.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.ZoneId;

/**
 * Bean del livello semantico: modello di embedding locale, store dei vettori e
 * {@link VectorStore} che li combina.
 * <p>
 * Lo store vive in memoria ed è persistito come JSON in {@code dms.store.embedding-file}:
 * viene letto qui all'avvio e riscritto da {@link StoreLifecycle} allo shutdown.
 * Un file illeggibile viene rinominato in {@code *.corrupt} e si riparte da uno store
 * vuoto; la ricerca resta possibile per keyword finché i documenti non sono reimportati.
 */
@Configuration
public class LangChain4jConfig {

    private static final Logger log = LoggerFactory.getLogger(LangChain4jConfig.class);

    static final String EMBEDDING_MODEL_NAME = "all-MiniLM-L6-v2 (quantizzato)";

    @Bean
    public EmbeddingModel embeddingModel() {
        log.info("Modello di embedding: {} (in locale, nessuna API key)", EMBEDDING_MODEL_NAME);
        return new AllMiniLmL6V2QuantizedEmbeddingModel();
    }

    @Bean
    public InMemoryEmbeddingStore<TextSegment> embeddingStore(DmsProperties properties) {
        Path file = Paths.get(properties.store().embeddingFile()).toAbsolutePath();
        if (!Files.isRegularFile(file)) {
            log.info("Nessun embedding store su disco in {}: store vuoto", file);
            return new InMemoryEmbeddingStore<>();
        }
        try {
            InMemoryEmbeddingStore<TextSegment> store = InMemoryEmbeddingStore.fromFile(file);
            log.info("Embedding store caricato da {}", file);
            return store;
        } catch (RuntimeException e) {
            Path quarantine = file.resolveSibling(file.getFileName() + ".corrupt");
            log.error("Embedding store illeggibile ({}): spostato in {}, si riparte da uno store vuoto",
                    e.getMessage(), quarantine);
            moveAside(file, quarantine);
            return new InMemoryEmbeddingStore<>();
        }
    }

    @Bean
    public VectorStore vectorStore(EmbeddingModel embeddingModel,
                                   InMemoryEmbeddingStore<TextSegment> embeddingStore) {
        return new LangChain4jVectorStore(embeddingModel, embeddingStore, EMBEDDING_MODEL_NAME, ZoneId.systemDefault());
    }

    private static void moveAside(Path file, Path target) {
        try {
            Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Impossibile spostare " + file + " in " + target, e);
        }
    }
}
