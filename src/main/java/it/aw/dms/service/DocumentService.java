package it.aw.dms.service;

import it.aw.dms.exception.DocumentNotFoundException;
import it.aw.dms.model.DocumentRecord;
import it.aw.dms.model.DocumentSummary;
import it.aw.dms.model.SearchFilter;
import it.aw.dms.model.StoreStats;
import it.aw.dms.registry.DocumentRegistry;
import it.aw.dms.service.retrieval.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Consultazione e cancellazione dei documenti importati.
 */
@Service
public class DocumentService {

    private static final Logger log = LoggerFactory.getLogger(DocumentService.class);

    private final DocumentRegistry registry;
    private final VectorStore vectorStore;

    public DocumentService(DocumentRegistry registry, VectorStore vectorStore) {
        this.registry = registry;
        this.vectorStore = vectorStore;
    }

    public List<DocumentSummary> list(SearchFilter filter) {
        return registry.findAll(filter);
    }

    public DocumentRecord get(String documentId) {
        return registry.findById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
    }

    /**
     * Rimuove il documento dal registry e i suoi vettori dallo store.
     *
     * @throws DocumentNotFoundException se il documento non esiste
     */
    public void delete(String documentId) {
        List<String> chunkIds = registry.remove(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
        vectorStore.delete(chunkIds);
        log.info("Documento eliminato: {} ({} chunk)", documentId, chunkIds.size());
    }

    public Map<String, Integer> categories() {
        return registry.categorySummary();
    }

    public Map<String, Integer> directories() {
        return registry.directorySummary();
    }

    public StoreStats stats() {
        return new StoreStats(
                registry.totalDocuments(),
                registry.totalChunks(),
                registry.categorySummary(),
                vectorStore.storeType(),
                vectorStore.embeddingModelName());
    }
}
