package it.aw.dms.service.retrieval;

import it.aw.dms.exception.RetrievalStoreUnavailableException;
import it.aw.dms.model.SearchFilter;
import it.aw.dms.model.SearchResult;
import it.aw.dms.registry.DocumentRegistry;
import it.aw.dms.registry.StoredChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ricerca dei chunk rilevanti per una domanda.
 * <p>
 * Interroga il {@link VectorStore} con il filtro tradotto in metadati; se lo store non
 * risponde ripiega su una ricerca per keyword sul testo dei chunk conservato nel
 * {@link DocumentRegistry}. In entrambi i casi i risultati sono deduplicati per chunk
 * e ordinati in modo deterministico: score decrescente, poi path più corto, poi path,
 * poi pagina crescente.
 */
public class RetrievalAggregator {

    private static final Logger log = LoggerFactory.getLogger(RetrievalAggregator.class);

    static final Comparator<SearchResult> RESULT_ORDER =
            Comparator.comparingDouble(SearchResult::score).reversed()
                    .thenComparingInt((SearchResult r) -> r.documentPath().length())
                    .thenComparing(SearchResult::documentPath)
                    .thenComparingInt(SearchResult::pageNumber);

    private final VectorStore vectorStore;
    private final DocumentRegistry registry;

    public RetrievalAggregator(VectorStore vectorStore, DocumentRegistry registry) {
        this.vectorStore = vectorStore;
        this.registry = registry;
    }

    /**
     * @param query  testo della domanda; se vuoto il risultato è vuoto
     * @param filter vincoli su categoria, directory e data di import
     * @param limit  numero massimo di risultati, maggiore di zero
     */
    public List<SearchResult> search(String query, SearchFilter filter, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit deve essere > 0 (ricevuto: " + limit + ")");
        }
        if (query == null || query.isBlank()) return List.of();
        SearchFilter effective = filter != null ? filter : SearchFilter.none();

        List<SearchResult> candidates;
        try {
            candidates = vectorStore.search(query, effective, limit);
        } catch (RetrievalStoreUnavailableException e) {
            log.warn("Store vettoriale non disponibile ({}), ricerca per keyword", e.getMessage());
            candidates = keywordSearch(query, effective);
        }

        Map<String, SearchResult> unique = new LinkedHashMap<>();
        for (SearchResult r : candidates) {
            if (effective.matchesDirectory(r.directoryLabel())) {
                unique.merge(r.chunkId(), r, (a, b) -> a.score() >= b.score() ? a : b);
            }
        }
        List<SearchResult> results = unique.values().stream()
                .sorted(RESULT_ORDER)
                .limit(limit)
                .collect(Collectors.toList());
        log.debug("Ricerca '{}': {} risultati (filtro {})", query, results.size(), effective);
        return results;
    }

    List<SearchResult> keywordSearch(String query, SearchFilter filter) {
        Set<String> terms = KeywordScorer.terms(query);
        List<SearchResult> results = new ArrayList<>();
        for (StoredChunk chunk : registry.keywordCandidates(filter)) {
            double score = KeywordScorer.score(terms, chunk.content());
            if (score > 0) {
                results.add(new SearchResult(chunk.chunkId(), score, chunk.documentPath(),
                        chunk.pageNumber(), chunk.directoryLabel(), chunk.content()));
            }
        }
        return results;
    }
}
