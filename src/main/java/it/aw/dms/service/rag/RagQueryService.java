package it.aw.dms.service.rag;

import it.aw.dms.model.QueryRequest;
import it.aw.dms.model.RagResponse;
import it.aw.dms.model.SearchResult;
import it.aw.dms.service.retrieval.RetrievalAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Risponde a una domanda: ricerca dei chunk rilevanti e generazione della risposta.
 * Se tutti i modelli falliscono l'eccezione
 * {@link it.aw.dms.exception.ProviderExhaustedException} arriva al chiamante.
 */
@Service
public class RagQueryService {

    private static final Logger log = LoggerFactory.getLogger(RagQueryService.class);

    private final RetrievalAggregator retrieval;
    private final AnswerGenerator generator;

    public RagQueryService(RetrievalAggregator retrieval, AnswerGenerator generator) {
        this.retrieval = retrieval;
        this.generator = generator;
    }

    public RagResponse query(QueryRequest request) {
        log.info("Domanda ricevuta (limit={}, filtro={})", request.limit(), request.filter());
        List<SearchResult> results = retrieval.search(request.question(), request.filter(), request.limit());
        return generator.generate(request.question(), results, request.model());
    }
}
