package it.aw.dms.controller;

import it.aw.dms.config.DmsProperties;
import it.aw.dms.model.QueryRequest;
import it.aw.dms.model.RagResponse;
import it.aw.dms.model.SearchFilter;
import it.aw.dms.service.llm.ConnectivityReport;
import it.aw.dms.service.llm.ProviderFallbackChain;
import it.aw.dms.service.rag.RagQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * Domande sui documenti e amministrazione dei modelli.
 *
 * Endpoint disponibili:
 *   POST /api/query        risponde a una domanda con le fonti citate
 *   GET  /api/models       modelli disponibili presso il provider
 *   POST /api/models/test  verifica la connettività lungo la catena di fallback
 */
@RestController
@RequestMapping("/api")
public class QueryController {

    /** Corpo di POST /api/query; i campi null usano i default di configurazione. */
    public record QueryBody(String question, String category, String directory,
                            LocalDate from, LocalDate to, Integer limit, String model) {}

    private final RagQueryService ragQueryService;
    private final ProviderFallbackChain chain;
    private final int defaultLimit;

    public QueryController(RagQueryService ragQueryService, ProviderFallbackChain chain,
                           DmsProperties properties) {
        this.ragQueryService = ragQueryService;
        this.chain = chain;
        this.defaultLimit = properties.rag().searchLimit();
    }

    /**
     * Esempio:
     *   curl -X POST http://localhost:8889/api/query -H "Content-Type: application/json" \
     *        -d '{"question":"Wie hoch war die Stromrechnung im März?","directory":"2024/03"}'
     */
    @PostMapping("/query")
    public ResponseEntity<RagResponse> query(@RequestBody QueryBody body) {
        QueryRequest request = new QueryRequest(
                body.question(),
                new SearchFilter(body.category(), body.directory(), body.from(), body.to()),
                body.limit() != null ? body.limit() : defaultLimit,
                body.model());
        return ResponseEntity.ok(ragQueryService.query(request));
    }

    @GetMapping("/models")
    public ResponseEntity<List<String>> models() {
        return ResponseEntity.ok(chain.listModels());
    }

    @PostMapping("/models/test")
    public ResponseEntity<ConnectivityReport> testModels() {
        return ResponseEntity.ok(chain.testConnectivity());
    }
}
