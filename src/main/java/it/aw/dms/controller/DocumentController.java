package it.aw.dms.controller;

import it.aw.dms.model.DocumentRecord;
import it.aw.dms.model.DocumentSummary;
import it.aw.dms.model.ImportReport;
import it.aw.dms.model.SearchFilter;
import it.aw.dms.model.StoreStats;
import it.aw.dms.service.DocumentService;
import it.aw.dms.service.IngestionService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Espone import, consultazione e cancellazione dei documenti.
 *
 * Endpoint disponibili:
 *   POST   /api/documents/import            importa un PDF dal filesystem del server
 *   POST   /api/documents/import-directory  importa tutti i PDF di una cartella
 *   GET    /api/documents                   lista con filtri (category, directory, from, to)
 *   GET    /api/documents/categories        numero di documenti per categoria
 *   GET    /api/documents/directories       numero di documenti per directory label
 *   GET    /api/documents/stats             statistiche aggregate
 *   GET    /api/documents/{documentId}      dettaglio di un documento
 *   DELETE /api/documents/{documentId}      rimuove documento e vettori
 *
 * Nota: i path letterali hanno priorità su /{documentId} in Spring MVC.
 */
@RestController
@RequestMapping("/api/documents")
public class DocumentController {

    /** Import di un singolo file; {@code category} forza la categoria. */
    public record ImportRequest(String path, String directoryLabel, boolean force, String category) {}

    public record DirectoryImportRequest(String path, Boolean recursive, String pattern, boolean force) {}

    /** Esito di un import singolo: {@code document} è null se il file era già presente. */
    public record ImportResponse(boolean skipped, DocumentSummary document) {}

    private final IngestionService ingestionService;
    private final DocumentService documentService;

    public DocumentController(IngestionService ingestionService, DocumentService documentService) {
        this.ingestionService = ingestionService;
        this.documentService = documentService;
    }

    /**
     * Esempio:
     *   curl -X POST http://localhost:8889/api/documents/import \
     *        -H "Content-Type: application/json" \
     *        -d '{"path":"/data/2024/03/rechnung.pdf","category":"invoice"}'
     */
    @PostMapping("/import")
    public ResponseEntity<ImportResponse> importFile(@RequestBody ImportRequest request) {
        if (request.path() == null || request.path().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        return ingestionService.importFile(Path.of(request.path()), request.directoryLabel(),
                        request.force(), request.category())
                .map(summary -> ResponseEntity.ok(new ImportResponse(false, summary)))
                .orElseGet(() -> ResponseEntity.ok(new ImportResponse(true, null)));
    }

    /**
     * Esempio:
     *   curl -X POST http://localhost:8889/api/documents/import-directory \
     *        -H "Content-Type: application/json" -d '{"path":"/data/2024"}'
     */
    @PostMapping("/import-directory")
    public ResponseEntity<ImportReport> importDirectory(@RequestBody DirectoryImportRequest request) {
        if (request.path() == null || request.path().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        boolean recursive = request.recursive() == null || request.recursive();
        return ResponseEntity.ok(ingestionService.importDirectory(
                Path.of(request.path()), recursive, request.pattern(), request.force()));
    }

    @GetMapping
    public ResponseEntity<List<DocumentSummary>> listDocuments(
            @RequestParam(value = "category", required = false) String category,
            @RequestParam(value = "directory", required = false) String directory,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(documentService.list(new SearchFilter(category, directory, from, to)));
    }

    @GetMapping("/categories")
    public ResponseEntity<Map<String, Integer>> categories() {
        return ResponseEntity.ok(documentService.categories());
    }

    @GetMapping("/directories")
    public ResponseEntity<Map<String, Integer>> directories() {
        return ResponseEntity.ok(documentService.directories());
    }

    @GetMapping("/stats")
    public ResponseEntity<StoreStats> stats() {
        return ResponseEntity.ok(documentService.stats());
    }

    @GetMapping("/{documentId}")
    public ResponseEntity<DocumentRecord> getDocument(@PathVariable String documentId) {
        return ResponseEntity.ok(documentService.get(documentId));
    }

    @DeleteMapping("/{documentId}")
    public ResponseEntity<Void> deleteDocument(@PathVariable String documentId) {
        documentService.delete(documentId);
        return ResponseEntity.noContent().build();
    }
}
