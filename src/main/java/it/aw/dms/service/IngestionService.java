package it.aw.dms.service;

import it.aw.dms.exception.RetrievalStoreUnavailableException;
import it.aw.dms.exception.UnprocessableDocumentException;
import it.aw.dms.model.CategoryResult;
import it.aw.dms.model.ChunkingParams;
import it.aw.dms.model.DocumentContent;
import it.aw.dms.model.DocumentRecord;
import it.aw.dms.model.DocumentSummary;
import it.aw.dms.model.ImportReport;
import it.aw.dms.model.ImportReport.ImportFailure;
import it.aw.dms.model.TextChunk;
import it.aw.dms.registry.DocumentRegistry;
import it.aw.dms.service.categorization.CategorizationEngine;
import it.aw.dms.service.extraction.ContentExtractor;
import it.aw.dms.service.retrieval.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Importa documenti PDF nel sistema.
 * <p>
 * Pipeline per ogni file:
 * <ol>
 *   <li>Estrazione del testo (diretto o OCR) via {@link ContentExtractor}</li>
 *   <li>Categorizzazione, con eventuale categoria imposta dall'utente</li>
 *   <li>Chunking con {@link TextChunker}</li>
 *   <li>Registrazione nel {@link DocumentRegistry}</li>
 *   <li>Embedding + indicizzazione nel {@link VectorStore}; se fallisce la registrazione
 *       viene annullata</li>
 * </ol>
 * Un file già importato viene saltato, a meno di {@code force}: in quel caso il record
 * precedente e i suoi vettori sono sostituiti.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    public static final String DEFAULT_PATTERN = "*.{pdf,PDF}";

    private final ContentExtractor extractor;
    private final CategorizationEngine categorizer;
    private final VectorStore vectorStore;
    private final DocumentRegistry registry;
    private final ChunkingParams chunkingParams;

    public IngestionService(ContentExtractor extractor,
                            CategorizationEngine categorizer,
                            VectorStore vectorStore,
                            DocumentRegistry registry,
                            ChunkingParams chunkingParams) {
        this.extractor = extractor;
        this.categorizer = categorizer;
        this.vectorStore = vectorStore;
        this.registry = registry;
        this.chunkingParams = chunkingParams;
    }

    /**
     * Importa un singolo PDF.
     *
     * @param directoryLabel   label della cartella; null per usare il nome della cartella del file
     * @param categoryOverride categoria imposta dall'utente, null per la categorizzazione automatica
     * @return il documento importato, oppure vuoto se era già presente e {@code force} è false
     * @throws UnprocessableDocumentException se dal file non si può estrarre testo
     */
    public Optional<DocumentSummary> importFile(Path file, String directoryLabel, boolean force,
                                                String categoryOverride) {
        Path path = file.toAbsolutePath().normalize();
        Optional<DocumentRecord> existing = registry.findByPath(path.toString());
        if (existing.isPresent() && !force) {
            log.info("Già importato, saltato: {} (documentId={})", path, existing.get().documentId());
            return Optional.empty();
        }

        String label = directoryLabel != null ? directoryLabel : DirectoryLabels.labelFor(path);
        DocumentContent content = extractor.extract(path, label);
        CategoryResult category = categoryOverride != null
                ? categorizer.categorize(content.text(), categoryOverride)
                : categorizer.categorize(content.text());

        existing.ifPresent(previous -> {
            log.info("Re-import forzato: sostituzione di {} (documentId={})", path, previous.documentId());
            registry.remove(previous.documentId()).ifPresent(vectorStore::delete);
        });

        String documentId = UUID.randomUUID().toString();
        List<TextChunk> chunks = TextChunker.chunk(documentId, content, chunkingParams);
        DocumentRecord record = registry.register(documentId, content, category, chunks);
        try {
            vectorStore.upsert(content, category.primaryCategory(), chunks);
        } catch (RetrievalStoreUnavailableException e) {
            log.error("Indicizzazione fallita per {}: annullata la registrazione", path);
            registry.remove(documentId);
            throw e;
        }

        log.info("Import completato: {} — {} pagine, {} chunk, categoria={} ({}), metodo={} (documentId={})",
                path.getFileName(), content.pageCount(), chunks.size(), category.primaryCategory(),
                String.format("%.2f", category.confidence()), content.method().label(), documentId);
        return Optional.of(record.toSummary());
    }

    /**
     * Importa tutti i PDF di una cartella. Un file che fallisce viene riportato nel
     * report e non interrompe l'elaborazione degli altri.
     *
     * @param globPattern pattern sul nome del file, null per {@value #DEFAULT_PATTERN}
     */
    public ImportReport importDirectory(Path root, boolean recursive, String globPattern, boolean force) {
        long started = System.nanoTime();
        Path normalizedRoot = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(normalizedRoot)) {
            throw new IllegalArgumentException("Non è una cartella: " + root);
        }
        List<Path> files = listFiles(normalizedRoot, recursive,
                globPattern != null && !globPattern.isBlank() ? globPattern : DEFAULT_PATTERN);
        log.info("Import cartella {}: {} file trovati (ricorsivo={}, force={})",
                normalizedRoot, files.size(), recursive, force);

        int processed = 0;
        int skipped = 0;
        List<ImportFailure> failures = new ArrayList<>();
        for (Path file : files) {
            try {
                String label = DirectoryLabels.labelFor(normalizedRoot, file);
                if (importFile(file, label, force, null).isPresent()) processed++;
                else skipped++;
            } catch (UnprocessableDocumentException e) {
                log.warn("Documento non elaborabile, saltato: {}", e.getMessage());
                failures.add(new ImportFailure(file.toString(), e.getMessage()));
            } catch (RuntimeException e) {
                log.error("Import fallito per {}: {}", file, e.getMessage(), e);
                failures.add(new ImportFailure(file.toString(), e.getMessage()));
            }
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        ImportReport report = new ImportReport(files.size(), processed, skipped, failures.size(), failures, elapsed);
        log.info("Import cartella completato: {} totali, {} importati, {} saltati, {} falliti in {} ms",
                report.total(), report.processed(), report.skipped(), report.failed(), elapsed.toMillis());
        return report;
    }

    private static List<Path> listFiles(Path root, boolean recursive, String globPattern) {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);
        try (Stream<Path> stream = recursive ? Files.walk(root) : Files.list(root)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(p -> matcher.matches(p.getFileName()))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Lettura cartella fallita: " + root, e);
        }
    }
}
