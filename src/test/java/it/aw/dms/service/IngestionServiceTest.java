package it.aw.dms.service;

import it.aw.dms.exception.RetrievalStoreUnavailableException;
import it.aw.dms.exception.UnprocessableDocumentException;
import it.aw.dms.model.CategoryResult;
import it.aw.dms.model.ChunkingParams;
import it.aw.dms.model.DocumentContent;
import it.aw.dms.model.DocumentRecord;
import it.aw.dms.model.DocumentSummary;
import it.aw.dms.model.ImportReport;
import it.aw.dms.model.TextChunk;
import it.aw.dms.registry.DocumentRegistry;
import it.aw.dms.service.categorization.CategorizationEngine;
import it.aw.dms.service.extraction.ContentExtractor;
import it.aw.dms.service.retrieval.VectorStore;
import it.aw.dms.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IngestionServiceTest {

    private static final String INVOICE_TEXT =
            "Rechnung Nr. RE-2024-0815\nRechnungsdatum: 12.03.2024\nGesamtbetrag: 84,20 EUR\nMwSt 19%";

    @Mock
    private ContentExtractor extractor;

    @Mock
    private VectorStore vectorStore;

    @Mock
    private DocumentRegistry registry;

    @TempDir
    Path root;

    private IngestionService service;

    @BeforeEach
    void setUp() {
        service = new IngestionService(extractor, CategorizationEngine.withDefaultDetectors(0.1),
                vectorStore, registry, new ChunkingParams(200, 20));
    }

    private void extractorReturnsInvoiceText() {
        when(extractor.extract(any(Path.class), anyString())).thenAnswer(inv -> Fixtures.content(
                inv.getArgument(0, Path.class).toString(), INVOICE_TEXT, inv.getArgument(1),
                LocalDateTime.of(2024, 3, 12, 10, 0)));
    }

    private void registryEchoesRecords() {
        when(registry.register(anyString(), any(), any(), anyList())).thenAnswer(inv -> {
            DocumentContent c = inv.getArgument(1);
            List<TextChunk> chunks = inv.getArgument(3);
            return record(inv.getArgument(0), c, inv.getArgument(2), chunks.size());
        });
    }

    private static DocumentRecord record(String id, DocumentContent c, CategoryResult category, int chunks) {
        return new DocumentRecord(id, c.path(), Path.of(c.path()).getFileName().toString(), c.fileSize(),
                c.pageCount(), c.directoryLabel(), c.importedAt(), c.method().label(), c.ocrUsed(),
                c.processingTime().toMillis(), chunks, category);
    }

    private Path touch(String relative) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, "%PDF-1.4");
    }

    @Test
    @DisplayName("Un documento non elaborabile non interrompe l'import della cartella")
    void importDirectory_shouldContinuePastUnprocessableDocument() throws IOException {
        Path a = touch("2024/03/a.pdf");
        Path b = touch("2024/03/b.pdf");
        touch("2024/03/c.PDF");
        touch("2024/03/notes.txt");
        when(registry.findByPath(anyString())).thenReturn(Optional.empty());
        extractorReturnsInvoiceText();
        doThrow(new UnprocessableDocumentException(b, "nessun testo estraibile"))
                .when(extractor).extract(eq(b.toAbsolutePath().normalize()), anyString());
        registryEchoesRecords();

        ImportReport report = service.importDirectory(root, true, null, false);

        assertEquals(3, report.total());
        assertEquals(2, report.processed());
        assertEquals(0, report.skipped());
        assertEquals(1, report.failed());
        assertTrue(report.failures().get(0).path().endsWith("b.pdf"));
        verify(extractor).extract(a.toAbsolutePath().normalize(), "2024/03");
        verify(vectorStore, times(2)).upsert(any(), eq("invoice"), anyList());
    }

    @Test
    @DisplayName("Senza ricorsione vengono importati solo i file della radice")
    void importDirectory_shouldHonourRecursionFlag() throws IOException {
        touch("top.pdf");
        touch("2024/nested.pdf");
        when(registry.findByPath(anyString())).thenReturn(Optional.empty());
        extractorReturnsInvoiceText();
        registryEchoesRecords();

        ImportReport report = service.importDirectory(root, false, null, false);

        assertEquals(1, report.total());
        verify(extractor).extract(root.resolve("top.pdf").toAbsolutePath().normalize(), "");
    }

    @Test
    @DisplayName("Un file già importato viene saltato senza estrarre il testo")
    void importFile_shouldSkipAlreadyImportedFile() throws IOException {
        Path file = touch("a.pdf");
        DocumentContent previous = Fixtures.content(file.toString(), INVOICE_TEXT, "", LocalDateTime.now());
        when(registry.findByPath(file.toAbsolutePath().normalize().toString()))
                .thenReturn(Optional.of(record("old-id", previous, Fixtures.invoice(), 1)));

        Optional<DocumentSummary> result = service.importFile(file, null, false, null);

        assertTrue(result.isEmpty());
        verifyNoInteractions(extractor, vectorStore);
    }

    @Test
    @DisplayName("Con force il documento esistente e i suoi vettori vengono sostituiti")
    void importFile_shouldReplacePreviousImportWhenForced() throws IOException {
        Path file = touch("a.pdf");
        DocumentContent previous = Fixtures.content(file.toString(), INVOICE_TEXT, "", LocalDateTime.now());
        when(registry.findByPath(anyString()))
                .thenReturn(Optional.of(record("old-id", previous, Fixtures.invoice(), 1)));
        when(registry.remove("old-id")).thenReturn(Optional.of(List.of("old-id#0")));
        extractorReturnsInvoiceText();
        registryEchoesRecords();

        DocumentSummary summary = service.importFile(file, "manuale", true, null).orElseThrow();

        assertNotEquals("old-id", summary.documentId());
        assertEquals("invoice", summary.category());
        verify(vectorStore).delete(List.of("old-id#0"));
        verify(extractor).extract(file.toAbsolutePath().normalize(), "manuale");
    }

    @Test
    @DisplayName("La categoria imposta dall'utente sostituisce quella rilevata")
    void importFile_shouldApplyCategoryOverride() throws IOException {
        Path file = touch("a.pdf");
        when(registry.findByPath(anyString())).thenReturn(Optional.empty());
        extractorReturnsInvoiceText();
        registryEchoesRecords();

        DocumentSummary summary = service.importFile(file, null, false, "contract").orElseThrow();

        assertEquals("contract", summary.category());
        verify(vectorStore).upsert(any(), eq("contract"), anyList());
    }

    @Test
    @DisplayName("Se l'indicizzazione fallisce la registrazione viene annullata")
    void importFile_shouldRollBackRegistrationWhenVectorStoreFails() throws IOException {
        Path file = touch("a.pdf");
        when(registry.findByPath(anyString())).thenReturn(Optional.empty());
        extractorReturnsInvoiceText();
        registryEchoesRecords();
        when(vectorStore.upsert(any(), anyString(), anyList()))
                .thenThrow(new RetrievalStoreUnavailableException("store non disponibile", new IllegalStateException()));

        assertThrows(RetrievalStoreUnavailableException.class,
                () -> service.importFile(file, null, false, null));

        ArgumentCaptor<String> id = ArgumentCaptor.forClass(String.class);
        verify(registry).register(id.capture(), any(), any(), anyList());
        verify(registry).remove(id.getValue());
    }

    @Test
    @DisplayName("Un percorso che non è una cartella è rifiutato")
    void importDirectory_shouldRejectRegularFile() throws IOException {
        Path file = touch("a.pdf");

        assertThrows(IllegalArgumentException.class, () -> service.importDirectory(file, true, null, false));
        verifyNoInteractions(extractor, registry, vectorStore);
    }
}
