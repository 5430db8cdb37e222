package it.aw.dms.service.extraction;

import it.aw.dms.exception.OcrException;
import it.aw.dms.exception.UnprocessableDocumentException;
import it.aw.dms.model.DocumentContent;
import it.aw.dms.model.ExtractionMethod;
import it.aw.dms.support.TestPdfs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContentExtractorTest {

    private static final String RICH_PAGE = TestPdfs.filler("Rechnung Nr. 2024-17 der Stadtwerke Musterstadt", 300);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneId.of("UTC"));

    @TempDir
    Path tmp;

    /** OCR finto: restituisce i testi in ordine, una pagina per chiamata; null = errore. */
    private static final class ScriptedOcr implements OcrEngine {
        private final Deque<String> outputs;
        int calls;

        ScriptedOcr(String... outputs) {
            this.outputs = new ArrayDeque<>();
            for (String o : outputs) this.outputs.add(o == null ? "\u0000FAIL" : o);
        }

        @Override
        public String recognize(BufferedImage image) {
            calls++;
            assertNotNull(image);
            String next = outputs.isEmpty() ? "" : outputs.poll();
            if (next.equals("\u0000FAIL")) throw new OcrException("tesseract non disponibile", null);
            return next;
        }
    }

    private ContentExtractor extractor(ScriptedOcr ocr) {
        return new ContentExtractor(new OcrSettings(true, 50, "deu", 72, null), ocr, CLOCK);
    }

    @Test
    @DisplayName("Un PDF con testo sopra soglia è estratto direttamente senza OCR")
    void extract_shouldUseDirectTextAboveThreshold() throws Exception {
        Path pdf = TestPdfs.write(tmp.resolve("rechnung.pdf"), List.of(RICH_PAGE, RICH_PAGE));
        ScriptedOcr ocr = new ScriptedOcr();

        DocumentContent content = extractor(ocr).extract(pdf, "2024/03");

        assertEquals(ExtractionMethod.DIRECT, content.method());
        assertFalse(content.ocrUsed());
        assertEquals(0, ocr.calls);
        assertEquals(2, content.pageCount());
        assertEquals(2, content.pageOffsets().size());
        assertEquals(0, content.pageOffsets().get(0));
        assertTrue(content.text().contains("Stadtwerke Musterstadt"));
        assertEquals("2024/03", content.directoryLabel());
        assertEquals(Files.size(pdf), content.fileSize());
        assertEquals(LocalDateTime.of(2024, 3, 15, 10, 0), content.importedAt());
        assertFalse(content.isDegraded());
    }

    @Test
    @DisplayName("Un PDF scansionato passa all'OCR su ogni pagina")
    void extract_shouldUseOcrForScannedPdf() throws Exception {
        Path pdf = TestPdfs.write(tmp.resolve("scan.pdf"), List.of("", ""));
        ScriptedOcr ocr = new ScriptedOcr("Kontoauszug Seite eins", "Neuer Saldo 1.234,56");

        DocumentContent content = extractor(ocr).extract(pdf, "");

        assertEquals(ExtractionMethod.OCR, content.method());
        assertTrue(content.ocrUsed());
        assertEquals(2, ocr.calls);
        assertEquals("Kontoauszug Seite eins\nNeuer Saldo 1.234,56", content.text());
        assertEquals(List.of(0, 23), content.pageOffsets());
    }

    @Test
    @DisplayName("Con testo diretto parziale vince per pagina il testo più lungo e il metodo è hybrid")
    void extract_shouldMergePerPageAndReportHybrid() throws Exception {
        Path pdf = TestPdfs.write(tmp.resolve("misto.pdf"), List.of("Seite 1 direkt", ""));
        ScriptedOcr ocr = new ScriptedOcr("S1", "Seite 2 aus der Texterkennung");

        DocumentContent content = extractor(ocr).extract(pdf, "");

        assertEquals(ExtractionMethod.HYBRID, content.method());
        assertEquals("Seite 1 direkt\nSeite 2 aus der Texterkennung", content.text());
    }

    @Test
    @DisplayName("Un errore OCR su una pagina la segna come degradata senza interrompere il documento")
    void extract_shouldDegradePageOnOcrFailure() throws Exception {
        Path pdf = TestPdfs.write(tmp.resolve("degradato.pdf"), List.of("Seite 1 direkt", ""));
        ScriptedOcr ocr = new ScriptedOcr("Seite 1 direkt und mehr", null);

        DocumentContent content = extractor(ocr).extract(pdf, "");

        assertEquals(List.of(2), content.degradedPages());
        assertTrue(content.isDegraded());
        assertEquals(2, content.pageCount());
        assertTrue(content.text().startsWith("Seite 1 direkt und mehr"));
    }

    @Test
    @DisplayName("Senza testo né diretto né OCR il documento non è elaborabile")
    void extract_shouldRejectDocumentWithoutAnyText() throws Exception {
        Path pdf = TestPdfs.write(tmp.resolve("vuoto.pdf"), List.of(""));

        assertThrows(UnprocessableDocumentException.class, () -> extractor(new ScriptedOcr("   ")).extract(pdf, ""));
    }

    @Test
    @DisplayName("Con OCR disabilitato si usa solo il testo diretto anche sotto soglia")
    void extract_shouldSkipOcrWhenDisabled() throws Exception {
        Path pdf = TestPdfs.write(tmp.resolve("poco.pdf"), List.of("Kurz"));
        ScriptedOcr ocr = new ScriptedOcr("non deve essere usato");
        ContentExtractor disabled = new ContentExtractor(new OcrSettings(false, 50, "deu", 72, null), ocr, CLOCK);

        DocumentContent content = disabled.extract(pdf, "");

        assertEquals(ExtractionMethod.DIRECT, content.method());
        assertEquals("Kurz", content.text());
        assertEquals(0, ocr.calls);
    }

    @Test
    @DisplayName("PDF cifrati, corrotti, senza pagine o mancanti non sono elaborabili")
    void extract_shouldRejectUnreadableDocuments() throws Exception {
        ContentExtractor extractor = extractor(new ScriptedOcr());
        Path encrypted = TestPdfs.writeEncrypted(tmp.resolve("cifrato.pdf"), RICH_PAGE);
        Path corrupt = Files.writeString(tmp.resolve("rotto.pdf"), "questo non è un PDF");
        Path noPages = TestPdfs.writeWithoutPages(tmp.resolve("senza-pagine.pdf"));

        assertThrows(UnprocessableDocumentException.class, () -> extractor.extract(encrypted, ""));
        assertThrows(UnprocessableDocumentException.class, () -> extractor.extract(corrupt, ""));
        assertThrows(UnprocessableDocumentException.class, () -> extractor.extract(noPages, ""));
        assertThrows(UnprocessableDocumentException.class, () -> extractor.extract(tmp.resolve("manca.pdf"), ""));
    }

    @Test
    @DisplayName("needsOcr confronta la densità di testo con la soglia")
    void needsOcr_shouldCompareDensityWithThreshold() throws Exception {
        ContentExtractor extractor = extractor(new ScriptedOcr());
        Path rich = TestPdfs.write(tmp.resolve("ricco.pdf"), List.of(RICH_PAGE));
        Path sparse = TestPdfs.write(tmp.resolve("scarso.pdf"), List.of("Kurz", ""));

        assertFalse(extractor.needsOcr(rich));
        assertTrue(extractor.needsOcr(sparse));
        assertThrows(UnprocessableDocumentException.class,
                () -> extractor.needsOcr(TestPdfs.writeWithoutPages(tmp.resolve("zero.pdf"))));
    }
}
