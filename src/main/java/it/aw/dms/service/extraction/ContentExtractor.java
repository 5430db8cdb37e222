package it.aw.dms.service.extraction;

import it.aw.dms.exception.OcrException;
import it.aw.dms.exception.UnprocessableDocumentException;
import it.aw.dms.model.DocumentContent;
import it.aw.dms.model.ExtractionMethod;
import it.aw.dms.service.extraction.PdfPageParser.PagedText;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Converte un PDF in {@link DocumentContent} scegliendo la strategia di estrazione.
 * <p>
 * Pipeline:
 * <ol>
 *   <li>Testo diretto pagina per pagina (PDFBox)</li>
 *   <li>Densità = caratteri diretti / pagine; un PDF senza pagine è non elaborabile</li>
 *   <li>Densità &ge; soglia: metodo {@code direct}</li>
 *   <li>Densità &lt; soglia: OCR di ogni pagina; per pagina vince il testo più lungo
 *       tra diretto e OCR. Metodo {@code hybrid} se almeno una pagina aveva testo diretto,
 *       altrimenti {@code ocr}</li>
 * </ol>
 * Un errore OCR su una pagina non interrompe il documento: la pagina conserva il testo
 * diretto e viene segnata come degradata. Nessun retry automatico.
 */
public class ContentExtractor {

    private static final Logger log = LoggerFactory.getLogger(ContentExtractor.class);

    private final OcrSettings settings;
    private final OcrEngine ocrEngine;
    private final Clock clock;

    public ContentExtractor(OcrSettings settings, OcrEngine ocrEngine) {
        this(settings, ocrEngine, Clock.systemDefaultZone());
    }

    public ContentExtractor(OcrSettings settings, OcrEngine ocrEngine, Clock clock) {
        this.settings = settings;
        this.ocrEngine = ocrEngine;
        this.clock = clock;
    }

    /**
     * Estrae il testo del documento.
     *
     * @param path           percorso del PDF
     * @param directoryLabel chiave di raggruppamento gerarchica (es. "2024/03/Rechnungen")
     * @throws UnprocessableDocumentException se il documento non è leggibile
     */
    public DocumentContent extract(Path path, String directoryLabel) {
        long started = System.nanoTime();
        long fileSize = requireReadable(path);

        try (PDDocument doc = PdfPageParser.load(path)) {
            int pageCount = doc.getNumberOfPages();
            if (pageCount == 0) {
                throw new UnprocessableDocumentException(path, "il PDF non contiene pagine");
            }

            List<String> directPages = PdfPageParser.extractPages(doc);
            double density = density(directPages, pageCount);

            List<String> pages;
            List<Integer> degradedPages = List.of();
            ExtractionMethod method;
            if (!settings.enabled() || density >= settings.threshold()) {
                log.debug("Estrazione diretta: {} — {} caratteri/pagina (soglia {})",
                        path.getFileName(), String.format("%.1f", density), settings.threshold());
                pages = directPages;
                method = ExtractionMethod.DIRECT;
            } else {
                log.debug("OCR necessario: {} — {} caratteri/pagina (soglia {})",
                        path.getFileName(), String.format("%.1f", density), settings.threshold());
                OcrPass pass = ocrPages(doc, directPages);
                pages = pass.pages();
                degradedPages = pass.degradedPages();
                boolean anyDirect = directPages.stream().anyMatch(p -> !p.isEmpty());
                method = anyDirect ? ExtractionMethod.HYBRID : ExtractionMethod.OCR;
                if (!degradedPages.isEmpty()) {
                    log.warn("Estrazione degradata: {} — OCR fallito sulle pagine {}, usato il testo diretto",
                            path.getFileName(), degradedPages);
                }
            }

            PagedText paged = PagedText.join(pages);
            if (paged.fullText().isBlank()) {
                throw new UnprocessableDocumentException(path, "nessun testo estraibile, né diretto né OCR");
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            log.info("Estrazione completata: {} — {} pagine, {} caratteri, metodo={}, {} ms",
                    path.getFileName(), pageCount, paged.fullText().length(), method.label(), elapsed.toMillis());

            return new DocumentContent(
                    path.toString(),
                    paged.fullText(),
                    pageCount,
                    fileSize,
                    LocalDateTime.now(clock),
                    directoryLabel != null ? directoryLabel : "",
                    method,
                    method != ExtractionMethod.DIRECT,
                    elapsed,
                    paged.pageOffsets(),
                    degradedPages);
        } catch (InvalidPasswordException e) {
            throw new UnprocessableDocumentException(path, "PDF cifrato", e);
        } catch (IOException e) {
            throw new UnprocessableDocumentException(path, "struttura PDF non leggibile: " + e.getMessage(), e);
        }
    }

    /**
     * Indica se il documento richiede OCR, cioè se la densità di testo diretto
     * è sotto la soglia configurata.
     *
     * @throws UnprocessableDocumentException se il documento non è leggibile o non ha pagine
     */
    public boolean needsOcr(Path path) {
        requireReadable(path);
        try (PDDocument doc = PdfPageParser.load(path)) {
            int pageCount = doc.getNumberOfPages();
            if (pageCount == 0) {
                throw new UnprocessableDocumentException(path, "il PDF non contiene pagine");
            }
            double density = density(PdfPageParser.extractPages(doc), pageCount);
            return density < settings.threshold();
        } catch (InvalidPasswordException e) {
            throw new UnprocessableDocumentException(path, "PDF cifrato", e);
        } catch (IOException e) {
            throw new UnprocessableDocumentException(path, "struttura PDF non leggibile: " + e.getMessage(), e);
        }
    }

    private static double density(List<String> pages, int pageCount) {
        return (double) PdfPageParser.totalChars(pages) / pageCount;
    }

    private record OcrPass(List<String> pages, List<Integer> degradedPages) {}

    private OcrPass ocrPages(PDDocument doc, List<String> directPages) {
        PDFRenderer renderer = new PDFRenderer(doc);
        List<String> combined = new ArrayList<>(directPages.size());
        List<Integer> degraded = new ArrayList<>();
        int recognized = 0;

        for (int i = 0; i < directPages.size(); i++) {
            String direct = directPages.get(i);
            String ocr;
            try {
                BufferedImage image = renderer.renderImageWithDPI(i, settings.dpi(), ImageType.GRAY);
                ocr = ocrEngine.recognize(image).strip();
            } catch (OcrException | IOException e) {
                log.warn("OCR fallito per la pagina {}: {}", i + 1, e.getMessage());
                degraded.add(i + 1);
                combined.add(direct);
                continue;
            }
            if (!ocr.isEmpty()) recognized++;
            combined.add(ocr.length() > direct.length() ? ocr : direct);
        }

        log.debug("OCR completato: {}/{} pagine con testo", recognized, directPages.size());
        return new OcrPass(combined, degraded);
    }

    private static long requireReadable(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new UnprocessableDocumentException(path, "file non trovato");
        }
        if (!Files.isReadable(path)) {
            throw new UnprocessableDocumentException(path, "file non leggibile");
        }
        try {
            return Files.size(path);
        } catch (IOException e) {
            throw new UnprocessableDocumentException(path, "dimensione del file non determinabile", e);
        }
    }
}
