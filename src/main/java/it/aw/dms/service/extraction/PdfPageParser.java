package it.aw.dms.service.extraction;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Estrazione del testo diretto PDF pagina per pagina via PDFBox.
 * <p>
 * Produce una lista di testi, uno per pagina, e sa concatenarli in un {@link PagedText}
 * che conserva l'offset di inizio di ogni pagina nel testo completo. Questa informazione
 * viene usata dal chunker per attribuire ad ogni chunk la pagina del suo primo carattere.
 */
public final class PdfPageParser {

    private static final Logger log = LoggerFactory.getLogger(PdfPageParser.class);

    /** Separatore tra pagine nel testo concatenato. */
    public static final String PAGE_SEPARATOR = "\n";

    private PdfPageParser() {}

    /**
     * Testo completo con mappa pagina → offset nel testo concatenato.
     *
     * @param fullText    testo di tutte le pagine concatenate con {@link #PAGE_SEPARATOR}
     * @param pageOffsets offset 0-based di inizio di ogni pagina (indice 0 = pagina 1)
     */
    public record PagedText(String fullText, List<Integer> pageOffsets) {

        public PagedText {
            pageOffsets = List.copyOf(pageOffsets);
        }

        public static PagedText join(List<String> pages) {
            StringBuilder sb = new StringBuilder();
            List<Integer> offsets = new ArrayList<>(pages.size());
            for (int i = 0; i < pages.size(); i++) {
                if (i > 0) sb.append(PAGE_SEPARATOR);
                offsets.add(sb.length());
                sb.append(pages.get(i));
            }
            return new PagedText(sb.toString(), offsets);
        }

        /**
         * Pagina (1-based) che contiene il carattere all'offset dato.
         * Un offset che cade sul separatore appartiene alla pagina precedente.
         */
        public int pageAt(int offset) {
            return pageAt(offset, pageOffsets);
        }

        public static int pageAt(int offset, List<Integer> pageOffsets) {
            int page = 1;
            for (int i = 0; i < pageOffsets.size(); i++) {
                if (pageOffsets.get(i) <= offset) page = i + 1;
                else break;
            }
            return page;
        }
    }

    /** Apre il PDF. Il chiamante è responsabile della chiusura del documento. */
    public static PDDocument load(Path path) throws IOException {
        return Loader.loadPDF(path.toFile());
    }

    /**
     * Estrae il testo diretto di ogni pagina, ripulito degli spazi iniziali e finali.
     * Una pagina che PDFBox non riesce a leggere produce una stringa vuota:
     * il chiamante deciderà se ricorrere all'OCR.
     */
    public static List<String> extractPages(PDDocument doc) throws IOException {
        int totalPages = doc.getNumberOfPages();
        log.debug("PdfPageParser: {} pagine trovate", totalPages);

        PDFTextStripper stripper = new PDFTextStripper();
        List<String> pages = new ArrayList<>(totalPages);
        for (int p = 1; p <= totalPages; p++) {
            stripper.setStartPage(p);
            stripper.setEndPage(p);
            try {
                pages.add(stripper.getText(doc).strip());
            } catch (IOException | RuntimeException e) {
                log.warn("PdfPageParser: testo della pagina {} non estraibile: {}", p, e.getMessage());
                pages.add("");
            }
        }
        return pages;
    }

    /** Caratteri totali di testo diretto, usato per la densità. */
    public static int totalChars(List<String> pages) {
        int total = 0;
        for (String page : pages) total += page.length();
        return total;
    }
}
