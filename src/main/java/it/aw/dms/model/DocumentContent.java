package it.aw.dms.model;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Testo estratto da un PDF con le statistiche dell'estrazione.
 * <p>
 * Creato una sola volta per import e mai modificato. {@code pageOffsets} contiene
 * l'offset 0-based di inizio di ogni pagina nel testo concatenato (una voce per pagina,
 * in ordine), ed è ciò che il chunker usa per attribuire la pagina ai chunk.
 * {@code degradedPages} elenca le pagine (1-based) su cui l'OCR è fallito e si è
 * ripiegato sul testo diretto.
 */
public record DocumentContent(
        String           path,
        String           text,
        int              pageCount,
        long             fileSize,
        LocalDateTime    importedAt,
        String           directoryLabel,   // es. "2024/03/Rechnungen" ("" se nessuna cartella)
        ExtractionMethod method,
        boolean          ocrUsed,
        Duration         processingTime,
        List<Integer>    pageOffsets,
        List<Integer>    degradedPages
) {
    public DocumentContent {
        pageOffsets   = List.copyOf(pageOffsets);
        degradedPages = List.copyOf(degradedPages);
    }

    public boolean isDegraded() {
        return !degradedPages.isEmpty();
    }
}
