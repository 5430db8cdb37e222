package it.aw.dms.model;

import java.time.LocalDateTime;

/**
 * Dettaglio completo di un documento importato: metadati di estrazione,
 * esito della categorizzazione e numero di chunk indicizzati.
 * <p>
 * Restituito da GET /api/documents/{documentId}.
 * Per le liste usare {@link DocumentSummary}.
 */
public record DocumentRecord(
        String         documentId,
        String         path,
        String         fileName,
        long           fileSize,
        int            pageCount,
        String         directoryLabel,
        LocalDateTime  importedAt,
        String         extractionMethod,  // direct | ocr | hybrid
        boolean        ocrUsed,
        long           processingMillis,
        int            chunkCount,
        CategoryResult category           // null se il documento non è stato categorizzato
) {
    /** Proietta il record nella vista leggera. */
    public DocumentSummary toSummary() {
        return new DocumentSummary(documentId, path, directoryLabel, importedAt, pageCount, chunkCount,
                extractionMethod,
                category != null ? category.primaryCategory() : null,
                category != null ? category.confidence() : 0.0);
    }
}
