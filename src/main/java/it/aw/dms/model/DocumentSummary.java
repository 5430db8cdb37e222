package it.aw.dms.model;

import java.time.LocalDateTime;

/**
 * Vista leggera di un documento importato, senza entità né categorie alternative.
 * <p>
 * Restituita dagli import e da GET /api/documents (lista).
 */
public record DocumentSummary(
        String        documentId,
        String        path,
        String        directoryLabel,
        LocalDateTime importedAt,
        int           pageCount,
        int           chunkCount,
        String        extractionMethod,
        String        category,
        double        categoryConfidence
) {}
