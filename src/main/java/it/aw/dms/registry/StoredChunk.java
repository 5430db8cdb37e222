package it.aw.dms.registry;

/**
 * Testo di un chunk come conservato nel registry, usato dalla ricerca per keyword
 * quando lo store vettoriale non è disponibile.
 */
public record StoredChunk(
        String chunkId,
        String documentId,
        String documentPath,
        int    pageNumber,
        String directoryLabel,
        String content
) {}
