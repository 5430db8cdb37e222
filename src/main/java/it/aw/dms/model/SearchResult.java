package it.aw.dms.model;

/**
 * Risultato di una ricerca: il chunk trovato, il punteggio di rilevanza e la posizione
 * nel documento di origine. Prodotto per singola query, mai persistito.
 */
public record SearchResult(
        String chunkId,
        double score,
        String documentPath,
        int    pageNumber,
        String directoryLabel,
        String content
) {}
