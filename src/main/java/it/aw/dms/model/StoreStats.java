package it.aw.dms.model;

import java.util.Map;

/**
 * Statistiche aggregate su registry ed embedding store.
 */
public record StoreStats(
        int totalDocuments,
        int totalChunks,
        Map<String, Integer> documentsByCategory,
        String storeType,
        String embeddingModel
) {}
