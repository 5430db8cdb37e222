package it.aw.dms.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Esito della categorizzazione di un documento.
 * <p>
 * Le entità mantengono l'ordine di estrazione del detector.
 * Invarianti verificate nel costruttore: confidenza in [0,1], alternative in ordine
 * decrescente, nessuna alternativa con la categoria primaria o con confidenza superiore
 * alla primaria.
 */
public record CategoryResult(
        String              primaryCategory,
        double              confidence,
        Map<String, String> entities,
        List<CategoryScore> suggestedCategories
) {
    public CategoryResult {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence fuori da [0,1]: " + confidence);
        }
        entities = Collections.unmodifiableMap(new LinkedHashMap<>(entities));
        suggestedCategories = List.copyOf(suggestedCategories);
        double previous = Double.MAX_VALUE;
        for (CategoryScore s : suggestedCategories) {
            if (s.category().equals(primaryCategory)) {
                throw new IllegalArgumentException("la categoria primaria non può comparire tra le alternative");
            }
            if (s.confidence() > confidence) {
                throw new IllegalArgumentException(
                        "alternativa " + s.category() + " con confidenza superiore alla primaria");
            }
            if (s.confidence() > previous) {
                throw new IllegalArgumentException("alternative non ordinate per confidenza decrescente");
            }
            previous = s.confidence();
        }
    }
}
