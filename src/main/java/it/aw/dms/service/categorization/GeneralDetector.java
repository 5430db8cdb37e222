package it.aw.dms.service.categorization;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Categoria di ripiego: non riconosce mai il testo ({@link #match} vale 0) ma estrae
 * le entità generiche presenti in qualsiasi documento.
 */
public class GeneralDetector extends PatternCategoryDetector {

    public static final String CATEGORY = "general";

    private static final Map<String, List<String>> ENTITIES = new LinkedHashMap<>();
    static {
        ENTITIES.put("date", List.of("\\b(\\d{1,2}\\.\\d{1,2}\\.\\d{4}|\\d{4}-\\d{2}-\\d{2})\\b"));
        ENTITIES.put("amount", List.of("([0-9][0-9.,]*[0-9])\\s*(?:€|EUR)"));
        ENTITIES.put("email", List.of("\\b([A-Z0-9._%+-]+@[A-Z0-9.-]+\\.[A-Z]{2,})\\b"));
    }

    public GeneralDetector() {
        super(CATEGORY, List.of(), 1, ENTITIES);
    }

    @Override
    public double match(String text) {
        return 0.0;
    }
}
