package it.aw.dms.service.categorization;

import it.aw.dms.model.CategoryResult;
import it.aw.dms.model.CategoryScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Assegna una categoria a un testo interrogando una lista ordinata di {@link CategoryDetector}.
 * <p>
 * Regole:
 * <ul>
 *   <li>categoria primaria = detector con confidenza massima; a parità vince quello
 *       dichiarato prima nella lista (l'ordine della lista è quindi una priorità)</li>
 *   <li>alternative = gli altri detector con confidenza strettamente sopra la soglia,
 *       in ordine decrescente (stabile rispetto alla lista)</li>
 *   <li>se nessun detector supera la soglia la categoria è quella del detector di ripiego,
 *       con confidenza pari alla soglia</li>
 * </ul>
 * Nessun I/O, deterministico.
 */
public class CategorizationEngine {

    private static final Logger log = LoggerFactory.getLogger(CategorizationEngine.class);

    public static final double DEFAULT_SUGGESTION_FLOOR = 0.1;

    private final List<CategoryDetector> detectors;
    private final CategoryDetector fallback;
    private final double suggestionFloor;

    public CategorizationEngine(List<CategoryDetector> detectors, CategoryDetector fallback, double suggestionFloor) {
        if (suggestionFloor < 0.0 || suggestionFloor > 1.0) {
            throw new IllegalArgumentException("suggestionFloor fuori da [0,1]: " + suggestionFloor);
        }
        this.detectors = List.copyOf(detectors);
        this.fallback = fallback;
        this.suggestionFloor = suggestionFloor;
    }

    /** Detector standard, in ordine di priorità: fattura, estratto conto, contratto. */
    public static CategorizationEngine withDefaultDetectors(double suggestionFloor) {
        return new CategorizationEngine(
                List.of(new InvoiceDetector(), new BankStatementDetector(), new ContractDetector()),
                new GeneralDetector(),
                suggestionFloor);
    }

    public CategoryResult categorize(String text) {
        if (text == null || text.isBlank()) {
            return fallbackResult(text);
        }

        List<CategoryScore> scores = new ArrayList<>(detectors.size());
        CategoryDetector best = null;
        double bestConfidence = -1.0;
        for (CategoryDetector detector : detectors) {
            double confidence = detector.match(text);
            scores.add(new CategoryScore(detector.category(), confidence));
            if (confidence > bestConfidence) {
                best = detector;
                bestConfidence = confidence;
            }
        }

        if (best == null || bestConfidence <= suggestionFloor) {
            log.debug("Categorizzazione: nessun detector sopra la soglia {}, uso '{}'", suggestionFloor, fallback.category());
            return fallbackResult(text);
        }

        String primary = best.category();
        List<CategoryScore> suggestions = scores.stream()
                .filter(s -> !s.category().equals(primary))
                .filter(s -> s.confidence() > suggestionFloor)
                .sorted(Comparator.comparingDouble(CategoryScore::confidence).reversed())
                .collect(Collectors.toList());

        log.debug("Categorizzazione: {} ({}) — alternative {}", primary, bestConfidence, suggestions);
        return new CategoryResult(primary, bestConfidence, best.extract(text), suggestions);
    }

    /**
     * Categorizzazione con scelta manuale. La categoria indicata dall'utente diventa primaria
     * con confidenza 1.0; l'esito automatico resta visibile tra le alternative.
     *
     * @param overrideCategory categoria imposta, null o vuota per la sola categorizzazione automatica
     * @throws IllegalArgumentException se la categoria non è tra quelle note
     */
    public CategoryResult categorize(String text, String overrideCategory) {
        if (overrideCategory == null || overrideCategory.isBlank()) {
            return categorize(text);
        }
        CategoryDetector chosen = detectorFor(overrideCategory);

        CategoryResult automatic = categorize(text);
        List<CategoryScore> suggestions = new ArrayList<>();
        suggestions.add(new CategoryScore(automatic.primaryCategory(), automatic.confidence()));
        suggestions.addAll(automatic.suggestedCategories());
        List<CategoryScore> filtered = suggestions.stream()
                .filter(s -> !s.category().equals(chosen.category()))
                .sorted(Comparator.comparingDouble(CategoryScore::confidence).reversed())
                .collect(Collectors.toList());

        return new CategoryResult(chosen.category(), 1.0, chosen.extract(text == null ? "" : text), filtered);
    }

    /** Confidenza del solo detector indicato, senza confronto con gli altri. */
    public double confidenceFor(String text, String category) {
        return detectorFor(category).match(text);
    }

    public Map<String, String> extractEntities(String text, String category) {
        return detectorFor(category).extract(text);
    }

    /** Categorie note, in ordine di priorità; il ripiego è l'ultima. */
    public List<String> knownCategories() {
        List<String> categories = detectors.stream().map(CategoryDetector::category).collect(Collectors.toList());
        categories.add(fallback.category());
        return categories;
    }

    public double suggestionFloor() {
        return suggestionFloor;
    }

    private CategoryResult fallbackResult(String text) {
        Map<String, String> entities = (text == null || text.isBlank()) ? Map.of() : fallback.extract(text);
        return new CategoryResult(fallback.category(), suggestionFloor, entities, List.of());
    }

    private CategoryDetector detectorFor(String category) {
        if (fallback.category().equalsIgnoreCase(category)) return fallback;
        return detectors.stream()
                .filter(d -> d.category().equalsIgnoreCase(category))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Categoria sconosciuta: " + category));
    }
}
