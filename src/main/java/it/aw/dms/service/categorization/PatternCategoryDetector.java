package it.aw.dms.service.categorization;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Base per i detector a regole: un insieme di segnali (pattern di keyword) e,
 * per ogni entità, una lista ordinata di pattern con un gruppo di cattura.
 * <p>
 * La confidenza è il numero di segnali distinti presenti diviso per {@code saturation},
 * limitata a 1.0: con {@code saturation} segnali il detector è certo.
 * Per ogni entità vince il primo pattern che produce un valore non vuoto.
 */
public abstract class PatternCategoryDetector implements CategoryDetector {

    protected static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.MULTILINE;

    private final String category;
    private final List<Pattern> signals;
    private final int saturation;
    private final Map<String, List<Pattern>> entityPatterns;

    protected PatternCategoryDetector(String category, List<String> signals, int saturation,
                                      Map<String, List<String>> entityPatterns) {
        if (saturation <= 0) {
            throw new IllegalArgumentException("saturation deve essere > 0 (ricevuto: " + saturation + ")");
        }
        this.category = category;
        this.signals = signals.stream().map(s -> Pattern.compile(s, FLAGS)).collect(Collectors.toList());
        this.saturation = saturation;
        this.entityPatterns = new LinkedHashMap<>();
        entityPatterns.forEach((name, patterns) ->
                this.entityPatterns.put(name, patterns.stream().map(p -> Pattern.compile(p, FLAGS)).collect(Collectors.toList())));
    }

    @Override
    public String category() {
        return category;
    }

    @Override
    public double match(String text) {
        if (text == null || text.isBlank()) return 0.0;
        return Math.min(1.0, (double) matchedSignals(text) / saturation);
    }

    /** Numero di segnali distinti presenti nel testo. */
    public int matchedSignals(String text) {
        int matched = 0;
        for (Pattern signal : signals) {
            if (signal.matcher(text).find()) matched++;
        }
        return matched;
    }

    @Override
    public Map<String, String> extract(String text) {
        Map<String, String> entities = new LinkedHashMap<>();
        if (text == null || text.isBlank()) return entities;
        for (Map.Entry<String, List<Pattern>> entry : entityPatterns.entrySet()) {
            String value = firstMatch(text, entry.getValue());
            if (value != null) entities.put(entry.getKey(), value);
        }
        return entities;
    }

    private static String firstMatch(String text, List<Pattern> patterns) {
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                String value = m.groupCount() > 0 ? m.group(1) : m.group();
                if (value != null && !value.isBlank()) return value.strip();
            }
        }
        return null;
    }
}
