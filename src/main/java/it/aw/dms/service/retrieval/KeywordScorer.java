package it.aw.dms.service.retrieval;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Punteggio lessicale usato quando la ricerca vettoriale non è disponibile.
 * <p>
 * score = 0.8 · copertura + 0.2 · densità, dove la copertura è la frazione di termini
 * distinti della query presenti nel testo e la densità il numero di occorrenze
 * rapportato a tre per termine (saturata a 1). Un testo senza termini in comune vale 0.
 */
public final class KeywordScorer {

    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]{2,}");
    private static final int OCCURRENCES_PER_TERM = 3;

    private KeywordScorer() {}

    public static Set<String> terms(String text) {
        Set<String> terms = new LinkedHashSet<>();
        if (text == null) return terms;
        Matcher m = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) terms.add(m.group());
        return terms;
    }

    public static double score(Set<String> queryTerms, String content) {
        if (queryTerms.isEmpty() || content == null || content.isEmpty()) return 0.0;
        String lower = content.toLowerCase(Locale.ROOT);
        int matched = 0;
        int occurrences = 0;
        for (String term : queryTerms) {
            int n = countOccurrences(lower, term);
            if (n > 0) {
                matched++;
                occurrences += n;
            }
        }
        if (matched == 0) return 0.0;
        double coverage = (double) matched / queryTerms.size();
        double density = Math.min(1.0, (double) occurrences / (queryTerms.size() * OCCURRENCES_PER_TERM));
        return 0.8 * coverage + 0.2 * density;
    }

    private static int countOccurrences(String text, String term) {
        int count = 0;
        int from = 0;
        while ((from = text.indexOf(term, from)) >= 0) {
            count++;
            from += term.length();
        }
        return count;
    }
}
