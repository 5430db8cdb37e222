package it.aw.dms.service.rag;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import it.aw.dms.model.RagResponse;
import it.aw.dms.model.SearchResult;
import it.aw.dms.model.Source;
import it.aw.dms.service.llm.Completion;
import it.aw.dms.service.llm.ProviderFallbackChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Costruisce la risposta a una domanda a partire dai risultati della ricerca.
 * <p>
 * Il contesto inviato al modello rispetta {@code contextBudget}: i risultati sono aggiunti
 * in ordine di rilevanza finché c'è spazio, quindi i meno rilevanti sono i primi a restare
 * fuori. Se già il primo risultato supera il budget viene troncato.
 */
public class AnswerGenerator {

    private static final Logger log = LoggerFactory.getLogger(AnswerGenerator.class);

    static final String SYSTEM_PROMPT = """
            Sei un assistente per un sistema di gestione documentale.
            Rispondi alla domanda usando esclusivamente i documenti forniti qui sotto,
            nella stessa lingua della domanda.
            Se i documenti non contengono la risposta, dichiaralo esplicitamente invece di inventarla.
            Cita il documento e la pagina da cui provengono le informazioni.
            Riporta importi, date e numeri esattamente come compaiono nei documenti.

            Documenti:
            """;

    private final ProviderFallbackChain chain;
    private final AnswerSettings settings;

    public AnswerGenerator(ProviderFallbackChain chain, AnswerSettings settings) {
        this.chain = chain;
        this.settings = settings;
    }

    /**
     * @param results risultati ordinati per rilevanza; se vuoti il modello non viene invocato
     * @param preferredModel modello da provare per primo, null per il default
     */
    public RagResponse generate(String question, List<SearchResult> results, String preferredModel) {
        if (results == null || results.isEmpty()) {
            log.info("Nessun risultato rilevante per la domanda, LLM non invocato");
            return RagResponse.noRelevantResults();
        }

        List<SearchResult> context = selectContext(results);
        List<ChatMessage> messages = List.of(
                SystemMessage.from(SYSTEM_PROMPT + formatContext(context)),
                UserMessage.from(question));

        Completion completion = chain.complete(messages, preferredModel);
        double confidence = confidence(results);
        log.info("Risposta generata da {}: {} fonti, confidenza {}",
                completion.model(), context.size(), String.format("%.2f", confidence));
        return new RagResponse(completion.text(), sources(context), confidence, results.size(), completion.model());
    }

    /** Risultati che entrano nel contesto, eventualmente con il primo troncato. */
    List<SearchResult> selectContext(List<SearchResult> results) {
        List<SearchResult> selected = new ArrayList<>();
        int used = 0;
        for (SearchResult r : results) {
            int size = formatEntry(selected.size() + 1, r).length();
            if (used + size <= settings.contextBudget()) {
                selected.add(r);
                used += size;
            } else if (selected.isEmpty()) {
                selected.add(truncate(r));
                break;
            } else {
                break;
            }
        }
        if (selected.size() < results.size()) {
            log.debug("Contesto limitato a {} risultati su {} (budget {} caratteri)",
                    selected.size(), results.size(), settings.contextBudget());
        }
        return selected;
    }

    /** 0.05 + 0.95 · (0.7 · score migliore + 0.3 · min(1, n/3)); zero solo senza risultati. */
    static double confidence(List<SearchResult> results) {
        if (results.isEmpty()) return 0.0;
        double top = results.stream().mapToDouble(SearchResult::score).max().orElse(0.0);
        top = Math.max(0.0, Math.min(1.0, top));
        double countFactor = Math.min(1.0, results.size() / 3.0);
        return 0.05 + 0.95 * (0.7 * top + 0.3 * countFactor);
    }

    private List<Source> sources(List<SearchResult> context) {
        List<Source> sources = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (SearchResult r : context) {
            if (seen.add(r.documentPath() + "#" + r.pageNumber())) {
                sources.add(new Source(r.documentPath(), r.pageNumber(), r.directoryLabel(), excerpt(r.content())));
            }
        }
        return sources;
    }

    private String excerpt(String content) {
        String text = content.strip();
        return text.length() <= settings.excerptLength()
                ? text
                : text.substring(0, settings.excerptLength()) + "...";
    }

    private SearchResult truncate(SearchResult r) {
        int overhead = formatEntry(1, withContent(r, "")).length();
        int room = Math.max(0, settings.contextBudget() - overhead);
        return withContent(r, r.content().substring(0, Math.min(room, r.content().length())));
    }

    private static SearchResult withContent(SearchResult r, String content) {
        return new SearchResult(r.chunkId(), r.score(), r.documentPath(), r.pageNumber(), r.directoryLabel(), content);
    }

    private static String formatContext(List<SearchResult> context) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < context.size(); i++) {
            sb.append(formatEntry(i + 1, context.get(i)));
        }
        return sb.toString();
    }

    private static String formatEntry(int n, SearchResult r) {
        return "[" + n + "] " + r.documentPath() + ", pagina " + r.pageNumber() + "\n"
                + r.content() + "\n\n";
    }
}
