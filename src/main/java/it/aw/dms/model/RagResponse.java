package it.aw.dms.model;

import java.util.List;

/**
 * Risposta a una domanda: testo, fonti citate in ordine di contesto, confidenza
 * complessiva e numero di risultati di ricerca considerati.
 * {@code model} è il modello che ha prodotto la risposta (null se l'LLM non è stato invocato).
 */
public record RagResponse(
        String       answer,
        List<Source> sources,
        double       confidence,
        int          searchResultsCount,
        String       model
) {
    public static final String NO_RELEVANT_INFORMATION =
            "Non sono state trovate informazioni rilevanti per la domanda. "
            + "Provare una formulazione diversa o verificare che i documenti pertinenti siano stati importati.";

    public RagResponse {
        sources = List.copyOf(sources);
    }

    public static RagResponse noRelevantResults() {
        return new RagResponse(NO_RELEVANT_INFORMATION, List.of(), 0.0, 0, null);
    }
}
