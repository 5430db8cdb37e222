package it.aw.dms.model;

/**
 * Domanda dell'utente con filtri, numero massimo di risultati e modello preferito
 * (null = modello di default della configurazione).
 */
public record QueryRequest(String question, SearchFilter filter, int limit, String model) {

    public QueryRequest {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("la domanda non può essere vuota");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit deve essere > 0 (ricevuto: " + limit + ")");
        }
        filter = filter != null ? filter : SearchFilter.none();
    }
}
