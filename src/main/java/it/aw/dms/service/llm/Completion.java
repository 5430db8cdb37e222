package it.aw.dms.service.llm;

import it.aw.dms.exception.ProviderExhaustedException.ModelAttempt;

import java.util.List;

/**
 * Testo prodotto da un modello, con il modello che l'ha effettivamente prodotto e
 * i modelli falliti prima di lui.
 */
public record Completion(String text, String model, List<ModelAttempt> failedAttempts) {

    public Completion {
        failedAttempts = List.copyOf(failedAttempts);
    }

    public Completion(String text, String model) {
        this(text, model, List.of());
    }
}
