package it.aw.dms.exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Tutti i modelli della catena di fallback hanno fallito.
 * Riporta, nell'ordine in cui sono stati provati, ogni modello con l'ultimo errore ricevuto.
 */
public class ProviderExhaustedException extends DmsException {

    /** Esito di un modello: numero di tentativi fatti e ultimo errore. */
    public record ModelAttempt(String model, int attempts, String lastError) {}

    private final List<ModelAttempt> attempts;

    public ProviderExhaustedException(List<ModelAttempt> attempts) {
        super(ErrorKind.PROVIDER_EXHAUSTED,
                "Tutti i modelli hanno fallito: " + describe(attempts),
                "Verificare API key, connessione e disponibilità dei modelli configurati.");
        this.attempts = List.copyOf(attempts);
    }

    public List<ModelAttempt> getAttempts() { return attempts; }

    public List<String> attemptedModels() {
        return attempts.stream().map(ModelAttempt::model).collect(Collectors.toList());
    }

    private static String describe(List<ModelAttempt> attempts) {
        return attempts.stream()
                .map(a -> a.model() + " (" + a.attempts() + "x: " + a.lastError() + ")")
                .collect(Collectors.joining(", "));
    }
}
