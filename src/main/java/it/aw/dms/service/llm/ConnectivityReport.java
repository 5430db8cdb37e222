package it.aw.dms.service.llm;

import it.aw.dms.exception.ProviderExhaustedException.ModelAttempt;

import java.util.List;

/**
 * Esito del test di connettività: il primo modello che ha risposto (null se nessuno)
 * e i modelli falliti prima di lui.
 */
public record ConnectivityReport(boolean reachable, String model, List<ModelAttempt> failures) {

    public ConnectivityReport {
        failures = List.copyOf(failures);
    }
}
