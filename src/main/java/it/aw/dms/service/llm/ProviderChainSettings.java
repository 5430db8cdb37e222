package it.aw.dms.service.llm;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parametri della catena di fallback.
 *
 * @param defaultModel   modello usato quando il chiamante non ne indica uno
 * @param fallbackModels modelli da provare, in ordine, dopo il preferito
 * @param maxRetries     tentativi aggiuntivi sullo stesso modello per errori transitori
 * @param initialBackoff attesa prima del primo retry, raddoppiata ad ogni retry
 * @param maxBackoff     tetto dell'attesa
 */
public record ProviderChainSettings(
        String         defaultModel,
        List<String>   fallbackModels,
        int            maxRetries,
        Duration       initialBackoff,
        Duration       maxBackoff
) {
    public ProviderChainSettings {
        if (defaultModel == null || defaultModel.isBlank()) {
            throw new IllegalArgumentException("defaultModel obbligatorio");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries deve essere >= 0 (ricevuto: " + maxRetries + ")");
        }
        if (initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("backoff non valido: " + initialBackoff + " / " + maxBackoff);
        }
        fallbackModels = fallbackModels != null ? List.copyOf(fallbackModels) : List.of();
    }

    /** Preferito (o default), poi default, poi fallback; senza duplicati né valori vuoti. */
    public List<String> modelOrder(String preferredModel) {
        Set<String> order = new LinkedHashSet<>();
        if (preferredModel != null && !preferredModel.isBlank()) order.add(preferredModel.trim());
        order.add(defaultModel);
        for (String m : fallbackModels) {
            if (m != null && !m.isBlank()) order.add(m.trim());
        }
        return new ArrayList<>(order);
    }

    /** Attesa prima del retry n-esimo (1-based): initial · 2^(n-1), al massimo maxBackoff. */
    public Duration backoffFor(int retry) {
        Duration delay = initialBackoff;
        for (int i = 1; i < retry && delay.compareTo(maxBackoff) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }
}
