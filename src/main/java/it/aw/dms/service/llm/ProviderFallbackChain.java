package it.aw.dms.service.llm;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.UserMessage;
import it.aw.dms.exception.DmsException;
import it.aw.dms.exception.ErrorKind;
import it.aw.dms.exception.ProviderCallException;
import it.aw.dms.exception.ProviderExhaustedException;
import it.aw.dms.exception.ProviderExhaustedException.ModelAttempt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Invoca il provider LLM provando i modelli in ordine finché uno risponde.
 * <p>
 * L'avanzamento è una macchina a stati: {@link Attempting} → {@link Succeeded} oppure
 * {@link Failed}, calcolato dalla funzione pura {@link #next}. Un errore transitorio
 * viene ritentato sullo stesso modello fino a {@code maxRetries} volte con backoff
 * esponenziale; un errore non transitorio passa subito al modello successivo.
 */
public class ProviderFallbackChain {

    private static final Logger log = LoggerFactory.getLogger(ProviderFallbackChain.class);

    static final String PING_MESSAGE = "Hello";

    /** Stato della catena. */
    public interface ChainState {}

    /** Prossima chiamata da fare: modello (indice nell'ordine), tentativo 1-based, modelli già falliti. */
    public record Attempting(int modelIndex, String model, int attempt, List<ModelAttempt> history)
            implements ChainState {
        public Attempting {
            history = List.copyOf(history);
        }
    }

    /** Risposta ottenuta; {@code history} elenca i modelli falliti prima di {@code model}. */
    public record Succeeded(String text, String model, List<ModelAttempt> history) implements ChainState {
        public Succeeded {
            history = List.copyOf(history);
        }
    }

    public record Failed(List<ModelAttempt> attempts) implements ChainState {
        public Failed {
            attempts = List.copyOf(attempts);
        }
    }

    /** Esito di una singola chiamata: testo oppure errore. */
    public record CallOutcome(String text, ProviderCallException error) {

        public static CallOutcome success(String text) {
            return new CallOutcome(text, null);
        }

        public static CallOutcome failure(ProviderCallException error) {
            return new CallOutcome(null, error);
        }

        public boolean isSuccess() {
            return error == null;
        }
    }

    private final LlmProvider provider;
    private final ProviderChainSettings settings;
    private final Sleeper sleeper;

    public ProviderFallbackChain(LlmProvider provider, ProviderChainSettings settings) {
        this(provider, settings, Sleeper.SYSTEM);
    }

    public ProviderFallbackChain(LlmProvider provider, ProviderChainSettings settings, Sleeper sleeper) {
        this.provider = provider;
        this.settings = settings;
        this.sleeper = sleeper;
    }

    public static Attempting start(List<String> models) {
        if (models.isEmpty()) throw new IllegalArgumentException("nessun modello configurato");
        return new Attempting(0, models.get(0), 1, List.of());
    }

    /**
     * Transizione della catena dato l'esito dell'ultima chiamata.
     */
    public static ChainState next(Attempting current, CallOutcome outcome, List<String> models, int maxRetries) {
        if (outcome.isSuccess()) {
            return new Succeeded(outcome.text(), current.model(), current.history());
        }
        ProviderCallException error = outcome.error();
        if (error.isTransient() && current.attempt() <= maxRetries) {
            return new Attempting(current.modelIndex(), current.model(), current.attempt() + 1, current.history());
        }
        List<ModelAttempt> history = new ArrayList<>(current.history());
        history.add(new ModelAttempt(current.model(), current.attempt(), error.getMessage()));
        int nextIndex = current.modelIndex() + 1;
        if (nextIndex < models.size()) {
            return new Attempting(nextIndex, models.get(nextIndex), 1, history);
        }
        return new Failed(history);
    }

    /**
     * @param preferredModel modello da provare per primo; null per il default
     * @throws ProviderExhaustedException se nessun modello ha risposto
     */
    public Completion complete(List<ChatMessage> messages, String preferredModel) {
        List<String> models = settings.modelOrder(preferredModel);
        ChainState state = start(models);

        while (state instanceof Attempting attempting) {
            if (attempting.attempt() > 1) {
                pause(settings.backoffFor(attempting.attempt() - 1));
            }
            CallOutcome outcome = call(messages, attempting.model());
            state = next(attempting, outcome, models, settings.maxRetries());
            logTransition(attempting, outcome, state);
        }

        if (state instanceof Succeeded succeeded) {
            return new Completion(succeeded.text(), succeeded.model(), succeeded.history());
        }
        Failed failed = (Failed) state;
        log.error("Nessun modello disponibile: {}", failed.attempts());
        throw new ProviderExhaustedException(failed.attempts());
    }

    /** Verifica la raggiungibilità del provider con un messaggio minimo lungo la stessa catena. */
    public ConnectivityReport testConnectivity() {
        try {
            Completion completion = complete(List.of(UserMessage.from(PING_MESSAGE)), null);
            return new ConnectivityReport(true, completion.model(), completion.failedAttempts());
        } catch (ProviderExhaustedException e) {
            return new ConnectivityReport(false, null, e.getAttempts());
        }
    }

    public List<String> listModels() {
        return provider.listModels();
    }

    public ProviderChainSettings settings() {
        return settings;
    }

    private CallOutcome call(List<ChatMessage> messages, String model) {
        try {
            return CallOutcome.success(provider.complete(messages, model));
        } catch (ProviderCallException e) {
            return CallOutcome.failure(e);
        }
    }

    private void pause(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DmsException(ErrorKind.PROVIDER_CALL_FAILED, "Attesa tra i tentativi interrotta", null, e);
        }
    }

    private void logTransition(Attempting from, CallOutcome outcome, ChainState to) {
        if (to instanceof Succeeded s) {
            log.info("Risposta ottenuta da {} (tentativo {})", s.model(), from.attempt());
        } else if (to instanceof Attempting a && a.model().equals(from.model())) {
            log.warn("Errore transitorio su {} (tentativo {}): {} - nuovo tentativo",
                    from.model(), from.attempt(), outcome.error().getMessage());
        } else if (to instanceof Attempting a) {
            log.warn("Modello {} non disponibile: {} - fallback su {}",
                    from.model(), outcome.error().getMessage(), a.model());
        }
    }
}
