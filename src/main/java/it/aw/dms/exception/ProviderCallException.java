package it.aw.dms.exception;

/**
 * Fallimento di una singola chiamata al provider LLM.
 * <p>
 * {@code transientError} decide il comportamento della catena di fallback:
 * gli errori transitori (timeout, 408, 429, 5xx, rete) vengono ritentati sullo stesso
 * modello, gli altri (400, 401, 403, 404) passano subito al modello successivo.
 */
public class ProviderCallException extends DmsException {

    private final String model;
    private final Integer statusCode;
    private final boolean transientError;

    public ProviderCallException(String model, Integer statusCode, boolean transientError,
                                 String message, Throwable cause) {
        super(ErrorKind.PROVIDER_CALL_FAILED, message, suggestionFor(statusCode), cause);
        this.model = model;
        this.statusCode = statusCode;
        this.transientError = transientError;
    }

    public static ProviderCallException transientFailure(String model, Integer statusCode, String message) {
        return new ProviderCallException(model, statusCode, true, message, null);
    }

    public static ProviderCallException permanentFailure(String model, Integer statusCode, String message) {
        return new ProviderCallException(model, statusCode, false, message, null);
    }

    public String getModel() { return model; }

    public Integer getStatusCode() { return statusCode; }

    public boolean isTransient() { return transientError; }

    private static String suggestionFor(Integer status) {
        if (status == null) return "Verificare la connessione di rete e la configurazione del provider.";
        if (status == 401 || status == 403) return "Verificare la API key OpenRouter nella configurazione.";
        if (status == 404) return "Il modello non è disponibile: sceglierne un altro.";
        if (status == 429) return "Rate limit superato: attendere qualche istante.";
        if (status >= 500) return "Errore lato provider: riprovare più tardi o usare un altro modello.";
        return "Verificare la richiesta e la configurazione del provider.";
    }
}
