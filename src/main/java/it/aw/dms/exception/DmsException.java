package it.aw.dms.exception;

/**
 * Radice della gerarchia di eccezioni del sistema.
 * <p>
 * Oltre al messaggio porta un {@link ErrorKind} e, opzionalmente, un suggerimento
 * operativo da mostrare all'utente (es. "rimuovere la password dal PDF").
 */
public class DmsException extends RuntimeException {

    private final ErrorKind kind;
    private final String recoverySuggestion;

    public DmsException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public DmsException(ErrorKind kind, String message, String recoverySuggestion) {
        this(kind, message, recoverySuggestion, null);
    }

    public DmsException(ErrorKind kind, String message, String recoverySuggestion, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.recoverySuggestion = recoverySuggestion;
    }

    public ErrorKind getKind() { return kind; }

    public String getRecoverySuggestion() { return recoverySuggestion; }
}
