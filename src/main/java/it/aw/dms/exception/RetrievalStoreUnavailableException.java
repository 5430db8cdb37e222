package it.aw.dms.exception;

public class RetrievalStoreUnavailableException extends DmsException {

    public RetrievalStoreUnavailableException(String message, Throwable cause) {
        super(ErrorKind.RETRIEVAL_STORE_UNAVAILABLE, message,
                "Lo store vettoriale verrà ricostruito re-importando i documenti.", cause);
    }
}
