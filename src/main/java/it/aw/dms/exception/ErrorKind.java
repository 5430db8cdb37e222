package it.aw.dms.exception;

/**
 * Classificazione degli errori del sistema.
 * <p>
 * Ogni {@link DmsException} porta con sé il proprio kind: il layer REST lo usa
 * per scegliere lo status HTTP, l'import batch per decidere se proseguire.
 */
public enum ErrorKind {
    UNPROCESSABLE_DOCUMENT,      // PDF illeggibile, corrotto, cifrato o vuoto: saltare e proseguire
    EXTRACTION_DEGRADED,         // OCR fallito su alcune pagine: si prosegue con testo parziale
    RETRIEVAL_STORE_UNAVAILABLE, // vector store in errore: ricerca per keyword
    PROVIDER_CALL_FAILED,        // singola chiamata LLM fallita
    PROVIDER_EXHAUSTED,          // tutti i modelli della catena falliti
    CONFIGURATION,
    NOT_FOUND
}
