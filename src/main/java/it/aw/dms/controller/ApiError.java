package it.aw.dms.controller;

import java.time.LocalDateTime;

/**
 * Corpo delle risposte di errore.
 *
 * @param kind               tipo di errore (es. UNPROCESSABLE_DOCUMENT), null per errori generici
 * @param recoverySuggestion indicazione operativa per l'utente, se disponibile
 */
public record ApiError(
        int           status,
        String        kind,
        String        message,
        String        recoverySuggestion,
        LocalDateTime timestamp
) {}
