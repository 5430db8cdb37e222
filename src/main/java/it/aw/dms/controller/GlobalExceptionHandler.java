package it.aw.dms.controller;

import it.aw.dms.exception.DmsException;
import it.aw.dms.exception.ProviderExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;

/**
 * Traduce le eccezioni applicative in risposte HTTP con corpo {@link ApiError}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(DmsException.class)
    public ResponseEntity<ApiError> handleDms(DmsException e) {
        HttpStatus status = statusFor(e);
        if (status.is5xxServerError()) {
            log.error("{}: {}", e.getKind(), e.getMessage(), e);
        } else {
            log.warn("{}: {}", e.getKind(), e.getMessage());
        }
        return body(status, e.getKind().name(), e.getMessage(), e.getRecoverySuggestion());
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiError> handleBadRequest(Exception e) {
        log.warn("Richiesta non valida: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, null, e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception e) {
        log.error("Errore non gestito: {}", e.getMessage(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, null, e.getMessage(), null);
    }

    static HttpStatus statusFor(DmsException e) {
        if (e instanceof ProviderExhaustedException) return HttpStatus.BAD_GATEWAY;
        return switch (e.getKind()) {
            case UNPROCESSABLE_DOCUMENT -> HttpStatus.UNPROCESSABLE_ENTITY;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case PROVIDER_EXHAUSTED, PROVIDER_CALL_FAILED -> HttpStatus.BAD_GATEWAY;
            case RETRIEVAL_STORE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static ResponseEntity<ApiError> body(HttpStatus status, String kind, String message, String suggestion) {
        return ResponseEntity.status(status)
                .body(new ApiError(status.value(), kind, message, suggestion, LocalDateTime.now()));
    }
}
