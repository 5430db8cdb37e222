package it.aw.dms.exception;

/**
 * Errore OCR su una singola pagina. Non esce mai dall'estrattore: la pagina
 * ricade sul testo diretto disponibile e viene segnata come degradata.
 */
public class OcrException extends DmsException {

    public OcrException(String message, Throwable cause) {
        super(ErrorKind.EXTRACTION_DEGRADED, message,
                "Verificare l'installazione di Tesseract e dei language pack configurati.", cause);
    }
}
