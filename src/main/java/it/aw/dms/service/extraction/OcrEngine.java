package it.aw.dms.service.extraction;

import it.aw.dms.exception.OcrException;

import java.awt.image.BufferedImage;

/**
 * Motore OCR esterno. Riconosce il testo di una singola pagina già renderizzata.
 * Lingua e opzioni del motore sono fissate dall'implementazione.
 */
public interface OcrEngine {

    /**
     * @throws OcrException se il riconoscimento della pagina fallisce
     */
    String recognize(BufferedImage image);
}
