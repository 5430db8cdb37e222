package it.aw.dms.service.extraction;

import it.aw.dms.exception.OcrException;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;

/**
 * {@link OcrEngine} basato su Tess4J.
 * <p>
 * Equivale a {@code tesseract --oem 3 --psm 6}: motore di default e pagina trattata
 * come un unico blocco di testo, adatto a fatture ed estratti conto.
 * L'istanza {@link Tesseract} non è thread-safe, quindi l'accesso è sincronizzato.
 * La libreria nativa viene caricata solo al primo riconoscimento.
 */
public class TesseractOcrEngine implements OcrEngine {

    private static final Logger log = LoggerFactory.getLogger(TesseractOcrEngine.class);

    private final Tesseract tesseract;

    public TesseractOcrEngine(OcrSettings settings) {
        this.tesseract = new Tesseract();
        if (settings.datapath() != null && !settings.datapath().isBlank()) {
            tesseract.setDatapath(settings.datapath());
        }
        tesseract.setLanguage(settings.language());
        tesseract.setOcrEngineMode(ITessAPI.TessOcrEngineMode.OEM_DEFAULT);
        tesseract.setPageSegMode(ITessAPI.TessPageSegMode.PSM_SINGLE_BLOCK);
        tesseract.setVariable("user_defined_dpi", String.valueOf(settings.dpi()));
        log.info("OCR: Tesseract configurato (lingua={}, dpi={})", settings.language(), settings.dpi());
    }

    @Override
    public synchronized String recognize(BufferedImage image) {
        try {
            String text = tesseract.doOCR(image);
            return text != null ? text : "";
        } catch (TesseractException e) {
            throw new OcrException("Riconoscimento OCR fallito: " + e.getMessage(), e);
        } catch (UnsatisfiedLinkError e) {
            throw new OcrException("Libreria nativa Tesseract non disponibile", e);
        }
    }
}
