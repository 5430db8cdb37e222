package it.aw.dms.service.extraction;

/**
 * Configurazione dell'estrazione testo.
 *
 * @param enabled   se false l'OCR non viene mai invocato (solo testo diretto)
 * @param threshold densità minima in caratteri/pagina sotto la quale si passa all'OCR
 * @param language  lingua Tesseract, passata invariata al motore (es. "deu", "deu+eng")
 * @param dpi       risoluzione di rendering delle pagine per l'OCR
 * @param datapath  cartella tessdata; null = default del sistema
 */
public record OcrSettings(boolean enabled, int threshold, String language, int dpi, String datapath) {

    public static final int DEFAULT_THRESHOLD = 50;

    public OcrSettings {
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold deve essere >= 0 (ricevuto: " + threshold + ")");
        }
        if (dpi <= 0) {
            throw new IllegalArgumentException("dpi deve essere > 0 (ricevuto: " + dpi + ")");
        }
    }

    public static OcrSettings defaults() {
        return new OcrSettings(true, DEFAULT_THRESHOLD, "deu", 300, null);
    }
}
