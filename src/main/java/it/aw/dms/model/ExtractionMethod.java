package it.aw.dms.model;

/** Strategia con cui è stato ottenuto il testo di un documento. */
public enum ExtractionMethod {
    DIRECT("direct"),
    OCR("ocr"),
    HYBRID("hybrid");

    private final String label;

    ExtractionMethod(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ExtractionMethod fromLabel(String label) {
        for (ExtractionMethod m : values()) {
            if (m.label.equalsIgnoreCase(label)) return m;
        }
        throw new IllegalArgumentException("Metodo di estrazione sconosciuto: " + label);
    }
}
