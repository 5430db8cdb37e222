package it.aw.dms.support;

import it.aw.dms.model.CategoryResult;
import it.aw.dms.model.CategoryScore;
import it.aw.dms.model.DocumentContent;
import it.aw.dms.model.ExtractionMethod;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/** Valori di modello ricorrenti nei test. */
public final class Fixtures {

    private Fixtures() {}

    public static DocumentContent content(String path, String text, String directoryLabel, LocalDateTime importedAt) {
        return new DocumentContent(path, text, 1, text.length(), importedAt, directoryLabel,
                ExtractionMethod.DIRECT, false, Duration.ofMillis(42), List.of(0), List.of());
    }

    public static CategoryResult invoice() {
        return new CategoryResult("invoice", 0.8, Map.of("invoice_number", "RE-1"),
                List.of(new CategoryScore("contract", 0.2)));
    }

    public static CategoryResult category(String name) {
        return new CategoryResult(name, 0.6, Map.of(), List.of());
    }
}
