package it.aw.dms.model;

import java.time.Duration;
import java.util.List;

/**
 * Riepilogo di un import di cartella.
 *
 * @param failures un elemento per ogni file fallito, nell'ordine di elaborazione
 */
public record ImportReport(
        int                 total,
        int                 processed,
        int                 skipped,
        int                 failed,
        List<ImportFailure> failures,
        Duration            elapsed
) {
    public record ImportFailure(String path, String reason) {}

    public ImportReport {
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return failed > 0;
    }
}
