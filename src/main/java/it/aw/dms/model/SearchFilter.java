package it.aw.dms.model;

import java.time.LocalDate;

/**
 * Filtri di ricerca lato chiamante. Ogni campo null significa "nessun vincolo".
 * <p>
 * {@code directoryPrefix} è un prefisso di directory label per segmenti interi:
 * "2024/03" include "2024/03" e "2024/03/Rechnungen", non "2024/030".
 * Le date sono inclusive e si riferiscono alla data di import.
 */
public record SearchFilter(
        String    category,
        String    directoryPrefix,
        LocalDate importedFrom,
        LocalDate importedTo
) {
    public SearchFilter {
        category = blankToNull(category);
        directoryPrefix = normalizePrefix(directoryPrefix);
        if (importedFrom != null && importedTo != null && importedFrom.isAfter(importedTo)) {
            throw new IllegalArgumentException(
                    "intervallo di date non valido: " + importedFrom + " > " + importedTo);
        }
    }

    public static SearchFilter none() {
        return new SearchFilter(null, null, null, null);
    }

    public static SearchFilter byDirectory(String prefix) {
        return new SearchFilter(null, prefix, null, null);
    }

    public static SearchFilter byCategory(String category) {
        return new SearchFilter(category, null, null, null);
    }

    public boolean isEmpty() {
        return category == null && directoryPrefix == null && importedFrom == null && importedTo == null;
    }

    /** Verifica se una directory label ricade sotto il prefisso del filtro. */
    public boolean matchesDirectory(String directoryLabel) {
        if (directoryPrefix == null) return true;
        if (directoryLabel == null) return false;
        return directoryLabel.equals(directoryPrefix) || directoryLabel.startsWith(directoryPrefix + "/");
    }

    private static String normalizePrefix(String prefix) {
        if (prefix == null) return null;
        String p = prefix.trim().replace('\\', '/');
        while (p.startsWith("/")) p = p.substring(1);
        while (p.endsWith("/")) p = p.substring(0, p.length() - 1);
        return p.isEmpty() ? null : p;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
