package it.aw.dms.service.retrieval;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.store.embedding.filter.Filter;
import dev.langchain4j.store.embedding.filter.comparison.IsEqualTo;
import dev.langchain4j.store.embedding.filter.comparison.IsGreaterThanOrEqualTo;
import dev.langchain4j.store.embedding.filter.comparison.IsLessThanOrEqualTo;
import dev.langchain4j.store.embedding.filter.logical.And;
import it.aw.dms.model.SearchFilter;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Chiavi dei metadati dei segmenti nell'embedding store e traduzione di un
 * {@link SearchFilter} in {@link Filter} LangChain4j.
 * <p>
 * Il prefisso di directory non ha un operatore dedicato: ogni segmento porta una chiave
 * {@code dir.N} per ciascun antenato della sua directory label
 * ("2024/03/Rechnungen" → dir.0=2024, dir.1=2024/03, dir.2=2024/03/Rechnungen),
 * e il filtro per prefisso diventa un'uguaglianza sulla chiave della profondità giusta.
 */
public final class MetadataFilters {

    public static final String DOCUMENT_ID  = "document_id";
    public static final String PATH         = "path";
    public static final String PAGE         = "page";
    public static final String CHUNK_INDEX  = "chunk_index";
    public static final String DIRECTORY    = "directory";
    public static final String CATEGORY     = "category";
    public static final String IMPORTED_AT  = "imported_at";
    static final String DIR_PREFIX = "dir.";

    private MetadataFilters() {}

    /** @return il filtro LangChain4j, o null se il filtro è vuoto */
    public static Filter toStoreFilter(SearchFilter filter, ZoneId zone) {
        if (filter == null || filter.isEmpty()) return null;
        List<Filter> parts = new ArrayList<>();
        if (filter.category() != null) {
            parts.add(new IsEqualTo(CATEGORY, filter.category()));
        }
        if (filter.directoryPrefix() != null) {
            String prefix = filter.directoryPrefix();
            int depth = prefix.split("/").length - 1;
            parts.add(new IsEqualTo(DIR_PREFIX + depth, prefix));
        }
        if (filter.importedFrom() != null) {
            parts.add(new IsGreaterThanOrEqualTo(IMPORTED_AT, startOfDay(filter.importedFrom(), zone)));
        }
        if (filter.importedTo() != null) {
            parts.add(new IsLessThanOrEqualTo(IMPORTED_AT, startOfDay(filter.importedTo().plusDays(1), zone) - 1));
        }
        Filter result = parts.get(0);
        for (int i = 1; i < parts.size(); i++) {
            result = new And(result, parts.get(i));
        }
        return result;
    }

    /** Scrive le chiavi {@code dir.N} per la directory label indicata. */
    public static void putDirectoryKeys(Metadata metadata, String directoryLabel) {
        metadata.put(DIRECTORY, directoryLabel == null ? "" : directoryLabel);
        if (directoryLabel == null || directoryLabel.isEmpty()) return;
        String[] segments = directoryLabel.split("/");
        StringBuilder ancestor = new StringBuilder();
        for (int depth = 0; depth < segments.length; depth++) {
            if (depth > 0) ancestor.append('/');
            ancestor.append(segments[depth]);
            metadata.put(DIR_PREFIX + depth, ancestor.toString());
        }
    }

    static long toEpochMillis(LocalDateTime dateTime, ZoneId zone) {
        return dateTime.atZone(zone).toInstant().toEpochMilli();
    }

    private static long startOfDay(LocalDate date, ZoneId zone) {
        return toEpochMillis(date.atStartOfDay(), zone);
    }
}
