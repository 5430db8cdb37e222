package it.aw.dms.service.retrieval;

import it.aw.dms.model.DocumentContent;
import it.aw.dms.model.SearchFilter;
import it.aw.dms.model.SearchResult;
import it.aw.dms.model.TextChunk;

import java.util.Collection;
import java.util.List;

/**
 * Indice vettoriale dei chunk. Le implementazioni segnalano l'indisponibilità
 * con {@link it.aw.dms.exception.RetrievalStoreUnavailableException}.
 */
public interface VectorStore {

    /**
     * Calcola gli embedding dei chunk e li indicizza con i metadati del documento.
     * Un chunk con lo stesso id viene sostituito.
     *
     * @return i chunk con l'embedding valorizzato
     */
    List<TextChunk> upsert(DocumentContent document, String category, List<TextChunk> chunks);

    /** Chunk più simili alla query che soddisfano il filtro, per score decrescente. */
    List<SearchResult> search(String query, SearchFilter filter, int limit);

    void delete(Collection<String> chunkIds);

    /** Descrizione dello store e del modello di embedding, per le statistiche. */
    String storeType();

    String embeddingModelName();
}
