package it.aw.dms.service.retrieval;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.filter.Filter;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import it.aw.dms.exception.RetrievalStoreUnavailableException;
import it.aw.dms.model.DocumentContent;
import it.aw.dms.model.SearchFilter;
import it.aw.dms.model.SearchResult;
import it.aw.dms.model.TextChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link VectorStore} su un {@link InMemoryEmbeddingStore} LangChain4j.
 * <p>
 * Gli id dei chunk sono usati come id degli embedding, così la cancellazione di un
 * documento rimuove esattamente i suoi vettori. Qualunque errore dello store o del
 * modello di embedding viene riportato come {@link RetrievalStoreUnavailableException}.
 */
public class LangChain4jVectorStore implements VectorStore {

    private static final Logger log = LoggerFactory.getLogger(LangChain4jVectorStore.class);

    private final EmbeddingModel embeddingModel;
    private final InMemoryEmbeddingStore<TextSegment> embeddingStore;
    private final String embeddingModelName;
    private final ZoneId zone;

    public LangChain4jVectorStore(EmbeddingModel embeddingModel,
                                  InMemoryEmbeddingStore<TextSegment> embeddingStore,
                                  String embeddingModelName,
                                  ZoneId zone) {
        this.embeddingModel = embeddingModel;
        this.embeddingStore = embeddingStore;
        this.embeddingModelName = embeddingModelName;
        this.zone = zone;
    }

    @Override
    public List<TextChunk> upsert(DocumentContent document, String category, List<TextChunk> chunks) {
        if (chunks.isEmpty()) return List.of();
        long importedAt = MetadataFilters.toEpochMillis(document.importedAt(), zone);

        List<String> ids = new ArrayList<>(chunks.size());
        List<TextSegment> segments = new ArrayList<>(chunks.size());
        for (TextChunk chunk : chunks) {
            Metadata meta = new Metadata();
            meta.put(MetadataFilters.DOCUMENT_ID, chunk.documentId());
            meta.put(MetadataFilters.PATH, document.path());
            meta.put(MetadataFilters.PAGE, chunk.pageNumber());
            meta.put(MetadataFilters.CHUNK_INDEX, chunk.chunkIndex());
            meta.put(MetadataFilters.IMPORTED_AT, importedAt);
            if (category != null) meta.put(MetadataFilters.CATEGORY, category);
            MetadataFilters.putDirectoryKeys(meta, document.directoryLabel());
            ids.add(chunk.id());
            segments.add(TextSegment.from(chunk.content(), meta));
        }

        try {
            List<Embedding> embeddings = embeddingModel.embedAll(segments).content();
            // l'InMemoryEmbeddingStore non sostituisce id esistenti
            embeddingStore.removeAll(ids);
            for (int i = 0; i < ids.size(); i++) {
                embeddingStore.add(ids.get(i), embeddings.get(i), segments.get(i));
            }
            log.debug("Indicizzati {} chunk per {}", ids.size(), document.path());

            List<TextChunk> result = new ArrayList<>(chunks.size());
            for (int i = 0; i < chunks.size(); i++) {
                result.add(chunks.get(i).withEmbedding(embeddings.get(i).vector()));
            }
            return result;
        } catch (RuntimeException e) {
            throw new RetrievalStoreUnavailableException(
                    "Indicizzazione fallita per " + document.path() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<SearchResult> search(String query, SearchFilter filter, int limit) {
        Filter storeFilter = MetadataFilters.toStoreFilter(filter, zone);
        try {
            Embedding queryEmbedding = embeddingModel.embed(query).content();
            List<EmbeddingMatch<TextSegment>> matches = embeddingStore.search(
                    EmbeddingSearchRequest.builder()
                            .queryEmbedding(queryEmbedding)
                            .maxResults(limit)
                            .filter(storeFilter)
                            .build()
            ).matches();

            return matches.stream()
                    .map(this::toResult)
                    .collect(Collectors.toList());
        } catch (RuntimeException e) {
            throw new RetrievalStoreUnavailableException("Ricerca vettoriale fallita: " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(Collection<String> chunkIds) {
        if (chunkIds.isEmpty()) return;
        try {
            embeddingStore.removeAll(chunkIds);
        } catch (RuntimeException e) {
            throw new RetrievalStoreUnavailableException("Cancellazione vettori fallita: " + e.getMessage(), e);
        }
    }

    @Override
    public String storeType() {
        return embeddingStore.getClass().getSimpleName();
    }

    @Override
    public String embeddingModelName() {
        return embeddingModelName;
    }

    private SearchResult toResult(EmbeddingMatch<TextSegment> match) {
        Metadata meta = match.embedded().metadata();
        Integer page = meta.getInteger(MetadataFilters.PAGE);
        return new SearchResult(
                match.embeddingId(),
                match.score(),
                meta.getString(MetadataFilters.PATH),
                page != null ? page : 1,
                meta.getString(MetadataFilters.DIRECTORY),
                match.embedded().text());
    }
}
