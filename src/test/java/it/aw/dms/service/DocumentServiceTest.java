package it.aw.dms.service;

import it.aw.dms.exception.DocumentNotFoundException;
import it.aw.dms.model.StoreStats;
import it.aw.dms.registry.DocumentRegistry;
import it.aw.dms.service.retrieval.VectorStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DocumentServiceTest {

    @Mock
    private DocumentRegistry registry;

    @Mock
    private VectorStore vectorStore;

    @InjectMocks
    private DocumentService service;

    @Test
    @DisplayName("La cancellazione rimuove anche i vettori del documento")
    void delete_shouldRemoveVectors() {
        when(registry.remove("doc-1")).thenReturn(Optional.of(List.of("doc-1#0", "doc-1#1")));

        service.delete("doc-1");

        verify(vectorStore).delete(List.of("doc-1#0", "doc-1#1"));
    }

    @Test
    @DisplayName("Cancellare un documento inesistente solleva DocumentNotFoundException")
    void delete_shouldFailForUnknownDocument() {
        when(registry.remove("missing")).thenReturn(Optional.empty());

        assertThrows(DocumentNotFoundException.class, () -> service.delete("missing"));
        verify(vectorStore, never()).delete(anyCollection());
    }

    @Test
    @DisplayName("Il dettaglio di un documento inesistente solleva DocumentNotFoundException")
    void get_shouldFailForUnknownDocument() {
        when(registry.findById("missing")).thenReturn(Optional.empty());

        assertThrows(DocumentNotFoundException.class, () -> service.get("missing"));
    }

    @Test
    @DisplayName("Le statistiche combinano registry e vector store")
    void stats_shouldCombineRegistryAndStore() {
        when(registry.totalDocuments()).thenReturn(2);
        when(registry.totalChunks()).thenReturn(7);
        when(registry.categorySummary()).thenReturn(Map.of("invoice", 2));
        when(vectorStore.storeType()).thenReturn("InMemoryEmbeddingStore");
        when(vectorStore.embeddingModelName()).thenReturn("all-MiniLM-L6-v2");

        StoreStats stats = service.stats();

        assertEquals(2, stats.totalDocuments());
        assertEquals(7, stats.totalChunks());
        assertEquals(Map.of("invoice", 2), stats.documentsByCategory());
        assertEquals("InMemoryEmbeddingStore", stats.storeType());
    }
}
