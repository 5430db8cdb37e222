package it.aw.dms.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Porzione di testo di un documento, unità di indicizzazione e retrieval.
 * <p>
 * {@code pageNumber} è la pagina (1-based) che contiene il primo carattere del chunk,
 * {@code chunkIndex} la posizione 0-based nel documento. L'embedding è valorizzato
 * solo dopo il passaggio nel vector store; l'array viene copiato in ingresso e in uscita
 * e partecipa a equals/hashCode per contenuto.
 */
public record TextChunk(
        String  id,
        String  documentId,
        String  content,
        int     pageNumber,
        int     chunkIndex,
        float[] embedding
) {
    public TextChunk {
        embedding = embedding != null ? embedding.clone() : null;
    }

    public TextChunk(String id, String documentId, String content, int pageNumber, int chunkIndex) {
        this(id, documentId, content, pageNumber, chunkIndex, null);
    }

    @Override
    public float[] embedding() {
        return embedding != null ? embedding.clone() : null;
    }

    public TextChunk withEmbedding(float[] vector) {
        return new TextChunk(id, documentId, content, pageNumber, chunkIndex, vector);
    }

    public static String idFor(String documentId, int chunkIndex) {
        return documentId + "#" + chunkIndex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TextChunk other)) return false;
        return pageNumber == other.pageNumber
                && chunkIndex == other.chunkIndex
                && Objects.equals(id, other.id)
                && Objects.equals(documentId, other.documentId)
                && Objects.equals(content, other.content)
                && Arrays.equals(embedding, other.embedding);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(id, documentId, content, pageNumber, chunkIndex) + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "TextChunk[id=" + id + ", documentId=" + documentId + ", pageNumber=" + pageNumber
                + ", chunkIndex=" + chunkIndex + ", content=" + content.length() + " caratteri"
                + ", embedding=" + (embedding != null ? embedding.length + " dimensioni" : "assente") + "]";
    }
}
