package it.aw.dms.model;

/**
 * Parametri di chunking: dimensione della finestra e sovrapposizione, in caratteri.
 */
public record ChunkingParams(int chunkSize, int overlap) {

    public static final int DEFAULT_CHUNK_SIZE = 1000;
    public static final int DEFAULT_OVERLAP    = 200;

    /** Costruttore compatto con validazione. */
    public ChunkingParams {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize deve essere > 0 (ricevuto: " + chunkSize + ")");
        }
        if (overlap < 0) {
            throw new IllegalArgumentException("overlap deve essere >= 0 (ricevuto: " + overlap + ")");
        }
        if (overlap >= chunkSize) {
            throw new IllegalArgumentException(
                    "overlap (" + overlap + ") deve essere < chunkSize (" + chunkSize + ")");
        }
    }

    public static ChunkingParams defaults() {
        return new ChunkingParams(DEFAULT_CHUNK_SIZE, DEFAULT_OVERLAP);
    }

    /** Avanzamento della finestra tra un chunk e il successivo. */
    public int step() {
        return chunkSize - overlap;
    }
}
