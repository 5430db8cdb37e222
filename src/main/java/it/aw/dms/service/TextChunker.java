package it.aw.dms.service;

import it.aw.dms.model.ChunkingParams;
import it.aw.dms.model.DocumentContent;
import it.aw.dms.model.TextChunk;
import it.aw.dms.service.extraction.PdfPageParser.PagedText;

import java.util.ArrayList;
import java.util.List;

/**
 * Divide un testo in chunk a finestra fissa con sovrapposizione.
 * <p>
 * Ogni chunk è lungo {@code chunkSize} caratteri tranne l'ultimo, che può essere più corto;
 * due chunk consecutivi condividono esattamente {@code overlap} caratteri, riprodotti
 * identici in coda al primo e in testa al secondo. Un testo più corto della finestra
 * produce un solo chunk, un testo vuoto nessuno.
 * <p>
 * La pagina di un chunk è quella che contiene il suo primo carattere.
 * Funzione pura: stesso input, stesso output, nessun I/O.
 */
public final class TextChunker {

    private TextChunker() {}

    public static List<TextChunk> chunk(String documentId, DocumentContent content, ChunkingParams params) {
        return chunk(documentId, content.text(), content.pageOffsets(), params);
    }

    public static List<TextChunk> chunk(String documentId, String text, ChunkingParams params) {
        return chunk(documentId, text, List.of(0), params);
    }

    /**
     * @param pageOffsets offset di inizio di ogni pagina nel testo (vuota = tutto a pagina 1)
     */
    public static List<TextChunk> chunk(String documentId, String text, List<Integer> pageOffsets,
                                        ChunkingParams params) {
        List<TextChunk> chunks = new ArrayList<>();
        if (text == null || text.isEmpty()) return chunks;

        int length = text.length();
        int start = 0;
        int index = 0;
        while (true) {
            int end = Math.min(start + params.chunkSize(), length);
            chunks.add(new TextChunk(
                    TextChunk.idFor(documentId, index),
                    documentId,
                    text.substring(start, end),
                    PagedText.pageAt(start, pageOffsets),
                    index));
            if (end >= length) break;
            start = end - params.overlap();
            index++;
        }
        return chunks;
    }

    /**
     * Ricostruisce il testo originale da una sequenza di chunk prodotti con lo stesso overlap,
     * scartando la parte sovrapposta di ogni chunk dopo il primo.
     */
    public static String reassemble(List<TextChunk> chunks, int overlap) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < chunks.size(); i++) {
            String content = chunks.get(i).content();
            sb.append(i == 0 ? content : content.substring(Math.min(overlap, content.length())));
        }
        return sb.toString();
    }
}
