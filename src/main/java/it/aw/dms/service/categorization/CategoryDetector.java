package it.aw.dms.service.categorization;

import java.util.Map;

/**
 * Rilevatore di una categoria documentale.
 * <p>
 * Ogni implementazione sa dire quanto un testo somiglia alla propria categoria
 * e quali entità strutturate ne può estrarre. Nuove categorie si aggiungono
 * registrando un nuovo detector, senza toccare quelli esistenti.
 */
public interface CategoryDetector {

    /** Etichetta della categoria (es. "invoice"). */
    String category();

    /** Confidenza in [0,1] che il testo appartenga alla categoria. */
    double match(String text);

    /** Entità estratte dal testo, in ordine di dichiarazione; vuota se nessuna. */
    Map<String, String> extract(String text);
}
