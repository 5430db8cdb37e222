package it.aw.dms.service.rag;

/**
 * @param contextBudget numero massimo di caratteri di contesto inviati al modello
 * @param excerptLength lunghezza dell'estratto riportato in ogni fonte
 */
public record AnswerSettings(int contextBudget, int excerptLength) {

    public AnswerSettings {
        if (contextBudget <= 0) {
            throw new IllegalArgumentException("contextBudget deve essere > 0 (ricevuto: " + contextBudget + ")");
        }
        if (excerptLength <= 0) {
            throw new IllegalArgumentException("excerptLength deve essere > 0 (ricevuto: " + excerptLength + ")");
        }
    }
}
