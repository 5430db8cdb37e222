package it.aw.dms.service.llm;

import dev.langchain4j.data.message.ChatMessage;

import java.util.List;

/**
 * Provider di modelli linguistici. Un errore di chiamata è sempre una
 * {@link it.aw.dms.exception.ProviderCallException} che dichiara se è transitorio.
 */
public interface LlmProvider {

    /** Invia la conversazione al modello indicato e restituisce il testo della risposta. */
    String complete(List<ChatMessage> messages, String model);

    /** Identificativi dei modelli disponibili presso il provider. */
    List<String> listModels();
}
