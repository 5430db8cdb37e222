package it.aw.dms.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import it.aw.dms.exception.DmsException;
import it.aw.dms.exception.ErrorKind;
import it.aw.dms.exception.ProviderCallException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link LlmProvider} per l'API OpenRouter (formato chat completions compatibile OpenAI).
 * <p>
 * Classificazione degli errori HTTP: 408, 429 e 5xx sono transitori, come timeout ed
 * errori di connessione; gli altri status (400, 401, 403, 404...) non lo sono, come
 * una risposta 200 con corpo non decodificabile.
 */
public class OpenRouterLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenRouterLlmProvider.class);

    static final String REFERER = "https://github.com/rmoriz/dms";
    static final String TITLE = "DMS - Document Management System";
    private static final double TEMPERATURE = 0.7;
    private static final int MAX_TOKENS = 2000;

    private final WebClient webClient;
    private final String apiKey;
    private final Duration timeout;

    public OpenRouterLlmProvider(WebClient.Builder builder, String baseUrl, String apiKey, Duration timeout) {
        this.apiKey = apiKey;
        this.timeout = timeout;
        this.webClient = builder
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader("HTTP-Referer", REFERER)
                .defaultHeader("X-Title", TITLE)
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .build();
    }

    @Override
    public String complete(List<ChatMessage> messages, String model) {
        requireApiKey();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", toWire(messages));
        body.put("temperature", TEMPERATURE);
        body.put("max_tokens", MAX_TOKENS);

        log.debug("Chiamata OpenRouter: modello={}, messaggi={}", model, messages.size());
        JsonNode response = exchange(model, () -> webClient.post()
                .uri("/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(timeout)
                .block());

        if (response == null) {
            throw ProviderCallException.transientFailure(model, null, "risposta vuota da " + model);
        }
        if (response.hasNonNull("error")) {
            String message = response.path("error").path("message").asText("errore sconosciuto");
            throw ProviderCallException.permanentFailure(model, null, model + ": " + message);
        }
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull() || content.asText().isBlank()) {
            throw ProviderCallException.permanentFailure(model, null, "risposta senza contenuto da " + model);
        }
        JsonNode usage = response.path("usage");
        if (!usage.isMissingNode()) {
            log.debug("Token usati da {}: prompt={}, completion={}", model,
                    usage.path("prompt_tokens").asInt(), usage.path("completion_tokens").asInt());
        }
        return content.asText().trim();
    }

    @Override
    public List<String> listModels() {
        requireApiKey();
        JsonNode response = exchange("models", () -> webClient.get()
                .uri("/models")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(timeout)
                .block());
        List<String> ids = new ArrayList<>();
        if (response != null) {
            for (JsonNode m : response.path("data")) {
                String id = m.path("id").asText(null);
                if (id != null) ids.add(id);
            }
        }
        return ids;
    }

    static boolean isTransientStatus(int status) {
        return status == 408 || status == 429 || status >= 500;
    }

    private JsonNode exchange(String model, Supplier<JsonNode> call) {
        try {
            return call.get();
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            String message = model + ": HTTP " + status + (status == 404 ? " (modello non disponibile)" : "");
            throw new ProviderCallException(model, status, isTransientStatus(status), message, e);
        } catch (WebClientRequestException e) {
            throw new ProviderCallException(model, null, true, model + ": errore di connessione (" + e.getMessage() + ")", e);
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                throw new ProviderCallException(model, null, true, model + ": timeout dopo " + timeout.toSeconds() + "s", e);
            }
            if (e instanceof CodecException || e instanceof WebClientException) {
                throw new ProviderCallException(model, null, false, model + ": risposta non leggibile (" + e.getMessage() + ")", e);
            }
            throw e;
        }
    }

    private void requireApiKey() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new DmsException(ErrorKind.CONFIGURATION, "API key OpenRouter non configurata",
                    "Impostare dms.openrouter.api-key o la variabile OPENROUTER_API_KEY.");
        }
    }

    private static List<Map<String, String>> toWire(List<ChatMessage> messages) {
        return messages.stream()
                .map(m -> Map.of("role", roleOf(m), "content", textOf(m)))
                .collect(Collectors.toList());
    }

    private static String roleOf(ChatMessage message) {
        if (message instanceof SystemMessage) return "system";
        if (message instanceof AiMessage) return "assistant";
        return "user";
    }

    private static String textOf(ChatMessage message) {
        if (message instanceof SystemMessage s) return s.text();
        if (message instanceof AiMessage a) return a.text();
        if (message instanceof UserMessage u) return u.singleText();
        throw new IllegalArgumentException("tipo di messaggio non supportato: " + message.type());
    }
}
