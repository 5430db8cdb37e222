package it.aw.dms.service.llm;

import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import it.aw.dms.exception.DmsException;
import it.aw.dms.exception.ErrorKind;
import it.aw.dms.exception.ProviderCallException;
import it.aw.dms.exception.ProviderExhaustedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class OpenRouterLlmProviderTest {

    private static final String BASE_URL = "https://openrouter.test/api/v1";

    private final List<ClientRequest> requests = new ArrayList<>();

    private OpenRouterLlmProvider provider(ExchangeFunction exchange, String apiKey) {
        ExchangeFunction recording = request -> {
            requests.add(request);
            return exchange.exchange(request);
        };
        return new OpenRouterLlmProvider(WebClient.builder().exchangeFunction(recording), BASE_URL, apiKey,
                Duration.ofMillis(200));
    }

    private static ExchangeFunction respond(HttpStatus status, String json) {
        return request -> Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, "application/json")
                .body(json)
                .build());
    }

    @Test
    @DisplayName("La risposta chat completions viene letta da choices[0].message.content")
    void complete_shouldReturnMessageContent() {
        OpenRouterLlmProvider provider = provider(respond(HttpStatus.OK, """
                {"choices":[{"message":{"role":"assistant","content":"  Die Rechnung beträgt 84,20 EUR. "}}],
                 "usage":{"prompt_tokens":120,"completion_tokens":12}}
                """), "sk-test");

        String answer = provider.complete(
                List.of(SystemMessage.from("Kontext"), UserMessage.from("Wie hoch?")), "anthropic/claude-3-sonnet");

        assertEquals("Die Rechnung beträgt 84,20 EUR.", answer);
        ClientRequest request = requests.get(0);
        assertEquals(HttpMethod.POST, request.method());
        assertEquals("/api/v1/chat/completions", request.url().getPath());
        assertEquals("Bearer sk-test", request.headers().getFirst(HttpHeaders.AUTHORIZATION));
        assertEquals(OpenRouterLlmProvider.REFERER, request.headers().getFirst("HTTP-Referer"));
        assertEquals(OpenRouterLlmProvider.TITLE, request.headers().getFirst("X-Title"));
    }

    @Test
    @DisplayName("429 e 5xx sono errori transitori, 404 e 401 no")
    void complete_shouldClassifyHttpStatus() {
        ProviderCallException rateLimited = assertThrows(ProviderCallException.class, () ->
                provider(respond(HttpStatus.TOO_MANY_REQUESTS, "{}"), "k").complete(List.of(UserMessage.from("x")), "m"));
        ProviderCallException unavailable = assertThrows(ProviderCallException.class, () ->
                provider(respond(HttpStatus.SERVICE_UNAVAILABLE, "{}"), "k").complete(List.of(UserMessage.from("x")), "m"));
        ProviderCallException notFound = assertThrows(ProviderCallException.class, () ->
                provider(respond(HttpStatus.NOT_FOUND, "{}"), "k").complete(List.of(UserMessage.from("x")), "m"));
        ProviderCallException unauthorized = assertThrows(ProviderCallException.class, () ->
                provider(respond(HttpStatus.UNAUTHORIZED, "{}"), "k").complete(List.of(UserMessage.from("x")), "m"));

        assertTrue(rateLimited.isTransient());
        assertEquals(429, rateLimited.getStatusCode());
        assertTrue(unavailable.isTransient());
        assertFalse(notFound.isTransient());
        assertEquals("m", notFound.getModel());
        assertFalse(unauthorized.isTransient());
    }

    @Test
    @DisplayName("Timeout ed errori di connessione sono transitori")
    void complete_shouldTreatTimeoutAndConnectionErrorsAsTransient() {
        ProviderCallException timeout = assertThrows(ProviderCallException.class, () ->
                provider(request -> Mono.never(), "k").complete(List.of(UserMessage.from("x")), "m"));
        ProviderCallException refused = assertThrows(ProviderCallException.class, () ->
                provider(request -> Mono.error(new WebClientRequestException(new ConnectException("refused"),
                        HttpMethod.POST, URI.create(BASE_URL), new HttpHeaders())), "k")
                        .complete(List.of(UserMessage.from("x")), "m"));

        assertTrue(timeout.isTransient());
        assertNull(timeout.getStatusCode());
        assertTrue(refused.isTransient());
    }

    @Test
    @DisplayName("Una risposta senza contenuto non è transitoria")
    void complete_shouldRejectEmptyContent() {
        ProviderCallException e = assertThrows(ProviderCallException.class, () ->
                provider(respond(HttpStatus.OK, "{\"choices\":[]}"), "k").complete(List.of(UserMessage.from("x")), "m"));

        assertFalse(e.isTransient());
    }

    @Test
    @DisplayName("Un corpo 200 non decodificabile è un errore non transitorio del modello")
    void complete_shouldReportUndecodableBodyAsProviderFailure() {
        ProviderCallException e = assertThrows(ProviderCallException.class, () ->
                provider(respond(HttpStatus.OK, "{not json"), "k").complete(List.of(UserMessage.from("x")), "m"));

        assertFalse(e.isTransient());
        assertEquals("m", e.getModel());
        assertNull(e.getStatusCode());
    }

    @Test
    @DisplayName("Dopo un corpo non decodificabile la catena passa al modello successivo")
    void complete_shouldLetChainFallBackAfterUndecodableBody() {
        AtomicInteger calls = new AtomicInteger();
        ExchangeFunction exchange = request -> calls.getAndIncrement() == 0
                ? respond(HttpStatus.OK, "{not json").exchange(request)
                : respond(HttpStatus.OK, "{\"choices\":[{\"message\":{\"content\":\"ok\"}}]}").exchange(request);
        ProviderChainSettings settings = new ProviderChainSettings("model-a", List.of("model-b"), 0,
                Duration.ofMillis(1), Duration.ofMillis(1));
        ProviderFallbackChain chain = new ProviderFallbackChain(provider(exchange, "k"), settings, delay -> { });

        Completion completion = chain.complete(List.of(UserMessage.from("x")), null);

        assertEquals("model-b", completion.model());
        assertEquals("ok", completion.text());
        assertEquals(2, requests.size());
        assertEquals(List.of("model-a"), completion.failedAttempts().stream()
                .map(ProviderExhaustedException.ModelAttempt::model).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Senza API key la chiamata fallisce come errore di configurazione")
    void complete_shouldRequireApiKey() {
        DmsException e = assertThrows(DmsException.class, () ->
                provider(respond(HttpStatus.OK, "{}"), " ").complete(List.of(UserMessage.from("x")), "m"));

        assertEquals(ErrorKind.CONFIGURATION, e.getKind());
        assertTrue(requests.isEmpty());
    }

    @Test
    @DisplayName("L'elenco modelli legge gli id da data[]")
    void listModels_shouldReturnModelIds() {
        OpenRouterLlmProvider provider = provider(respond(HttpStatus.OK, """
                {"data":[{"id":"anthropic/claude-3-sonnet"},{"id":"openai/gpt-4"}]}
                """), "k");

        assertEquals(List.of("anthropic/claude-3-sonnet", "openai/gpt-4"), provider.listModels());
        assertEquals("/api/v1/models", requests.get(0).url().getPath());
        assertEquals(HttpMethod.GET, requests.get(0).method());
    }
}
