package com.driftwatch.client;

import com.driftwatch.exception.NarrativeApiException;
import com.driftwatch.exception.NarrativeApiUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Client for an OpenAI-compatible {@code /chat/completions} endpoint used to turn drift
 * reports into prose.
 */
@Slf4j
@Component
public class NarrativeApiClient {

    @Value("${narrative.api.base-url}")
    private String baseUrl;

    @Value("${narrative.api.api-key:}")
    private String apiKey;

    @Value("${narrative.api.model:openai/gpt-oss-20b}")
    private String model;

    @Value("${narrative.api.temperature:0.7}")
    private double temperature;

    @Value("${narrative.api.max-tokens:1024}")
    private int maxTokens;

    @Value("${narrative.api.timeout-seconds:20}")
    private int timeoutSeconds;

    private WebClient webClient;
    private final ObjectMapper mapper = new ObjectMapper();

    @PostConstruct
    void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));
        WebClient.Builder builder = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader(HttpHeaders.CONTENT_TYPE, "application/json");
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        this.webClient = builder.build();
        log.info("NarrativeApiClient initialised → {} | model={}", baseUrl, model);
    }

    public Mono<String> complete(String systemPrompt, String userPrompt) {
        return webClient.post().uri("/chat/completions")
            .bodyValue(buildBody(systemPrompt, userPrompt))
            .retrieve()
            .onStatus(HttpStatusCode::is4xxClientError, resp ->
                resp.bodyToMono(String.class).map(b -> new NarrativeApiException("Narrative API rejected request (4xx): " + b)))
            .onStatus(HttpStatusCode::is5xxServerError, resp ->
                resp.bodyToMono(String.class).map(b -> new NarrativeApiUnavailableException(new RuntimeException(b))))
            .bodyToMono(JsonNode.class)
            .map(this::toContent)
            .retryWhen(Retry.backoff(2, Duration.ofMillis(300))
                .filter(ex -> ex instanceof WebClientRequestException)
                .onRetryExhaustedThrow((spec, sig) -> new NarrativeApiUnavailableException(sig.failure())))
            .onErrorMap(WebClientRequestException.class, NarrativeApiUnavailableException::new);
    }

    private String toContent(JsonNode json) {
        JsonNode content = json == null ? null : json.path("choices").path(0).path("message").path("content");
        if (content == null || content.isMissingNode() || content.isNull() || content.asText().isBlank()) {
            throw new NarrativeApiException("Narrative API response missing message content: " + json);
        }
        return content.asText().trim();
    }

    private ObjectNode buildBody(String systemPrompt, String userPrompt) {
        ObjectNode node = mapper.createObjectNode();
        node.put("model", model);
        node.put("temperature", temperature);
        node.put("max_tokens", maxTokens);
        ArrayNode messages = node.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemPrompt);
        messages.addObject().put("role", "user").put("content", userPrompt);
        return node;
    }
}
