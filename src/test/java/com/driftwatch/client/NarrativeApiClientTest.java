package com.driftwatch.client;

import com.driftwatch.exception.NarrativeApiException;
import com.driftwatch.exception.NarrativeApiUnavailableException;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.test.StepVerifier;

import static com.github.tomakehurst.wiremock.client.WireMock.*;

class NarrativeApiClientTest {

    private static WireMockServer wireMock;

    private NarrativeApiClient client;

    @BeforeAll
    static void startWireMock() {
        wireMock = new WireMockServer(WireMockConfiguration.wireMockConfig().dynamicPort());
        wireMock.start();
    }

    @AfterAll
    static void stopWireMock() { wireMock.stop(); }

    @BeforeEach
    void setUp() {
        client = new NarrativeApiClient();
        ReflectionTestUtils.setField(client, "baseUrl", wireMock.baseUrl());
        ReflectionTestUtils.setField(client, "apiKey", "test-key");
        ReflectionTestUtils.setField(client, "model", "test-model");
        ReflectionTestUtils.setField(client, "temperature", 0.7);
        ReflectionTestUtils.setField(client, "maxTokens", 256);
        ReflectionTestUtils.setField(client, "timeoutSeconds", 2);
        client.init();
    }

    @AfterEach
    void resetStubs() { wireMock.resetAll(); }

    @Test
    void complete_returnsFirstChoiceContent() {
        wireMock.stubFor(post(urlEqualTo("/chat/completions"))
            .willReturn(aResponse()
                .withHeader("Content-Type", "application/json")
                .withBody("{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"  Mean shifted.  \"}}]}")));

        StepVerifier.create(client.complete("system", "report"))
            .expectNext("Mean shifted.")
            .verifyComplete();

        wireMock.verify(postRequestedFor(urlEqualTo("/chat/completions"))
            .withHeader("Authorization", equalTo("Bearer test-key"))
            .withRequestBody(matchingJsonPath("$.model", equalTo("test-model")))
            .withRequestBody(matchingJsonPath("$.max_tokens", equalTo("256")))
            .withRequestBody(matchingJsonPath("$.messages[1].content", equalTo("report"))));
    }

    @Test
    void complete_serverError_isUnavailable() {
        wireMock.stubFor(post(urlEqualTo("/chat/completions"))
            .willReturn(aResponse().withStatus(500).withBody("overloaded")));

        StepVerifier.create(client.complete("system", "report"))
            .expectError(NarrativeApiUnavailableException.class)
            .verify();
    }

    @Test
    void complete_clientError_isRejected() {
        wireMock.stubFor(post(urlEqualTo("/chat/completions"))
            .willReturn(aResponse().withStatus(401).withBody("bad key")));

        StepVerifier.create(client.complete("system", "report"))
            .expectErrorMatches(ex -> ex instanceof NarrativeApiException
                && ex.getMessage().contains("bad key"))
            .verify();
    }

    @Test
    void complete_missingContent_isRejected() {
        wireMock.stubFor(post(urlEqualTo("/chat/completions"))
            .willReturn(aResponse()
                .withHeader("Content-Type", "application/json")
                .withBody("{\"choices\":[]}")));

        StepVerifier.create(client.complete("system", "report"))
            .expectError(NarrativeApiException.class)
            .verify();
    }
}
