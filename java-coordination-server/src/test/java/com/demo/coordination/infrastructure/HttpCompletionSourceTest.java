package com.demo.coordination.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.demo.coordination.config.CoordinationProperties;
import com.demo.coordination.config.RestTemplateConfig;
import com.demo.coordination.domain.CompletionRequest;
import com.demo.coordination.domain.HistoryTurn;
import com.demo.coordination.exception.ProviderFailureException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class HttpCompletionSourceTest {

    private MockRestServiceServer server;
    private HttpCompletionSource source;

    @BeforeEach
    void setUp() {
        CoordinationProperties properties = new CoordinationProperties();
        RestTemplate restTemplate = new RestTemplateConfig().completionRestTemplate(properties);
        server = MockRestServiceServer.bindTo(restTemplate).build();
        source = new HttpCompletionSource(restTemplate, new ObjectMapper(), properties);
    }

    @Test
    void streamsAnsweringChunksUntilComplete() {
        String body = "{\"status\":\"answering\",\"chunk\":\"Hel\"}\n"
                + "{\"status\":\"answering\",\"chunk\":\"lo\"}\n"
                + "{\"status\":\"complete\"}\n";
        server.expect(requestTo("http://localhost:8000/api/qa/professional-stream"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.question_text").value("What is Kafka?"))
                .andExpect(jsonPath("$.ai_info.name").value("Data Scientist"))
                .andRespond(withSuccess(body, MediaType.APPLICATION_NDJSON));

        List<String> increments = new ArrayList<>();
        try (CompletionStream stream = source.generate(request(false))) {
            stream.forEachRemaining(increments::add);
        }

        assertThat(increments).containsExactly("Hel", "lo");
        server.verify();
    }

    @Test
    void streamEndpointErrorIsAProviderFailure() {
        server.expect(requestTo("http://localhost:8000/api/qa/professional-stream"))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY).body("upstream down"));

        CompletionStream stream = source.generate(request(false));

        assertThatThrownBy(stream::hasNext)
                .isInstanceOf(ProviderFailureException.class)
                .hasMessageContaining("502");
        assertThat(stream.hasNext()).isFalse();
    }

    @Test
    void moderatorGetsWholeSyncAnswerAsOneIncrement() {
        String body = "{\"messages\":[{\"content\":[{\"text\":\"Forward to AI mentor: **Data Scientist**\"}]}]}";
        server.expect(requestTo("http://localhost:8000/api/qa/professional-sync"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        List<String> increments = new ArrayList<>();
        try (CompletionStream stream = source.generate(request(true))) {
            stream.forEachRemaining(increments::add);
        }

        assertThat(increments).containsExactly("Forward to AI mentor: **Data Scientist**");
    }

    @Test
    void syncAnswerWithoutTextIsAProviderFailure() {
        server.expect(requestTo("http://localhost:8000/api/qa/professional-sync"))
                .andRespond(withSuccess("{\"messages\":[]}", MediaType.APPLICATION_JSON));

        CompletionStream stream = source.generate(request(true));

        assertThatThrownBy(stream::hasNext)
                .isInstanceOf(ProviderFailureException.class)
                .hasMessageContaining("no text");
    }

    @Test
    void nothingIsSentUntilTheFirstRead() {
        server.expect(ExpectedCount.never(), requestTo("http://localhost:8000/api/qa/professional-stream"));

        CompletionStream stream = source.generate(request(false));
        stream.close();

        assertThat(stream.hasNext()).isFalse();
        server.verify();
    }

    @Test
    void payloadFallsBackToDefaultsForMissingFields() {
        CompletionRequest request = request(false);
        request.setModel(null);
        request.setHistory(null);
        request.getResponder().setDescription(null);

        Map<String, Object> payload = source.buildPayload(request);

        assertThat(payload).containsEntry("model", "gemini-2.5-flash")
                .containsEntry("top_k", 10)
                .containsEntry("embedding_model", "embedding-001")
                .containsEntry("room_id", "R1")
                .containsEntry("histories_chat", List.of());
        @SuppressWarnings("unchecked")
        Map<String, Object> aiInfo = (Map<String, Object>) payload.get("ai_info");
        assertThat(aiInfo).containsEntry("description", "")
                .containsEntry("system_prompt", "Answer like a data scientist.");
    }

    private static CompletionRequest request(boolean moderator) {
        return CompletionRequest.builder()
                .runId("run-1")
                .roomId("R1")
                .questionText("What is Kafka?")
                .model("gemini-2.5-pro")
                .moderator(moderator)
                .history(List.of(new HistoryTurn("Hi", "Hello")))
                .responder(CompletionRequest.ResponderProfile.builder()
                        .id("ds")
                        .name("Data Scientist")
                        .description("Statistics")
                        .personality("calm")
                        .instructions("Answer like a data scientist.")
                        .build())
                .build();
    }
}
