package com.demo.coordination.infrastructure;

import com.demo.coordination.config.CoordinationProperties;
import com.demo.coordination.domain.CompletionRequest;
import com.demo.coordination.exception.ProviderFailureException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpRequest;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Completion source backed by the QA service.
 *
 * Standard responders stream NDJSON from the professional-stream endpoint.
 * Moderators call professional-sync and get their whole answer as a single
 * increment.
 */
@Component
@Slf4j
public class HttpCompletionSource implements CompletionSource {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final CoordinationProperties.Completion config;

    public HttpCompletionSource(RestTemplate completionRestTemplate,
                                ObjectMapper objectMapper,
                                CoordinationProperties properties) {
        this.restTemplate = completionRestTemplate;
        this.objectMapper = objectMapper;
        this.config = properties.getCompletion();
    }

    /**
     * Returns without contacting the QA service; the request goes out on the
     * stream's first read, and closing the stream aborts it at any point.
     */
    @Override
    public CompletionStream generate(CompletionRequest request) {
        if (request.isModerator()) {
            return new SyncCompletionStream("QA sync call", () -> callSync(request));
        }
        return new NdjsonCompletionStream(() -> openStream(request), objectMapper);
    }

    private String callSync(CompletionRequest request) {
        String url = config.getBaseUrl() + config.getSyncPath();

        JsonNode body = restTemplate.postForObject(url, buildPayload(request), JsonNode.class);
        String text = body == null ? null : body.path("messages").path(0).path("content").path(0).path("text").asText(null);

        if (text == null) {
            throw new ProviderFailureException("QA sync response carried no text");
        }
        log.debug("Sync completion received: runId={}, length={}", request.getRunId(), text.length());
        return text;
    }

    private ClientHttpResponse openStream(CompletionRequest request) throws IOException {
        URI uri = URI.create(config.getBaseUrl() + config.getStreamPath());

        ClientHttpRequest httpRequest = restTemplate.getRequestFactory().createRequest(uri, HttpMethod.POST);
        httpRequest.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        httpRequest.getHeaders().setAccept(List.of(MediaType.APPLICATION_NDJSON, MediaType.APPLICATION_JSON));
        objectMapper.writeValue(httpRequest.getBody(), buildPayload(request));

        ClientHttpResponse response = httpRequest.execute();
        try {
            HttpStatusCode status = response.getStatusCode();
            if (!status.is2xxSuccessful()) {
                String error = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
                log.error("QA stream endpoint error: runId={}, status={}, body={}",
                        request.getRunId(), status, error);
                response.close();
                throw new ProviderFailureException("QA stream returned " + status);
            }
        } catch (IOException e) {
            response.close();
            throw e;
        }

        log.info("Opened completion stream: runId={}, responder={}",
                request.getRunId(), request.getResponder().getName());
        return response;
    }

    Map<String, Object> buildPayload(CompletionRequest request) {
        CompletionRequest.ResponderProfile profile = request.getResponder();

        Map<String, Object> aiInfo = new HashMap<>();
        aiInfo.put("id", profile.getId());
        aiInfo.put("name", profile.getName());
        aiInfo.put("description", profile.getDescription() != null ? profile.getDescription() : "");
        aiInfo.put("personality", profile.getPersonality() != null ? profile.getPersonality() : "");
        aiInfo.put("system_prompt", profile.getInstructions());

        Map<String, Object> payload = new HashMap<>();
        payload.put("question_text", request.getQuestionText());
        payload.put("model", request.getModel() != null ? request.getModel() : config.getDefaultModel());
        payload.put("ai_info", aiInfo);
        payload.put("room_id", request.getRoomId());
        payload.put("top_k", config.getTopK());
        payload.put("histories_chat", request.getHistory() != null ? request.getHistory() : List.of());
        payload.put("embedding_model", config.getEmbeddingModel());
        return payload;
    }
}
