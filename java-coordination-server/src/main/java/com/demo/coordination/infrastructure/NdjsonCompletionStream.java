package com.demo.coordination.infrastructure;

import com.demo.coordination.exception.ProviderFailureException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.ClientHttpResponse;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.NoSuchElementException;

/**
 * Reads QA stream lines lazily. The request is sent on the first
 * {@link #hasNext()}, so the stream can be handed to a canceller before
 * anything blocks.
 *
 * {"status":"answering","chunk":"..."} yields an increment,
 * {"status":"complete"} ends the stream, {"status":"error"} fails it.
 * Lines that are not JSON are skipped.
 */
@Slf4j
class NdjsonCompletionStream extends AbortableHttpStream {

    private final Exchange<ClientHttpResponse> opener;
    private final ObjectMapper objectMapper;

    private BufferedReader reader;
    private String pending;
    private boolean finished;

    NdjsonCompletionStream(Exchange<ClientHttpResponse> opener, ObjectMapper objectMapper) {
        this.opener = opener;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (finished || isClosed()) {
            return false;
        }
        try {
            pending = readNextChunk();
        } catch (RuntimeException e) {
            finished = true;
            throw e;
        }
        return pending != null;
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        String chunk = pending;
        pending = null;
        return chunk;
    }

    private String readNextChunk() {
        BufferedReader in = reader();
        String line;
        while ((line = await("QA stream read", in::readLine)) != null) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }

            JsonNode node;
            try {
                node = objectMapper.readTree(trimmed);
            } catch (JsonProcessingException e) {
                log.warn("Skipping undecodable stream line: {}", e.getOriginalMessage());
                continue;
            }

            String status = node.path("status").asText("");
            switch (status) {
                case "answering":
                    String chunk = node.path("chunk").asText("");
                    if (!chunk.isEmpty()) {
                        return chunk;
                    }
                    break;
                case "complete":
                    log.debug("Completion stream reported complete");
                    finish();
                    return null;
                case "error":
                    finish();
                    throw new ProviderFailureException("QA stream error: " + node.path("message").asText(trimmed));
                default:
                    log.debug("Ignoring stream line with status={}", status);
            }
        }
        finish();
        return null;
    }

    private BufferedReader reader() {
        if (reader == null) {
            InputStream body = await("QA stream", () -> track(opener.run().getBody()));
            reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8));
        }
        return reader;
    }

    // Closes the body without draining whatever follows the last line
    private void finish() {
        finished = true;
        close();
    }
}
