package com.demo.coordination.controller;

import com.demo.coordination.domain.QaStreamRequest;
import com.demo.coordination.domain.QaStreamResponse;
import com.demo.coordination.domain.RunTicket;
import com.demo.coordination.service.ThreadCoordinationService;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Starts and cancels responder runs. Progress is delivered through the run
 * row and the thread's Redis channel, not through this response.
 */
@Slf4j
@RestController
@RequestMapping("/api/qa")
@RequiredArgsConstructor
public class ThreadResponseController {

    private final ThreadCoordinationService coordinationService;

    /**
     * Start response generation
     * POST /api/qa/stream
     */
    @PostMapping("/stream")
    public ResponseEntity<QaStreamResponse> stream(@RequestBody QaStreamRequest request) {
        log.info("Response requested: roomId={}, threadId={}, responderId={}, messageId={}",
                request.getRoomId(), request.getThreadId(), request.getResponderId(), request.getUserMessageId());

        RunTicket ticket = coordinationService.startResponse(request.toRunRequest());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(QaStreamResponse.from(ticket));
    }

    /**
     * Cancel a run executing on this instance
     * POST /api/qa/cancel
     */
    @PostMapping("/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@RequestBody CancelRequest request) {
        boolean cancelled = coordinationService.cancelRun(request.getStreamingMessageId());

        Map<String, Object> response = new HashMap<>();
        response.put("streaming_message_id", request.getStreamingMessageId());
        response.put("cancelled", cancelled);
        return ResponseEntity.status(cancelled ? HttpStatus.ACCEPTED : HttpStatus.NOT_FOUND).body(response);
    }

    @Data
    public static class CancelRequest {
        @JsonProperty("streaming_message_id")
        private String streamingMessageId;
    }
}
