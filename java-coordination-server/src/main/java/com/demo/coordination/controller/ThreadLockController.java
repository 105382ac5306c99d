package com.demo.coordination.controller;

import com.demo.coordination.domain.LockStatusResponse;
import com.demo.coordination.service.ThreadCoordinationService;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Client-side lock handling: a sender takes the PRODUCER lock while composing
 * and can check who holds a thread.
 */
@RestController
@RequestMapping("/api/threads/{threadId}/lock")
@RequiredArgsConstructor
public class ThreadLockController {

    private final ThreadCoordinationService coordinationService;

    @PostMapping
    public LockStatusResponse acquire(@PathVariable String threadId, @RequestBody AcquireRequest request) {
        return coordinationService.acquireProducerLock(threadId, request.getParticipantId());
    }

    @GetMapping
    public LockStatusResponse status(@PathVariable String threadId) {
        return coordinationService.lockStatus(threadId);
    }

    @DeleteMapping
    public ResponseEntity<Void> release(@PathVariable String threadId,
                                        @RequestParam(name = "holder_id", required = false) String holderId) {
        coordinationService.releaseLock(threadId, holderId);
        return ResponseEntity.noContent().build();
    }

    @Data
    public static class AcquireRequest {
        @JsonProperty("participant_id")
        private String participantId;
    }
}
