package com.demo.coordination.service;

import com.demo.coordination.domain.LockResult;
import com.demo.coordination.domain.LockStatusResponse;
import com.demo.coordination.domain.Message;
import com.demo.coordination.domain.Responder;
import com.demo.coordination.domain.RunRequest;
import com.demo.coordination.domain.RunTicket;
import com.demo.coordination.exception.NotFoundException;
import com.demo.coordination.exception.StoreFailureException;
import com.demo.coordination.infrastructure.MessageStore;
import com.demo.coordination.infrastructure.ResponderDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for HTTP callers: validates a response request, takes the
 * thread lock for the responder and starts the background run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ThreadCoordinationService {

    private final ThreadLockCoordinator lockCoordinator;
    private final ResponseOrchestrator orchestrator;
    private final MessageStore messageStore;
    private final ResponderDirectory responderDirectory;

    /**
     * @throws IllegalArgumentException if an identifier is missing
     * @throws NotFoundException if the source message or the responder does not exist
     * @throws com.demo.coordination.exception.LockConflictException if the thread is busy
     */
    public RunTicket startResponse(RunRequest request) {
        requireText(request.getRoomId(), "room_id");
        requireText(request.getThreadId(), "thread_id");
        requireText(request.getResponderId(), "ai_id");
        requireText(request.getSourceMessageId(), "user_message_id");

        Message source = messageStore.findById(request.getSourceMessageId())
                .orElseThrow(() -> new NotFoundException("User message not found: " + request.getSourceMessageId()));
        Responder responder = responderDirectory.findResponder(request.getResponderId())
                .filter(Responder::isActive)
                .orElseThrow(() -> new NotFoundException("Responder not found: " + request.getResponderId()));

        LockResult lock = lockCoordinator.transitionToResponder(
                request.getThreadId(), source.getSenderId(), responder.getId());
        if (!lock.isGranted()) {
            throw lock.toConflictException(request.getThreadId());
        }

        try {
            String runId = orchestrator.launch(request);
            log.info("Response started: threadId={}, responderId={}, runId={}",
                    request.getThreadId(), responder.getId(), runId);
            return RunTicket.processing(runId);
        } catch (RuntimeException e) {
            log.error("Failed to start response: threadId={}, responderId={}",
                    request.getThreadId(), responder.getId(), e);
            try {
                lockCoordinator.release(request.getThreadId(), responder.getId());
            } catch (StoreFailureException releaseError) {
                e.addSuppressed(releaseError);
            }
            throw e;
        }
    }

    /**
     * Client pre-acquisition before sending a message.
     */
    public LockStatusResponse acquireProducerLock(String threadId, String participantId) {
        requireText(threadId, "thread_id");
        requireText(participantId, "participant_id");

        LockResult result = lockCoordinator.acquireProducer(threadId, participantId);
        if (!result.isGranted()) {
            throw result.toConflictException(threadId);
        }
        return LockStatusResponse.of(result.getLock());
    }

    public LockStatusResponse lockStatus(String threadId) {
        return lockCoordinator.inspect(threadId)
                .map(LockStatusResponse::of)
                .orElseGet(() -> LockStatusResponse.unlocked(threadId));
    }

    public void releaseLock(String threadId, String holderId) {
        requireText(holderId, "holder_id");
        lockCoordinator.release(threadId, holderId);
    }

    /**
     * @return false if the run is not executing on this instance
     */
    public boolean cancelRun(String runId) {
        requireText(runId, "streaming_message_id");
        return orchestrator.cancel(runId);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}
