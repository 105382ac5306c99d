package com.demo.coordination.service;

import com.demo.coordination.domain.LockResult;
import com.demo.coordination.domain.Responder;
import com.demo.coordination.domain.ResponderRef;
import com.demo.coordination.domain.RunRequest;
import com.demo.coordination.service.selection.SelectionResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Hands a thread over to the responder a moderator picked.
 *
 * Runs after the moderator's own run has completed and released its lock.
 * At most one follow-up run is started and it is never chained again.
 */
@Service
@Slf4j
public class ModeratorChainer {

    private final SelectionResolver selectionResolver;
    private final ThreadLockCoordinator lockCoordinator;
    private final RunLauncher runLauncher;
    private final MetricsService metricsService;

    public ModeratorChainer(
            SelectionResolver selectionResolver,
            ThreadLockCoordinator lockCoordinator,
            @Lazy RunLauncher runLauncher,
            MetricsService metricsService) {
        this.selectionResolver = selectionResolver;
        this.lockCoordinator = lockCoordinator;
        this.runLauncher = runLauncher;
        this.metricsService = metricsService;
    }

    /**
     * @param roomResponders active responders of the room; moderators among
     *                       them are never selected
     * @return id of the follow-up run, or empty when nothing was selected,
     *         the selection matched no responder, or the thread is busy
     */
    public Optional<String> maybeChain(
            String threadId,
            String roomId,
            String sourceMessageId,
            String moderatorId,
            String moderatorOutput,
            List<Responder> roomResponders) {

        Optional<ResponderRef> selection = selectionResolver.resolveSelection(moderatorOutput);
        if (selection.isEmpty()) {
            log.info("Moderator made no selection: threadId={}, moderatorId={}", threadId, moderatorId);
            return Optional.empty();
        }

        ResponderRef ref = selection.get();
        Optional<Responder> target = roomResponders.stream()
                .filter(Responder::isActive)
                .filter(responder -> !responder.isModerator())
                .filter(responder -> !responder.getId().equals(moderatorId))
                .filter(ref::matches)
                .findFirst();
        if (target.isEmpty()) {
            log.info("Moderator selection matched no responder: threadId={}, moderatorId={}, ref={}",
                    threadId, moderatorId, ref);
            return Optional.empty();
        }

        String targetId = target.get().getId();
        LockResult lock = lockCoordinator.transitionToResponder(threadId, moderatorId, targetId);
        if (!lock.isGranted()) {
            log.warn("Chain skipped, thread busy: threadId={}, targetId={}, holderId={}, kind={}",
                    threadId, targetId, lock.getHolderId(), lock.getKind());
            return Optional.empty();
        }

        RunRequest request = RunRequest.builder()
                .threadId(threadId)
                .roomId(roomId)
                .responderId(targetId)
                .sourceMessageId(sourceMessageId)
                .chainingAllowed(false)
                .build();
        try {
            String runId = runLauncher.launch(request);
            log.info("Moderator chained: threadId={}, moderatorId={}, targetId={}, runId={}",
                    threadId, moderatorId, targetId, runId);
            return Optional.of(runId);
        } catch (RuntimeException e) {
            log.error("Failed to launch chained run: threadId={}, targetId={}", threadId, targetId, e);
            metricsService.recordError(e.getClass().getSimpleName(), "ModeratorChainer");
            lockCoordinator.release(threadId, targetId);
            return Optional.empty();
        }
    }
}
