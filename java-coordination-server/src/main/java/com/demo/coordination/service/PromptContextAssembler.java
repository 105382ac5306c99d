package com.demo.coordination.service;

import com.demo.coordination.config.CoordinationProperties;
import com.demo.coordination.domain.CompletionRequest;
import com.demo.coordination.domain.HistoryTurn;
import com.demo.coordination.domain.Message;
import com.demo.coordination.domain.Responder;
import com.demo.coordination.domain.StreamingRun;
import com.demo.coordination.exception.NotFoundException;
import com.demo.coordination.infrastructure.MessageStore;
import com.demo.coordination.infrastructure.ResponderDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the completion request of a run from the responder configuration,
 * the source message and the recent thread history.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PromptContextAssembler {

    static final String DEFAULT_INSTRUCTIONS = "You are a helpful AI assistant.";
    static final String DEFAULT_NAME = "Assistant";
    static final String ROOM_SECTION_HEADER = "## Available AI Mentors in this room:";

    private final ResponderDirectory responderDirectory;
    private final MessageStore messageStore;
    private final CoordinationProperties properties;

    public RunContext assemble(StreamingRun run) {
        Responder responder = responderDirectory.findResponder(run.getResponderId())
                .orElseThrow(() -> new NotFoundException("Responder not found: " + run.getResponderId()));
        Message source = messageStore.findById(run.getSourceMessageId())
                .orElseThrow(() -> new NotFoundException("Message not found: " + run.getSourceMessageId()));

        List<Responder> roomResponders = run.getRoomId() != null
                ? responderDirectory.findActiveRoomResponders(run.getRoomId())
                : List.of();

        String instructions = responder.getSystemPrompt() != null && !responder.getSystemPrompt().isBlank()
                ? responder.getSystemPrompt()
                : DEFAULT_INSTRUCTIONS;
        if (responder.isModerator()) {
            instructions = instructions + describeRoom(roomResponders);
        }

        List<Message> recent = messageStore.findRecent(run.getThreadId(), properties.getStream().getHistoryLimit());

        CompletionRequest request = CompletionRequest.builder()
                .runId(run.getId())
                .roomId(run.getRoomId())
                .questionText(source.getContent())
                .model(responder.getModel() != null ? responder.getModel()
                        : properties.getCompletion().getDefaultModel())
                .responder(CompletionRequest.ResponderProfile.builder()
                        .id(responder.getId())
                        .name(responder.getName() != null ? responder.getName() : DEFAULT_NAME)
                        .description(nullToEmpty(responder.getDescription()))
                        .personality(nullToEmpty(responder.getPersonality()))
                        .instructions(instructions)
                        .build())
                .history(toHistory(recent))
                .moderator(responder.isModerator())
                .build();

        log.debug("Context assembled: runId={}, responderId={}, moderator={}, historyTurns={}",
                run.getId(), responder.getId(), responder.isModerator(), request.getHistory().size());

        return RunContext.builder()
                .responder(responder)
                .roomResponders(roomResponders)
                .completionRequest(request)
                .build();
    }

    /**
     * Pairs each human message with every responder reply to it that appears
     * later in the window. Input and output are oldest first.
     */
    static List<HistoryTurn> toHistory(List<Message> messages) {
        List<HistoryTurn> history = new ArrayList<>();
        for (int i = 0; i < messages.size(); i++) {
            Message question = messages.get(i);
            if (question.getSenderKind() != Message.SenderKind.HUMAN) {
                continue;
            }
            for (int j = i + 1; j < messages.size(); j++) {
                Message reply = messages.get(j);
                if (reply.getSenderKind() == Message.SenderKind.RESPONDER
                        && question.getId().equals(reply.getInReplyTo())) {
                    history.add(new HistoryTurn(question.getContent(), reply.getContent()));
                }
            }
        }
        return history;
    }

    /**
     * Other selectable responders of the room, appended to a moderator's instructions.
     */
    static String describeRoom(List<Responder> roomResponders) {
        List<Responder> selectable = roomResponders.stream()
                .filter(responder -> !responder.isModerator())
                .collect(Collectors.toList());
        if (selectable.isEmpty()) {
            return "";
        }

        StringBuilder section = new StringBuilder("\n\n").append(ROOM_SECTION_HEADER);
        for (Responder responder : selectable) {
            section.append("\n- AI ID: ").append(responder.getId())
                    .append(", Name: ").append(responder.getName());
            if (responder.getDescription() != null && !responder.getDescription().isBlank()) {
                section.append(". Description: ").append(responder.getDescription());
            }
            if (responder.getPersonality() != null && !responder.getPersonality().isBlank()) {
                section.append(". Personality: ").append(responder.getPersonality());
            }
            section.append(".");
        }
        return section.toString();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
