package com.demo.coordination.service;

import com.demo.coordination.domain.CompletionRequest;
import com.demo.coordination.domain.Responder;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Inputs of one run, read once before generation starts.
 */
@Value
@Builder
public class RunContext {
    Responder responder;

    /** Active responders of the room, moderators included. */
    List<Responder> roomResponders;

    CompletionRequest completionRequest;

    public boolean isModerator() {
        return responder.isModerator();
    }
}
