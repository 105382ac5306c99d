package com.demo.coordination.service.selection;

import com.demo.coordination.domain.ModeratorDecision;

import java.util.Optional;

/**
 * Reads a moderator's raw output. Empty means this decoder does not
 * recognise the format, not that no responder was picked.
 */
public interface SelectionDecoder {

    Optional<ModeratorDecision> decode(String moderatorOutput);
}
