package com.demo.coordination.domain;

import lombok.Value;

import java.util.Optional;

/**
 * Decoded moderator output: the text shown in the thread plus an optional selection.
 */
@Value
public class ModeratorDecision {

    String displayText;
    ResponderRef selection;

    public Optional<ResponderRef> getSelection() {
        return Optional.ofNullable(selection);
    }
}
