package com.demo.coordination.service.selection;

import com.demo.coordination.domain.ModeratorDecision;
import com.demo.coordination.domain.ResponderRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Tries each decoder in order; the first one that recognises the output wins.
 */
@Component
@Slf4j
public class SelectionResolver {

    private final List<SelectionDecoder> decoders;

    public SelectionResolver(List<SelectionDecoder> decoders) {
        this.decoders = List.copyOf(decoders);
    }

    public Optional<ModeratorDecision> decode(String moderatorOutput) {
        for (SelectionDecoder decoder : decoders) {
            Optional<ModeratorDecision> decision = decoder.decode(moderatorOutput);
            if (decision.isPresent()) {
                log.debug("Moderator output decoded: decoder={}, selection={}",
                        decoder.getClass().getSimpleName(), decision.get().getSelection().orElse(null));
                return decision;
            }
        }
        return Optional.empty();
    }

    public Optional<ResponderRef> resolveSelection(String moderatorOutput) {
        return decode(moderatorOutput).flatMap(ModeratorDecision::getSelection);
    }

    /**
     * Text to store as the moderator's message; the raw output when nothing
     * recognises it.
     */
    public String displayText(String moderatorOutput) {
        return decode(moderatorOutput)
                .map(ModeratorDecision::getDisplayText)
                .orElse(moderatorOutput != null ? moderatorOutput : "");
    }
}
