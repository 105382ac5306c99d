package com.demo.coordination.service.selection;

import com.demo.coordination.domain.ModeratorDecision;
import com.demo.coordination.domain.ResponderRef;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Free-text answers that name the next responder with a marker line such as
 * {@code Forward to AI mentor: **Data Scientist**}. The whole text is shown as-is.
 */
@Component
@Order(2)
public class PatternSelectionDecoder implements SelectionDecoder {

    private static final Pattern FORWARD_MARKER =
            Pattern.compile("Forward to AI mentor:\\s*\\*\\*(.+?)\\*\\*", Pattern.CASE_INSENSITIVE);

    @Override
    public Optional<ModeratorDecision> decode(String moderatorOutput) {
        if (moderatorOutput == null || moderatorOutput.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = FORWARD_MARKER.matcher(moderatorOutput);
        ResponderRef selection = null;
        if (matcher.find() && !matcher.group(1).isBlank()) {
            selection = ResponderRef.byName(matcher.group(1));
        }
        return Optional.of(new ModeratorDecision(moderatorOutput, selection));
    }
}
