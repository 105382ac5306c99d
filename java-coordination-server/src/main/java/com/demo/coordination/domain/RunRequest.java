package com.demo.coordination.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Validated identifiers for one orchestration run.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RunRequest {
    private String threadId;
    private String roomId;
    private String responderId;
    private String sourceMessageId;

    // Chained runs are started with false so a moderator hand-off is one hop
    @Builder.Default
    private boolean chainingAllowed = true;
}
