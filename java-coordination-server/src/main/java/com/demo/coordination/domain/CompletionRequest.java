package com.demo.coordination.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Everything a completion source needs to generate one response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletionRequest {
    private String runId;
    private String roomId;
    private String questionText;
    private String model;
    private ResponderProfile responder;
    private List<HistoryTurn> history;

    /** Moderators get a single, non-incremental answer. */
    private boolean moderator;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResponderProfile {
        private String id;
        private String name;
        private String description;
        private String personality;
        private String instructions;
    }
}
