package com.demo.coordination.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One answered question of the thread history, in the shape the QA service expects.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HistoryTurn {

    @JsonProperty("Question")
    private String question;

    @JsonProperty("Answer")
    private String answer;
}
