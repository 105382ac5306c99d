package com.demo.coordination.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QaStreamRequest {

    @JsonProperty("room_id")
    private String roomId;

    @JsonProperty("thread_id")
    private String threadId;

    @JsonProperty("ai_id")
    private String responderId;

    @JsonProperty("user_message_id")
    private String userMessageId;

    public RunRequest toRunRequest() {
        return RunRequest.builder()
                .roomId(roomId)
                .threadId(threadId)
                .responderId(responderId)
                .sourceMessageId(userMessageId)
                .build();
    }
}
