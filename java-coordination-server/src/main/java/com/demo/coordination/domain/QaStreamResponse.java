package com.demo.coordination.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QaStreamResponse {

    @JsonProperty("streaming_message_id")
    private String streamingMessageId;

    private String status;

    public static QaStreamResponse from(RunTicket ticket) {
        return new QaStreamResponse(ticket.getRunId(), ticket.getStatus());
    }
}
