package com.demo.coordination.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RunTicket {
    public static final String STATUS_PROCESSING = "processing";

    private String runId;
    private String status;

    public static RunTicket processing(String runId) {
        return new RunTicket(runId, STATUS_PROCESSING);
    }
}
