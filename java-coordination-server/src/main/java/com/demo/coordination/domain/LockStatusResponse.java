package com.demo.coordination.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LockStatusResponse {

    @JsonProperty("thread_id")
    private String threadId;

    @JsonProperty("is_locked")
    private boolean locked;

    @JsonProperty("holder_id")
    private String holderId;

    @JsonProperty("lock_type")
    private ThreadLock.LockKind kind;

    @JsonProperty("expires_at")
    private Instant expiresAt;

    public static LockStatusResponse unlocked(String threadId) {
        return LockStatusResponse.builder().threadId(threadId).locked(false).build();
    }

    public static LockStatusResponse of(ThreadLock lock) {
        return LockStatusResponse.builder()
                .threadId(lock.getThreadId())
                .locked(true)
                .holderId(lock.getHolderId())
                .kind(lock.getKind())
                .expiresAt(lock.getExpiresAt())
                .build();
    }
}
