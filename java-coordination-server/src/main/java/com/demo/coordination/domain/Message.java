package com.demo.coordination.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Permanent thread message. Written once, never updated.
 */
@Entity
@Table(name = "messages", indexes = {
    @Index(name = "idx_message_thread_created", columnList = "threadId,createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    @Column(length = 100)
    private String id;

    @Column(length = 100)
    private String roomId;

    @Column(nullable = false, length = 100)
    private String threadId;

    @Column(columnDefinition = "TEXT")
    private String content;

    @Enumerated(EnumType.STRING)
    @Column(length = 20, nullable = false)
    private SenderKind senderKind;

    @Column(length = 100)
    private String senderId;

    @Column(length = 100)
    private String inReplyTo;

    @Column(nullable = false)
    private Instant createdAt;

    public enum SenderKind {
        HUMAN, RESPONDER
    }
}
