package com.demo.coordination.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Responder configuration: the behavioral instructions and traits a
 * completion source is primed with.
 */
@Entity
@Table(name = "responders")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Responder implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    @Column(length = 100)
    private String id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(columnDefinition = "TEXT")
    private String personality;

    @Column(columnDefinition = "TEXT")
    private String systemPrompt;

    @Column(length = 100)
    private String model;

    @Enumerated(EnumType.STRING)
    @Column(length = 20, nullable = false)
    @Builder.Default
    private ResponderRole role = ResponderRole.STANDARD;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    public boolean isModerator() {
        return role == ResponderRole.MODERATOR;
    }

    public enum ResponderRole {
        /** Answers the user directly. */
        STANDARD,
        /** Selects another responder of the room instead of answering. */
        MODERATOR
    }
}
