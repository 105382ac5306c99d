package com.demo.coordination.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Registration of a responder into a room.
 */
@Entity
@Table(name = "room_responders", indexes = {
    @Index(name = "idx_room_responder_room", columnList = "roomId")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoomResponder implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String roomId;

    @Column(nullable = false, length = 100)
    private String responderId;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;
}
