package com.ai.coach.entity;

import com.ai.coach.conversation.Substate;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Stored coaching session. The full state lives in {@code stateJson}; substate and
 * turn count are copied out so sessions can be listed without parsing it.
 */
@Entity
@Table(name = "coaching_session", indexes = {
    @Index(name = "idx_coaching_session_session_id", columnList = "session_id", unique = true)
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, unique = true)
    private String sessionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private Substate substate = Substate.GOAL_AND_VISION;

    private int turnCount;

    @Lob
    @Column(name = "state_json", nullable = false)
    private String stateJson;

    private Instant createdAt;

    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
