package com.staydesk.platform.assistant.entities;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@Entity
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "reservation_wizard_sessions")
public class WizardSessionEntity {
    @Id
    @Column(name = "session_id")
    private String sessionId;

    @Column(name = "owner_id")
    private String ownerId;

    @Column(nullable = false)
    private String step;

    // Jackson-serialized ReservationDraft
    @Column(columnDefinition = "TEXT", nullable = false)
    private String data;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
