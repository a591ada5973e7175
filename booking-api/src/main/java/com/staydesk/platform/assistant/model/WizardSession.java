package com.staydesk.platform.assistant.model;

import java.time.LocalDateTime;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted progress of one conversation through the booking wizard. At most
 * one session exists per sessionId; starting a new flow overwrites it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WizardSession {
    private String sessionId;

    /**
     * User driving the conversation, recorded for auditing only
     */
    private String ownerId;

    private ReservationStep step;

    @Builder.Default
    private ReservationDraft draft = new ReservationDraft();

    private LocalDateTime updatedAt;
}
