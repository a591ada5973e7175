package com.staydesk.platform.assistant.model;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonIgnore;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One inbound user action delivered by the messaging transport: either free
 * text or the payload of a previously offered option.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WizardInput {
    @NotBlank
    private String sessionId;

    private String ownerId;

    /**
     * Property the conversation works on; used when a new flow starts
     */
    private UUID propertyId;

    private String text;

    private String payload;

    public static WizardInput text(String sessionId, String ownerId, String text) {
        return WizardInput.builder().sessionId(sessionId).ownerId(ownerId).text(text).build();
    }

    public static WizardInput selection(String sessionId, String ownerId, String payload) {
        return WizardInput.builder().sessionId(sessionId).ownerId(ownerId).payload(payload).build();
    }

    @JsonIgnore
    public boolean isSelection() {
        return payload != null && !payload.isBlank();
    }
}
