package com.staydesk.platform.assistant.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Booking data accumulated by the wizard. Step handlers never mutate a draft
 * in place: they derive the next one with {@link #toBuilder()} and hand it to
 * the state machine, which checks that the fields required by the target step
 * are present before storing it on the session.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ReservationDraft {

    @Builder.Default
    private FlowType flowType = FlowType.NEW;

    /**
     * Field being edited, set only when flowType == MODIFY
     */
    private ModifyField modifyField;

    /**
     * Reservation being edited, set only when flowType == MODIFY. Passed as
     * the excluded reservation to every availability lookup.
     */
    private UUID editTargetId;

    private UUID propertyId;
    private String guestName;
    private LocalDate checkIn;
    private LocalDate checkOut;
    private String roomNo;
    private String roomType;
    private Integer adults;
    private Integer children;
    private BigDecimal amount;
    private String notes;

    /**
     * Single-use token of the summary currently shown, null outside CONFIRM
     */
    private String confirmationToken;

    @JsonIgnore
    public boolean isModification() {
        return flowType == FlowType.MODIFY && editTargetId != null;
    }

    @JsonIgnore
    public boolean hasValidInterval() {
        return checkIn != null && checkOut != null && checkOut.isAfter(checkIn);
    }

    /**
     * First data-collection step whose field is still missing, or CONFIRM when
     * the draft is complete. Notes are optional and never block.
     */
    @JsonIgnore
    public ReservationStep firstMissingStep() {
        if (guestName == null) {
            return ReservationStep.GUEST_NAME;
        }
        if (checkIn == null) {
            return ReservationStep.CHECK_IN_DATE;
        }
        if (checkOut == null) {
            return ReservationStep.CHECK_OUT_DATE;
        }
        if (roomNo == null) {
            return ReservationStep.ROOM_SELECTION;
        }
        if (adults == null) {
            return ReservationStep.ADULTS_COUNT;
        }
        if (children == null) {
            return ReservationStep.CHILDREN_COUNT;
        }
        if (amount == null) {
            return ReservationStep.AMOUNT_ENTRY;
        }
        return ReservationStep.CONFIRM;
    }

    /**
     * Value accepted at the given step, rendered the way selection payloads
     * carry it. Used to recognise a repeated selection.
     */
    public String valueFor(ReservationStep step) {
        switch (step) {
            case GUEST_NAME:
                return guestName;
            case CHECK_IN_DATE:
                return checkIn != null ? checkIn.toString() : null;
            case CHECK_OUT_DATE:
                return checkOut != null ? checkOut.toString() : null;
            case ROOM_SELECTION:
                return roomNo;
            case ADULTS_COUNT:
                return adults != null ? adults.toString() : null;
            case CHILDREN_COUNT:
                return children != null ? children.toString() : null;
            case AMOUNT_ENTRY:
                return amount != null ? amount.toPlainString() : null;
            case NOTES_ENTRY:
                return notes;
            default:
                return null;
        }
    }
}
