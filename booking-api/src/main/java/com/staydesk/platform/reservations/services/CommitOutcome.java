package com.staydesk.platform.reservations.services;

import java.util.UUID;

import com.staydesk.platform.reservations.entities.ReservationEntity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a commit attempt. Business-rule conflicts are reported here
 * rather than thrown, so the caller can route the wizard back to the step that
 * needs a new decision.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommitOutcome {

    public enum Status {
        COMMITTED,
        /**
         * Held room is gone or overlaps another reservation
         */
        ROOM_UNAVAILABLE,
        /**
         * adults + children no longer fit the room
         */
        CAPACITY_EXCEEDED,
        /**
         * Reservation being edited no longer exists or was cancelled
         */
        TARGET_UNAVAILABLE,
        /**
         * A required field is missing or invalid
         */
        INCOMPLETE_DRAFT
    }

    private Status status;
    private ReservationEntity reservation;
    private boolean modification;

    /**
     * Capacity the guests were checked against
     */
    private Integer capacity;

    /**
     * Booking as it was before a modification
     */
    private String previousSummary;

    public static CommitOutcome rejected(Status status) {
        return CommitOutcome.builder().status(status).build();
    }

    public boolean isCommitted() {
        return status == Status.COMMITTED;
    }

    public ReservationCommittedEvent toEvent(String performedBy) {
        return ReservationCommittedEvent.builder()
                .reservationId(reservation.getId())
                .propertyId(reservation.getPropertyId())
                .roomNo(reservation.getRoomNo())
                .checkIn(reservation.getCheckIn())
                .checkOut(reservation.getCheckOut())
                .modification(modification)
                .performedBy(performedBy)
                .previousSummary(previousSummary)
                .summary(ReservationCommitService.describe(reservation))
                .build();
    }

    public UUID getReservationId() {
        return reservation != null ? reservation.getId() : null;
    }
}
