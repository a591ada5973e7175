package com.staydesk.platform.reservations.services;

import java.time.LocalDate;
import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReservationCommittedEvent {
    private UUID reservationId;
    private UUID propertyId;
    private String roomNo;
    private LocalDate checkIn;
    private LocalDate checkOut;
    private boolean modification;
    private String performedBy;

    /**
     * One-line description of the booking before the change, null for a new
     * reservation
     */
    private String previousSummary;

    private String summary;
}
