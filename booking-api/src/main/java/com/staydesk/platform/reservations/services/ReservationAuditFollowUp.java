package com.staydesk.platform.reservations.services;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

/**
 * Writes the CREATED / MODIFIED audit trail entry of a committed reservation
 */
@Component
@RequiredArgsConstructor
public class ReservationAuditFollowUp implements ReservationFollowUp {

    private final ReservationAuditService auditService;

    @Override
    public Mono<Void> onReservationCommitted(ReservationCommittedEvent event) {
        return Mono.fromRunnable(() -> {
            if (event.isModification()) {
                auditService.logModified(event.getReservationId(), event.getPreviousSummary(), event.getSummary(),
                        event.getPerformedBy());
            } else {
                auditService.logCreated(event.getReservationId(), event.getSummary(), event.getPerformedBy());
            }
        });
    }
}
