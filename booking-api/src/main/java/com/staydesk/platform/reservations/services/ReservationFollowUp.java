package com.staydesk.platform.reservations.services;

import reactor.core.publisher.Mono;

/**
 * Downstream work triggered by a committed reservation (audit trail,
 * notifications, documents). Follow-ups run after the commit and never affect
 * its outcome.
 */
public interface ReservationFollowUp {

    Mono<Void> onReservationCommitted(ReservationCommittedEvent event);
}
