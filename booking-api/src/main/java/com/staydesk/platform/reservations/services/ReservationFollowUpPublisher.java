package com.staydesk.platform.reservations.services;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Hands a committed reservation to every registered {@link ReservationFollowUp}
 * without waiting for them.
 */
@Component
@Slf4j
public class ReservationFollowUpPublisher {

    private final List<ReservationFollowUp> followUps;

    public ReservationFollowUpPublisher(List<ReservationFollowUp> followUps) {
        this.followUps = followUps != null ? followUps : new ArrayList<>();
    }

    public void publish(ReservationCommittedEvent event) {
        if (followUps.isEmpty()) {
            return;
        }
        log.debug("Publishing committed reservation {} to {} follow-up(s)", event.getReservationId(),
                followUps.size());

        Flux.fromIterable(followUps)
                .flatMap(followUp -> Mono.defer(() -> followUp.onReservationCommitted(event))
                        .doOnError(error -> log.error("Follow-up {} failed for reservation {}",
                                followUp.getClass().getSimpleName(), event.getReservationId(), error))
                        .onErrorResume(error -> Mono.empty()))
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe();
    }
}
