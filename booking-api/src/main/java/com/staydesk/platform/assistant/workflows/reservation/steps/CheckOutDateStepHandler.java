package com.staydesk.platform.assistant.workflows.reservation.steps;

import java.time.LocalDate;
import java.time.YearMonth;

import org.springframework.stereotype.Component;

import com.staydesk.platform.assistant.model.ReservationDraft;
import com.staydesk.platform.assistant.model.ReservationStep;
import com.staydesk.platform.assistant.model.ReservationStepResponse;
import com.staydesk.platform.assistant.model.WizardSession;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Handler for CHECK_OUT_DATE step.
 * Only dates strictly after the stored check-in are accepted; accepted dates
 * always go through room availability, even when a room is already held.
 */
@Component
@Slf4j
public class CheckOutDateStepHandler extends BaseDateStepHandler {

    @Override
    public ReservationStep getStep() {
        return ReservationStep.CHECK_OUT_DATE;
    }

    @Override
    protected String prompt(WizardSession session) {
        return message("booking.checkout.prompt", "Check-in: {0}\n\nSelect check-out date:",
                String.valueOf(session.getDraft().getCheckIn()));
    }

    @Override
    protected YearMonth initialMonth(WizardSession session) {
        return YearMonth.from(minDate(session));
    }

    @Override
    protected LocalDate minDate(WizardSession session) {
        return session.getDraft().getCheckIn().plusDays(1);
    }

    @Override
    protected Mono<ReservationStepResponse> accept(LocalDate date, WizardSession session) {
        if (!date.isAfter(session.getDraft().getCheckIn())) {
            return Mono.just(reject(message("booking.checkout.before-checkin", "Check-out must be after check-in!"),
                    session));
        }
        ReservationDraft draft = session.getDraft().toBuilder()
                .checkOut(date)
                .build();
        log.debug("Check-out {} accepted for session {}", date, session.getSessionId());
        return Mono.just(ReservationStepResponse.switchTo(ReservationStep.ROOM_SELECTION, draft));
    }
}
