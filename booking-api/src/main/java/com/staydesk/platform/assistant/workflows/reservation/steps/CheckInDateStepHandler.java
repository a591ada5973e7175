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
 * Handler for CHECK_IN_DATE step.
 * A new check-in always clears the check-out, which is asked next.
 */
@Component
@Slf4j
public class CheckInDateStepHandler extends BaseDateStepHandler {

    @Override
    public ReservationStep getStep() {
        return ReservationStep.CHECK_IN_DATE;
    }

    @Override
    protected String prompt(WizardSession session) {
        return session.getDraft().isModification()
                ? message("booking.checkin.prompt.modify", "Select new check-in date:")
                : message("booking.checkin.prompt", "Select check-in date:");
    }

    @Override
    protected YearMonth initialMonth(WizardSession session) {
        return YearMonth.from(calendarBuilder.today());
    }

    @Override
    protected LocalDate minDate(WizardSession session) {
        return null;
    }

    @Override
    protected Mono<ReservationStepResponse> accept(LocalDate date, WizardSession session) {
        ReservationDraft draft = session.getDraft().toBuilder()
                .checkIn(date)
                .checkOut(null)
                .build();
        log.debug("Check-in {} accepted for session {}", date, session.getSessionId());
        return Mono.just(ReservationStepResponse.switchTo(ReservationStep.CHECK_OUT_DATE, draft));
    }
}
