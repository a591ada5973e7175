package com.staydesk.platform.assistant.workflows.reservation.steps;

import org.springframework.stereotype.Component;

import com.staydesk.platform.assistant.model.ReservationDraft;
import com.staydesk.platform.assistant.model.ReservationStep;
import com.staydesk.platform.assistant.model.ReservationStepResponse;
import com.staydesk.platform.assistant.model.WizardAction;
import com.staydesk.platform.assistant.model.WizardSession;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Handler for GUEST_NAME step.
 * Accepts a trimmed name of 2 to 255 characters, the width of the
 * guest_name column.
 */
@Component
@Slf4j
public class GuestNameStepHandler extends BaseReservationStepHandler {

    static final int MIN_LENGTH = 2;
    static final int MAX_LENGTH = 255;

    @Override
    public ReservationStep getStep() {
        return ReservationStep.GUEST_NAME;
    }

    @Override
    public Mono<ReservationStepResponse> enter(WizardSession session) {
        String prompt = session.getDraft().isModification()
                ? message("booking.guest.prompt.modify", "Enter the new guest name:")
                : message("booking.guest.prompt", "Guest name?");
        return Mono.just(ReservationStepResponse.builder()
                .status(ReservationStepResponse.StepStatus.ASK_USER)
                .response(prompt)
                .build());
    }

    @Override
    public Mono<ReservationStepResponse> handle(WizardAction action, WizardSession session) {
        String name = inputValue(action);
        if (name == null) {
            return unsupported(action, session);
        }
        if (name.length() < MIN_LENGTH) {
            return Mono.just(ReservationStepResponse.answer(
                    message("booking.guest.invalid", "Please enter a valid guest name (min 2 chars).")));
        }
        if (name.length() > MAX_LENGTH) {
            return Mono.just(ReservationStepResponse.answer(message("booking.guest.too-long",
                    "Guest name is too long (max {0} chars).", String.valueOf(MAX_LENGTH))));
        }

        ReservationDraft draft = session.getDraft().toBuilder()
                .guestName(name)
                .build();
        log.debug("Guest name accepted for session {}", session.getSessionId());
        return Mono.just(ReservationStepResponse.switchTo(draft.firstMissingStep(), draft));
    }
}
