package com.staydesk.platform.assistant.workflows.reservation.steps;

import java.util.List;

import org.springframework.stereotype.Component;

import com.staydesk.platform.assistant.model.PromptOption;
import com.staydesk.platform.assistant.model.ReservationDraft;
import com.staydesk.platform.assistant.model.ReservationStep;
import com.staydesk.platform.assistant.model.ReservationStepResponse;
import com.staydesk.platform.assistant.model.WizardAction;
import com.staydesk.platform.assistant.model.WizardSession;

import reactor.core.publisher.Mono;

/**
 * Handler for NOTES_ENTRY step, only reached when editing a booking.
 * "-" removes the notes.
 */
@Component
public class NotesEntryStepHandler extends BaseReservationStepHandler {

    static final String CLEAR = "-";

    @Override
    public ReservationStep getStep() {
        return ReservationStep.NOTES_ENTRY;
    }

    @Override
    public Mono<ReservationStepResponse> enter(WizardSession session) {
        return Mono.just(ReservationStepResponse.builder()
                .status(ReservationStepResponse.StepStatus.ASK_USER)
                .response(message("booking.notes.prompt", "Send the new notes, or - to remove them:"))
                .options(List.of(List.of(PromptOption.of(message("booking.option.clear-notes", "Remove notes"),
                        WizardAction.stepPayload(getStep(), CLEAR)))))
                .build());
    }

    @Override
    public Mono<ReservationStepResponse> handle(WizardAction action, WizardSession session) {
        String value = inputValue(action);
        if (value == null || value.isEmpty()) {
            return unsupported(action, session);
        }

        ReservationDraft draft = session.getDraft().toBuilder()
                .notes(CLEAR.equals(value) ? null : value)
                .build();
        return Mono.just(ReservationStepResponse.switchTo(ReservationStep.CONFIRM, draft));
    }
}
