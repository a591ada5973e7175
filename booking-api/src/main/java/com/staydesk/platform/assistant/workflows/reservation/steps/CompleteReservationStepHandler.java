package com.staydesk.platform.assistant.workflows.reservation.steps;

import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.staydesk.platform.assistant.model.PromptOption;
import com.staydesk.platform.assistant.model.ReservationDraft;
import com.staydesk.platform.assistant.model.ReservationStep;
import com.staydesk.platform.assistant.model.ReservationStepResponse;
import com.staydesk.platform.assistant.model.WizardAction;
import com.staydesk.platform.assistant.model.WizardSession;
import com.staydesk.platform.reservations.services.CommitOutcome;
import com.staydesk.platform.reservations.services.ReservationCommitService;
import com.staydesk.platform.reservations.services.ReservationFollowUpPublisher;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Handler for COMPLETE_RESERVATION step.
 * Backend-only step that commits the confirmed draft.
 *
 * Business conflicts roll the wizard back with the draft intact: a lost room
 * goes back to room selection, guests that no longer fit go back to the
 * adults count. Storage failures propagate so that nothing about the session
 * is saved and the confirm option can be used again.
 */
@Component
@Slf4j
public class CompleteReservationStepHandler extends BaseReservationStepHandler {

    @Autowired
    private ReservationCommitService commitService;

    @Autowired
    private ReservationFollowUpPublisher followUpPublisher;

    @Override
    public ReservationStep getStep() {
        return ReservationStep.COMPLETE_RESERVATION;
    }

    @Override
    public Mono<ReservationStepResponse> enter(WizardSession session) {
        log.info("🔄 COMPLETE_RESERVATION handler processing (backend only) for session {}", session.getSessionId());
        ReservationDraft draft = session.getDraft();

        return Mono.fromCallable(() -> commitService.commit(draft, session.getOwnerId()))
                .map(outcome -> toResponse(outcome, draft, session));
    }

    @Override
    public Mono<ReservationStepResponse> handle(WizardAction action, WizardSession session) {
        // never waits for input, the commit runs on entry
        return unsupported(action, session);
    }

    private ReservationStepResponse toResponse(CommitOutcome outcome, ReservationDraft draft, WizardSession session) {
        switch (outcome.getStatus()) {
            case COMMITTED:
                followUpPublisher.publish(outcome.toEvent(session.getOwnerId()));
                String text = outcome.isModification()
                        ? message("booking.commit.updated", "Booking updated ✅ ID: {0}",
                                String.valueOf(outcome.getReservationId()))
                        : message("booking.commit.created", "Booking created ✅ ID: {0}",
                                String.valueOf(outcome.getReservationId()));
                return ReservationStepResponse.builder()
                        .status(ReservationStepResponse.StepStatus.COMPLETED)
                        .response(text)
                        .reservationId(outcome.getReservationId())
                        .options(List.of(List.of(PromptOption.of(message("booking.option.view", "View booking"),
                                WizardAction.showPayload(outcome.getReservationId())))))
                        .build();

            case ROOM_UNAVAILABLE:
                return ReservationStepResponse.switchTo(ReservationStep.ROOM_SELECTION,
                        draft.toBuilder().roomNo(null).roomType(null).build(),
                        message("booking.commit.room-taken",
                                "Sorry, room {0} was just booked for {1} → {2}. Please choose another room.",
                                draft.getRoomNo(), String.valueOf(draft.getCheckIn()),
                                String.valueOf(draft.getCheckOut())));

            case CAPACITY_EXCEEDED:
                return ReservationStepResponse.switchTo(ReservationStep.ADULTS_COUNT,
                        draft.toBuilder().adults(null).children(null).build(),
                        message("booking.commit.capacity",
                                "Room {0} now allows at most {1} guests. Please enter the guest count again.",
                                draft.getRoomNo(), String.valueOf(outcome.getCapacity())));

            case TARGET_UNAVAILABLE:
                return ReservationStepResponse.builder()
                        .status(ReservationStepResponse.StepStatus.CANCEL)
                        .response(message("booking.commit.target-gone",
                                "This booking can no longer be modified. Use /book to create a new one."))
                        .build();

            case INCOMPLETE_DRAFT:
            default:
                ReservationStep missing = draft.firstMissingStep();
                if (missing != ReservationStep.CONFIRM) {
                    return ReservationStepResponse.switchTo(missing, draft);
                }
                return ReservationStepResponse.builder()
                        .status(ReservationStepResponse.StepStatus.CANCEL)
                        .response(message("booking.commit.incomplete",
                                "Some booking details are invalid. Use /book to start over."))
                        .build();
        }
    }
}
