package com.staydesk.platform.assistant.workflows.reservation.steps;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.staydesk.platform.assistant.model.ReservationDraft;
import com.staydesk.platform.assistant.model.ReservationStep;
import com.staydesk.platform.assistant.model.ReservationStepResponse;
import com.staydesk.platform.assistant.model.WizardAction;
import com.staydesk.platform.assistant.model.WizardSession;
import com.staydesk.platform.reservations.services.CapacityValidator;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Handler for CHILDREN_COUNT step.
 * Offers 0..(capacity - adults) children; a submitted value outside that range
 * is rejected whatever option it came from.
 */
@Component
@Slf4j
public class ChildrenCountStepHandler extends BaseReservationStepHandler {

    @Autowired
    private CapacityValidator capacityValidator;

    @Override
    public ReservationStep getStep() {
        return ReservationStep.CHILDREN_COUNT;
    }

    @Override
    public Mono<ReservationStepResponse> enter(WizardSession session) {
        return Mono.fromCallable(() -> {
            int capacity = capacityOf(session);
            int adults = session.getDraft().getAdults();
            return ReservationStepResponse.builder()
                    .status(ReservationStepResponse.StepStatus.ASK_USER)
                    .response(message("booking.children.prompt", "Children? (up to {0})",
                            String.valueOf(capacityValidator.maxChildren(adults, capacity))))
                    .options(AdultsCountStepHandler.countOptions(getStep(),
                            capacityValidator.offeredChildren(adults, capacity)))
                    .build();
        });
    }

    @Override
    public Mono<ReservationStepResponse> handle(WizardAction action, WizardSession session) {
        String value = inputValue(action);
        if (value == null) {
            return unsupported(action, session);
        }

        return Mono.fromCallable(() -> {
            int capacity = capacityOf(session);
            int adults = session.getDraft().getAdults();
            Integer children = parseCount(value);
            if (children == null || !capacityValidator.validate(adults, children, capacity)) {
                log.info("Rejected children '{}' with {} adults for room {} (capacity {})", value, adults,
                        session.getDraft().getRoomNo(), capacity);
                return ReservationStepResponse.builder()
                        .status(ReservationStepResponse.StepStatus.ANSWER_USER)
                        .response(message("booking.children.invalid",
                                "Room {0} allows {1} guests in total. Please choose between 0 and {2} children.",
                                session.getDraft().getRoomNo(), String.valueOf(capacity),
                                String.valueOf(capacityValidator.maxChildren(adults, capacity))))
                        .options(AdultsCountStepHandler.countOptions(getStep(),
                                capacityValidator.offeredChildren(adults, capacity)))
                        .build();
            }

            ReservationDraft draft = session.getDraft().toBuilder()
                    .children(children)
                    .build();
            return ReservationStepResponse.switchTo(draft.firstMissingStep(), draft);
        });
    }

    private int capacityOf(WizardSession session) {
        return capacityValidator.getMaxOccupancy(session.getDraft().getPropertyId(), session.getDraft().getRoomNo());
    }
}
