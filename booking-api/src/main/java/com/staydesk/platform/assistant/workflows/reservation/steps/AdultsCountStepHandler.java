package com.staydesk.platform.assistant.workflows.reservation.steps;

import java.util.ArrayList;
import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.staydesk.platform.assistant.model.PromptOption;
import com.staydesk.platform.assistant.model.ReservationDraft;
import com.staydesk.platform.assistant.model.ReservationStep;
import com.staydesk.platform.assistant.model.ReservationStepResponse;
import com.staydesk.platform.assistant.model.WizardAction;
import com.staydesk.platform.assistant.model.WizardSession;
import com.staydesk.platform.reservations.services.CapacityValidator;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Handler for ADULTS_COUNT step.
 *
 * Offers 1..capacity adults (bounded by the configured maximum) and checks
 * any submitted value against the room again. Children already set that no
 * longer fit are cleared so the children step asks again.
 */
@Component
@Slf4j
public class AdultsCountStepHandler extends BaseReservationStepHandler {

    @Autowired
    private CapacityValidator capacityValidator;

    @Override
    public ReservationStep getStep() {
        return ReservationStep.ADULTS_COUNT;
    }

    @Override
    public Mono<ReservationStepResponse> enter(WizardSession session) {
        return Mono.fromCallable(() -> {
            int capacity = capacityOf(session);
            return ReservationStepResponse.builder()
                    .status(ReservationStepResponse.StepStatus.ASK_USER)
                    .response(message("booking.adults.prompt", "Adults? (room {0} allows up to {1} guests)",
                            session.getDraft().getRoomNo(), String.valueOf(capacity)))
                    .options(countOptions(getStep(), capacityValidator.offeredAdults(capacity)))
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
            Integer adults = parseCount(value);
            if (adults == null || !capacityValidator.validate(adults, 0, capacity)) {
                log.info("Rejected adults '{}' for room {} (capacity {})", value, session.getDraft().getRoomNo(),
                        capacity);
                return ReservationStepResponse.builder()
                        .status(ReservationStepResponse.StepStatus.ANSWER_USER)
                        .response(message("booking.adults.invalid", "Please choose between 1 and {0} adults.",
                                String.valueOf(capacity)))
                        .options(countOptions(getStep(), capacityValidator.offeredAdults(capacity)))
                        .build();
            }

            ReservationDraft current = session.getDraft();
            ReservationDraft.ReservationDraftBuilder builder = current.toBuilder().adults(adults);
            String notice = null;
            if (current.getChildren() != null && !capacityValidator.validate(adults, current.getChildren(), capacity)) {
                builder.children(null);
                notice = message("booking.adults.children-reset",
                        "{0} adults and {1} children exceed the room capacity of {2}. Please choose the children again.",
                        String.valueOf(adults), String.valueOf(current.getChildren()), String.valueOf(capacity));
            }
            ReservationDraft draft = builder.build();
            return ReservationStepResponse.switchTo(draft.firstMissingStep(), draft, notice);
        });
    }

    private int capacityOf(WizardSession session) {
        return capacityValidator.getMaxOccupancy(session.getDraft().getPropertyId(), session.getDraft().getRoomNo());
    }

    static List<List<PromptOption>> countOptions(ReservationStep step, List<Integer> counts) {
        List<List<PromptOption>> rows = new ArrayList<>();
        List<PromptOption> row = new ArrayList<>();
        for (Integer count : counts) {
            row.add(PromptOption.of(String.valueOf(count), WizardAction.stepPayload(step, count)));
            if (row.size() == 5) {
                rows.add(row);
                row = new ArrayList<>();
            }
        }
        if (!row.isEmpty()) {
            rows.add(row);
        }
        return rows;
    }
}
