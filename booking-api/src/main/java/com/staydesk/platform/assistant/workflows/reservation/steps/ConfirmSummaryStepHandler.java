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
import com.staydesk.platform.assistant.services.ConfirmationTokenGuard;
import com.staydesk.platform.assistant.services.ReservationSummaryFormatter;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Handler for CONFIRM step.
 *
 * Every time the summary is shown a fresh confirmation token is issued and
 * embedded in the Confirm option. A confirm action carrying another token (or
 * none) ends the session: the summary it refers to is no longer the one on
 * record.
 */
@Component
@Slf4j
public class ConfirmSummaryStepHandler extends BaseReservationStepHandler {

    static final String DECLINE_PAYLOAD = "decline";

    @Autowired
    private ConfirmationTokenGuard tokenGuard;

    @Autowired
    private ReservationSummaryFormatter summaryFormatter;

    @Override
    public ReservationStep getStep() {
        return ReservationStep.CONFIRM;
    }

    @Override
    public Mono<ReservationStepResponse> enter(WizardSession session) {
        String token = tokenGuard.issue(session);
        log.info("🔄 CONFIRM summary shown for session {}", session.getSessionId());
        return Mono.just(ReservationStepResponse.builder()
                .status(ReservationStepResponse.StepStatus.ASK_USER)
                .response(summaryFormatter.draftSummary(session.getDraft()))
                .options(confirmOptions(token))
                .build());
    }

    @Override
    public Mono<ReservationStepResponse> handle(WizardAction action, WizardSession session) {
        if (action.getType() != WizardAction.ActionType.CONFIRM) {
            return Mono.just(ReservationStepResponse.builder()
                    .status(ReservationStepResponse.StepStatus.ANSWER_USER)
                    .response(message("booking.confirm.use-buttons", "Please confirm or cancel the booking above."))
                    .options(confirmOptions(session.getDraft().getConfirmationToken()))
                    .build());
        }

        if (!tokenGuard.verify(session, action.getValue())) {
            return Mono.just(ReservationStepResponse.builder()
                    .status(ReservationStepResponse.StepStatus.CANCEL)
                    .response(message("booking.confirm.expired", "Confirmation expired. Please /book again."))
                    .build());
        }

        ReservationDraft draft = session.getDraft().toBuilder()
                .confirmationToken(null)
                .build();
        return Mono.just(ReservationStepResponse.switchTo(ReservationStep.COMPLETE_RESERVATION, draft));
    }

    private List<List<PromptOption>> confirmOptions(String token) {
        return List.of(List.of(
                PromptOption.of(message("booking.option.confirm", "✅ Confirm"), WizardAction.confirmPayload(token)),
                PromptOption.of(message("booking.option.cancel", "❌ Cancel"), DECLINE_PAYLOAD)));
    }
}
