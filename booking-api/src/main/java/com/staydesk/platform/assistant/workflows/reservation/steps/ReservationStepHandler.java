package com.staydesk.platform.assistant.workflows.reservation.steps;

import com.staydesk.platform.assistant.model.ReservationStep;
import com.staydesk.platform.assistant.model.ReservationStepResponse;
import com.staydesk.platform.assistant.model.WizardAction;
import com.staydesk.platform.assistant.model.WizardSession;

import reactor.core.publisher.Mono;

/**
 * Interface for reservation step handlers.
 * Each step in the reservation wizard is handled by a dedicated handler class.
 */
public interface ReservationStepHandler {

    /**
     * Called when the wizard arrives on this step. Renders the step's prompt
     * (ASK_USER), or moves on right away (SWITCH_STEP) when the step has
     * nothing to ask. The session already carries the draft for this step.
     */
    Mono<ReservationStepResponse> enter(WizardSession session);

    /**
     * Handles one user action received while the session waits on this step
     *
     * @param action  parsed user input
     * @param session current session, not modified by the handler
     * @return Step response with status and next action
     */
    Mono<ReservationStepResponse> handle(WizardAction action, WizardSession session);

    /**
     * Returns the step this handler manages
     */
    ReservationStep getStep();
}
