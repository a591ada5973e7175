package com.staydesk.platform.assistant.workflows.reservation;

import com.staydesk.platform.assistant.model.ReservationStep;
import com.staydesk.platform.assistant.model.ReservationStepResponse;

/**
 * Observer interface for monitoring and tracing wizard transitions.
 */
public interface StateMachineObserver {

    default void onTransitionStarting(StepTransitionContext context) {
        // Default: no-op
    }

    default void onTransitionCompleted(StepTransitionContext context, ReservationStepResponse response) {
        // Default: no-op
    }

    default void onTransitionRejected(StepTransitionContext context,
            StepTransitionContext.TransitionValidationResult validationResult) {
        // Default: no-op
    }

    default void onStepEntered(ReservationStep step, StepTransitionContext context) {
        // Default: no-op
    }

    default void onStepExited(ReservationStep step, StepTransitionContext context) {
        // Default: no-op
    }

    default void onSwitchStepIteration(ReservationStep fromStep, ReservationStep toStep, int iteration) {
        // Default: no-op
    }

    default void onError(ReservationStep currentStep, Throwable error, StepTransitionContext context) {
        // Default: no-op
    }
}
