package com.staydesk.platform.assistant.workflows.reservation;

import org.springframework.stereotype.Component;

import com.staydesk.platform.assistant.model.ReservationStep;
import com.staydesk.platform.assistant.model.ReservationStepResponse;

import lombok.extern.slf4j.Slf4j;

/**
 * Default logging observer for wizard transitions.
 */
@Component
@Slf4j
public class LoggingStateMachineObserver implements StateMachineObserver {

    @Override
    public void onTransitionStarting(StepTransitionContext context) {
        log.info("🔄 [{}] Transition starting: {} -> {} (reason: {}, iteration: {})",
                sessionOf(context), fromOf(context), context.getToStep(), context.getReason(),
                context.getMetadata("iteration", Integer.class));
        String notice = context.getData("notice", String.class);
        if (notice != null) {
            log.debug("[{}] Carrying notice into {}: {}", sessionOf(context), context.getToStep(), notice);
        }
    }

    @Override
    public void onTransitionCompleted(StepTransitionContext context, ReservationStepResponse response) {
        log.info("✅ [{}] Transition completed: {} -> {} (status: {})",
                sessionOf(context), fromOf(context), context.getToStep(), response.getStatus());
    }

    @Override
    public void onTransitionRejected(StepTransitionContext context,
            StepTransitionContext.TransitionValidationResult validationResult) {
        log.warn("⚠️ [{}] Transition rejected: {} -> {} - {}",
                sessionOf(context), fromOf(context), context.getToStep(), validationResult.getErrorMessage());
    }

    @Override
    public void onStepEntered(ReservationStep step, StepTransitionContext context) {
        log.debug("📍 Entering step: {}", step);
    }

    @Override
    public void onStepExited(ReservationStep step, StepTransitionContext context) {
        log.debug("📍 Exiting step: {}", step);
    }

    @Override
    public void onSwitchStepIteration(ReservationStep fromStep, ReservationStep toStep, int iteration) {
        log.debug("🔄 SWITCH_STEP iteration {}: {} -> {}", iteration, fromStep, toStep);
    }

    @Override
    public void onError(ReservationStep currentStep, Throwable error, StepTransitionContext context) {
        log.error("❌ Error in step {}: {}", currentStep, error.getMessage(), error);
    }

    private static String sessionOf(StepTransitionContext context) {
        return context.getData("sessionId", String.class);
    }

    private static Object fromOf(StepTransitionContext context) {
        return context.isFlowStart() ? "start" : context.getFromStep();
    }
}
