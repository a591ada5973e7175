package com.staydesk.platform.assistant.workflows.reservation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.staydesk.platform.assistant.model.PromptOption;
import com.staydesk.platform.assistant.model.ReservationDraft;
import com.staydesk.platform.assistant.model.ReservationStep;
import com.staydesk.platform.assistant.model.ReservationStepResponse;
import com.staydesk.platform.assistant.model.WizardAction;
import com.staydesk.platform.assistant.model.WizardSession;
import com.staydesk.platform.assistant.workflows.reservation.steps.ReservationStepHandler;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Central state machine for the reservation wizard.
 *
 * Responsibilities:
 * - Routes a user action to the handler of the session's current step
 * - Handles SWITCH_STEP loops, entering each target step in turn
 * - Validates transitions before applying a draft to the session
 * - Ignores options that belong to a step the session has already left
 * - Notifies observers
 *
 * The session object passed in is updated in memory (step and draft); the
 * caller decides from the final status whether to save, delete or drop it.
 */
@Component
@Slf4j
public class ReservationStateMachine {

    static final int MAX_ITERATIONS = 10;

    private final TransitionValidator transitionValidator;
    private final List<StateMachineObserver> observers;

    @Autowired
    public ReservationStateMachine(
            TransitionValidator transitionValidator,
            List<StateMachineObserver> observers) {
        this.transitionValidator = transitionValidator;
        this.observers = observers != null ? observers : new ArrayList<>();
    }

    /**
     * Starts a flow on its entry step: GUEST_NAME for a new booking, the
     * field's entry step when modifying an existing one
     */
    public Mono<ReservationStepResponse> startFlow(
            WizardSession session,
            ReservationStep entryStep,
            Map<ReservationStep, ReservationStepHandler> stepHandlers) {

        StepTransitionContext transitionContext = StepTransitionContext.forFlowStart(entryStep, session.getDraft())
                .withData("sessionId", session.getSessionId());

        StepTransitionContext.TransitionValidationResult validationResult = transitionValidator.validateTransition(
                null, entryStep, session.getDraft());
        if (!validationResult.isValid()) {
            notifyTransitionRejected(transitionContext, validationResult);
            return Mono.just(internalError());
        }
        transitionContext.setValidationResult(validationResult);
        notifyTransitionStarting(transitionContext);

        return enterStep(session, entryStep, stepHandlers, 0)
                .doOnSuccess(response -> notifyTransitionCompleted(transitionContext, response));
    }

    /**
     * Processes one user action on the session's current step with automatic
     * SWITCH_STEP loop handling
     */
    public Mono<ReservationStepResponse> processAction(
            WizardSession session,
            WizardAction action,
            Map<ReservationStep, ReservationStepHandler> stepHandlers) {

        ReservationStep currentStep = session.getStep();
        ReservationStepHandler handler = stepHandlers.get(currentStep);
        if (handler == null) {
            log.error("❌ No handler found for step: {}", currentStep);
            notifyError(currentStep, new IllegalStateException("No handler found for step: " + currentStep), null);
            return Mono.just(internalError());
        }

        ReservationStepResponse staleResponse = checkStaleOption(session, action);
        if (staleResponse != null) {
            return Mono.just(staleResponse);
        }

        return Mono.defer(() -> handler.handle(action, session))
                .flatMap(stepResponse -> processResponse(session, currentStep, stepResponse, stepHandlers, 0))
                .doOnError(error -> notifyError(currentStep, error, null));
    }

    /**
     * An option tagged with another step than the current one comes from an
     * older prompt. Repeating the value already accepted for that step is a
     * no-op; anything else is refused. Returns null when the action is for the
     * current step.
     */
    ReservationStepResponse checkStaleOption(WizardSession session, WizardAction action) {
        if (action.getStep() == null || action.getStep() == session.getStep()) {
            return null;
        }
        if (action.getType() == WizardAction.ActionType.STEP_VALUE
                && action.getValue() != null
                && action.getValue().equals(session.getDraft().valueFor(action.getStep()))) {
            log.debug("Repeated selection {}={} ignored for session {}", action.getStep(), action.getValue(),
                    session.getSessionId());
            return ReservationStepResponse.answer(action.getValue() + " is already selected.");
        }
        log.info("Stale option for {} received while session {} is at {}", action.getStep(),
                session.getSessionId(), session.getStep());
        return ReservationStepResponse.answer("That option is no longer active. Please answer the latest question.");
    }

    private Mono<ReservationStepResponse> enterStep(
            WizardSession session,
            ReservationStep step,
            Map<ReservationStep, ReservationStepHandler> stepHandlers,
            int iteration) {

        ReservationStepHandler handler = stepHandlers.get(step);
        if (handler == null) {
            log.error("❌ No handler found for next step: {}", step);
            notifyError(step, new IllegalStateException("No handler found for step: " + step), null);
            return Mono.just(internalError());
        }

        session.setStep(step);
        notifyStepEntered(step, null);

        return Mono.defer(() -> handler.enter(session))
                .flatMap(stepResponse -> processResponse(session, step, stepResponse, stepHandlers, iteration));
    }

    private Mono<ReservationStepResponse> processResponse(
            WizardSession session,
            ReservationStep currentStep,
            ReservationStepResponse stepResponse,
            Map<ReservationStep, ReservationStepHandler> stepHandlers,
            int iteration) {

        switch (stepResponse.getStatus()) {
            case SWITCH_STEP:
                return handleSwitchStep(session, currentStep, stepResponse, stepHandlers, iteration);

            case ASK_USER:
                return handleAskUser(session, stepResponse);

            case ANSWER_USER:
            case COMPLETED:
            case CANCEL:
            case ERROR:
                return Mono.just(stepResponse);

            default:
                log.warn("Unknown status: {}, treating as ANSWER_USER", stepResponse.getStatus());
                return Mono.just(stepResponse);
        }
    }

    private Mono<ReservationStepResponse> handleSwitchStep(
            WizardSession session,
            ReservationStep currentStep,
            ReservationStepResponse stepResponse,
            Map<ReservationStep, ReservationStepHandler> stepHandlers,
            int iteration) {

        // Prevent infinite loops
        if (iteration >= MAX_ITERATIONS) {
            log.error("❌ SWITCH_STEP loop exceeded max iterations ({}), stopping", MAX_ITERATIONS);
            notifyError(currentStep, new IllegalStateException("SWITCH_STEP loop exceeded max iterations"), null);
            return Mono.just(internalError());
        }

        ReservationStep nextStep = stepResponse.getNextStep();
        if (nextStep == null) {
            log.error("❌ SWITCH_STEP status but no nextStep specified");
            return Mono.just(internalError());
        }

        ReservationDraft nextDraft = stepResponse.getDraft() != null ? stepResponse.getDraft() : session.getDraft();

        StepTransitionContext transitionContext = StepTransitionContext.forSwitchStep(
                currentStep, nextStep, stepResponse, "SWITCH_STEP from " + currentStep);
        transitionContext.setDraft(nextDraft);
        transitionContext.withData("sessionId", session.getSessionId());
        if (stepResponse.getResponse() != null) {
            transitionContext.withData("notice", stepResponse.getResponse());
        }
        transitionContext.withMetadata("iteration", iteration + 1);

        StepTransitionContext.TransitionValidationResult validationResult = transitionValidator.validateTransition(
                currentStep, nextStep, nextDraft);

        if (!validationResult.isValid()) {
            log.warn("❌ Transition validation failed: {}", validationResult.getErrorMessage());
            notifyTransitionRejected(transitionContext, validationResult);
            return Mono.just(internalError());
        }

        transitionContext.setValidationResult(validationResult);
        notifyTransitionStarting(transitionContext);

        session.setDraft(nextDraft);

        log.info("🔄 SWITCH_STEP: {} -> {} (iteration: {})", currentStep, nextStep, iteration + 1);
        notifySwitchStepIteration(currentStep, nextStep, iteration + 1);
        notifyStepExited(currentStep, transitionContext);

        return enterStep(session, nextStep, stepHandlers, iteration + 1)
                .map(response -> withNotice(response, stepResponse))
                .doOnSuccess(response -> notifyTransitionCompleted(transitionContext, response));
    }

    /**
     * Stores the handler's draft (if any) and waits on the current step
     */
    private Mono<ReservationStepResponse> handleAskUser(
            WizardSession session,
            ReservationStepResponse stepResponse) {

        if (stepResponse.getDraft() != null) {
            session.setDraft(stepResponse.getDraft());
        }
        return Mono.just(stepResponse);
    }

    /**
     * Prepends the notice of a SWITCH_STEP response to the prompt of the step
     * it led to, and appends its options. A step entered through a switch has
     * moved the session, so a plain answer becomes ASK_USER.
     */
    private ReservationStepResponse withNotice(ReservationStepResponse response, ReservationStepResponse switchResponse) {
        if (response.getStatus() == ReservationStepResponse.StepStatus.ERROR) {
            return response;
        }
        String notice = switchResponse.getResponse();
        if (notice != null && !notice.isBlank()) {
            response.setResponse(response.getResponse() != null ? notice + "\n\n" + response.getResponse() : notice);
        }
        List<List<PromptOption>> extraOptions = switchResponse.getOptions();
        if (extraOptions != null && !extraOptions.isEmpty()) {
            List<List<PromptOption>> merged = new ArrayList<>(
                    response.getOptions() != null ? response.getOptions() : new ArrayList<>());
            merged.addAll(extraOptions);
            response.setOptions(merged);
        }
        if (response.getStatus() == ReservationStepResponse.StepStatus.ANSWER_USER) {
            response.setStatus(ReservationStepResponse.StepStatus.ASK_USER);
        }
        return response;
    }

    private ReservationStepResponse internalError() {
        return ReservationStepResponse.builder()
                .status(ReservationStepResponse.StepStatus.ERROR)
                .response("Something went wrong. Please try again.")
                .build();
    }

    // Observer notification methods

    private void notifyTransitionStarting(StepTransitionContext context) {
        observers.forEach(observer -> {
            try {
                observer.onTransitionStarting(context);
            } catch (Exception e) {
                log.warn("Error in observer onTransitionStarting", e);
            }
        });
    }

    private void notifyTransitionCompleted(StepTransitionContext context, ReservationStepResponse response) {
        if (response == null) {
            return;
        }
        observers.forEach(observer -> {
            try {
                observer.onTransitionCompleted(context, response);
            } catch (Exception e) {
                log.warn("Error in observer onTransitionCompleted", e);
            }
        });
    }

    private void notifyTransitionRejected(StepTransitionContext context,
            StepTransitionContext.TransitionValidationResult validationResult) {
        observers.forEach(observer -> {
            try {
                observer.onTransitionRejected(context, validationResult);
            } catch (Exception e) {
                log.warn("Error in observer onTransitionRejected", e);
            }
        });
    }

    private void notifyStepEntered(ReservationStep step, StepTransitionContext context) {
        observers.forEach(observer -> {
            try {
                observer.onStepEntered(step, context);
            } catch (Exception e) {
                log.warn("Error in observer onStepEntered", e);
            }
        });
    }

    private void notifyStepExited(ReservationStep step, StepTransitionContext context) {
        observers.forEach(observer -> {
            try {
                observer.onStepExited(step, context);
            } catch (Exception e) {
                log.warn("Error in observer onStepExited", e);
            }
        });
    }

    private void notifySwitchStepIteration(ReservationStep fromStep, ReservationStep toStep, int iteration) {
        observers.forEach(observer -> {
            try {
                observer.onSwitchStepIteration(fromStep, toStep, iteration);
            } catch (Exception e) {
                log.warn("Error in observer onSwitchStepIteration", e);
            }
        });
    }

    private void notifyError(ReservationStep currentStep, Throwable error, StepTransitionContext context) {
        observers.forEach(observer -> {
            try {
                observer.onError(currentStep, error, context);
            } catch (Exception e) {
                log.warn("Error in observer onError", e);
            }
        });
    }
}
