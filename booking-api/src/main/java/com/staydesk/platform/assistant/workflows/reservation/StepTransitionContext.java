package com.staydesk.platform.assistant.workflows.reservation;

import java.util.HashMap;
import java.util.Map;

import com.staydesk.platform.assistant.model.ReservationDraft;
import com.staydesk.platform.assistant.model.ReservationStep;
import com.staydesk.platform.assistant.model.ReservationStepResponse;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Context of one state transition in the reservation wizard.
 *
 * Carries the draft the target step will receive, the reason of the
 * transition and metadata such as the SWITCH_STEP iteration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepTransitionContext {

    /**
     * Source step, null when a flow is being started
     */
    private ReservationStep fromStep;

    private ReservationStep toStep;

    /**
     * Reason for the transition (e.g. "SWITCH_STEP from CHECK_OUT_DATE",
     * "flow started")
     */
    private String reason;

    /**
     * Response of the step that triggered this transition
     */
    private ReservationStepResponse previousResponse;

    /**
     * Draft handed to the target step
     */
    private ReservationDraft draft;

    /**
     * Common keys:
     * - "sessionId": conversation being processed
     * - "notice": text prepended to the target step's prompt
     */
    @Builder.Default
    private Map<String, Object> data = new HashMap<>();

    /**
     * Common keys:
     * - "iteration": current iteration in the SWITCH_STEP loop
     */
    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    private TransitionValidationResult validationResult;

    public static StepTransitionContext forSwitchStep(
            ReservationStep fromStep,
            ReservationStep toStep,
            ReservationStepResponse previousResponse,
            String reason) {
        return StepTransitionContext.builder()
                .fromStep(fromStep)
                .toStep(toStep)
                .reason(reason)
                .previousResponse(previousResponse)
                .draft(previousResponse != null ? previousResponse.getDraft() : null)
                .data(new HashMap<>())
                .metadata(new HashMap<>())
                .build();
    }

    public static StepTransitionContext forFlowStart(ReservationStep entryStep, ReservationDraft draft) {
        return StepTransitionContext.builder()
                .toStep(entryStep)
                .reason("flow started (" + draft.getFlowType() + ")")
                .draft(draft)
                .data(new HashMap<>())
                .metadata(new HashMap<>())
                .build();
    }

    public boolean isFlowStart() {
        return fromStep == null;
    }

    public StepTransitionContext withData(String key, Object value) {
        if (this.data == null) {
            this.data = new HashMap<>();
        }
        this.data.put(key, value);
        return this;
    }

    public StepTransitionContext withMetadata(String key, Object value) {
        if (this.metadata == null) {
            this.metadata = new HashMap<>();
        }
        this.metadata.put(key, value);
        return this;
    }

    @SuppressWarnings("unchecked")
    public <T> T getData(String key, Class<T> type) {
        if (data == null) {
            return null;
        }
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (type.isInstance(value)) {
            return (T) value;
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    public <T> T getMetadata(String key, Class<T> type) {
        if (metadata == null) {
            return null;
        }
        Object value = metadata.get(key);
        if (type.isInstance(value)) {
            return (T) value;
        }
        return null;
    }

    /**
     * Result of transition validation
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TransitionValidationResult {
        private boolean valid;
        private String errorMessage;
        private String errorCode;

        public static TransitionValidationResult valid() {
            return TransitionValidationResult.builder()
                    .valid(true)
                    .build();
        }

        public static TransitionValidationResult invalid(String errorCode, String errorMessage) {
            return TransitionValidationResult.builder()
                    .valid(false)
                    .errorCode(errorCode)
                    .errorMessage(errorMessage)
                    .build();
        }
    }
}
