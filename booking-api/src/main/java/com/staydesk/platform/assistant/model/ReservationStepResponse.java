package com.staydesk.platform.assistant.model;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a step handler: what to tell the user and where the wizard goes
 * next. This is the protocol between step handlers and the state machine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReservationStepResponse {
    /**
     * Status of the step processing
     * - ANSWER_USER: reply without any state change (rejected input, calendar
     * paging, repeated selection)
     * - ASK_USER: reply and wait for input on the current step; the draft, when
     * present, replaces the session draft
     * - SWITCH_STEP: move to nextStep with the given draft; the response text,
     * when present, is prepended to the next step's prompt
     * - CANCEL: the session must be cleared
     * - COMPLETED: reservation committed, the session must be cleared
     * - ERROR: infrastructure failure, the session is left untouched
     */
    private StepStatus status;

    /**
     * Next step when status == SWITCH_STEP
     */
    private ReservationStep nextStep;

    /**
     * Text shown to the user
     */
    private String response;

    @Builder.Default
    private List<List<PromptOption>> options = new ArrayList<>();

    /**
     * Updated draft, null when the step did not change any data
     */
    private ReservationDraft draft;

    /**
     * Reservation written by a COMPLETED step
     */
    private UUID reservationId;

    public enum StepStatus {
        ANSWER_USER,
        ASK_USER,
        SWITCH_STEP,
        CANCEL,
        COMPLETED,
        ERROR
    }

    public static ReservationStepResponse answer(String response) {
        return ReservationStepResponse.builder()
                .status(StepStatus.ANSWER_USER)
                .response(response)
                .build();
    }

    public static ReservationStepResponse switchTo(ReservationStep nextStep, ReservationDraft draft) {
        return ReservationStepResponse.builder()
                .status(StepStatus.SWITCH_STEP)
                .nextStep(nextStep)
                .draft(draft)
                .build();
    }

    public static ReservationStepResponse switchTo(ReservationStep nextStep, ReservationDraft draft,
            String notice) {
        return ReservationStepResponse.builder()
                .status(StepStatus.SWITCH_STEP)
                .nextStep(nextStep)
                .draft(draft)
                .response(notice)
                .build();
    }

    public boolean isCompleted() {
        return status == StepStatus.COMPLETED;
    }

    public boolean isCanceled() {
        return status == StepStatus.CANCEL;
    }

    public boolean isSwitchingStep() {
        return status == StepStatus.SWITCH_STEP;
    }

    public boolean isError() {
        return status == StepStatus.ERROR;
    }

    public WizardPrompt toPrompt() {
        return WizardPrompt.builder()
                .text(response)
                .options(options != null ? options : new ArrayList<>())
                .build();
    }
}
