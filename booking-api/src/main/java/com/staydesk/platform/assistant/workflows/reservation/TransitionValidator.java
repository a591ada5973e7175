package com.staydesk.platform.assistant.workflows.reservation;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.staydesk.platform.assistant.model.ModifyField;
import com.staydesk.platform.assistant.model.ReservationDraft;
import com.staydesk.platform.assistant.model.ReservationStep;

import lombok.extern.slf4j.Slf4j;

/**
 * Validates transitions between steps of the reservation wizard.
 *
 * Two checks are made:
 * - the target is reachable from the current step
 * - the draft carries every field the target step relies on (e.g. the
 * check-out step needs a check-in date, the confirm step a complete draft)
 */
@Component
@Slf4j
public class TransitionValidator {

    /**
     * Key: from step, Value: set of allowed target steps
     */
    private static final Map<ReservationStep, Set<ReservationStep>> ALLOWED_TRANSITIONS = new EnumMap<>(
            ReservationStep.class);

    /**
     * Steps a flow may start on: GUEST_NAME for a new booking, the entry step
     * of a modifiable field otherwise
     */
    private static final Set<ReservationStep> ENTRY_STEPS = EnumSet.of(ReservationStep.GUEST_NAME);

    static {
        // GUEST_NAME moves to the first field still missing; in a modify flow
        // that is usually CONFIRM
        ALLOWED_TRANSITIONS.put(ReservationStep.GUEST_NAME, EnumSet.of(
                ReservationStep.CHECK_IN_DATE,
                ReservationStep.CHECK_OUT_DATE,
                ReservationStep.ROOM_SELECTION,
                ReservationStep.ADULTS_COUNT,
                ReservationStep.CHILDREN_COUNT,
                ReservationStep.AMOUNT_ENTRY,
                ReservationStep.CONFIRM));

        // A new check-in always invalidates the check-out
        ALLOWED_TRANSITIONS.put(ReservationStep.CHECK_IN_DATE, EnumSet.of(
                ReservationStep.CHECK_OUT_DATE));

        // New dates always go through availability
        ALLOWED_TRANSITIONS.put(ReservationStep.CHECK_OUT_DATE, EnumSet.of(
                ReservationStep.ROOM_SELECTION));

        // ROOM_SELECTION can go back to CHECK_IN_DATE when nothing is free
        ALLOWED_TRANSITIONS.put(ReservationStep.ROOM_SELECTION, EnumSet.of(
                ReservationStep.CHECK_IN_DATE,
                ReservationStep.ADULTS_COUNT,
                ReservationStep.CHILDREN_COUNT,
                ReservationStep.AMOUNT_ENTRY,
                ReservationStep.CONFIRM));

        ALLOWED_TRANSITIONS.put(ReservationStep.ADULTS_COUNT, EnumSet.of(
                ReservationStep.CHILDREN_COUNT,
                ReservationStep.AMOUNT_ENTRY,
                ReservationStep.CONFIRM));

        ALLOWED_TRANSITIONS.put(ReservationStep.CHILDREN_COUNT, EnumSet.of(
                ReservationStep.AMOUNT_ENTRY,
                ReservationStep.CONFIRM));

        ALLOWED_TRANSITIONS.put(ReservationStep.AMOUNT_ENTRY, EnumSet.of(
                ReservationStep.CONFIRM));

        ALLOWED_TRANSITIONS.put(ReservationStep.NOTES_ENTRY, EnumSet.of(
                ReservationStep.CONFIRM));

        ALLOWED_TRANSITIONS.put(ReservationStep.CONFIRM, EnumSet.of(
                ReservationStep.COMPLETE_RESERVATION));

        // Commit conflicts roll the wizard back to the step needing a new
        // decision
        ALLOWED_TRANSITIONS.put(ReservationStep.COMPLETE_RESERVATION, EnumSet.of(
                ReservationStep.GUEST_NAME,
                ReservationStep.CHECK_IN_DATE,
                ReservationStep.CHECK_OUT_DATE,
                ReservationStep.ROOM_SELECTION,
                ReservationStep.ADULTS_COUNT,
                ReservationStep.CHILDREN_COUNT,
                ReservationStep.AMOUNT_ENTRY));

        for (ModifyField field : ModifyField.values()) {
            ENTRY_STEPS.add(field.getEntryStep());
        }
    }

    public StepTransitionContext.TransitionValidationResult validateTransition(
            ReservationStep fromStep,
            ReservationStep toStep,
            ReservationDraft draft) {

        if (fromStep == null) {
            if (!ENTRY_STEPS.contains(toStep)) {
                String errorMessage = String.format("A flow cannot start on %s. Entry steps: %s", toStep,
                        ENTRY_STEPS);
                log.warn("❌ Invalid flow start: {}", errorMessage);
                return StepTransitionContext.TransitionValidationResult.invalid("INVALID_ENTRY", errorMessage);
            }
        } else if (!isTransitionAllowed(fromStep, toStep)) {
            String errorMessage = String.format(
                    "Transition from %s to %s is not allowed. Allowed targets: %s",
                    fromStep, toStep, getAllowedTargets(fromStep));
            log.warn("❌ Invalid transition: {}", errorMessage);
            return StepTransitionContext.TransitionValidationResult.invalid("INVALID_TRANSITION", errorMessage);
        }

        return validateRequiredData(toStep, draft);
    }

    /**
     * Validates that required data is present for the target step
     */
    StepTransitionContext.TransitionValidationResult validateRequiredData(
            ReservationStep targetStep,
            ReservationDraft draft) {

        if (draft == null) {
            return StepTransitionContext.TransitionValidationResult.invalid(
                    "MISSING_DRAFT", "a draft is required to enter " + targetStep);
        }
        if (draft.getPropertyId() == null) {
            return StepTransitionContext.TransitionValidationResult.invalid(
                    "MISSING_PROPERTY", "propertyId is required to enter " + targetStep);
        }

        switch (targetStep) {
            case GUEST_NAME:
            case CHECK_IN_DATE:
                return StepTransitionContext.TransitionValidationResult.valid();

            case CHECK_OUT_DATE:
                if (draft.getCheckIn() == null) {
                    return StepTransitionContext.TransitionValidationResult.invalid(
                            "MISSING_CHECK_IN", "checkIn is required to transition to CHECK_OUT_DATE");
                }
                return StepTransitionContext.TransitionValidationResult.valid();

            case ROOM_SELECTION:
                if (!draft.hasValidInterval()) {
                    return StepTransitionContext.TransitionValidationResult.invalid(
                            "INVALID_INTERVAL", "a valid check-in/check-out interval is required to transition"
                                    + " to ROOM_SELECTION");
                }
                return StepTransitionContext.TransitionValidationResult.valid();

            case ADULTS_COUNT:
                if (!draft.hasValidInterval() || draft.getRoomNo() == null) {
                    return StepTransitionContext.TransitionValidationResult.invalid(
                            "MISSING_ROOM", "roomNo is required to transition to ADULTS_COUNT");
                }
                return StepTransitionContext.TransitionValidationResult.valid();

            case CHILDREN_COUNT:
                if (draft.getRoomNo() == null || draft.getAdults() == null) {
                    return StepTransitionContext.TransitionValidationResult.invalid(
                            "MISSING_ADULTS", "adults is required to transition to CHILDREN_COUNT");
                }
                return StepTransitionContext.TransitionValidationResult.valid();

            case AMOUNT_ENTRY:
                if (draft.getAdults() == null || draft.getChildren() == null) {
                    return StepTransitionContext.TransitionValidationResult.invalid(
                            "MISSING_GUESTS", "adults and children are required to transition to AMOUNT_ENTRY");
                }
                return StepTransitionContext.TransitionValidationResult.valid();

            case NOTES_ENTRY:
                if (!draft.isModification()) {
                    return StepTransitionContext.TransitionValidationResult.invalid(
                            "NOT_A_MODIFICATION", "NOTES_ENTRY is only reachable when editing a reservation");
                }
                return StepTransitionContext.TransitionValidationResult.valid();

            case CONFIRM:
            case COMPLETE_RESERVATION:
                ReservationStep missing = draft.firstMissingStep();
                if (missing != ReservationStep.CONFIRM) {
                    return StepTransitionContext.TransitionValidationResult.invalid(
                            "INCOMPLETE_DRAFT",
                            String.format("%s is still missing, cannot transition to %s", missing, targetStep));
                }
                return StepTransitionContext.TransitionValidationResult.valid();

            default:
                return StepTransitionContext.TransitionValidationResult.valid();
        }
    }

    public boolean isTransitionAllowed(ReservationStep fromStep, ReservationStep toStep) {
        Set<ReservationStep> allowedTargets = ALLOWED_TRANSITIONS.get(fromStep);
        return allowedTargets != null && allowedTargets.contains(toStep);
    }

    public Set<ReservationStep> getAllowedTargets(ReservationStep fromStep) {
        return ALLOWED_TRANSITIONS.getOrDefault(fromStep, EnumSet.noneOf(ReservationStep.class));
    }
}
