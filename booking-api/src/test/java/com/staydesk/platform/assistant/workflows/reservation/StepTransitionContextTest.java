package com.staydesk.platform.assistant.workflows.reservation;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.UUID;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.staydesk.platform.assistant.model.ReservationDraft;
import com.staydesk.platform.assistant.model.ReservationStep;
import com.staydesk.platform.assistant.model.ReservationStepResponse;

@DisplayName("StepTransitionContext Tests")
class StepTransitionContextTest {

    @Test
    @DisplayName("A flow start has no source step and carries the draft it was started with")
    void shouldDescribeFlowStart() {
        // Given
        ReservationDraft draft = ReservationDraft.builder().propertyId(UUID.randomUUID()).build();

        // When
        StepTransitionContext context = StepTransitionContext.forFlowStart(ReservationStep.GUEST_NAME, draft)
                .withData("sessionId", "chat-1");

        // Then
        assertTrue(context.isFlowStart());
        assertSame(draft, context.getDraft());
        assertEquals("chat-1", context.getData("sessionId", String.class));
        assertEquals("flow started (NEW)", context.getReason());
    }

    @Test
    @DisplayName("A SWITCH_STEP context exposes the notice and iteration under their types only")
    void shouldExposeTypedDataAndMetadata() {
        // Given
        ReservationDraft draft = ReservationDraft.builder().roomNo("101").build();
        ReservationStepResponse previous = ReservationStepResponse.switchTo(ReservationStep.ADULTS_COUNT, draft);

        // When
        StepTransitionContext context = StepTransitionContext.forSwitchStep(
                ReservationStep.ROOM_SELECTION, ReservationStep.ADULTS_COUNT, previous, "SWITCH_STEP from ROOM_SELECTION")
                .withData("notice", "Room 101 is still available.")
                .withMetadata("iteration", 2);

        // Then
        assertFalse(context.isFlowStart());
        assertSame(draft, context.getDraft());
        assertEquals("Room 101 is still available.", context.getData("notice", String.class));
        assertEquals(2, context.getMetadata("iteration", Integer.class));
        assertNull(context.getData("notice", Integer.class));
        assertNull(context.getMetadata("iteration", String.class));
        assertNull(context.getData("sessionId", String.class));
    }

    @Test
    @DisplayName("The logging observer reads every context shape without failing")
    void shouldLogFlowStartAndSwitchContexts() {
        // Given
        LoggingStateMachineObserver observer = new LoggingStateMachineObserver();
        StepTransitionContext start = StepTransitionContext.forFlowStart(ReservationStep.GUEST_NAME,
                new ReservationDraft());
        StepTransitionContext switched = StepTransitionContext.forSwitchStep(ReservationStep.CHECK_OUT_DATE,
                ReservationStep.ROOM_SELECTION, null, "SWITCH_STEP from CHECK_OUT_DATE")
                .withData("sessionId", "chat-2")
                .withData("notice", "Dates updated.")
                .withMetadata("iteration", 1);
        ReservationStepResponse asked = ReservationStepResponse.builder()
                .status(ReservationStepResponse.StepStatus.ASK_USER)
                .build();

        // When / Then
        assertDoesNotThrow(() -> {
            observer.onTransitionStarting(start);
            observer.onTransitionStarting(switched);
            observer.onTransitionCompleted(switched, asked);
            observer.onTransitionRejected(switched,
                    StepTransitionContext.TransitionValidationResult.invalid("MISSING_ROOM", "roomNo is required"));
        });
    }
}
