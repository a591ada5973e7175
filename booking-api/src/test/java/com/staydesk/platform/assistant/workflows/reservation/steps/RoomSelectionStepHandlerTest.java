package com.staydesk.platform.assistant.workflows.reservation.steps;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import com.staydesk.platform.assistant.TestMessageSources;
import com.staydesk.platform.assistant.model.FlowType;
import com.staydesk.platform.assistant.model.ReservationDraft;
import com.staydesk.platform.assistant.model.ReservationStep;
import com.staydesk.platform.assistant.model.ReservationStepResponse.StepStatus;
import com.staydesk.platform.assistant.model.WizardAction;
import com.staydesk.platform.assistant.model.WizardInput;
import com.staydesk.platform.assistant.model.WizardPrompt;
import com.staydesk.platform.assistant.model.WizardSession;
import com.staydesk.platform.reservations.services.AvailabilityResolver;
import com.staydesk.platform.reservations.services.AvailableRoom;
import com.staydesk.platform.reservations.services.CapacityValidator;

import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
@DisplayName("RoomSelectionStepHandler Tests")
class RoomSelectionStepHandlerTest {

    private static final UUID PROPERTY_ID = UUID.randomUUID();
    private static final LocalDate JUNE_5 = LocalDate.of(2025, 6, 5);
    private static final LocalDate JUNE_7 = LocalDate.of(2025, 6, 7);

    @Mock
    private AvailabilityResolver availabilityResolver;

    @Mock
    private CapacityValidator capacityValidator;

    private RoomSelectionStepHandler handler;
    private WizardSession session;

    @BeforeEach
    void setUp() {
        handler = new RoomSelectionStepHandler();
        ReflectionTestUtils.setField(handler, "messageSource", TestMessageSources.messages());
        ReflectionTestUtils.setField(handler, "availabilityResolver", availabilityResolver);
        ReflectionTestUtils.setField(handler, "capacityValidator", capacityValidator);
        lenient().when(capacityValidator.validate(anyInt(), anyInt(), anyInt())).thenAnswer(invocation -> {
            int adults = invocation.getArgument(0);
            int children = invocation.getArgument(1);
            int capacity = invocation.getArgument(2);
            return adults >= 1 && children >= 0 && adults + children <= capacity;
        });
        session = WizardSession.builder()
                .sessionId("s1")
                .step(ReservationStep.ROOM_SELECTION)
                .draft(ReservationDraft.builder()
                        .propertyId(PROPERTY_ID)
                        .guestName("Asha Rao")
                        .checkIn(JUNE_5)
                        .checkOut(JUNE_7)
                        .build())
                .build();
    }

    @Test
    @DisplayName("Should list the free rooms two per row")
    void shouldListAvailableRooms() {
        // Given
        when(availabilityResolver.resolveAvailability(PROPERTY_ID, JUNE_5, JUNE_7, null))
                .thenReturn(List.of(room("101"), room("102"), room("201")));

        // When / Then
        StepVerifier.create(handler.enter(session))
                .assertNext(response -> {
                    assertEquals(StepStatus.ASK_USER, response.getStatus());
                    assertEquals("Select a room:", response.getResponse());
                    assertEquals(2, response.getOptions().size());
                    assertEquals(List.of("step:ROOM_SELECTION:101", "step:ROOM_SELECTION:102",
                            "step:ROOM_SELECTION:201"), response.toPrompt().payloads());
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("No free room sends the wizard back to check-in with a Start Over option")
    void shouldGoBackToCheckInWhenNothingIsFree() {
        // Given
        when(availabilityResolver.resolveAvailability(PROPERTY_ID, JUNE_5, JUNE_7, null)).thenReturn(List.of());

        // When / Then
        StepVerifier.create(handler.enter(session))
                .assertNext(response -> {
                    assertEquals(StepStatus.SWITCH_STEP, response.getStatus());
                    assertEquals(ReservationStep.CHECK_IN_DATE, response.getNextStep());
                    assertEquals("No rooms available for 2025-06-05 → 2025-06-07", response.getResponse());
                    assertNull(response.getDraft().getCheckIn());
                    assertNull(response.getDraft().getCheckOut());
                    assertEquals("restart", response.getOptions().get(0).get(0).getPayload());
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("A held room that is still free is kept and the wizard moves on")
    void shouldKeepHeldRoomWhenStillFree() {
        // Given
        UUID reservationId = UUID.randomUUID();
        session.setDraft(modification(reservationId).toBuilder().roomNo("101").build());
        when(availabilityResolver.resolveAvailability(PROPERTY_ID, JUNE_5, JUNE_7, reservationId))
                .thenReturn(List.of(room("101")));
        when(capacityValidator.getMaxOccupancy(PROPERTY_ID, "101")).thenReturn(2);

        // When / Then
        StepVerifier.create(handler.enter(session))
                .assertNext(response -> {
                    assertEquals(StepStatus.SWITCH_STEP, response.getStatus());
                    assertEquals(ReservationStep.CONFIRM, response.getNextStep());
                    assertEquals("Room 101 is still available for 2025-06-05 → 2025-06-07.", response.getResponse());
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("A held room that is taken is dropped and the other rooms are offered")
    void shouldForceReselectionWhenHeldRoomIsTaken() {
        // Given
        UUID reservationId = UUID.randomUUID();
        session.setDraft(modification(reservationId).toBuilder().roomNo("101").build());
        when(availabilityResolver.resolveAvailability(PROPERTY_ID, JUNE_5, JUNE_7, reservationId))
                .thenReturn(List.of(room("102")));

        // When / Then
        StepVerifier.create(handler.enter(session))
                .assertNext(response -> {
                    assertEquals(StepStatus.ASK_USER, response.getStatus());
                    assertTrue(response.getResponse().startsWith("Room 101 is not available for 2025-06-05"));
                    assertNull(response.getDraft().getRoomNo());
                    assertEquals(List.of("step:ROOM_SELECTION:102"), response.toPrompt().payloads());
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("A room taken since the list was shown is refused with a refreshed list")
    void shouldRefuseRoomTakenMeanwhile() {
        // Given
        when(availabilityResolver.resolveAvailability(PROPERTY_ID, JUNE_5, JUNE_7, null))
                .thenReturn(List.of(room("102")));

        // When / Then
        StepVerifier.create(handler.handle(selection("step:ROOM_SELECTION:101"), session))
                .assertNext(response -> {
                    assertEquals(StepStatus.ANSWER_USER, response.getStatus());
                    WizardPrompt prompt = response.toPrompt();
                    assertEquals(List.of("step:ROOM_SELECTION:102"), prompt.payloads());
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Picking a smaller room clears guest counts it cannot hold")
    void shouldClearGuestsThatDoNotFit() {
        // Given
        UUID reservationId = UUID.randomUUID();
        session.setDraft(modification(reservationId).toBuilder().roomNo(null).adults(2).children(2).build());
        when(availabilityResolver.resolveAvailability(PROPERTY_ID, JUNE_5, JUNE_7, reservationId))
                .thenReturn(List.of(room("101"), room("102")));
        when(capacityValidator.getMaxOccupancy(any(), any())).thenReturn(3);

        // When / Then
        StepVerifier.create(handler.handle(selection("step:ROOM_SELECTION:101"), session))
                .assertNext(response -> {
                    assertEquals(StepStatus.SWITCH_STEP, response.getStatus());
                    assertEquals(ReservationStep.CHILDREN_COUNT, response.getNextStep());
                    assertEquals("101", response.getDraft().getRoomNo());
                    assertEquals(2, response.getDraft().getAdults());
                    assertNull(response.getDraft().getChildren());
                    assertEquals("Room 101 allows up to 3 guests. Please enter the guest count again.",
                            response.getResponse());
                })
                .verifyComplete();
    }

    private ReservationDraft modification(UUID reservationId) {
        return session.getDraft().toBuilder()
                .flowType(FlowType.MODIFY)
                .editTargetId(reservationId)
                .adults(2)
                .children(0)
                .amount(new BigDecimal("4500"))
                .build();
    }

    private static AvailableRoom room(String roomNo) {
        return AvailableRoom.builder().roomNo(roomNo).roomType("Deluxe").build();
    }

    private static WizardAction selection(String payload) {
        return WizardAction.parse(WizardInput.selection("s1", "u1", payload));
    }
}
