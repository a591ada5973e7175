package com.staydesk.platform.assistant.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.MessageSource;

import com.staydesk.platform.assistant.TestMessageSources;
import com.staydesk.platform.assistant.model.FlowType;
import com.staydesk.platform.assistant.model.ModifyField;
import com.staydesk.platform.assistant.model.ReservationDraft;
import com.staydesk.platform.assistant.model.ReservationStep;
import com.staydesk.platform.assistant.model.WizardPrompt;
import com.staydesk.platform.reservations.entities.ReservationEntity;
import com.staydesk.platform.reservations.store.ReservationStore;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReservationMenuService Tests")
class ReservationMenuServiceTest {

    @Mock
    private ReservationStore reservationStore;

    private ReservationMenuService menuService;
    private ReservationEntity reservation;

    @BeforeEach
    void setUp() {
        MessageSource messages = TestMessageSources.messages();
        menuService = new ReservationMenuService(reservationStore, new ReservationSummaryFormatter(messages),
                messages);
        reservation = ReservationEntity.builder()
                .id(UUID.randomUUID())
                .propertyId(UUID.randomUUID())
                .guestName("Asha Rao")
                .roomNo("101")
                .checkIn(LocalDate.of(2025, 6, 1))
                .checkOut(LocalDate.of(2025, 6, 3))
                .adults(2)
                .children(1)
                .totalAmount(new BigDecimal("4500"))
                .notes("Late arrival")
                .build();
    }

    @Test
    @DisplayName("Should show the booking details with Modify and Done")
    void shouldShowReservation() {
        // Given
        when(reservationStore.findReservation(reservation.getId())).thenReturn(Optional.of(reservation));

        // When
        WizardPrompt prompt = menuService.showReservation(reservation.getId());

        // Then
        assertTrue(prompt.getText().startsWith("Booking " + reservation.getId()));
        assertTrue(prompt.getText().contains("Guest: Asha Rao"));
        assertTrue(prompt.getText().contains("Dates: 2025-06-01 → 2025-06-03"));
        assertTrue(prompt.getText().contains("Guests: 3 (2/1)"));
        assertTrue(prompt.getText().contains("Notes: Late arrival"));
        assertTrue(prompt.getText().endsWith("Status: CONFIRMED"));
        assertEquals(List.of("modify:" + reservation.getId(), "done"), prompt.payloads());
    }

    @Test
    @DisplayName("A cancelled booking is shown without the Modify option")
    void shouldHideModifyForCancelledReservation() {
        // Given
        reservation.setCancelled(true);
        when(reservationStore.findReservation(reservation.getId())).thenReturn(Optional.of(reservation));

        // When
        WizardPrompt prompt = menuService.showReservation(reservation.getId());

        // Then
        assertTrue(prompt.getText().endsWith("Status: Cancelled"));
        assertEquals(List.of("done"), prompt.payloads());
    }

    @Test
    @DisplayName("The modify menu lists the seven fields and a way back")
    void shouldListModifiableFields() {
        // Given
        when(reservationStore.findReservation(reservation.getId())).thenReturn(Optional.of(reservation));

        // When
        WizardPrompt prompt = menuService.modifyMenu(reservation.getId());

        // Then
        assertEquals("What would you like to change?", prompt.getText());
        List<String> payloads = prompt.payloads();
        assertEquals(8, payloads.size());
        for (ModifyField field : ModifyField.values()) {
            assertTrue(payloads.contains("modify:" + reservation.getId() + ":" + field.name()));
        }
        assertEquals("show:" + reservation.getId(), payloads.get(7));
    }

    @Test
    @DisplayName("Unknown bookings are reported as not found")
    void shouldReportMissingReservation() {
        // Given
        UUID unknown = UUID.randomUUID();
        when(reservationStore.findReservation(unknown)).thenReturn(Optional.empty());

        // When / Then
        assertEquals("Booking " + unknown + " not found.", menuService.showReservation(unknown).getText());
    }

    @Test
    @DisplayName("A modification draft copies the booking and clears the edited field")
    void shouldBuildModificationDraft() {
        // When
        ReservationDraft dates = menuService.modificationDraft(reservation, ModifyField.DATES);
        ReservationDraft adults = menuService.modificationDraft(reservation, ModifyField.ADULTS);
        ReservationDraft notes = menuService.modificationDraft(reservation, ModifyField.NOTES);

        // Then
        assertEquals(FlowType.MODIFY, dates.getFlowType());
        assertEquals(reservation.getId(), dates.getEditTargetId());
        assertTrue(dates.isModification());
        assertNull(dates.getCheckIn());
        assertNull(dates.getCheckOut());
        assertEquals("101", dates.getRoomNo());
        assertEquals(ReservationStep.CHECK_IN_DATE, dates.firstMissingStep());

        assertNull(adults.getAdults());
        assertEquals(1, adults.getChildren());
        assertEquals(ReservationStep.ADULTS_COUNT, adults.firstMissingStep());

        assertEquals("Late arrival", notes.getNotes());
        assertEquals(ReservationStep.CONFIRM, notes.firstMissingStep());
        assertFalse(notes.getAmount() == null);
    }
}
