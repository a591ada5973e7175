package com.staydesk.platform.assistant.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

@DisplayName("ReservationDraft Tests")
class ReservationDraftTest {

    @Test
    @DisplayName("firstMissingStep walks the fields in dialogue order")
    void shouldFindFirstMissingStep() {
        ReservationDraft draft = ReservationDraft.builder().propertyId(UUID.randomUUID()).build();
        assertEquals(ReservationStep.GUEST_NAME, draft.firstMissingStep());

        draft = draft.toBuilder().guestName("Asha").build();
        assertEquals(ReservationStep.CHECK_IN_DATE, draft.firstMissingStep());

        draft = draft.toBuilder().checkIn(LocalDate.of(2025, 6, 1)).build();
        assertEquals(ReservationStep.CHECK_OUT_DATE, draft.firstMissingStep());

        draft = draft.toBuilder().checkOut(LocalDate.of(2025, 6, 3)).build();
        assertEquals(ReservationStep.ROOM_SELECTION, draft.firstMissingStep());

        draft = draft.toBuilder().roomNo("101").build();
        assertEquals(ReservationStep.ADULTS_COUNT, draft.firstMissingStep());

        draft = draft.toBuilder().adults(2).build();
        assertEquals(ReservationStep.CHILDREN_COUNT, draft.firstMissingStep());

        draft = draft.toBuilder().children(0).build();
        assertEquals(ReservationStep.AMOUNT_ENTRY, draft.firstMissingStep());

        draft = draft.toBuilder().amount(BigDecimal.TEN).build();
        assertEquals(ReservationStep.CONFIRM, draft.firstMissingStep());
    }

    @Test
    @DisplayName("A modification needs both the MODIFY flow type and a target")
    void shouldDetectModification() {
        assertFalse(ReservationDraft.builder().flowType(FlowType.MODIFY).build().isModification());
        assertTrue(ReservationDraft.builder().flowType(FlowType.MODIFY).editTargetId(UUID.randomUUID()).build()
                .isModification());
    }

    @Test
    @DisplayName("valueFor renders values the way selection payloads carry them")
    void shouldRenderStepValues() {
        ReservationDraft draft = ReservationDraft.builder()
                .checkIn(LocalDate.of(2025, 6, 1))
                .roomNo("101")
                .adults(2)
                .build();

        assertEquals("2025-06-01", draft.valueFor(ReservationStep.CHECK_IN_DATE));
        assertEquals("101", draft.valueFor(ReservationStep.ROOM_SELECTION));
        assertEquals("2", draft.valueFor(ReservationStep.ADULTS_COUNT));
        assertNull(draft.valueFor(ReservationStep.CHILDREN_COUNT));
        assertNull(draft.valueFor(ReservationStep.CONFIRM));
    }

    @Test
    @DisplayName("Should survive a JSON round trip through the session store's mapper")
    void shouldSerializeWithJackson() throws Exception {
        // Given
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        ReservationDraft draft = ReservationDraft.builder()
                .flowType(FlowType.MODIFY)
                .modifyField(ModifyField.DATES)
                .editTargetId(UUID.randomUUID())
                .propertyId(UUID.randomUUID())
                .guestName("Asha Rao")
                .checkIn(LocalDate.of(2025, 6, 1))
                .amount(new BigDecimal("4500.50"))
                .confirmationToken("0a1b2c3d")
                .build();

        // When
        String json = objectMapper.writeValueAsString(draft);
        ReservationDraft restored = objectMapper.readValue(json, ReservationDraft.class);

        // Then
        assertEquals(draft, restored);
        assertFalse(json.contains("modification"));
    }
}
