package com.staydesk.platform.assistant.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.staydesk.platform.assistant.entities.WizardSessionEntity;
import com.staydesk.platform.assistant.model.FlowType;
import com.staydesk.platform.assistant.model.ReservationDraft;
import com.staydesk.platform.assistant.model.ReservationStep;
import com.staydesk.platform.assistant.model.WizardSession;
import com.staydesk.platform.assistant.repositories.WizardSessionRepository;
import com.staydesk.platform.exceptions.CodedError;
import com.staydesk.platform.exceptions.CodedErrorException;

@ExtendWith(MockitoExtension.class)
@DisplayName("JpaWizardSessionStore Tests")
class JpaWizardSessionStoreTest {

    @Mock
    private WizardSessionRepository sessionRepository;

    private JpaWizardSessionStore store;

    @BeforeEach
    void setUp() {
        store = new JpaWizardSessionStore(sessionRepository, new ObjectMapper().findAndRegisterModules());
    }

    @Test
    @DisplayName("A saved session is read back with the same step and draft")
    void shouldSaveAndLoadSession() {
        // Given
        WizardSession session = WizardSession.builder()
                .sessionId("chat-1")
                .ownerId("user-1")
                .step(ReservationStep.CONFIRM)
                .draft(ReservationDraft.builder()
                        .flowType(FlowType.NEW)
                        .propertyId(UUID.randomUUID())
                        .guestName("Asha Rao")
                        .checkIn(LocalDate.of(2025, 6, 1))
                        .checkOut(LocalDate.of(2025, 6, 3))
                        .roomNo("101")
                        .adults(2)
                        .children(0)
                        .amount(new BigDecimal("4500.50"))
                        .confirmationToken("abcd1234")
                        .build())
                .build();

        // When
        store.save(session);

        // Then
        ArgumentCaptor<WizardSessionEntity> captor = ArgumentCaptor.forClass(WizardSessionEntity.class);
        verify(sessionRepository).save(captor.capture());
        WizardSessionEntity entity = captor.getValue();
        assertEquals("CONFIRM", entity.getStep());
        assertEquals("user-1", entity.getOwnerId());
        assertNotNull(session.getUpdatedAt());

        when(sessionRepository.findById("chat-1")).thenReturn(Optional.of(entity));
        WizardSession loaded = store.load("chat-1").orElseThrow();
        assertEquals(ReservationStep.CONFIRM, loaded.getStep());
        assertEquals(session.getDraft(), loaded.getDraft());
    }

    @Test
    @DisplayName("An unknown sessionId loads as empty")
    void shouldReturnEmptyForUnknownSession() {
        when(sessionRepository.findById("missing")).thenReturn(Optional.empty());

        assertTrue(store.load("missing").isEmpty());
    }

    @Test
    @DisplayName("Storage failures surface as SESSION_STORE_UNAVAILABLE")
    void shouldReportUnavailableStore() {
        // Given
        when(sessionRepository.findById(any())).thenThrow(new DataAccessResourceFailureException("down"));
        doThrow(new DataAccessResourceFailureException("down")).when(sessionRepository).deleteById("chat-1");

        // When / Then
        CodedErrorException loadError = assertThrows(CodedErrorException.class, () -> store.load("chat-1"));
        CodedErrorException deleteError = assertThrows(CodedErrorException.class, () -> store.delete("chat-1"));
        assertEquals(CodedError.SESSION_STORE_UNAVAILABLE, loadError.getError());
        assertEquals(CodedError.SESSION_STORE_UNAVAILABLE, deleteError.getError());
    }

    @Test
    @DisplayName("Unreadable draft JSON is reported as SESSION_CORRUPTED")
    void shouldReportCorruptedDraft() {
        // Given
        when(sessionRepository.findById("chat-1")).thenReturn(Optional.of(entity("CONFIRM", "{not json")));

        // When
        CodedErrorException error = assertThrows(CodedErrorException.class, () -> store.load("chat-1"));

        // Then
        assertEquals(CodedError.SESSION_CORRUPTED, error.getError());
        assertEquals("chat-1", error.getVariables().get("sessionId"));
    }

    @Test
    @DisplayName("An unknown step name is reported as SESSION_CORRUPTED")
    void shouldReportUnknownStep() {
        when(sessionRepository.findById("chat-1")).thenReturn(Optional.of(entity("PAYMENT", "{}")));

        CodedErrorException error = assertThrows(CodedErrorException.class, () -> store.load("chat-1"));

        assertEquals(CodedError.SESSION_CORRUPTED, error.getError());
    }

    private static WizardSessionEntity entity(String step, String data) {
        return WizardSessionEntity.builder()
                .sessionId("chat-1")
                .step(step)
                .data(data)
                .updatedAt(LocalDateTime.now())
                .build();
    }
}
