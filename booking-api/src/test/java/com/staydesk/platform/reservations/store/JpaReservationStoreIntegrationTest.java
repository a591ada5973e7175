package com.staydesk.platform.reservations.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import com.staydesk.platform.BaseIntegrationTest;
import com.staydesk.platform.assistant.model.ReservationDraft;
import com.staydesk.platform.assistant.model.ReservationStep;
import com.staydesk.platform.assistant.model.WizardSession;
import com.staydesk.platform.assistant.repositories.WizardSessionRepository;
import com.staydesk.platform.assistant.store.WizardSessionStore;
import com.staydesk.platform.reservations.entities.ReservationAuditLogEntity;
import com.staydesk.platform.reservations.entities.ReservationEntity;
import com.staydesk.platform.reservations.entities.RoomEntity;
import com.staydesk.platform.reservations.repositories.ReservationAuditLogRepository;
import com.staydesk.platform.reservations.repositories.ReservationRepository;
import com.staydesk.platform.reservations.repositories.RoomRepository;
import com.staydesk.platform.reservations.services.CommitOutcome;
import com.staydesk.platform.reservations.services.ReservationCommitService;

@DisplayName("PostgreSQL store Integration Tests")
class JpaReservationStoreIntegrationTest extends BaseIntegrationTest {

    private static final UUID PROPERTY_ID = UUID.randomUUID();

    @Autowired
    private ReservationStore reservationStore;

    @Autowired
    private WizardSessionStore sessionStore;

    @Autowired
    private ReservationCommitService commitService;

    @Autowired
    private RoomRepository roomRepository;

    @Autowired
    private ReservationRepository reservationRepository;

    @Autowired
    private ReservationAuditLogRepository auditLogRepository;

    @Autowired
    private WizardSessionRepository sessionRepository;

    @BeforeEach
    void setUp() {
        auditLogRepository.deleteAll();
        reservationRepository.deleteAll();
        roomRepository.deleteAll();
        sessionRepository.deleteAll();

        roomRepository.save(RoomEntity.builder()
                .propertyId(PROPERTY_ID)
                .roomNumber("101")
                .roomType("Deluxe")
                .maxOccupancy(2)
                .build());
        roomRepository.save(RoomEntity.builder()
                .propertyId(PROPERTY_ID)
                .roomNumber("102")
                .roomType("Suite")
                .maxOccupancy(4)
                .build());
    }

    @Test
    @DisplayName("Overlap query uses half-open intervals and skips cancelled bookings")
    void shouldQueryOverlapsWithHalfOpenIntervals() {
        // Given
        reservationStore.insertReservation(reservation("101", LocalDate.of(2025, 6, 1), LocalDate.of(2025, 6, 3),
                false));
        reservationStore.insertReservation(reservation("102", LocalDate.of(2025, 6, 2), LocalDate.of(2025, 6, 4),
                true));

        // When
        List<ReservationEntity> sameNights = reservationStore.queryOverlappingReservations(PROPERTY_ID,
                LocalDate.of(2025, 6, 2), LocalDate.of(2025, 6, 5));
        List<ReservationEntity> backToBack = reservationStore.queryOverlappingReservations(PROPERTY_ID,
                LocalDate.of(2025, 6, 3), LocalDate.of(2025, 6, 5));

        // Then
        assertEquals(1, sameNights.size());
        assertEquals("101", sameNights.get(0).getRoomNo());
        assertTrue(backToBack.isEmpty());
        assertEquals(List.of("101", "102"), reservationStore.queryRoomsForProperty(PROPERTY_ID).stream()
                .map(RoomEntity::getRoomNumber)
                .toList());
    }

    @Test
    @DisplayName("A wizard session survives a save and load through the database")
    void shouldPersistWizardSession() {
        // Given
        WizardSession session = WizardSession.builder()
                .sessionId("chat-42")
                .ownerId("user-42")
                .step(ReservationStep.ADULTS_COUNT)
                .draft(draft("Asha Rao", 2))
                .build();
        session.getDraft().setAdults(null);

        // When
        sessionStore.save(session);
        WizardSession loaded = sessionStore.load("chat-42").orElseThrow();
        sessionStore.delete("chat-42");

        // Then
        assertEquals(ReservationStep.ADULTS_COUNT, loaded.getStep());
        assertEquals(session.getDraft(), loaded.getDraft());
        assertTrue(sessionStore.load("chat-42").isEmpty());
    }

    @Test
    @DisplayName("Concurrent commits for the same room and nights leave exactly one booking")
    void shouldSerializeConcurrentCommits() throws Exception {
        // Given
        int contenders = 4;
        ExecutorService executor = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<CommitOutcome>> results = new ArrayList<>();
        for (int i = 0; i < contenders; i++) {
            ReservationDraft draft = draft("Guest " + i, 1);
            Callable<CommitOutcome> commit = () -> {
                start.await();
                return commitService.commit(draft, "integration");
            };
            results.add(executor.submit(commit));
        }

        // When
        start.countDown();
        List<CommitOutcome> outcomes = new ArrayList<>();
        for (Future<CommitOutcome> result : results) {
            outcomes.add(result.get(30, TimeUnit.SECONDS));
        }
        executor.shutdown();

        // Then
        long committed = outcomes.stream().filter(CommitOutcome::isCommitted).count();
        assertEquals(1, committed);
        assertTrue(outcomes.stream()
                .filter(outcome -> !outcome.isCommitted())
                .allMatch(outcome -> outcome.getStatus() == CommitOutcome.Status.ROOM_UNAVAILABLE));
        assertEquals(1, reservationRepository.count());

        UUID reservationId = outcomes.stream().filter(CommitOutcome::isCommitted).findFirst().orElseThrow()
                .getReservationId();
        assertEquals(ReservationAuditLogEntity.CREATED, awaitAuditLog(reservationId).getEventType());
    }

    private ReservationAuditLogEntity awaitAuditLog(UUID reservationId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            List<ReservationAuditLogEntity> logs = auditLogRepository.findByReservationIdOrderByCreatedAtDesc(
                    reservationId);
            if (!logs.isEmpty()) {
                return logs.get(0);
            }
            Thread.sleep(100);
        }
        throw new AssertionError("no audit log written for reservation " + reservationId);
    }

    private static ReservationDraft draft(String guestName, int adults) {
        return ReservationDraft.builder()
                .propertyId(PROPERTY_ID)
                .guestName(guestName)
                .checkIn(LocalDate.of(2025, 6, 1))
                .checkOut(LocalDate.of(2025, 6, 3))
                .roomNo("101")
                .adults(adults)
                .children(0)
                .amount(new BigDecimal("4500.00"))
                .build();
    }

    private static ReservationEntity reservation(String roomNo, LocalDate checkIn, LocalDate checkOut,
            boolean cancelled) {
        return ReservationEntity.builder()
                .propertyId(PROPERTY_ID)
                .guestName("Existing Guest")
                .roomNo(roomNo)
                .checkIn(checkIn)
                .checkOut(checkOut)
                .adults(1)
                .children(0)
                .noOfPax(1)
                .adultChild("1/0")
                .totalAmount(new BigDecimal("1000.00"))
                .cancelled(cancelled)
                .build();
    }
}
