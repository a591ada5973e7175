package com.staydesk.platform.reservations.services;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.staydesk.platform.assistant.model.ReservationDraft;
import com.staydesk.platform.reservations.entities.ReservationEntity;
import com.staydesk.platform.reservations.entities.ReservationStatusForEntity;
import com.staydesk.platform.reservations.entities.RoomEntity;
import com.staydesk.platform.reservations.store.ReservationStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns a completed draft into a reservation row.
 *
 * The room row is locked first, then availability and capacity are checked
 * again against committed data before anything is written. Two commits for
 * the same room therefore run one after the other and the second one sees the
 * first one's reservation. Storage failures propagate and roll the
 * transaction back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReservationCommitService {

    public static final String SOURCE_DIRECT = "direct";

    private final ReservationStore reservationStore;
    private final AvailabilityResolver availabilityResolver;
    private final CapacityValidator capacityValidator;

    @Value("${staydesk.booking.time-zone:Asia/Kolkata}")
    private String timeZone;

    @Value("${staydesk.booking.source-via:telegram}")
    private String sourceVia;

    @Transactional
    public CommitOutcome commit(ReservationDraft draft, String performedBy) {
        if (!isCommittable(draft)) {
            log.warn("Refusing to commit incomplete draft for property {} (step {} missing)",
                    draft.getPropertyId(), draft.firstMissingStep());
            return CommitOutcome.rejected(CommitOutcome.Status.INCOMPLETE_DRAFT);
        }

        ReservationEntity target = null;
        if (draft.isModification()) {
            Optional<ReservationEntity> existing = reservationStore.findReservation(draft.getEditTargetId());
            if (existing.isEmpty() || existing.get().isCancelled()) {
                log.warn("Reservation {} can no longer be modified", draft.getEditTargetId());
                return CommitOutcome.rejected(CommitOutcome.Status.TARGET_UNAVAILABLE);
            }
            target = existing.get();
        }

        Optional<RoomEntity> room = reservationStore.lockRoom(draft.getPropertyId(), draft.getRoomNo());
        if (room.isEmpty() || !room.get().isActive()) {
            log.info("Room {} of property {} no longer exists, rejecting commit", draft.getRoomNo(),
                    draft.getPropertyId());
            return CommitOutcome.rejected(CommitOutcome.Status.ROOM_UNAVAILABLE);
        }

        if (!availabilityResolver.isRoomAvailable(draft.getPropertyId(), draft.getRoomNo(), draft.getCheckIn(),
                draft.getCheckOut(), draft.getEditTargetId())) {
            log.info("Room {} was taken for {} -> {} before commit", draft.getRoomNo(), draft.getCheckIn(),
                    draft.getCheckOut());
            return CommitOutcome.rejected(CommitOutcome.Status.ROOM_UNAVAILABLE);
        }

        int capacity = capacityValidator.capacityOf(room.get());
        if (!capacityValidator.validate(draft.getAdults(), draft.getChildren(), capacity)) {
            log.info("Guests {}/{} exceed capacity {} of room {}", draft.getAdults(), draft.getChildren(), capacity,
                    draft.getRoomNo());
            return CommitOutcome.builder()
                    .status(CommitOutcome.Status.CAPACITY_EXCEEDED)
                    .capacity(capacity)
                    .build();
        }

        ReservationEntity saved;
        String previousSummary = null;
        if (target != null) {
            previousSummary = describe(target);
            saved = reservationStore.updateReservation(target.getId(), toReservation(draft, performedBy));
            log.info("Updated reservation {}: room {} {} -> {}", saved.getId(), saved.getRoomNo(),
                    saved.getCheckIn(), saved.getCheckOut());
        } else {
            saved = reservationStore.insertReservation(toReservation(draft, performedBy));
            log.info("Created reservation {}: room {} {} -> {}", saved.getId(), saved.getRoomNo(),
                    saved.getCheckIn(), saved.getCheckOut());
        }

        return CommitOutcome.builder()
                .status(CommitOutcome.Status.COMMITTED)
                .reservation(saved)
                .modification(target != null)
                .previousSummary(previousSummary)
                .capacity(capacity)
                .build();
    }

    /**
     * Non-empty name, room, valid interval, at least one adult, no negative
     * children, non-negative amount
     */
    public boolean isCommittable(ReservationDraft draft) {
        return draft.getPropertyId() != null
                && draft.getGuestName() != null && !draft.getGuestName().isBlank()
                && draft.getRoomNo() != null && !draft.getRoomNo().isBlank()
                && draft.hasValidInterval()
                && draft.getAdults() != null && draft.getAdults() >= 1
                && draft.getChildren() != null && draft.getChildren() >= 0
                && draft.getAmount() != null && draft.getAmount().signum() >= 0;
    }

    private ReservationEntity toReservation(ReservationDraft draft, String performedBy) {
        int adults = draft.getAdults();
        int children = draft.getChildren();
        return ReservationEntity.builder()
                .propertyId(draft.getPropertyId())
                .guestName(draft.getGuestName().trim())
                .roomNo(draft.getRoomNo())
                .checkIn(draft.getCheckIn())
                .checkOut(draft.getCheckOut())
                .adults(adults)
                .children(children)
                .noOfPax(adults + children)
                .adultChild(ReservationEntity.composeAdultChild(adults, children))
                .totalAmount(draft.getAmount())
                .notes(draft.getNotes())
                .status(ReservationStatusForEntity.CONFIRMED)
                .cancelled(false)
                .bookingDate(LocalDate.now(ZoneId.of(timeZone)))
                .source(SOURCE_DIRECT)
                .sourceVia(sourceVia)
                .createdBy(performedBy)
                .build();
    }

    public static String describe(ReservationEntity reservation) {
        return describe(reservation.getGuestName(), reservation.getRoomNo(), reservation.getCheckIn(),
                reservation.getCheckOut(), reservation.getAdults(), reservation.getChildren(),
                reservation.getTotalAmount());
    }

    public static String describe(String guestName, String roomNo, LocalDate checkIn, LocalDate checkOut,
            int adults, int children, BigDecimal amount) {
        return String.format("%s, room %s, %s → %s, %d/%d, %s", guestName, roomNo, checkIn, checkOut, adults,
                children, amount != null ? amount.toPlainString() : "-");
    }
}
