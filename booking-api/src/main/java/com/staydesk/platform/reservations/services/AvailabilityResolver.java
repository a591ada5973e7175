package com.staydesk.platform.reservations.services;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.staydesk.platform.exceptions.CodedError;
import com.staydesk.platform.exceptions.CodedErrorException;
import com.staydesk.platform.reservations.entities.ReservationEntity;
import com.staydesk.platform.reservations.store.ReservationStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Computes which rooms of a property are free over a half-open date interval
 * [checkIn, checkOut). A reservation being edited can be excluded so that it
 * does not conflict with itself.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AvailabilityResolver {

    private final ReservationStore reservationStore;

    /**
     * Rooms of the property with no overlapping non-cancelled reservation,
     * ordered by room number.
     *
     * @throws CodedErrorException INVALID_INTERVAL when checkOut is not after
     *                             checkIn
     */
    public List<AvailableRoom> resolveAvailability(UUID propertyId, LocalDate checkIn, LocalDate checkOut,
            UUID excludeReservationId) {
        requireValidInterval(checkIn, checkOut);

        Set<String> bookedRooms = findConflicts(propertyId, checkIn, checkOut, excludeReservationId).stream()
                .map(ReservationEntity::getRoomNo)
                .collect(Collectors.toSet());

        List<AvailableRoom> available = reservationStore.queryRoomsForProperty(propertyId).stream()
                .filter(room -> room.isActive())
                .filter(room -> !bookedRooms.contains(room.getRoomNumber()))
                .sorted((a, b) -> a.getRoomNumber().compareTo(b.getRoomNumber()))
                .map(AvailableRoom::from)
                .collect(Collectors.toList());

        log.debug("Availability for property {} {} -> {} (excluding {}): {} free, booked {}",
                propertyId, checkIn, checkOut, excludeReservationId, available.size(), bookedRooms);
        return available;
    }

    public boolean isRoomAvailable(UUID propertyId, String roomNo, LocalDate checkIn, LocalDate checkOut,
            UUID excludeReservationId) {
        return resolveAvailability(propertyId, checkIn, checkOut, excludeReservationId).stream()
                .anyMatch(room -> room.getRoomNo().equals(roomNo));
    }

    /**
     * Non-cancelled reservations overlapping the interval, minus the excluded
     * one. The overlap is re-checked here so the result does not depend on how
     * precisely the store filters.
     */
    public List<ReservationEntity> findConflicts(UUID propertyId, LocalDate checkIn, LocalDate checkOut,
            UUID excludeReservationId) {
        requireValidInterval(checkIn, checkOut);
        return reservationStore.queryOverlappingReservations(propertyId, checkIn, checkOut).stream()
                .filter(reservation -> !reservation.isCancelled())
                .filter(reservation -> !Objects.equals(reservation.getId(), excludeReservationId))
                .filter(reservation -> overlaps(reservation.getCheckIn(), reservation.getCheckOut(), checkIn,
                        checkOut))
                .collect(Collectors.toList());
    }

    /**
     * [a, b) and [c, d) overlap iff a < d and c < b
     */
    public static boolean overlaps(LocalDate a, LocalDate b, LocalDate c, LocalDate d) {
        return a.isBefore(d) && c.isBefore(b);
    }

    private void requireValidInterval(LocalDate checkIn, LocalDate checkOut) {
        if (checkIn == null || checkOut == null || !checkOut.isAfter(checkIn)) {
            throw new CodedErrorException(CodedError.INVALID_INTERVAL, "checkIn", checkIn, "checkOut", checkOut);
        }
    }
}
