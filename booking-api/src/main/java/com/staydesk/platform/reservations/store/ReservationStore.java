package com.staydesk.platform.reservations.store;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.staydesk.platform.reservations.entities.ReservationEntity;
import com.staydesk.platform.reservations.entities.RoomEntity;

/**
 * Storage contract for rooms and reservations used by the booking engine.
 * Implementations translate storage failures into unchecked exceptions.
 */
public interface ReservationStore {

    /**
     * Active rooms of the property ordered by room number
     */
    List<RoomEntity> queryRoomsForProperty(UUID propertyId);

    Optional<RoomEntity> findRoom(UUID propertyId, String roomNo);

    /**
     * Same as {@link #findRoom} but holds an exclusive lock on the room until
     * the current transaction completes
     */
    Optional<RoomEntity> lockRoom(UUID propertyId, String roomNo);

    /**
     * Non-cancelled reservations overlapping the half-open interval
     * [checkIn, checkOut)
     */
    List<ReservationEntity> queryOverlappingReservations(UUID propertyId, LocalDate checkIn, LocalDate checkOut);

    Optional<ReservationEntity> findReservation(UUID reservationId);

    ReservationEntity insertReservation(ReservationEntity reservation);

    /**
     * Applies the booking fields of {@code changes} to the stored reservation
     */
    ReservationEntity updateReservation(UUID reservationId, ReservationEntity changes);
}
