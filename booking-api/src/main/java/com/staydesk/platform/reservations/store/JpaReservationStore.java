package com.staydesk.platform.reservations.store;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import com.staydesk.platform.exceptions.CodedError;
import com.staydesk.platform.exceptions.CodedErrorException;
import com.staydesk.platform.reservations.entities.ReservationEntity;
import com.staydesk.platform.reservations.entities.RoomEntity;
import com.staydesk.platform.reservations.repositories.ReservationRepository;
import com.staydesk.platform.reservations.repositories.RoomRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Component
@RequiredArgsConstructor
@Slf4j
public class JpaReservationStore implements ReservationStore {

    private final RoomRepository roomRepository;
    private final ReservationRepository reservationRepository;

    @Override
    public List<RoomEntity> queryRoomsForProperty(UUID propertyId) {
        return translate(() -> roomRepository.findByPropertyIdAndActiveTrueOrderByRoomNumberAsc(propertyId));
    }

    @Override
    public Optional<RoomEntity> findRoom(UUID propertyId, String roomNo) {
        return translate(() -> roomRepository.findByPropertyIdAndRoomNumber(propertyId, roomNo));
    }

    @Override
    public Optional<RoomEntity> lockRoom(UUID propertyId, String roomNo) {
        log.debug("Locking room {} of property {}", roomNo, propertyId);
        return translate(() -> roomRepository.findForUpdate(propertyId, roomNo));
    }

    @Override
    public List<ReservationEntity> queryOverlappingReservations(UUID propertyId, LocalDate checkIn,
            LocalDate checkOut) {
        return translate(() -> reservationRepository.findOverlapping(propertyId, checkIn, checkOut));
    }

    @Override
    public Optional<ReservationEntity> findReservation(UUID reservationId) {
        return translate(() -> reservationRepository.findById(reservationId));
    }

    @Override
    public ReservationEntity insertReservation(ReservationEntity reservation) {
        return translate(() -> reservationRepository.save(reservation));
    }

    @Override
    public ReservationEntity updateReservation(UUID reservationId, ReservationEntity changes) {
        ReservationEntity existing = translate(() -> reservationRepository.findById(reservationId))
                .orElseThrow(() -> new CodedErrorException(CodedError.RESERVATION_NOT_FOUND, "reservationId",
                        reservationId));
        existing.setGuestName(changes.getGuestName());
        existing.setRoomNo(changes.getRoomNo());
        existing.setCheckIn(changes.getCheckIn());
        existing.setCheckOut(changes.getCheckOut());
        existing.setAdults(changes.getAdults());
        existing.setChildren(changes.getChildren());
        existing.setNoOfPax(changes.getNoOfPax());
        existing.setAdultChild(changes.getAdultChild());
        existing.setTotalAmount(changes.getTotalAmount());
        existing.setNotes(changes.getNotes());
        return translate(() -> reservationRepository.save(existing));
    }

    /**
     * Runs one repository call, reporting data-access failures as
     * RESERVATION_STORE_UNAVAILABLE
     */
    private <T> T translate(Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            log.error("Reservation store call failed: {}", e.getMessage());
            throw new CodedErrorException(CodedError.RESERVATION_STORE_UNAVAILABLE, e);
        }
    }
}
