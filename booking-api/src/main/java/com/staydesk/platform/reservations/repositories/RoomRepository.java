package com.staydesk.platform.reservations.repositories;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.staydesk.platform.reservations.entities.RoomEntity;

import jakarta.persistence.LockModeType;

@Repository
public interface RoomRepository extends JpaRepository<RoomEntity, UUID> {

        /**
         * Active rooms of a property, in presentation order
         */
        List<RoomEntity> findByPropertyIdAndActiveTrueOrderByRoomNumberAsc(UUID propertyId);

        Optional<RoomEntity> findByPropertyIdAndRoomNumber(UUID propertyId, String roomNumber);

        /**
         * Loads the room row with a write lock held until the surrounding
         * transaction ends. Commits for the same room queue up behind it.
         */
        @Lock(LockModeType.PESSIMISTIC_WRITE)
        @Query("SELECT r FROM RoomEntity r WHERE r.propertyId = :propertyId AND r.roomNumber = :roomNumber")
        Optional<RoomEntity> findForUpdate(
                        @Param("propertyId") UUID propertyId,
                        @Param("roomNumber") String roomNumber);
}
