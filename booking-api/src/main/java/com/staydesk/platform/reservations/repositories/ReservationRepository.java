package com.staydesk.platform.reservations.repositories;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.staydesk.platform.reservations.entities.ReservationEntity;

@Repository
public interface ReservationRepository extends JpaRepository<ReservationEntity, UUID> {

        /**
         * Non-cancelled reservations of a property whose [checkIn, checkOut)
         * interval overlaps the given one
         */
        @Query("SELECT r FROM ReservationEntity r WHERE " +
                        "r.propertyId = :propertyId " +
                        "AND r.cancelled = false " +
                        "AND r.checkIn < :checkOut AND r.checkOut > :checkIn " +
                        "ORDER BY r.roomNo, r.checkIn")
        List<ReservationEntity> findOverlapping(
                        @Param("propertyId") UUID propertyId,
                        @Param("checkIn") LocalDate checkIn,
                        @Param("checkOut") LocalDate checkOut);
}
