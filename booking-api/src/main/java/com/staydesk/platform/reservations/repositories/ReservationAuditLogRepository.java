package com.staydesk.platform.reservations.repositories;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.staydesk.platform.reservations.entities.ReservationAuditLogEntity;

@Repository
public interface ReservationAuditLogRepository extends JpaRepository<ReservationAuditLogEntity, UUID> {

    /**
     * Audit trail of a reservation, newest first
     */
    @Query("SELECT ral FROM ReservationAuditLogEntity ral WHERE ral.reservationId = :reservationId ORDER BY ral.createdAt DESC")
    List<ReservationAuditLogEntity> findByReservationIdOrderByCreatedAtDesc(@Param("reservationId") UUID reservationId);
}
