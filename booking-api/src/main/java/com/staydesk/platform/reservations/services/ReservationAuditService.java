package com.staydesk.platform.reservations.services;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.staydesk.platform.reservations.entities.ReservationAuditLogEntity;
import com.staydesk.platform.reservations.repositories.ReservationAuditLogRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Audit trail of reservations written by the booking assistant. Failures
 * propagate to the caller.
 */
@Service
@Transactional
@Slf4j
@RequiredArgsConstructor
public class ReservationAuditService {

    private static final String UNKNOWN_ACTOR = "unknown";

    private final ReservationAuditLogRepository auditLogRepository;

    public ReservationAuditLogEntity logCreated(UUID reservationId, String summary, String performedBy) {
        return record(ReservationAuditLogEntity.builder()
                .reservationId(reservationId)
                .eventType(ReservationAuditLogEntity.CREATED)
                .newValue(summary)
                .logMessage("Reservation created from the booking assistant.")
                .performedBy(performedBy));
    }

    public ReservationAuditLogEntity logModified(UUID reservationId, String oldSummary, String newSummary,
            String performedBy) {
        return record(ReservationAuditLogEntity.builder()
                .reservationId(reservationId)
                .eventType(ReservationAuditLogEntity.MODIFIED)
                .oldValue(oldSummary)
                .newValue(newSummary)
                .logMessage(String.format("Reservation modified from [%s] to [%s]", oldSummary, newSummary))
                .performedBy(performedBy));
    }

    private ReservationAuditLogEntity record(ReservationAuditLogEntity.ReservationAuditLogEntityBuilder entry) {
        ReservationAuditLogEntity auditLog = entry.build();
        if (auditLog.getPerformedBy() == null) {
            auditLog.setPerformedBy(UNKNOWN_ACTOR);
        }
        auditLog.setCreatedAt(LocalDateTime.now(ZoneOffset.UTC));

        ReservationAuditLogEntity saved = auditLogRepository.save(auditLog);
        log.debug("Audit {} recorded for reservation {} by {}", auditLog.getEventType(),
                auditLog.getReservationId(), auditLog.getPerformedBy());
        return saved;
    }
}
