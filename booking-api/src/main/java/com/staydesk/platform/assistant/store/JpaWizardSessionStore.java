package com.staydesk.platform.assistant.store;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.staydesk.platform.assistant.entities.WizardSessionEntity;
import com.staydesk.platform.assistant.model.ReservationDraft;
import com.staydesk.platform.assistant.model.ReservationStep;
import com.staydesk.platform.assistant.model.WizardSession;
import com.staydesk.platform.assistant.repositories.WizardSessionRepository;
import com.staydesk.platform.exceptions.CodedError;
import com.staydesk.platform.exceptions.CodedErrorException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Component
@RequiredArgsConstructor
@Slf4j
public class JpaWizardSessionStore implements WizardSessionStore {

    private final WizardSessionRepository sessionRepository;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<WizardSession> load(String sessionId) {
        Optional<WizardSessionEntity> entity;
        try {
            entity = sessionRepository.findById(sessionId);
        } catch (DataAccessException e) {
            throw new CodedErrorException(CodedError.SESSION_STORE_UNAVAILABLE, e);
        }
        return entity.map(this::toSession);
    }

    @Override
    public void save(WizardSession session) {
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        String data;
        try {
            data = objectMapper.writeValueAsString(session.getDraft());
        } catch (JsonProcessingException e) {
            throw new CodedErrorException(CodedError.INTERNAL_ERROR, e);
        }
        try {
            sessionRepository.save(WizardSessionEntity.builder()
                    .sessionId(session.getSessionId())
                    .ownerId(session.getOwnerId())
                    .step(session.getStep().name())
                    .data(data)
                    .updatedAt(now)
                    .build());
        } catch (DataAccessException e) {
            throw new CodedErrorException(CodedError.SESSION_STORE_UNAVAILABLE, e);
        }
        session.setUpdatedAt(now);
        log.debug("Saved wizard session {} at step {}", session.getSessionId(), session.getStep());
    }

    @Override
    public void delete(String sessionId) {
        try {
            sessionRepository.deleteById(sessionId);
        } catch (DataAccessException e) {
            throw new CodedErrorException(CodedError.SESSION_STORE_UNAVAILABLE, e);
        }
        log.debug("Deleted wizard session {}", sessionId);
    }

    private WizardSession toSession(WizardSessionEntity entity) {
        try {
            return WizardSession.builder()
                    .sessionId(entity.getSessionId())
                    .ownerId(entity.getOwnerId())
                    .step(ReservationStep.valueOf(entity.getStep()))
                    .draft(objectMapper.readValue(entity.getData(), ReservationDraft.class))
                    .updatedAt(entity.getUpdatedAt())
                    .build();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Unreadable wizard session {}: {}", entity.getSessionId(), e.getMessage());
            throw new CodedErrorException(CodedError.SESSION_CORRUPTED,
                    Map.of("sessionId", entity.getSessionId()), e);
        }
    }
}
