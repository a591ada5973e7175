package com.staydesk.platform.assistant.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.staydesk.platform.assistant.entities.WizardSessionEntity;

@Repository
public interface WizardSessionRepository extends JpaRepository<WizardSessionEntity, String> {
}
