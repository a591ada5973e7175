package com.staydesk.platform.assistant.store;

import java.util.Optional;

import com.staydesk.platform.assistant.model.WizardSession;

/**
 * Durable storage of wizard sessions keyed by sessionId. Saving an existing
 * sessionId replaces it (last writer wins).
 */
public interface WizardSessionStore {

    Optional<WizardSession> load(String sessionId);

    void save(WizardSession session);

    void delete(String sessionId);
}
