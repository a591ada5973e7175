package com.staydesk.platform.assistant.services;

import java.security.SecureRandom;
import java.util.HexFormat;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.staydesk.platform.assistant.model.ReservationStep;
import com.staydesk.platform.assistant.model.WizardSession;

import lombok.extern.slf4j.Slf4j;

/**
 * Binds a shown booking summary to the confirm action that may follow it.
 *
 * A token is issued each time the summary is rendered and stored on the
 * session draft. Verification fails closed: no session, a session that is not
 * on the confirm step, no stored token or a different token all fail.
 */
@Component
@Slf4j
public class ConfirmationTokenGuard {

    private final SecureRandom random = new SecureRandom();

    @Value("${staydesk.booking.token-bytes:8}")
    private int tokenBytes;

    public String issue(WizardSession session) {
        byte[] bytes = new byte[Math.max(4, tokenBytes)];
        random.nextBytes(bytes);
        String token = HexFormat.of().formatHex(bytes);
        session.getDraft().setConfirmationToken(token);
        log.debug("Issued confirmation token for session {}", session.getSessionId());
        return token;
    }

    public boolean verify(WizardSession session, String suppliedToken) {
        if (session == null) {
            log.info("Confirmation rejected: no active session");
            return false;
        }
        if (session.getStep() != ReservationStep.CONFIRM) {
            log.info("Confirmation rejected for session {}: session is at {}", session.getSessionId(),
                    session.getStep());
            return false;
        }
        String stored = session.getDraft() != null ? session.getDraft().getConfirmationToken() : null;
        if (stored == null || suppliedToken == null || !stored.equals(suppliedToken)) {
            log.info("Confirmation rejected for session {}: token mismatch", session.getSessionId());
            return false;
        }
        return true;
    }
}
