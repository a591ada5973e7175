package com.staydesk.platform.assistant.workflows.reservation.steps;

import java.text.MessageFormat;
import java.util.Locale;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.MessageSource;
import org.springframework.context.NoSuchMessageException;

import com.staydesk.platform.assistant.model.ReservationStepResponse;
import com.staydesk.platform.assistant.model.WizardAction;
import com.staydesk.platform.assistant.model.WizardSession;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Base class for reservation step handlers.
 * Provides message lookup and the extraction of the raw value a user typed or
 * picked.
 */
@Slf4j
public abstract class BaseReservationStepHandler implements ReservationStepHandler {

    protected static final Locale LOCALE = Locale.ENGLISH;

    @Autowired
    protected MessageSource messageSource;

    /**
     * Resolves a user-facing text, falling back to the given default when the
     * key is missing
     */
    protected String message(String key, String fallback, Object... args) {
        try {
            return messageSource.getMessage(key, args, LOCALE);
        } catch (NoSuchMessageException e) {
            log.debug("Message {} not found, using fallback", key);
            return args.length > 0 ? MessageFormat.format(fallback, args) : fallback;
        }
    }

    /**
     * Value carried by a typed text or a step option, null for any other
     * action
     */
    protected String inputValue(WizardAction action) {
        switch (action.getType()) {
            case TEXT:
            case STEP_VALUE:
                return action.getValue() != null ? action.getValue().trim() : null;
            default:
                return null;
        }
    }

    protected Integer parseCount(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Reply for actions the step does not understand (e.g. a calendar page on
     * a counting step)
     */
    protected Mono<ReservationStepResponse> unsupported(WizardAction action, WizardSession session) {
        log.debug("Action {} not handled at step {} for session {}", action.getType(), getStep(),
                session.getSessionId());
        return Mono.just(ReservationStepResponse.answer(
                message("booking.input.unsupported", "Please answer the question above.")));
    }
}
