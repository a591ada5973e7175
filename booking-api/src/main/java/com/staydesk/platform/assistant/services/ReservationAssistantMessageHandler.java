package com.staydesk.platform.assistant.services;

import java.text.MessageFormat;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.MessageSource;
import org.springframework.context.NoSuchMessageException;
import org.springframework.stereotype.Service;

import com.staydesk.platform.assistant.model.ReservationDraft;
import com.staydesk.platform.assistant.model.ReservationStep;
import com.staydesk.platform.assistant.model.ReservationStepResponse;
import com.staydesk.platform.assistant.model.WizardAction;
import com.staydesk.platform.assistant.model.WizardInput;
import com.staydesk.platform.assistant.model.WizardPrompt;
import com.staydesk.platform.assistant.model.WizardSession;
import com.staydesk.platform.assistant.store.WizardSessionStore;
import com.staydesk.platform.assistant.workflows.reservation.ReservationStateMachine;
import com.staydesk.platform.assistant.workflows.reservation.steps.ReservationStepHandler;
import com.staydesk.platform.exceptions.CodedError;
import com.staydesk.platform.exceptions.CodedErrorException;
import com.staydesk.platform.reservations.entities.ReservationEntity;
import com.staydesk.platform.reservations.store.ReservationStore;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Entry point of the booking assistant: one call per inbound user action.
 *
 * Loads the conversation's session, routes the action (global commands here,
 * step input to the state machine) and then saves, deletes or leaves the
 * session depending on the outcome. Any failure while doing so is answered
 * with a generic message and the stored session is left as it was, so the
 * same input can be sent again.
 */
@Service
@Slf4j
public class ReservationAssistantMessageHandler {

    static final String TRACE_ID = "traceId";
    private static final Locale LOCALE = Locale.ENGLISH;

    private final WizardSessionStore sessionStore;
    private final ReservationStore reservationStore;
    private final ReservationStateMachine stateMachine;
    private final ReservationMenuService menuService;
    private final MessageSource messageSource;
    private final Map<ReservationStep, ReservationStepHandler> stepHandlers;

    @Value("${staydesk.booking.default-property-id:}")
    private String defaultPropertyId;

    public ReservationAssistantMessageHandler(
            WizardSessionStore sessionStore,
            ReservationStore reservationStore,
            ReservationStateMachine stateMachine,
            ReservationMenuService menuService,
            MessageSource messageSource,
            List<ReservationStepHandler> stepHandlers) {
        this.sessionStore = sessionStore;
        this.reservationStore = reservationStore;
        this.stateMachine = stateMachine;
        this.menuService = menuService;
        this.messageSource = messageSource;
        this.stepHandlers = new HashMap<>();
        if (stepHandlers != null) {
            for (ReservationStepHandler handler : stepHandlers) {
                this.stepHandlers.put(handler.getStep(), handler);
            }
        }
    }

    public Mono<WizardPrompt> handleMessage(WizardInput input) {
        return Mono.deferContextual(ctx -> {
            String traceId = ctx.getOrDefault(TRACE_ID, UUID.randomUUID().toString());
            return Mono.defer(() -> route(input))
                    .onErrorResume(error -> Mono.just(failure(input, error)))
                    .doFirst(() -> MDC.put(TRACE_ID, traceId))
                    .doFinally(signal -> MDC.remove(TRACE_ID));
        });
    }

    private Mono<WizardPrompt> route(WizardInput input) {
        WizardAction action = WizardAction.parse(input);
        log.info("📨 Session {}: {} action", input.getSessionId(), action.getType());

        switch (action.getType()) {
            case START_NEW:
                return startNewFlow(input);

            case RESTART:
                sessionStore.delete(input.getSessionId());
                return Mono.just(WizardPrompt.text(message("booking.wizard.cancelled",
                        "Booking wizard cancelled. Use /book to start over.")));

            case DECLINE:
                sessionStore.delete(input.getSessionId());
                return Mono.just(WizardPrompt.text(message("booking.declined", "Booking cancelled.")));

            case NOOP:
                return Mono.just(new WizardPrompt());

            case SHOW_RESERVATION:
                return Mono.fromCallable(() -> menuService.showReservation(action.getReservationId()));

            case MODIFY_MENU:
                return Mono.fromCallable(() -> menuService.modifyMenu(action.getReservationId()));

            case DONE:
                return Mono.just(menuService.done());

            case START_MODIFY:
                return startModifyFlow(input, action);

            case UNKNOWN:
                return Mono.just(WizardPrompt.text(message("booking.option.unknown",
                        "Sorry, that option is not valid anymore.")));

            default:
                return continueFlow(input, action);
        }
    }

    /**
     * /book: a new session on GUEST_NAME, replacing whatever the conversation
     * had before
     */
    private Mono<WizardPrompt> startNewFlow(WizardInput input) {
        UUID propertyId = resolvePropertyId(input);
        if (propertyId == null) {
            log.warn("No property for session {}, cannot start a booking", input.getSessionId());
            return Mono.just(WizardPrompt.text(message("booking.property.missing",
                    "No property is configured for this conversation.")));
        }

        WizardSession session = WizardSession.builder()
                .sessionId(input.getSessionId())
                .ownerId(input.getOwnerId())
                .draft(ReservationDraft.builder().propertyId(propertyId).build())
                .build();
        return stateMachine.startFlow(session, ReservationStep.GUEST_NAME, stepHandlers)
                .map(response -> applyOutcome(session, response));
    }

    private Mono<WizardPrompt> startModifyFlow(WizardInput input, WizardAction action) {
        Optional<ReservationEntity> reservation = reservationStore.findReservation(action.getReservationId());
        if (reservation.isEmpty()) {
            return Mono.just(menuService.notFound(action.getReservationId()));
        }
        if (reservation.get().isCancelled()) {
            return Mono.just(WizardPrompt.text(message("booking.modify.cancelled",
                    "This booking is cancelled and cannot be modified.")));
        }

        WizardSession session = WizardSession.builder()
                .sessionId(input.getSessionId())
                .ownerId(input.getOwnerId())
                .draft(menuService.modificationDraft(reservation.get(), action.getField()))
                .build();
        log.info("Modifying {} of reservation {} in session {}", action.getField(), action.getReservationId(),
                input.getSessionId());
        return stateMachine.startFlow(session, action.getField().getEntryStep(), stepHandlers)
                .map(response -> applyOutcome(session, response));
    }

    private Mono<WizardPrompt> continueFlow(WizardInput input, WizardAction action) {
        Optional<WizardSession> loaded = sessionStore.load(input.getSessionId());

        if (action.getType() == WizardAction.ActionType.CONFIRM
                && (loaded.isEmpty() || loaded.get().getStep() != ReservationStep.CONFIRM)) {
            // the summary being confirmed is not the one on record anymore
            log.info("Stale confirmation for session {} ignored", input.getSessionId());
            return Mono.just(WizardPrompt.text(message("booking.confirm.expired",
                    "Confirmation expired. Please /book again.")));
        }
        if (loaded.isEmpty()) {
            return Mono.just(WizardPrompt.text(message("booking.no-session",
                    "No booking in progress. Use /book to start.")));
        }

        WizardSession session = loaded.get();
        return stateMachine.processAction(session, action, stepHandlers)
                .map(response -> applyOutcome(session, response));
    }

    /**
     * Persists what the final status says about the session
     */
    private WizardPrompt applyOutcome(WizardSession session, ReservationStepResponse response) {
        switch (response.getStatus()) {
            case ASK_USER:
                session.setUpdatedAt(LocalDateTime.now(ZoneOffset.UTC));
                sessionStore.save(session);
                break;
            case COMPLETED:
            case CANCEL:
                sessionStore.delete(session.getSessionId());
                break;
            case ERROR:
                log.error("Session {} stopped with an error at step {}", session.getSessionId(), session.getStep());
                break;
            case ANSWER_USER:
            default:
                break;
        }
        return response.toPrompt();
    }

    private WizardPrompt failure(WizardInput input, Throwable error) {
        if (error instanceof CodedErrorException) {
            CodedError coded = ((CodedErrorException) error).getError();
            log.error("❌ {} ({}) while handling session {}: {}", coded, coded.getCode(), input.getSessionId(),
                    ((CodedErrorException) error).getVariables(), error);
        } else {
            log.error("❌ Unexpected failure while handling session {}", input.getSessionId(), error);
        }
        return WizardPrompt.text(message("booking.error.generic", "Something went wrong. Please try again."));
    }

    private UUID resolvePropertyId(WizardInput input) {
        if (input.getPropertyId() != null) {
            return input.getPropertyId();
        }
        if (defaultPropertyId == null || defaultPropertyId.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(defaultPropertyId.trim());
        } catch (IllegalArgumentException e) {
            throw new CodedErrorException(CodedError.PROPERTY_NOT_CONFIGURED, Map.of("value", defaultPropertyId), e);
        }
    }

    private String message(String key, String fallback, Object... args) {
        try {
            return messageSource.getMessage(key, args, LOCALE);
        } catch (NoSuchMessageException e) {
            return args.length > 0 ? MessageFormat.format(fallback, args) : fallback;
        }
    }
}
