package com.staydesk.platform.assistant.api;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.staydesk.platform.assistant.model.WizardInput;
import com.staydesk.platform.assistant.model.WizardPrompt;
import com.staydesk.platform.assistant.services.ReservationAssistantMessageHandler;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Messaging transport adapter: one inbound user action in, one prompt out.
 */
@RestController
@RequestMapping("/api/assistant/reservations")
@RequiredArgsConstructor
@Slf4j
public class ReservationAssistantController {

    private final ReservationAssistantMessageHandler messageHandler;

    /**
     * POST /api/assistant/reservations/messages
     */
    @PostMapping(value = "/messages", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<WizardPrompt>> postMessage(@Valid @RequestBody Mono<WizardInput> input) {
        return input
                .doOnNext(message -> log.debug("Inbound message for session {} (selection: {})",
                        message.getSessionId(), message.isSelection()))
                .flatMap(messageHandler::handleMessage)
                .map(ResponseEntity::ok);
    }
}
