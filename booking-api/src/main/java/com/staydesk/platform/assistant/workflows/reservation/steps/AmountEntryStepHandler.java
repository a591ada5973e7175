package com.staydesk.platform.assistant.workflows.reservation.steps;

import java.math.BigDecimal;

import org.springframework.stereotype.Component;

import com.staydesk.platform.assistant.model.ReservationDraft;
import com.staydesk.platform.assistant.model.ReservationStep;
import com.staydesk.platform.assistant.model.ReservationStepResponse;
import com.staydesk.platform.assistant.model.WizardAction;
import com.staydesk.platform.assistant.model.WizardSession;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Handler for AMOUNT_ENTRY step.
 * Thousands separators and spaces are ignored; anything that is not a
 * positive number gets the same error again. Accepted amounts fit the
 * NUMERIC(12, 2) total_amount column exactly.
 */
@Component
@Slf4j
public class AmountEntryStepHandler extends BaseReservationStepHandler {

    static final int MAX_SCALE = 2;
    static final int MAX_INTEGER_DIGITS = 10;

    @Override
    public ReservationStep getStep() {
        return ReservationStep.AMOUNT_ENTRY;
    }

    @Override
    public Mono<ReservationStepResponse> enter(WizardSession session) {
        return Mono.just(ReservationStepResponse.builder()
                .status(ReservationStepResponse.StepStatus.ASK_USER)
                .response(message("booking.amount.prompt", "Total amount?"))
                .build());
    }

    @Override
    public Mono<ReservationStepResponse> handle(WizardAction action, WizardSession session) {
        String value = inputValue(action);
        if (value == null) {
            return unsupported(action, session);
        }

        BigDecimal positive = parsePositive(value);
        if (positive == null) {
            return Mono.just(ReservationStepResponse.answer(
                    message("booking.amount.invalid", "Amount must be a positive number.")));
        }
        BigDecimal amount = withinLimits(positive);
        if (amount == null) {
            return Mono.just(ReservationStepResponse.answer(message("booking.amount.out-of-range",
                    "Amount must have at most {0} decimals and {1} digits before the decimal point.",
                    String.valueOf(MAX_SCALE), String.valueOf(MAX_INTEGER_DIGITS))));
        }

        ReservationDraft draft = session.getDraft().toBuilder()
                .amount(amount)
                .build();
        return Mono.just(ReservationStepResponse.switchTo(draft.firstMissingStep(), draft));
    }

    /**
     * Positive amount with commas and whitespace removed, null otherwise.
     * At most two decimals and ten integer digits are kept.
     */
    static BigDecimal parseAmount(String value) {
        BigDecimal positive = parsePositive(value);
        return positive != null ? withinLimits(positive) : null;
    }

    private static BigDecimal parsePositive(String value) {
        String cleaned = value.replaceAll("[,\\s]", "");
        if (cleaned.isEmpty()) {
            return null;
        }
        try {
            BigDecimal amount = new BigDecimal(cleaned);
            return amount.signum() > 0 ? amount : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * The amount at a scale of at most two, or null when it would be rounded
     * or overflow the integer part
     */
    private static BigDecimal withinLimits(BigDecimal amount) {
        BigDecimal normalized = amount.stripTrailingZeros();
        if (normalized.scale() > MAX_SCALE || normalized.precision() - normalized.scale() > MAX_INTEGER_DIGITS) {
            return null;
        }
        return amount.scale() > MAX_SCALE ? amount.setScale(MAX_SCALE) : amount;
    }
}
