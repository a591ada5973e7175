package com.staydesk.platform.assistant.workflows.reservation.steps;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;

import org.springframework.beans.factory.annotation.Autowired;

import com.staydesk.platform.assistant.model.ReservationStepResponse;
import com.staydesk.platform.assistant.model.WizardAction;
import com.staydesk.platform.assistant.model.WizardSession;
import com.staydesk.platform.assistant.services.CalendarKeyboardBuilder;

import reactor.core.publisher.Mono;

/**
 * Shared behaviour of the two date steps: a month calendar that can be paged
 * or reset to today without leaving the step, and ISO dates typed or picked.
 */
public abstract class BaseDateStepHandler extends BaseReservationStepHandler {

    @Autowired
    protected CalendarKeyboardBuilder calendarBuilder;

    protected abstract String prompt(WizardSession session);

    protected abstract YearMonth initialMonth(WizardSession session);

    /**
     * Earliest selectable day, null when any day may be picked
     */
    protected abstract LocalDate minDate(WizardSession session);

    protected abstract Mono<ReservationStepResponse> accept(LocalDate date, WizardSession session);

    @Override
    public Mono<ReservationStepResponse> enter(WizardSession session) {
        return Mono.just(calendarResponse(ReservationStepResponse.StepStatus.ASK_USER, prompt(session),
                initialMonth(session), session));
    }

    @Override
    public Mono<ReservationStepResponse> handle(WizardAction action, WizardSession session) {
        switch (action.getType()) {
            case CALENDAR_PAGE:
                return Mono.just(calendarResponse(ReservationStepResponse.StepStatus.ANSWER_USER,
                        prompt(session), action.getMonth(), session));
            case CALENDAR_TODAY:
                return Mono.just(calendarResponse(ReservationStepResponse.StepStatus.ANSWER_USER,
                        prompt(session), YearMonth.from(calendarBuilder.today()), session));
            case TEXT:
            case STEP_VALUE:
                LocalDate date = parseDate(inputValue(action));
                if (date == null) {
                    return Mono.just(reject(message("booking.date.invalid",
                            "Please pick a date or send it as YYYY-MM-DD."), session));
                }
                return accept(date, session);
            default:
                return unsupported(action, session);
        }
    }

    protected ReservationStepResponse reject(String error, WizardSession session) {
        return calendarResponse(ReservationStepResponse.StepStatus.ANSWER_USER, error, initialMonth(session),
                session);
    }

    private ReservationStepResponse calendarResponse(ReservationStepResponse.StepStatus status, String text,
            YearMonth month, WizardSession session) {
        return ReservationStepResponse.builder()
                .status(status)
                .response(text)
                .options(calendarBuilder.build(getStep(), month, minDate(session)))
                .build();
    }

    static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
