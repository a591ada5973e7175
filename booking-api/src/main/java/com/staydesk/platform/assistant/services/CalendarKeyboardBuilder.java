package com.staydesk.platform.assistant.services;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.staydesk.platform.assistant.model.PromptOption;
import com.staydesk.platform.assistant.model.ReservationStep;
import com.staydesk.platform.assistant.model.WizardAction;

/**
 * Renders a month as option rows: month header, prev / Today / next, weekday
 * initials, then a Sunday-first grid of days. Paging options only re-render
 * the calendar; only a day option carries a step value.
 */
@Component
public class CalendarKeyboardBuilder {

    static final String NOOP = "noop";
    private static final String[] WEEKDAYS = { "S", "M", "T", "W", "T", "F", "S" };

    @Value("${staydesk.booking.time-zone:Asia/Kolkata}")
    private String timeZone;

    public LocalDate today() {
        return LocalDate.now(ZoneId.of(timeZone));
    }

    /**
     * @param minDate earliest selectable day, earlier days are rendered inert;
     *                null makes every day selectable
     */
    public List<List<PromptOption>> build(ReservationStep step, YearMonth month, LocalDate minDate) {
        List<List<PromptOption>> rows = new ArrayList<>();

        rows.add(List.of(PromptOption.of(
                month.getMonth().getDisplayName(TextStyle.SHORT, Locale.ENGLISH) + " " + month.getYear(), NOOP)));

        rows.add(List.of(
                PromptOption.of("◀️", WizardAction.calendarPayload(step, month.minusMonths(1))),
                PromptOption.of("Today", WizardAction.todayPayload(step)),
                PromptOption.of("▶️", WizardAction.calendarPayload(step, month.plusMonths(1)))));

        List<PromptOption> header = new ArrayList<>();
        for (String weekday : WEEKDAYS) {
            header.add(PromptOption.of(weekday, NOOP));
        }
        rows.add(header);

        // DayOfWeek is Monday=1..Sunday=7, the grid starts on Sunday
        int leadingBlanks = month.atDay(1).getDayOfWeek().getValue() % 7;
        List<PromptOption> week = new ArrayList<>();
        for (int i = 0; i < leadingBlanks; i++) {
            week.add(PromptOption.of(" ", NOOP));
        }
        for (int day = 1; day <= month.lengthOfMonth(); day++) {
            LocalDate date = month.atDay(day);
            if (minDate != null && date.isBefore(minDate)) {
                week.add(PromptOption.of("·", NOOP));
            } else {
                week.add(PromptOption.of(String.valueOf(day), WizardAction.stepPayload(step, date)));
            }
            if (week.size() == 7) {
                rows.add(week);
                week = new ArrayList<>();
            }
        }
        if (!week.isEmpty()) {
            while (week.size() < 7) {
                week.add(PromptOption.of(" ", NOOP));
            }
            rows.add(week);
        }
        return rows;
    }
}
