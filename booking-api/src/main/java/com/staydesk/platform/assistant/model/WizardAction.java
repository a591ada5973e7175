package com.staydesk.platform.assistant.model;

import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Parsed form of an inbound {@link WizardInput}.
 *
 * Selection payloads use a colon separated grammar:
 * <ul>
 * <li>{@code step:<STEP>:<value>} value picked for a wizard step</li>
 * <li>{@code cal:<STEP>:<yyyy-MM>} calendar page for a date step</li>
 * <li>{@code today:<STEP>} calendar page of the current month</li>
 * <li>{@code confirm:<token>}, {@code decline}, {@code restart}, {@code book}</li>
 * <li>{@code show:<id>}, {@code modify:<id>}, {@code modify:<id>:<FIELD>}, {@code done}</li>
 * <li>{@code noop} inert calendar cells</li>
 * </ul>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WizardAction {

    public enum ActionType {
        TEXT,
        STEP_VALUE,
        CALENDAR_PAGE,
        CALENDAR_TODAY,
        NOOP,
        CONFIRM,
        DECLINE,
        RESTART,
        START_NEW,
        SHOW_RESERVATION,
        MODIFY_MENU,
        START_MODIFY,
        DONE,
        UNKNOWN
    }

    public static final String BOOK_COMMAND = "/book";
    public static final String CANCEL_COMMAND = "/cancel";

    private ActionType type;
    private ReservationStep step;
    private String value;
    private YearMonth month;
    private UUID reservationId;
    private ModifyField field;

    public static WizardAction parse(WizardInput input) {
        if (!input.isSelection()) {
            String text = input.getText() != null ? input.getText().trim() : "";
            String command = text.toLowerCase(Locale.ROOT);
            if (command.equals(BOOK_COMMAND) || command.startsWith(BOOK_COMMAND + " ")) {
                return of(ActionType.START_NEW);
            }
            if (command.equals(CANCEL_COMMAND)) {
                return of(ActionType.RESTART);
            }
            return WizardAction.builder().type(ActionType.TEXT).value(text).build();
        }
        return parsePayload(input.getPayload().trim());
    }

    static WizardAction parsePayload(String payload) {
        String[] parts = payload.split(":", 3);
        try {
            switch (parts[0]) {
                case "step":
                    if (parts.length < 3) {
                        return of(ActionType.UNKNOWN);
                    }
                    return WizardAction.builder()
                            .type(ActionType.STEP_VALUE)
                            .step(ReservationStep.valueOf(parts[1]))
                            .value(parts[2])
                            .build();
                case "cal":
                    if (parts.length < 3) {
                        return of(ActionType.UNKNOWN);
                    }
                    return WizardAction.builder()
                            .type(ActionType.CALENDAR_PAGE)
                            .step(ReservationStep.valueOf(parts[1]))
                            .month(YearMonth.parse(parts[2]))
                            .build();
                case "today":
                    if (parts.length < 2) {
                        return of(ActionType.UNKNOWN);
                    }
                    return WizardAction.builder()
                            .type(ActionType.CALENDAR_TODAY)
                            .step(ReservationStep.valueOf(parts[1]))
                            .build();
                case "noop":
                    return of(ActionType.NOOP);
                case "confirm":
                    return WizardAction.builder()
                            .type(ActionType.CONFIRM)
                            .value(parts.length > 1 ? parts[1] : null)
                            .build();
                case "decline":
                    return of(ActionType.DECLINE);
                case "restart":
                    return of(ActionType.RESTART);
                case "book":
                    return of(ActionType.START_NEW);
                case "done":
                    return of(ActionType.DONE);
                case "show":
                    if (parts.length < 2) {
                        return of(ActionType.UNKNOWN);
                    }
                    return WizardAction.builder()
                            .type(ActionType.SHOW_RESERVATION)
                            .reservationId(UUID.fromString(parts[1]))
                            .build();
                case "modify":
                    if (parts.length < 2) {
                        return of(ActionType.UNKNOWN);
                    }
                    if (parts.length == 2) {
                        return WizardAction.builder()
                                .type(ActionType.MODIFY_MENU)
                                .reservationId(UUID.fromString(parts[1]))
                                .build();
                    }
                    return WizardAction.builder()
                            .type(ActionType.START_MODIFY)
                            .reservationId(UUID.fromString(parts[1]))
                            .field(ModifyField.valueOf(parts[2]))
                            .build();
                default:
                    return of(ActionType.UNKNOWN);
            }
        } catch (IllegalArgumentException | DateTimeParseException e) {
            return of(ActionType.UNKNOWN);
        }
    }

    private static WizardAction of(ActionType type) {
        return WizardAction.builder().type(type).build();
    }

    public static String stepPayload(ReservationStep step, Object value) {
        return "step:" + step.name() + ":" + value;
    }

    public static String calendarPayload(ReservationStep step, YearMonth month) {
        return "cal:" + step.name() + ":" + month;
    }

    public static String todayPayload(ReservationStep step) {
        return "today:" + step.name();
    }

    public static String confirmPayload(String token) {
        return "confirm:" + token;
    }

    public static String showPayload(UUID reservationId) {
        return "show:" + reservationId;
    }

    public static String modifyPayload(UUID reservationId) {
        return "modify:" + reservationId;
    }

    public static String modifyPayload(UUID reservationId, ModifyField field) {
        return "modify:" + reservationId + ":" + field.name();
    }
}
