package com.staydesk.platform.assistant.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Field of an existing reservation that a modify flow edits, with the step
 * the flow starts on.
 */
@Getter
@RequiredArgsConstructor
public enum ModifyField {
    DATES("Dates", ReservationStep.CHECK_IN_DATE),
    ROOM("Room", ReservationStep.ROOM_SELECTION),
    GUEST("Guest name", ReservationStep.GUEST_NAME),
    ADULTS("Adults", ReservationStep.ADULTS_COUNT),
    CHILDREN("Children", ReservationStep.CHILDREN_COUNT),
    AMOUNT("Amount", ReservationStep.AMOUNT_ENTRY),
    NOTES("Notes", ReservationStep.NOTES_ENTRY);

    private final String label;
    private final ReservationStep entryStep;
}
