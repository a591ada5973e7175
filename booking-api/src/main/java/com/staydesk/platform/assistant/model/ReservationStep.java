package com.staydesk.platform.assistant.model;

/**
 * Enum representing the current step in the booking wizard.
 *
 * A new booking walks the steps in declaration order:
 * GUEST_NAME, CHECK_IN_DATE, CHECK_OUT_DATE, ROOM_SELECTION, ADULTS_COUNT,
 * CHILDREN_COUNT, AMOUNT_ENTRY, CONFIRM, COMPLETE_RESERVATION.
 *
 * A modification starts at the step owning the edited field (NOTES_ENTRY is
 * only reachable that way) and then jumps to CONFIRM once every field is set
 * again.
 */
public enum ReservationStep {
    /**
     * Guest name, free text, at least 2 characters
     */
    GUEST_NAME,

    /**
     * Check-in date, typed as YYYY-MM-DD or picked from the calendar
     */
    CHECK_IN_DATE,

    /**
     * Check-out date, strictly after the stored check-in
     */
    CHECK_OUT_DATE,

    /**
     * Room choice among the rooms free for [checkIn, checkOut).
     * - Entered after the dates are known; resolves availability on entry
     * - In a date modification, skipped when the held room is still free
     */
    ROOM_SELECTION,

    /**
     * Adults count, 1 up to the room capacity
     */
    ADULTS_COUNT,

    /**
     * Children count, 0 up to capacity minus adults
     */
    CHILDREN_COUNT,

    /**
     * Total amount, positive number
     */
    AMOUNT_ENTRY,

    /**
     * Free-text notes (special requests), modify flow only
     */
    NOTES_ENTRY,

    /**
     * Summary shown with a fresh single-use confirmation token.
     * - Confirm (with the token) moves to COMPLETE_RESERVATION
     * - Decline clears the session
     */
    CONFIRM,

    /**
     * Backend-only step: re-validates availability and capacity, then writes
     * the reservation. Never waits for user input.
     */
    COMPLETE_RESERVATION
}
