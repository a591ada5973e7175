package com.staydesk.platform.exceptions;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum CodedError {
        // Resource errors
        RESERVATION_NOT_FOUND("RES018", "Reservation not found", "resources/reservation-not-found"),

        // Validation errors
        INVALID_INPUT("VAL001", "Invalid input provided", "validation/invalid-input"),
        INVALID_INTERVAL("VAL010", "Check-out must be strictly after check-in", "validation/invalid-interval"),
        PROPERTY_NOT_CONFIGURED("VAL011", "No property selected for this conversation",
                        "validation/property-not-configured"),

        // Session errors
        SESSION_STORE_UNAVAILABLE("SES001", "Conversation state could not be read or written",
                        "sessions/store-unavailable"),
        SESSION_CORRUPTED("SES002", "Stored conversation state is unreadable", "sessions/corrupted"),

        // System errors
        INTERNAL_ERROR("SYS001", "An internal error occurred", "system/internal-error"),
        RESERVATION_STORE_UNAVAILABLE("SYS005", "Reservation storage is unavailable",
                        "system/reservation-store-unavailable");

        private final String code;
        private final String defaultMessage;
        private final String documentationPath;

        public String getDocumentationUrl() {
                return "https://docs.staydesk.app/errors/" + documentationPath;
        }

        public boolean isInfrastructure() {
                return code.startsWith("SES") || code.startsWith("SYS");
        }
}
