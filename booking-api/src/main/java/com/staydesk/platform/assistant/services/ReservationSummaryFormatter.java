package com.staydesk.platform.assistant.services;

import java.math.BigDecimal;
import java.text.MessageFormat;
import java.time.LocalDate;
import java.util.Locale;

import org.springframework.context.MessageSource;
import org.springframework.context.NoSuchMessageException;
import org.springframework.stereotype.Component;

import com.staydesk.platform.assistant.model.ReservationDraft;
import com.staydesk.platform.reservations.entities.ReservationEntity;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Plain-text summaries of a draft (before confirmation) and of a stored
 * reservation
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReservationSummaryFormatter {

    private static final Locale LOCALE = Locale.ENGLISH;

    private final MessageSource messageSource;

    public String draftSummary(ReservationDraft draft) {
        StringBuilder summary = new StringBuilder();
        summary.append(draft.isModification()
                ? message("booking.summary.title.modify", "Confirm booking update:")
                : message("booking.summary.title", "Confirm booking:"));
        summary.append("\n");
        appendDetails(summary, draft.getGuestName(), draft.getRoomNo(), draft.getRoomType(), draft.getCheckIn(),
                draft.getCheckOut(), draft.getAdults(), draft.getChildren(), draft.getAmount());
        if (draft.getNotes() != null && !draft.getNotes().isBlank()) {
            summary.append("\n").append(message("booking.summary.notes", "Notes: {0}", draft.getNotes()));
        }
        return summary.toString();
    }

    public String reservationSummary(ReservationEntity reservation) {
        StringBuilder summary = new StringBuilder();
        summary.append(message("booking.details.title", "Booking {0}", String.valueOf(reservation.getId())));
        summary.append("\n");
        appendDetails(summary, reservation.getGuestName(), reservation.getRoomNo(), null, reservation.getCheckIn(),
                reservation.getCheckOut(), reservation.getAdults(), reservation.getChildren(),
                reservation.getTotalAmount());
        if (reservation.getNotes() != null && !reservation.getNotes().isBlank()) {
            summary.append("\n").append(message("booking.summary.notes", "Notes: {0}", reservation.getNotes()));
        }
        summary.append("\n");
        if (reservation.isCancelled()) {
            summary.append(message("booking.details.cancelled", "Status: Cancelled"));
        } else {
            summary.append(message("booking.details.status", "Status: {0}", String.valueOf(reservation.getStatus())));
        }
        return summary.toString();
    }

    private void appendDetails(StringBuilder summary, String guestName, String roomNo, String roomType,
            LocalDate checkIn, LocalDate checkOut, Integer adults, Integer children, BigDecimal amount) {
        int a = adults != null ? adults : 0;
        int c = children != null ? children : 0;
        String room = roomType != null && !roomType.isBlank() ? roomNo + " (" + roomType + ")" : roomNo;

        summary.append(message("booking.summary.guest", "Guest: {0}", guestName)).append("\n");
        summary.append(message("booking.summary.room", "Room: {0}", room)).append("\n");
        summary.append(message("booking.summary.dates", "Dates: {0} → {1}", String.valueOf(checkIn),
                String.valueOf(checkOut))).append("\n");
        summary.append(message("booking.summary.guests", "Guests: {0} ({1}/{2})", String.valueOf(a + c),
                String.valueOf(a), String.valueOf(c))).append("\n");
        summary.append(message("booking.summary.amount", "Amount: {0}",
                amount != null ? amount.toPlainString() : "-"));
    }

    private String message(String key, String fallback, Object... args) {
        try {
            return messageSource.getMessage(key, args, LOCALE);
        } catch (NoSuchMessageException e) {
            log.debug("Message {} not found, using fallback", key);
            return args.length > 0 ? MessageFormat.format(fallback, args) : fallback;
        }
    }
}
