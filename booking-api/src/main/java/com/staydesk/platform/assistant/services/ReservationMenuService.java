package com.staydesk.platform.assistant.services;

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import org.springframework.context.MessageSource;
import org.springframework.context.NoSuchMessageException;
import org.springframework.stereotype.Service;

import com.staydesk.platform.assistant.model.FlowType;
import com.staydesk.platform.assistant.model.ModifyField;
import com.staydesk.platform.assistant.model.PromptOption;
import com.staydesk.platform.assistant.model.ReservationDraft;
import com.staydesk.platform.assistant.model.WizardAction;
import com.staydesk.platform.assistant.model.WizardPrompt;
import com.staydesk.platform.reservations.entities.ReservationEntity;
import com.staydesk.platform.reservations.store.ReservationStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Stateless screens around an existing booking: its details, the list of
 * modifiable fields, and the draft a modification starts from.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReservationMenuService {

    static final String DONE_PAYLOAD = "done";
    private static final Locale LOCALE = Locale.ENGLISH;

    private final ReservationStore reservationStore;
    private final ReservationSummaryFormatter summaryFormatter;
    private final MessageSource messageSource;

    public WizardPrompt showReservation(UUID reservationId) {
        Optional<ReservationEntity> reservation = reservationStore.findReservation(reservationId);
        if (reservation.isEmpty()) {
            return notFound(reservationId);
        }

        List<PromptOption> row = new ArrayList<>();
        if (!reservation.get().isCancelled()) {
            row.add(PromptOption.of(message("booking.option.modify", "✏️ Modify"),
                    WizardAction.modifyPayload(reservationId)));
        }
        row.add(PromptOption.of(message("booking.option.done", "Done"), DONE_PAYLOAD));

        List<List<PromptOption>> options = new ArrayList<>();
        options.add(row);
        return WizardPrompt.builder()
                .text(summaryFormatter.reservationSummary(reservation.get()))
                .options(options)
                .build();
    }

    public WizardPrompt modifyMenu(UUID reservationId) {
        Optional<ReservationEntity> reservation = reservationStore.findReservation(reservationId);
        if (reservation.isEmpty()) {
            return notFound(reservationId);
        }
        if (reservation.get().isCancelled()) {
            return WizardPrompt.text(message("booking.modify.cancelled",
                    "This booking is cancelled and cannot be modified."));
        }

        List<List<PromptOption>> options = new ArrayList<>();
        List<PromptOption> row = new ArrayList<>();
        for (ModifyField field : ModifyField.values()) {
            row.add(PromptOption.of(field.getLabel(), WizardAction.modifyPayload(reservationId, field)));
            if (row.size() == 2) {
                options.add(row);
                row = new ArrayList<>();
            }
        }
        if (!row.isEmpty()) {
            options.add(row);
        }
        options.add(List.of(PromptOption.of(message("booking.option.back", "← Back"),
                WizardAction.showPayload(reservationId))));

        return WizardPrompt.builder()
                .text(message("booking.modify.menu", "What would you like to change?"))
                .options(options)
                .build();
    }

    public WizardPrompt done() {
        return WizardPrompt.text(message("booking.done", "👍 Done."));
    }

    /**
     * Draft of a modification: every field of the booking except the one being
     * edited, which is cleared so that the wizard asks for it
     */
    public ReservationDraft modificationDraft(ReservationEntity reservation, ModifyField field) {
        ReservationDraft.ReservationDraftBuilder builder = ReservationDraft.builder()
                .flowType(FlowType.MODIFY)
                .modifyField(field)
                .editTargetId(reservation.getId())
                .propertyId(reservation.getPropertyId())
                .guestName(reservation.getGuestName())
                .checkIn(reservation.getCheckIn())
                .checkOut(reservation.getCheckOut())
                .roomNo(reservation.getRoomNo())
                .adults(reservation.getAdults())
                .children(reservation.getChildren())
                .amount(reservation.getTotalAmount())
                .notes(reservation.getNotes());

        switch (field) {
            case DATES:
                builder.checkIn(null).checkOut(null);
                break;
            case ROOM:
                builder.roomNo(null);
                break;
            case GUEST:
                builder.guestName(null);
                break;
            case ADULTS:
                builder.adults(null);
                break;
            case CHILDREN:
                builder.children(null);
                break;
            case AMOUNT:
                builder.amount(null);
                break;
            case NOTES:
            default:
                break;
        }
        return builder.build();
    }

    public WizardPrompt notFound(UUID reservationId) {
        log.info("Reservation {} not found", reservationId);
        return WizardPrompt.text(message("booking.not-found", "Booking {0} not found.", String.valueOf(reservationId)));
    }

    private String message(String key, String fallback, Object... args) {
        try {
            return messageSource.getMessage(key, args, LOCALE);
        } catch (NoSuchMessageException e) {
            return args.length > 0 ? MessageFormat.format(fallback, args) : fallback;
        }
    }
}
