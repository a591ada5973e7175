package com.staydesk.platform.assistant.workflows.reservation.steps;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.staydesk.platform.assistant.model.PromptOption;
import com.staydesk.platform.assistant.model.ReservationDraft;
import com.staydesk.platform.assistant.model.ReservationStep;
import com.staydesk.platform.assistant.model.ReservationStepResponse;
import com.staydesk.platform.assistant.model.WizardAction;
import com.staydesk.platform.assistant.model.WizardSession;
import com.staydesk.platform.reservations.services.AvailabilityResolver;
import com.staydesk.platform.reservations.services.AvailableRoom;
import com.staydesk.platform.reservations.services.CapacityValidator;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Handler for ROOM_SELECTION step.
 *
 * Availability is resolved on entry and again for every selection, excluding
 * the reservation being edited. A room already held by the draft (dates
 * changed on an existing booking) is kept when it is still free; guest counts
 * that no longer fit the room are cleared so they are asked again.
 */
@Component
@Slf4j
public class RoomSelectionStepHandler extends BaseReservationStepHandler {

    static final String RESTART_PAYLOAD = "restart";
    private static final int ROOMS_PER_ROW = 2;

    @Autowired
    private AvailabilityResolver availabilityResolver;

    @Autowired
    private CapacityValidator capacityValidator;

    @Override
    public ReservationStep getStep() {
        return ReservationStep.ROOM_SELECTION;
    }

    @Override
    public Mono<ReservationStepResponse> enter(WizardSession session) {
        return Mono.fromCallable(() -> {
            ReservationDraft draft = session.getDraft();
            List<AvailableRoom> rooms = resolve(draft);

            String notice = null;
            if (draft.getRoomNo() != null) {
                Optional<AvailableRoom> held = find(rooms, draft.getRoomNo());
                if (held.isPresent()) {
                    log.info("Held room {} still available for {} -> {}", draft.getRoomNo(), draft.getCheckIn(),
                            draft.getCheckOut());
                    return routeAfterRoom(draft, message("booking.room.still-available",
                            "Room {0} is still available for {1} → {2}.", draft.getRoomNo(),
                            String.valueOf(draft.getCheckIn()), String.valueOf(draft.getCheckOut())));
                }
                notice = message("booking.room.no-longer-available",
                        "Room {0} is not available for {1} → {2}. Please choose another room.", draft.getRoomNo(),
                        String.valueOf(draft.getCheckIn()), String.valueOf(draft.getCheckOut()));
                draft = draft.toBuilder().roomNo(null).roomType(null).build();
            }

            if (rooms.isEmpty()) {
                return noRoomsAvailable(draft);
            }

            String prompt = message("booking.room.prompt", "Select a room:");
            return ReservationStepResponse.builder()
                    .status(ReservationStepResponse.StepStatus.ASK_USER)
                    .response(notice != null ? notice + "\n\n" + prompt : prompt)
                    .options(roomOptions(rooms))
                    .draft(draft != session.getDraft() ? draft : null)
                    .build();
        });
    }

    @Override
    public Mono<ReservationStepResponse> handle(WizardAction action, WizardSession session) {
        String roomNo = inputValue(action);
        if (roomNo == null || roomNo.isEmpty()) {
            return unsupported(action, session);
        }

        return Mono.fromCallable(() -> {
            ReservationDraft draft = session.getDraft();
            // the list shown earlier may be stale, always ask again
            List<AvailableRoom> rooms = resolve(draft);
            Optional<AvailableRoom> selected = find(rooms, roomNo);

            if (selected.isEmpty()) {
                log.info("Room {} not available for {} -> {} (session {})", roomNo, draft.getCheckIn(),
                        draft.getCheckOut(), session.getSessionId());
                if (rooms.isEmpty()) {
                    return noRoomsAvailable(draft);
                }
                return ReservationStepResponse.builder()
                        .status(ReservationStepResponse.StepStatus.ANSWER_USER)
                        .response(message("booking.room.unavailable",
                                "Room {0} is not available for these dates. Please pick one of these rooms:", roomNo))
                        .options(roomOptions(rooms))
                        .build();
            }

            ReservationDraft updated = draft.toBuilder()
                    .roomNo(selected.get().getRoomNo())
                    .roomType(selected.get().getRoomType())
                    .build();
            return routeAfterRoom(updated, null);
        });
    }

    /**
     * Moves on with a room in the draft, clearing guest counts the room cannot
     * hold
     */
    private ReservationStepResponse routeAfterRoom(ReservationDraft draft, String notice) {
        int capacity = capacityValidator.getMaxOccupancy(draft.getPropertyId(), draft.getRoomNo());
        ReservationDraft next = draft;

        if (draft.getAdults() != null && draft.getAdults() > capacity) {
            next = draft.toBuilder().adults(null).children(null).build();
        } else if (draft.getAdults() != null && draft.getChildren() != null
                && !capacityValidator.validate(draft.getAdults(), draft.getChildren(), capacity)) {
            next = draft.toBuilder().children(null).build();
        }

        if (next != draft) {
            String capacityNotice = message("booking.room.capacity-reset",
                    "Room {0} allows up to {1} guests. Please enter the guest count again.", draft.getRoomNo(),
                    String.valueOf(capacity));
            notice = notice != null ? notice + "\n" + capacityNotice : capacityNotice;
            log.info("Guests {}/{} do not fit room {} (capacity {}), asking again", draft.getAdults(),
                    draft.getChildren(), draft.getRoomNo(), capacity);
        }
        return ReservationStepResponse.switchTo(next.firstMissingStep(), next, notice);
    }

    private ReservationStepResponse noRoomsAvailable(ReservationDraft draft) {
        String notice = message("booking.room.none", "No rooms available for {0} → {1}",
                String.valueOf(draft.getCheckIn()), String.valueOf(draft.getCheckOut()));
        ReservationDraft reset = draft.toBuilder()
                .checkIn(null)
                .checkOut(null)
                .roomNo(null)
                .roomType(null)
                .build();
        List<List<PromptOption>> startOver = new ArrayList<>();
        startOver.add(List.of(PromptOption.of(message("booking.option.start-over", "Start Over"), RESTART_PAYLOAD)));
        return ReservationStepResponse.builder()
                .status(ReservationStepResponse.StepStatus.SWITCH_STEP)
                .nextStep(ReservationStep.CHECK_IN_DATE)
                .draft(reset)
                .response(notice)
                .options(startOver)
                .build();
    }

    private List<AvailableRoom> resolve(ReservationDraft draft) {
        return availabilityResolver.resolveAvailability(draft.getPropertyId(), draft.getCheckIn(),
                draft.getCheckOut(), draft.getEditTargetId());
    }

    private Optional<AvailableRoom> find(List<AvailableRoom> rooms, String roomNo) {
        return rooms.stream()
                .filter(room -> room.getRoomNo().equalsIgnoreCase(roomNo.trim()))
                .findFirst();
    }

    private List<List<PromptOption>> roomOptions(List<AvailableRoom> rooms) {
        List<List<PromptOption>> rows = new ArrayList<>();
        List<PromptOption> row = new ArrayList<>();
        for (AvailableRoom room : rooms) {
            row.add(PromptOption.of(room.getLabel(),
                    WizardAction.stepPayload(ReservationStep.ROOM_SELECTION, room.getRoomNo())));
            if (row.size() == ROOMS_PER_ROW) {
                rows.add(row);
                row = new ArrayList<>();
            }
        }
        if (!row.isEmpty()) {
            rows.add(row);
        }
        return rows;
    }
}
