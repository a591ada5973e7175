package com.staydesk.platform.reservations.services;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.staydesk.platform.reservations.entities.RoomEntity;
import com.staydesk.platform.reservations.store.ReservationStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Room occupancy limits. A room whose capacity cannot be read falls back to
 * the configured default instead of failing the booking.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CapacityValidator {

    private final ReservationStore reservationStore;

    @Value("${staydesk.booking.default-max-occupancy:6}")
    private int defaultMaxOccupancy;

    @Value("${staydesk.booking.max-offered-guests:10}")
    private int maxOfferedGuests;

    public int getMaxOccupancy(UUID propertyId, String roomNo) {
        Optional<RoomEntity> room;
        try {
            room = reservationStore.findRoom(propertyId, roomNo);
        } catch (RuntimeException e) {
            log.warn("Could not read capacity of room {} (property {}), using default {}: {}",
                    roomNo, propertyId, defaultMaxOccupancy, e.getMessage());
            return defaultMaxOccupancy;
        }
        if (room.isEmpty()) {
            log.warn("Room {} (property {}) not found, using default capacity {}", roomNo, propertyId,
                    defaultMaxOccupancy);
            return defaultMaxOccupancy;
        }
        return capacityOf(room.get());
    }

    /**
     * Capacity of a room already loaded, e.g. the row locked by a commit.
     * Does not touch the store.
     */
    public int capacityOf(RoomEntity room) {
        Integer capacity = room.getMaxOccupancy();
        if (capacity == null || capacity <= 0) {
            log.warn("Room {} (property {}) has no usable max occupancy ({}), using default {}",
                    room.getRoomNumber(), room.getPropertyId(), capacity, defaultMaxOccupancy);
            return defaultMaxOccupancy;
        }
        return capacity;
    }

    /**
     * At least one adult, no negative children, total within capacity
     */
    public boolean validate(int adults, int children, int capacity) {
        return adults >= 1 && children >= 0 && adults + children <= capacity;
    }

    public int maxChildren(int adults, int capacity) {
        return Math.max(0, capacity - adults);
    }

    public List<Integer> offeredAdults(int capacity) {
        return IntStream.rangeClosed(1, Math.min(capacity, maxOfferedGuests))
                .boxed()
                .collect(Collectors.toList());
    }

    public List<Integer> offeredChildren(int adults, int capacity) {
        return IntStream.rangeClosed(0, Math.min(maxChildren(adults, capacity), maxOfferedGuests))
                .boxed()
                .collect(Collectors.toList());
    }
}
