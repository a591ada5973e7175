package com.staydesk.platform.reservations.services;

import com.staydesk.platform.reservations.entities.RoomEntity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AvailableRoom {
    private String roomNo;
    private String roomType;

    public static AvailableRoom from(RoomEntity room) {
        return new AvailableRoom(room.getRoomNumber(), room.getRoomType());
    }

    public String getLabel() {
        return "Room " + roomNo + (roomType != null && !roomType.isBlank() ? " (" + roomType + ")" : "");
    }
}
