package com.staydesk.platform.reservations.entities;

public enum ReservationStatusForEntity {
    CONFIRMED,
    CHECKED_IN,
    CHECKED_OUT,
    CANCELLED;
}
