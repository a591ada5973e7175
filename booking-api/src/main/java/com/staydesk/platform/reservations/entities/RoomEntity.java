package com.staydesk.platform.reservations.entities;

import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@Entity
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "rooms", uniqueConstraints = @UniqueConstraint(columnNames = { "property_id", "room_number" }))
public class RoomEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "property_id", nullable = false)
    private UUID propertyId;

    @NotNull
    @Column(name = "room_number", nullable = false)
    private String roomNumber;

    @Column(name = "room_type")
    private String roomType;

    /**
     * Maximum number of guests (adults + children). May be null or non-positive
     * on legacy rows, in which case the configured default applies.
     */
    @Column(name = "max_occupancy")
    private Integer maxOccupancy;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;
}
