package com.prodyna.pac.backend.api.dto;

import com.prodyna.pac.backend.domain.model.Location;
import com.prodyna.pac.backend.domain.model.Room;

/**
 * Request DTO for creating or replacing a room.
 * The location is referenced by its id.
 *
 * @author PAC Team
 */
public class RoomRequest {

    private String name;
    private Integer capacity;
    private Long locationId;

    public RoomRequest() {
    }

    public RoomRequest(String name, Integer capacity, Long locationId) {
        this.name = name;
        this.capacity = capacity;
        this.locationId = locationId;
    }

    public Room toEntity() {
        return Room.builder()
                .name(name)
                .capacity(capacity)
                .location(locationId != null ? Location.builder().id(locationId).build() : null)
                .build();
    }

    // Getters and setters
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Integer getCapacity() {
        return capacity;
    }

    public void setCapacity(Integer capacity) {
        this.capacity = capacity;
    }

    public Long getLocationId() {
        return locationId;
    }

    public void setLocationId(Long locationId) {
        this.locationId = locationId;
    }
}
