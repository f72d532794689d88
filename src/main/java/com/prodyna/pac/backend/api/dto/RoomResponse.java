package com.prodyna.pac.backend.api.dto;

import com.prodyna.pac.backend.domain.model.Room;

/**
 * Response DTO for a room, embedding its location.
 *
 * @author PAC Team
 */
public class RoomResponse {

    private Long id;
    private String name;
    private Integer capacity;
    private LocationResponse location;

    public RoomResponse() {
    }

    public static RoomResponse fromEntity(Room room) {
        if (room == null) {
            return null;
        }
        RoomResponse response = new RoomResponse();
        response.setId(room.getId());
        response.setName(room.getName());
        response.setCapacity(room.getCapacity());
        response.setLocation(LocationResponse.fromEntity(room.getLocation()));
        return response;
    }

    // Getters and setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

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

    public LocationResponse getLocation() {
        return location;
    }

    public void setLocation(LocationResponse location) {
        this.location = location;
    }
}
