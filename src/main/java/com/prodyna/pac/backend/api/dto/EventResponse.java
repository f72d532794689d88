package com.prodyna.pac.backend.api.dto;

import com.prodyna.pac.backend.domain.model.Event;

import java.time.LocalDate;

/**
 * Response DTO for an event, embedding its location.
 *
 * @author PAC Team
 */
public class EventResponse {

    private Long id;
    private String name;
    private LocalDate beginDate;
    private LocalDate endDate;
    private LocationResponse location;

    public EventResponse() {
    }

    public static EventResponse fromEntity(Event event) {
        if (event == null) {
            return null;
        }
        EventResponse response = new EventResponse();
        response.setId(event.getId());
        response.setName(event.getName());
        response.setBeginDate(event.getBeginDate());
        response.setEndDate(event.getEndDate());
        response.setLocation(LocationResponse.fromEntity(event.getLocation()));
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

    public LocalDate getBeginDate() {
        return beginDate;
    }

    public void setBeginDate(LocalDate beginDate) {
        this.beginDate = beginDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public void setEndDate(LocalDate endDate) {
        this.endDate = endDate;
    }

    public LocationResponse getLocation() {
        return location;
    }

    public void setLocation(LocationResponse location) {
        this.location = location;
    }
}
