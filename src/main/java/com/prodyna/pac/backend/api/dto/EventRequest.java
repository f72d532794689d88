package com.prodyna.pac.backend.api.dto;

import com.prodyna.pac.backend.domain.model.Event;
import com.prodyna.pac.backend.domain.model.Location;

import java.time.LocalDate;

/**
 * Request DTO for creating or replacing an event.
 * Dates are ISO-8601 ({@code 2024-05-13}); the location is referenced by its id.
 *
 * @author PAC Team
 */
public class EventRequest {

    private String name;
    private LocalDate beginDate;
    private LocalDate endDate;
    private Long locationId;

    public EventRequest() {
    }

    public EventRequest(String name, LocalDate beginDate, LocalDate endDate, Long locationId) {
        this.name = name;
        this.beginDate = beginDate;
        this.endDate = endDate;
        this.locationId = locationId;
    }

    public Event toEntity() {
        return Event.builder()
                .name(name)
                .beginDate(beginDate)
                .endDate(endDate)
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

    public Long getLocationId() {
        return locationId;
    }

    public void setLocationId(Long locationId) {
        this.locationId = locationId;
    }
}
