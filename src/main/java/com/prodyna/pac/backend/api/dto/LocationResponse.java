package com.prodyna.pac.backend.api.dto;

import com.prodyna.pac.backend.domain.model.Location;

/**
 * Response DTO for a location.
 *
 * @author PAC Team
 */
public class LocationResponse {

    private Long id;
    private String name;
    private Double lat;
    private Double lon;

    public LocationResponse() {
    }

    public LocationResponse(Long id, String name, Double lat, Double lon) {
        this.id = id;
        this.name = name;
        this.lat = lat;
        this.lon = lon;
    }

    /**
     * @return The response, or null for a null location
     */
    public static LocationResponse fromEntity(Location location) {
        if (location == null) {
            return null;
        }
        return new LocationResponse(location.getId(), location.getName(), location.getLat(), location.getLon());
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

    public Double getLat() {
        return lat;
    }

    public void setLat(Double lat) {
        this.lat = lat;
    }

    public Double getLon() {
        return lon;
    }

    public void setLon(Double lon) {
        this.lon = lon;
    }
}
