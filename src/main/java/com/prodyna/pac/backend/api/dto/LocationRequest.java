package com.prodyna.pac.backend.api.dto;

import com.prodyna.pac.backend.domain.model.Location;

/**
 * Request DTO for creating or replacing a location.
 *
 * @author PAC Team
 */
public class LocationRequest {

    private String name;
    private Double lat;
    private Double lon;

    public LocationRequest() {
    }

    public LocationRequest(String name, Double lat, Double lon) {
        this.name = name;
        this.lat = lat;
        this.lon = lon;
    }

    public Location toEntity() {
        return Location.builder()
                .name(name)
                .lat(lat)
                .lon(lon)
                .build();
    }

    // Getters and setters
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
