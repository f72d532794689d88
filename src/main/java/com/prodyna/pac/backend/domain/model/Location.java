package com.prodyna.pac.backend.domain.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A venue where events take place, identified by its name and coordinates.
 *
 * @author PAC Team
 */
@Entity
@Table(name = "location")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Location implements Identifiable {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @NotBlank
    @Size(max = 255)
    @Column(name = "name", nullable = false)
    private String name;

    /**
     * Latitude in decimal degrees.
     */
    @NotNull
    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    @Column(name = "lat", nullable = false)
    private Double lat;

    /**
     * Longitude in decimal degrees.
     */
    @NotNull
    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    @Column(name = "lon", nullable = false)
    private Double lon;
}
