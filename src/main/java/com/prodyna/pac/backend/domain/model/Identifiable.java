package com.prodyna.pac.backend.domain.model;

/**
 * Implemented by every persistent entity. The id is assigned by the database.
 */
public interface Identifiable {

    Long getId();

    void setId(Long id);
}
