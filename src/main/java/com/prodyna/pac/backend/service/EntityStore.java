package com.prodyna.pac.backend.service;

import com.prodyna.pac.backend.domain.model.Identifiable;

import java.util.List;

/**
 * Data access contract shared by all entity types.
 *
 * Every method either returns a fully loaded entity (with the relations its
 * entity graph declares) or throws a
 * {@link com.prodyna.pac.backend.exception.StoreException} whose kind tells
 * the caller what went wrong.
 *
 * @param <T> Entity type
 * @author PAC Team
 */
public interface EntityStore<T extends Identifiable> {

    /**
     * @return All entities, in storage order
     */
    List<T> findAll();

    /**
     * @param id Entity id
     * @return The entity
     * @throws com.prodyna.pac.backend.exception.ResourceNotFoundException if no entity has this id
     */
    T findById(Long id);

    /**
     * Validate and insert a new entity. Any id on the given entity is ignored.
     *
     * @param entity Entity to insert, relations given as id-only references
     * @return The entity as re-read from storage, with its assigned id
     * @throws com.prodyna.pac.backend.exception.ValidationFailedException if any constraint is violated
     */
    T create(T entity);

    /**
     * Replace all mutable fields and relations of an existing entity.
     *
     * @param id Id of the entity to replace
     * @param entity New state, relations given as id-only references
     * @return The entity as re-read from storage
     * @throws com.prodyna.pac.backend.exception.ResourceNotFoundException if no entity has this id
     * @throws com.prodyna.pac.backend.exception.ValidationFailedException if any constraint is violated
     */
    T update(Long id, T entity);

    /**
     * Hard delete an entity.
     *
     * @param id Entity id
     * @throws com.prodyna.pac.backend.exception.ResourceNotFoundException if no entity has this id
     */
    void delete(Long id);
}
