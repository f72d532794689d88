package com.prodyna.pac.backend.api.controller;

import com.prodyna.pac.backend.domain.model.Identifiable;
import com.prodyna.pac.backend.security.SecurityUtils;
import com.prodyna.pac.backend.service.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Base REST controller exposing the CRUD routes of one entity type.
 *
 * Routes, relative to the concrete controller's mapping:
 * GET / (list), GET /{id}, POST / (201), PUT /{id}, DELETE /{id} (204).
 * Errors raised by the store propagate to the global exception handler.
 *
 * @param <T> Entity type
 * @param <Q> Request DTO type
 * @param <R> Response DTO type
 * @author PAC Team
 */
public abstract class CrudController<T extends Identifiable, Q, R> {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final EntityStore<T> store;

    protected CrudController(EntityStore<T> store) {
        this.store = store;
    }

    protected abstract T toEntity(Q request);

    protected abstract R toResponse(T entity);

    /**
     * Get all entities.
     *
     * @return List of all entities
     */
    @GetMapping
    public ResponseEntity<List<R>> getAll() {
        return ResponseEntity.ok(toResponses(store.findAll()));
    }

    /**
     * Get an entity by ID.
     *
     * @param id Entity ID
     * @return The entity
     */
    @GetMapping("/{id:[0-9]+}")
    public ResponseEntity<R> getById(@PathVariable("id") Long id) {
        return ResponseEntity.ok(toResponse(store.findById(id)));
    }

    /**
     * Create a new entity.
     *
     * @param request Entity data
     * @return The created entity with its location
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<R> create(@RequestBody Q request) {
        T created = store.create(toEntity(request));
        logger.info("{} created {} with id: {}",
                SecurityUtils.currentSubjectOrAnonymous(), created.getClass().getSimpleName(), created.getId());

        URI location = ServletUriComponentsBuilder.fromCurrentRequest()
                .path("/{id}")
                .buildAndExpand(created.getId())
                .toUri();
        return ResponseEntity.created(location).body(toResponse(created));
    }

    /**
     * Replace an existing entity.
     *
     * @param id Entity ID
     * @param request New entity data
     * @return The updated entity
     */
    @PutMapping(value = "/{id:[0-9]+}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<R> update(@PathVariable("id") Long id, @RequestBody Q request) {
        T updated = store.update(id, toEntity(request));
        logger.info("{} updated {} with id: {}",
                SecurityUtils.currentSubjectOrAnonymous(), updated.getClass().getSimpleName(), id);

        return ResponseEntity.ok(toResponse(updated));
    }

    /**
     * Delete an entity.
     *
     * @param id Entity ID
     * @return No content
     */
    @DeleteMapping("/{id:[0-9]+}")
    public ResponseEntity<Void> delete(@PathVariable("id") Long id) {
        store.delete(id);
        logger.info("{} deleted entity with id: {}", SecurityUtils.currentSubjectOrAnonymous(), id);

        return ResponseEntity.noContent().build();
    }

    protected List<R> toResponses(List<T> entities) {
        return entities.stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }
}
