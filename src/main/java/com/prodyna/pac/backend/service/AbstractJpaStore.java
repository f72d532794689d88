package com.prodyna.pac.backend.service;

import com.prodyna.pac.backend.domain.model.Identifiable;
import com.prodyna.pac.backend.exception.ErrorKind;
import com.prodyna.pac.backend.exception.FieldViolation;
import com.prodyna.pac.backend.exception.ResourceNotFoundException;
import com.prodyna.pac.backend.exception.StoreException;
import com.prodyna.pac.backend.exception.ValidationFailedException;
import com.prodyna.pac.backend.infrastructure.metrics.StoreMetricsService;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * JPA implementation of the {@link EntityStore} contract.
 *
 * Write flow (create and update):
 * 1. Check the target exists (update only)
 * 2. Validate declared field constraints
 * 3. Resolve id-only references to managed entities
 * 4. Check cross-field consistency
 * 5. Reject with all violations at once, or persist and flush
 * 6. Clear the persistence context and re-read the entity with its graph
 *
 * Persistence failures are classified here, once: referential integrity
 * violations become CONFLICT, any other data access failure UNEXPECTED.
 *
 * @param <T> Entity type
 * @author PAC Team
 */
public abstract class AbstractJpaStore<T extends Identifiable> implements EntityStore<T> {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final String entityName;
    private final JpaRepository<T, Long> repository;
    private final EntityValidator validator;
    private final EntityManager entityManager;
    private final StoreMetricsService metricsService;

    protected AbstractJpaStore(
            String entityName,
            JpaRepository<T, Long> repository,
            EntityValidator validator,
            EntityManager entityManager,
            StoreMetricsService metricsService
    ) {
        this.entityName = entityName;
        this.repository = repository;
        this.validator = validator;
        this.entityManager = entityManager;
        this.metricsService = metricsService;
    }

    /**
     * Copy every mutable field and relation of {@code incoming} onto the managed {@code existing} entity.
     */
    protected abstract void applyUpdate(T existing, T incoming);

    /**
     * Replace the id-only references of {@code entity} with managed entities,
     * adding a violation for every reference that does not resolve.
     */
    protected void resolveReferences(T entity, List<FieldViolation> violations) {
    }

    /**
     * Add violations of constraints spanning several fields.
     */
    protected void checkConsistency(T entity, List<FieldViolation> violations) {
    }

    @Override
    @Transactional(readOnly = true)
    public List<T> findAll() {
        logger.debug("Getting all {} entities", entityName);

        List<T> entities = execute("findAll", repository::findAll);

        logger.debug("Returning {} {} entities", entities.size(), entityName);
        return entities;
    }

    @Override
    @Transactional(readOnly = true)
    public T findById(Long id) {
        logger.debug("Getting {} by id: {}", entityName, id);

        return execute("findById", () -> repository.findById(id).orElseThrow(() -> notFound(id)));
    }

    @Override
    @Transactional
    public T create(T entity) {
        logger.debug("Adding {}", entityName);

        return execute("create", () -> {
            entity.setId(null);
            validate(entity);

            T saved = repository.saveAndFlush(entity);
            logger.info("Created {} with id: {}", entityName, saved.getId());

            return reload(saved.getId());
        });
    }

    @Override
    @Transactional
    public T update(Long id, T entity) {
        logger.debug("Updating {} with id: {}", entityName, id);

        return execute("update", () -> {
            T existing = repository.findById(id).orElseThrow(() -> notFound(id));

            entity.setId(id);
            validate(entity);

            applyUpdate(existing, entity);
            repository.saveAndFlush(existing);
            logger.info("Updated {} with id: {}", entityName, id);

            return reload(id);
        });
    }

    @Override
    @Transactional
    public void delete(Long id) {
        logger.debug("Deleting {} with id: {}", entityName, id);

        execute("delete", () -> {
            T existing = repository.findById(id).orElseThrow(() -> notFound(id));
            repository.delete(existing);
            repository.flush();
            logger.info("Deleted {} with id: {}", entityName, id);
            return null;
        });
    }

    /**
     * Run a relation-scoped query with the same logging, metrics and error classification
     * as the CRUD operations.
     *
     * @param operation Operation name used in logs and metrics (e.g., "findByEventId")
     * @param relatedId Id of the related entity
     * @param query Query returning the related entities
     * @return Query result, empty if nothing is related
     */
    protected List<T> findRelated(String operation, Long relatedId, Supplier<List<T>> query) {
        logger.debug("Getting {} entities by {}: {}", entityName, operation, relatedId);

        List<T> entities = execute(operation, query);

        logger.debug("Returning {} {} entities for {}: {}", entities.size(), entityName, operation, relatedId);
        return entities;
    }

    /**
     * Resolve a single id-only reference.
     *
     * @param referenceRepository Repository of the referenced type
     * @param reference Reference carrying only an id, may be null
     * @param field Field name reported on failure
     * @param referenceType Referenced type name reported on failure
     * @param violations Violations collected so far
     * @return The managed entity, or null if the reference is null or does not resolve
     */
    protected <R extends Identifiable> R lookup(
            JpaRepository<R, Long> referenceRepository,
            R reference,
            String field,
            String referenceType,
            List<FieldViolation> violations
    ) {
        if (reference == null) {
            return null;
        }
        if (reference.getId() == null) {
            violations.add(new FieldViolation(field, "id is required"));
            return null;
        }

        Optional<R> resolved = referenceRepository.findById(reference.getId());
        if (resolved.isEmpty()) {
            violations.add(new FieldViolation(field,
                    String.format("%s with ID %d does not exist", referenceType, reference.getId())));
            return null;
        }
        return resolved.get();
    }

    /**
     * Resolve a collection of id-only references. Violations are reported as {@code field[index]},
     * a null entry or one without an id as "must not be null".
     *
     * @return The resolved entities in the order given, without duplicates
     */
    protected <R extends Identifiable> Set<R> lookupAll(
            JpaRepository<R, Long> referenceRepository,
            Collection<R> references,
            String field,
            String referenceType,
            List<FieldViolation> violations
    ) {
        Set<R> resolved = new LinkedHashSet<>();
        if (references == null) {
            return resolved;
        }

        int index = 0;
        for (R reference : references) {
            String indexedField = field + "[" + index + "]";
            if (reference == null || reference.getId() == null) {
                violations.add(new FieldViolation(indexedField, "must not be null"));
            } else {
                R entity = lookup(referenceRepository, reference, indexedField, referenceType, violations);
                if (entity != null) {
                    resolved.add(entity);
                }
            }
            index++;
        }
        return resolved;
    }

    protected String getEntityName() {
        return entityName;
    }

    private void validate(T entity) {
        List<FieldViolation> violations = validator.validate(entity);
        resolveReferences(entity, violations);
        checkConsistency(entity, violations);

        if (!violations.isEmpty()) {
            logger.warn("Rejected {} with {} violation(s): {}", entityName, violations.size(), violations);
            metricsService.recordValidationFailure(entityName, violations.size());
            throw new ValidationFailedException(entityName, violations);
        }
    }

    private T reload(Long id) {
        entityManager.clear();
        return repository.findById(id).orElseThrow(() -> notFound(id));
    }

    private ResourceNotFoundException notFound(Long id) {
        logger.warn("{} not found by id: {}", entityName, id);
        return new ResourceNotFoundException(entityName, id);
    }

    private <R> R execute(String operation, Supplier<R> action) {
        long startTime = System.currentTimeMillis();

        try {
            R result = action.get();
            metricsService.recordOperation(entityName, operation, StoreMetricsService.OUTCOME_SUCCESS,
                    System.currentTimeMillis() - startTime);
            return result;

        } catch (StoreException e) {
            metricsService.recordOperation(entityName, operation, e.getKind().name(),
                    System.currentTimeMillis() - startTime);
            throw e;

        } catch (DataIntegrityViolationException e) {
            logger.warn("Integrity violation during {} of {}: {}", operation, entityName, e.getMostSpecificCause().getMessage());
            metricsService.recordOperation(entityName, operation, ErrorKind.CONFLICT.name(),
                    System.currentTimeMillis() - startTime);
            throw new StoreException(ErrorKind.CONFLICT,
                    entityName + " conflicts with related data and cannot be " + pastTense(operation), e);

        } catch (DataAccessException | PersistenceException e) {
            logger.error("Unexpected error during {} of {}", operation, entityName, e);
            metricsService.recordOperation(entityName, operation, ErrorKind.UNEXPECTED.name(),
                    System.currentTimeMillis() - startTime);
            throw new StoreException(ErrorKind.UNEXPECTED, "Unexpected storage error during " + operation, e);
        }
    }

    private static String pastTense(String operation) {
        switch (operation) {
            case "create":
                return "created";
            case "update":
                return "updated";
            case "delete":
                return "deleted";
            default:
                return "processed";
        }
    }
}
