package com.prodyna.pac.backend.service;

import com.prodyna.pac.backend.exception.FieldViolation;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Applies the constraints declared on entity fields and reports every
 * violation as a {@link FieldViolation}.
 *
 * @author PAC Team
 */
@Component
public class EntityValidator {

    private static final Comparator<FieldViolation> BY_FIELD =
            Comparator.comparing(FieldViolation::getField).thenComparing(FieldViolation::getMessage);

    private final Validator validator;

    public EntityValidator(Validator validator) {
        this.validator = validator;
    }

    /**
     * Validate an entity against its declared constraints.
     *
     * @param entity Entity to validate
     * @return Mutable list of violations sorted by field, empty if the entity is valid
     */
    public List<FieldViolation> validate(Object entity) {
        return validator.validate(entity).stream()
                .map(EntityValidator::toFieldViolation)
                .sorted(BY_FIELD)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private static FieldViolation toFieldViolation(ConstraintViolation<Object> violation) {
        return new FieldViolation(violation.getPropertyPath().toString(), violation.getMessage());
    }
}
