package com.prodyna.pac.backend.exception;

import java.util.List;

/**
 * Exception thrown when an entity violates one or more field constraints.
 * Carries every violation found, not just the first one.
 *
 * @author PAC Team
 */
public class ValidationFailedException extends StoreException {

    private final String resourceType;
    private final List<FieldViolation> violations;

    public ValidationFailedException(String resourceType, List<FieldViolation> violations) {
        super(ErrorKind.VALIDATION_FAILED,
                String.format("%s failed validation with %d violation(s)", resourceType, violations.size()));
        this.resourceType = resourceType;
        this.violations = List.copyOf(violations);
    }

    public String getResourceType() {
        return resourceType;
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }
}
