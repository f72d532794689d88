package com.prodyna.pac.backend.exception;

/**
 * Exception thrown when a requested entity (location, talk, etc.) does not exist.
 *
 * @author PAC Team
 */
public class ResourceNotFoundException extends StoreException {

    private final String resourceType;
    private final Long resourceId;

    public ResourceNotFoundException(String resourceType, Long resourceId) {
        super(ErrorKind.NOT_FOUND, String.format("%s with ID %d not found", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public Long getResourceId() {
        return resourceId;
    }
}
