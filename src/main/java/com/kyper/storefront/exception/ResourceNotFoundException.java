package com.kyper.storefront.exception;

/**
 * Exception thrown when a requested resource (product, order, etc.) is not found.
 *
 * @author Storefront Team
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;
    private final Long resourceId;

    public ResourceNotFoundException(String resourceType, Long resourceId) {
        super(String.format("%s not found", resourceType));
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
