package com.e_com.rating.exception;

/**
 * Thrown when a product or review does not exist, or exists but is no longer active.
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;
    private final String identifier;

    public ResourceNotFoundException(String resourceType, Object identifier) {
        super(resourceType + " not found: " + identifier);
        this.resourceType = resourceType;
        this.identifier = String.valueOf(identifier);
    }

    public static ResourceNotFoundException product(String slug) {
        return new ResourceNotFoundException("Product", slug);
    }

    public static ResourceNotFoundException review(Long reviewId) {
        return new ResourceNotFoundException("Review", reviewId);
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getIdentifier() {
        return identifier;
    }
}
