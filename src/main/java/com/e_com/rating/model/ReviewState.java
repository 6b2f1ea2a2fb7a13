package com.e_com.rating.model;

/**
 * Lifecycle of a review. The only transition is ACTIVE to RETRACTED.
 */
public enum ReviewState {
    ACTIVE,
    RETRACTED
}
