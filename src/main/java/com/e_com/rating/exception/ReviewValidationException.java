package com.e_com.rating.exception;

public class ReviewValidationException extends RuntimeException {

    private final String field;

    public ReviewValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
