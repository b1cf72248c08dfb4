package com.retailerp.erp_backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Raised when a stock movement would have to create an inventory row with a negative quantity.
 */
public class InvalidTransitionException extends ApiException {

    public InvalidTransitionException(String message) {
        super(message, HttpStatus.BAD_REQUEST, "INVALID_TRANSITION");
    }
}
