package com.retailerp.erp_backend.exception;

import org.springframework.http.HttpStatus;

public class InsufficientStockException extends ApiException {

    public InsufficientStockException(String message) {
        super(message, HttpStatus.BAD_REQUEST, "INSUFFICIENT_STOCK");
    }

    public InsufficientStockException(String variantName, int available, int requested) {
        this(String.format("Insufficient stock for %s. Available: %d, Requested: %d",
                variantName, available, requested));
    }
}
