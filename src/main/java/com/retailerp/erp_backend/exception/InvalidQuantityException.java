package com.retailerp.erp_backend.exception;

import org.springframework.http.HttpStatus;

public class InvalidQuantityException extends ApiException {

    public InvalidQuantityException(String message) {
        super(message, HttpStatus.BAD_REQUEST, "INVALID_QUANTITY");
    }
}
