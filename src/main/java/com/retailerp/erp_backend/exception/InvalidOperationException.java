package com.retailerp.erp_backend.exception;

import org.springframework.http.HttpStatus;

public class InvalidOperationException extends ApiException {

    public InvalidOperationException(String message) {
        super(message, HttpStatus.BAD_REQUEST, "INVALID_OPERATION");
    }
}
