package com.retailerp.erp_backend.exception;

import org.springframework.http.HttpStatus;

public class ExceedsAmountDueException extends ApiException {

    public ExceedsAmountDueException(String message) {
        super(message, HttpStatus.BAD_REQUEST, "EXCEEDS_AMOUNT_DUE");
    }
}
