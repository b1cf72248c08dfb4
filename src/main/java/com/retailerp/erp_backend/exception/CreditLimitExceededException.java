package com.retailerp.erp_backend.exception;

import org.springframework.http.HttpStatus;

public class CreditLimitExceededException extends ApiException {

    public CreditLimitExceededException(String message) {
        super(message, HttpStatus.BAD_REQUEST, "CREDIT_LIMIT_EXCEEDED");
    }
}
