package com.retailerp.erp_backend.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

public class AlreadyReversedException extends ApiException {

    public AlreadyReversedException(UUID transactionId) {
        super("Transaction already reversed: " + transactionId, HttpStatus.BAD_REQUEST, "ALREADY_REVERSED");
    }
}
