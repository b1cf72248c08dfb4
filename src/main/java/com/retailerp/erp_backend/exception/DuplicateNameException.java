package com.retailerp.erp_backend.exception;

import org.springframework.http.HttpStatus;

public class DuplicateNameException extends ApiException {

    public DuplicateNameException(String resourceName, String name) {
        super(String.format("%s with name '%s' already exists", resourceName, name),
                HttpStatus.CONFLICT, "DUPLICATE_NAME");
    }
}
