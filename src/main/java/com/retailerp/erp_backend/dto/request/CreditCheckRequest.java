package com.retailerp.erp_backend.dto.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class CreditCheckRequest {

    @NotNull(message = "Sale amount is required")
    @DecimalMin(value = "0.0", message = "Sale amount cannot be negative")
    private BigDecimal saleAmount;
}
