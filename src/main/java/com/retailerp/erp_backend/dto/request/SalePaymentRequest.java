package com.retailerp.erp_backend.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.UUID;

@Data
@EqualsAndHashCode(callSuper = true)
public class SalePaymentRequest extends PaymentRequest {

    @NotNull(message = "Sale ID is required")
    private UUID saleId;
}
