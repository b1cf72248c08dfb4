package com.retailerp.erp_backend.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.UUID;

@Data
public class StockAdjustmentRequest {

    @NotNull(message = "Product variant ID is required")
    private UUID productVariantId;

    @NotNull(message = "Location ID is required")
    private UUID locationId;

    // Signed: positive adds stock, negative removes it
    @NotNull(message = "Quantity is required")
    private Integer quantity;

    private String notes;
}
