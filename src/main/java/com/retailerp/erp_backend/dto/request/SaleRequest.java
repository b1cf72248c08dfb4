package com.retailerp.erp_backend.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Data
public class SaleRequest {

    @NotNull(message = "Customer ID is required")
    private UUID customerId;

    @NotNull(message = "Location ID is required")
    private UUID locationId;

    // Defaults to today
    private LocalDate saleDate;

    @NotNull(message = "Items are required")
    @Size(min = 1, message = "At least one item must be included in the sale")
    @Valid
    private List<SaleItemRequest> items;

    private String notes;

    @Data
    public static class SaleItemRequest {

        @NotNull(message = "Product variant ID is required")
        private UUID productVariantId;

        @NotNull(message = "Quantity is required")
        @Min(value = 1, message = "Quantity must be at least 1")
        private Integer quantity;

        @NotNull(message = "Unit price is required")
        @DecimalMin(value = "0.0", message = "Unit price cannot be negative")
        private BigDecimal unitPrice;
    }
}
