package com.retailerp.erp_backend.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Data
public class CreditNoteRequest {

    @NotNull(message = "Original sale ID is required")
    private UUID originalSaleId;

    private LocalDate saleDate;

    @NotNull(message = "Items are required")
    @Size(min = 1, message = "At least one item must be returned")
    @Valid
    private List<ReturnItemRequest> items;

    private String notes;

    @Data
    public static class ReturnItemRequest {

        @NotNull(message = "Sale item ID is required")
        private UUID saleItemId;

        @NotNull(message = "Return quantity is required")
        @Min(value = 1, message = "Return quantity must be at least 1")
        private Integer returnQuantity;
    }
}
