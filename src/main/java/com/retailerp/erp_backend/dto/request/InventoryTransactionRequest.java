package com.retailerp.erp_backend.dto.request;

import com.retailerp.erp_backend.enums.PaymentStatus;
import com.retailerp.erp_backend.enums.TransactionType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.util.UUID;

@Data
public class InventoryTransactionRequest {

    @NotNull(message = "Transaction type is required")
    private TransactionType transactionType;

    @NotNull(message = "Product variant ID is required")
    private UUID productVariantId;

    @NotNull(message = "Quantity is required")
    @Min(value = 1, message = "Quantity must be at least 1")
    private Integer quantity;

    private UUID fromLocationId;

    private UUID toLocationId;

    private UUID supplierId;

    @DecimalMin(value = "0.0", message = "Unit cost cannot be negative")
    private BigDecimal unitCost;

    @DecimalMin(value = "0.0", message = "Amount paid cannot be negative")
    private BigDecimal amountPaid;

    private PaymentStatus paymentStatus;

    private String referenceType;

    private UUID referenceId;

    private String notes;
}
