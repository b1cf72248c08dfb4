package com.retailerp.erp_backend.dto.response;

import com.retailerp.erp_backend.enums.PaymentStatus;
import com.retailerp.erp_backend.enums.TransactionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryTransactionResponse {
    private UUID id;
    private TransactionType transactionType;
    private UUID productVariantId;
    private String variantName;
    private String sku;
    private int quantity;
    private UUID fromLocationId;
    private String fromLocationName;
    private UUID toLocationId;
    private String toLocationName;
    private UUID supplierId;
    private String supplierName;
    private BigDecimal unitCost;
    private BigDecimal totalCost;
    private PaymentStatus paymentStatus;
    private BigDecimal amountPaid;
    private BigDecimal amountDue;
    private String referenceType;
    private UUID referenceId;
    private String notes;
    private UUID createdBy;
    private LocalDateTime createdAt;
}
