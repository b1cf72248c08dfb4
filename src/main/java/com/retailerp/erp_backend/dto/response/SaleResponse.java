package com.retailerp.erp_backend.dto.response;

import com.retailerp.erp_backend.enums.PaymentStatus;
import com.retailerp.erp_backend.enums.SaleType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SaleResponse {
    private UUID id;
    private String saleNumber;
    private SaleType saleType;
    private UUID originalSaleId;
    private String originalSaleNumber;
    private UUID customerId;
    private String customerName;
    private UUID locationId;
    private String locationName;
    private LocalDate saleDate;
    private BigDecimal subtotal;
    private BigDecimal discountPercentage;
    private BigDecimal discountAmount;
    private BigDecimal totalAmount;
    private PaymentStatus paymentStatus;
    private BigDecimal amountPaid;
    private BigDecimal amountDue;
    private String notes;
    private List<SaleItemResponse> items;
    private List<PaymentResponse> payments;
    private LocalDateTime createdAt;
}
