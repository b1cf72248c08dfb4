package com.retailerp.erp_backend.dto.response;

import com.retailerp.erp_backend.enums.PaymentMethod;
import com.retailerp.erp_backend.model.ExpensePayment;
import com.retailerp.erp_backend.model.SalePayment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A sale or expense payment; exactly one of {@code saleId} and {@code expenseId} is set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentResponse {
    private UUID id;
    private UUID saleId;
    private UUID expenseId;
    private BigDecimal amount;
    private PaymentMethod paymentMethod;
    private String referenceNumber;
    private LocalDate paymentDate;
    private String notes;
    private UUID createdBy;
    private LocalDateTime createdAt;

    public static PaymentResponse from(SalePayment payment) {
        return PaymentResponse.builder()
                .id(payment.getId())
                .saleId(payment.getSale().getId())
                .amount(payment.getAmount())
                .paymentMethod(payment.getPaymentMethod())
                .referenceNumber(payment.getReferenceNumber())
                .paymentDate(payment.getPaymentDate())
                .notes(payment.getNotes())
                .createdBy(payment.getCreatedBy())
                .createdAt(payment.getCreatedAt())
                .build();
    }

    public static PaymentResponse from(ExpensePayment payment) {
        return PaymentResponse.builder()
                .id(payment.getId())
                .expenseId(payment.getExpense().getId())
                .amount(payment.getAmount())
                .paymentMethod(payment.getPaymentMethod())
                .referenceNumber(payment.getReferenceNumber())
                .paymentDate(payment.getPaymentDate())
                .notes(payment.getNotes())
                .createdBy(payment.getCreatedBy())
                .createdAt(payment.getCreatedAt())
                .build();
    }
}
