package com.retailerp.erp_backend.dto.response;

import com.retailerp.erp_backend.enums.ExpenseType;
import com.retailerp.erp_backend.enums.PaymentStatus;
import com.retailerp.erp_backend.enums.RecurrenceFrequency;
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
public class ExpenseResponse {
    private UUID id;
    private UUID categoryId;
    private String categoryName;
    private ExpenseType expenseType;
    private String title;
    private String description;
    private BigDecimal amount;
    private LocalDate expenseDate;
    private UUID supplierId;
    private String supplierName;
    private UUID saleId;
    private String saleNumber;
    private PaymentStatus paymentStatus;
    private BigDecimal amountPaid;
    private BigDecimal amountDue;
    private String notes;
    private boolean recurring;
    private RecurrenceFrequency recurrenceFrequency;
    private Integer recurrenceDayOfWeek;
    private Integer recurrenceDayOfMonth;
    private LocalDate recurrenceEndDate;
    private UUID parentExpenseId;
    private List<LocalDate> generatedOccurrences;
    private List<PaymentResponse> payments;
    private UUID createdBy;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
