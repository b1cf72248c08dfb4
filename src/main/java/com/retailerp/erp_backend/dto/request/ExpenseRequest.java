package com.retailerp.erp_backend.dto.request;

import com.retailerp.erp_backend.enums.ExpenseType;
import com.retailerp.erp_backend.enums.RecurrenceFrequency;
import jakarta.validation.constraints.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Data
public class ExpenseRequest {

    @NotNull(message = "Category ID is required")
    private UUID categoryId;

    @NotNull(message = "Expense type is required")
    private ExpenseType expenseType;

    @NotBlank(message = "Title is required")
    @Size(max = 255, message = "Title cannot exceed 255 characters")
    private String title;

    private String description;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.0", inclusive = false, message = "Amount must be greater than 0")
    private BigDecimal amount;

    // Defaults to today
    private LocalDate expenseDate;

    private UUID supplierId;

    private UUID saleId;

    private String notes;

    private boolean recurring;

    private RecurrenceFrequency recurrenceFrequency;

    @Min(value = 0, message = "Day of week must be between 0 (Monday) and 6 (Sunday)")
    @Max(value = 6, message = "Day of week must be between 0 (Monday) and 6 (Sunday)")
    private Integer recurrenceDayOfWeek;

    @Min(value = 1, message = "Day of month must be between 1 and 31")
    @Max(value = 31, message = "Day of month must be between 1 and 31")
    private Integer recurrenceDayOfMonth;

    private LocalDate recurrenceEndDate;
}
