package com.retailerp.erp_backend.controller;

import com.retailerp.erp_backend.dto.request.ExpenseRequest;
import com.retailerp.erp_backend.dto.request.ExpenseUpdateRequest;
import com.retailerp.erp_backend.dto.request.PaymentRequest;
import com.retailerp.erp_backend.dto.response.ApiResponse;
import com.retailerp.erp_backend.dto.response.ExpenseResponse;
import com.retailerp.erp_backend.dto.response.PaymentResponse;
import com.retailerp.erp_backend.dto.response.PaymentResultResponse;
import com.retailerp.erp_backend.enums.ExpenseType;
import com.retailerp.erp_backend.enums.PaymentStatus;
import com.retailerp.erp_backend.security.TenantContext;
import com.retailerp.erp_backend.service.ExpenseService;
import com.retailerp.erp_backend.service.PaymentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/expenses")
@RequiredArgsConstructor
public class ExpenseController {

    private final ExpenseService expenseService;
    private final PaymentService paymentService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<ExpenseResponse>>> getExpenses(
            @RequestParam(required = false) String expenseType,
            @RequestParam(required = false) String paymentStatus,
            @RequestParam(required = false) UUID categoryId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate fromDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate toDate,
            @RequestParam(defaultValue = "true") boolean includeRecurringChildren,
            @RequestParam(required = false) Integer limit,
            @AuthenticationPrincipal TenantContext tenant) {

        List<ExpenseResponse> expenses = expenseService.getExpenses(ExpenseType.fromString(expenseType),
                PaymentStatus.fromString(paymentStatus), categoryId, fromDate, toDate, includeRecurringChildren,
                limit, tenant);
        return ResponseEntity.ok(ApiResponse.success(expenses));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ExpenseResponse>> getExpenseById(
            @PathVariable UUID id,
            @AuthenticationPrincipal TenantContext tenant) {
        return ResponseEntity.ok(ApiResponse.success(expenseService.getExpenseById(id, tenant)));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<ExpenseResponse>> createExpense(
            @Valid @RequestBody ExpenseRequest request,
            @AuthenticationPrincipal TenantContext tenant) {

        ExpenseResponse expense = expenseService.createExpense(request, tenant);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(expense, "Expense created successfully"));
    }

    @PatchMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<ExpenseResponse>> updateExpense(
            @PathVariable UUID id,
            @Valid @RequestBody ExpenseUpdateRequest request,
            @AuthenticationPrincipal TenantContext tenant) {

        ExpenseResponse expense = expenseService.updateExpense(id, request, tenant);
        return ResponseEntity.ok(ApiResponse.success(expense, "Expense updated successfully"));
    }

    @PostMapping("/{id}/payments")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<PaymentResultResponse<ExpenseResponse>>> recordPayment(
            @PathVariable UUID id,
            @Valid @RequestBody PaymentRequest request,
            @AuthenticationPrincipal TenantContext tenant) {

        PaymentResultResponse<ExpenseResponse> result = paymentService.recordExpensePayment(id, request, tenant);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(result, "Payment recorded successfully"));
    }

    @GetMapping("/{id}/payments")
    public ResponseEntity<ApiResponse<List<PaymentResponse>>> getExpensePayments(
            @PathVariable UUID id,
            @AuthenticationPrincipal TenantContext tenant) {
        return ResponseEntity.ok(ApiResponse.success(paymentService.getExpensePayments(id, tenant)));
    }
}
