package com.retailerp.erp_backend.controller;

import com.retailerp.erp_backend.dto.request.CreditCheckRequest;
import com.retailerp.erp_backend.dto.request.CustomerRequest;
import com.retailerp.erp_backend.dto.response.ApiResponse;
import com.retailerp.erp_backend.dto.response.CreditCheckResponse;
import com.retailerp.erp_backend.dto.response.CustomerBalanceResponse;
import com.retailerp.erp_backend.dto.response.CustomerResponse;
import com.retailerp.erp_backend.dto.response.PaginatedResponse;
import com.retailerp.erp_backend.dto.response.ReconciliationResponse;
import com.retailerp.erp_backend.enums.CustomerStatus;
import com.retailerp.erp_backend.enums.CustomerType;
import com.retailerp.erp_backend.security.TenantContext;
import com.retailerp.erp_backend.service.CustomerService;
import com.retailerp.erp_backend.service.LedgerReconciliationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/customers")
@RequiredArgsConstructor
public class CustomerController {

    private final CustomerService customerService;
    private final LedgerReconciliationService ledgerReconciliationService;

    @GetMapping
    public ResponseEntity<ApiResponse<PaginatedResponse<CustomerResponse>>> getCustomers(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(required = false) String customerType,
            @RequestParam(required = false) String status,
            @AuthenticationPrincipal TenantContext tenant) {

        PaginatedResponse<CustomerResponse> customers = customerService.getCustomers(
                Math.max(page, 1), Math.max(1, Math.min(limit, 100)),
                CustomerType.fromString(customerType), CustomerStatus.fromString(status), tenant);
        return ResponseEntity.ok(ApiResponse.success(customers));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<CustomerResponse>> getCustomerById(
            @PathVariable UUID id,
            @AuthenticationPrincipal TenantContext tenant) {
        return ResponseEntity.ok(ApiResponse.success(customerService.getCustomerById(id, tenant)));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<CustomerResponse>> createCustomer(
            @Valid @RequestBody CustomerRequest request,
            @AuthenticationPrincipal TenantContext tenant) {

        CustomerResponse customer = customerService.createCustomer(request, tenant);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(customer, "Customer created successfully"));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<CustomerResponse>> updateCustomer(
            @PathVariable UUID id,
            @Valid @RequestBody CustomerRequest request,
            @AuthenticationPrincipal TenantContext tenant) {

        CustomerResponse customer = customerService.updateCustomer(id, request, tenant);
        return ResponseEntity.ok(ApiResponse.success(customer, "Customer updated successfully"));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<Void>> deleteCustomer(
            @PathVariable UUID id,
            @AuthenticationPrincipal TenantContext tenant) {

        customerService.deactivateCustomer(id, tenant);
        return ResponseEntity.ok(ApiResponse.success(null, "Customer deactivated successfully"));
    }

    @GetMapping("/{id}/balance")
    public ResponseEntity<ApiResponse<CustomerBalanceResponse>> getBalance(
            @PathVariable UUID id,
            @AuthenticationPrincipal TenantContext tenant) {
        return ResponseEntity.ok(ApiResponse.success(customerService.getBalance(id, tenant)));
    }

    @PostMapping("/{id}/check-credit")
    public ResponseEntity<ApiResponse<CreditCheckResponse>> checkCredit(
            @PathVariable UUID id,
            @Valid @RequestBody CreditCheckRequest request,
            @AuthenticationPrincipal TenantContext tenant) {

        CreditCheckResponse result = customerService.checkCredit(id, request.getSaleAmount(), tenant);
        return ResponseEntity.ok(ApiResponse.success(result));
    }

    @PostMapping("/{id}/reconcile")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<ReconciliationResponse>> reconcile(
            @PathVariable UUID id,
            @RequestParam(defaultValue = "false") boolean apply,
            @AuthenticationPrincipal TenantContext tenant) {

        ReconciliationResponse result = ledgerReconciliationService.reconcileCustomer(id, apply, tenant);
        return ResponseEntity.ok(ApiResponse.success(result));
    }
}
