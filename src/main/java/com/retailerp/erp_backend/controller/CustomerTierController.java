package com.retailerp.erp_backend.controller;

import com.retailerp.erp_backend.dto.request.CustomerTierRequest;
import com.retailerp.erp_backend.dto.response.ApiResponse;
import com.retailerp.erp_backend.dto.response.CustomerTierResponse;
import com.retailerp.erp_backend.security.TenantContext;
import com.retailerp.erp_backend.service.CustomerTierService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/customer-tiers")
@RequiredArgsConstructor
public class CustomerTierController {

    private final CustomerTierService customerTierService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<CustomerTierResponse>>> getTiers(@AuthenticationPrincipal TenantContext tenant) {
        return ResponseEntity.ok(ApiResponse.success(customerTierService.getTiers(tenant)));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<CustomerTierResponse>> createTier(
            @Valid @RequestBody CustomerTierRequest request,
            @AuthenticationPrincipal TenantContext tenant) {

        CustomerTierResponse tier = customerTierService.createTier(request, tenant);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(tier, "Customer tier created successfully"));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<Void>> deleteTier(
            @PathVariable UUID id,
            @AuthenticationPrincipal TenantContext tenant) {

        customerTierService.deleteTier(id, tenant);
        return ResponseEntity.ok(ApiResponse.success(null, "Customer tier deleted successfully"));
    }
}
