package com.retailerp.erp_backend.controller;

import com.retailerp.erp_backend.dto.response.ApiResponse;
import com.retailerp.erp_backend.dto.response.InventoryItemResponse;
import com.retailerp.erp_backend.dto.response.StockVerificationResponse;
import com.retailerp.erp_backend.security.TenantContext;
import com.retailerp.erp_backend.service.InventoryItemService;
import com.retailerp.erp_backend.service.LedgerReconciliationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/inventory-items")
@RequiredArgsConstructor
public class InventoryItemController {

    private final InventoryItemService inventoryItemService;
    private final LedgerReconciliationService ledgerReconciliationService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<InventoryItemResponse>>> getInventoryItems(
            @RequestParam(required = false) UUID productVariantId,
            @RequestParam(required = false) UUID locationId,
            @RequestParam(defaultValue = "false") boolean lowStockOnly,
            @AuthenticationPrincipal TenantContext tenant) {

        List<InventoryItemResponse> items = inventoryItemService.getInventoryItems(
                productVariantId, locationId, lowStockOnly, tenant);
        return ResponseEntity.ok(ApiResponse.success(items));
    }

    @GetMapping("/verify")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<StockVerificationResponse>> verifyStock(
            @RequestParam UUID productVariantId,
            @RequestParam UUID locationId,
            @AuthenticationPrincipal TenantContext tenant) {

        StockVerificationResponse verification = ledgerReconciliationService.verifyStock(productVariantId, locationId, tenant);
        return ResponseEntity.ok(ApiResponse.success(verification));
    }
}
