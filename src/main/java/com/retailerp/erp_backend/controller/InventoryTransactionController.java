package com.retailerp.erp_backend.controller;

import com.retailerp.erp_backend.dto.request.InventoryTransactionRequest;
import com.retailerp.erp_backend.dto.request.StockAdjustmentRequest;
import com.retailerp.erp_backend.dto.response.ApiResponse;
import com.retailerp.erp_backend.dto.response.InventoryTransactionResponse;
import com.retailerp.erp_backend.enums.TransactionType;
import com.retailerp.erp_backend.security.TenantContext;
import com.retailerp.erp_backend.service.InventoryTransactionService;
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
@RequestMapping("/api/inventory-transactions")
@RequiredArgsConstructor
public class InventoryTransactionController {

    private final InventoryTransactionService inventoryTransactionService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<InventoryTransactionResponse>>> getTransactions(
            @RequestParam(required = false) UUID productVariantId,
            @RequestParam(required = false) UUID locationId,
            @RequestParam(required = false) String transactionType,
            @RequestParam(required = false) Integer limit,
            @AuthenticationPrincipal TenantContext tenant) {

        List<InventoryTransactionResponse> transactions = inventoryTransactionService.getTransactions(
                productVariantId, locationId, TransactionType.fromString(transactionType), limit, tenant);
        return ResponseEntity.ok(ApiResponse.success(transactions));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<InventoryTransactionResponse>> getTransactionById(
            @PathVariable UUID id,
            @AuthenticationPrincipal TenantContext tenant) {
        return ResponseEntity.ok(ApiResponse.success(inventoryTransactionService.getTransactionById(id, tenant)));
    }

    @PostMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'SHOP_ATTENDANT')")
    public ResponseEntity<ApiResponse<InventoryTransactionResponse>> recordTransaction(
            @Valid @RequestBody InventoryTransactionRequest request,
            @AuthenticationPrincipal TenantContext tenant) {

        InventoryTransactionResponse transaction = inventoryTransactionService.recordTransaction(request, tenant);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(transaction, "Inventory transaction recorded successfully"));
    }

    @PostMapping("/adjust")
    @PreAuthorize("hasAnyRole('ADMIN', 'SHOP_ATTENDANT')")
    public ResponseEntity<ApiResponse<InventoryTransactionResponse>> adjustStock(
            @Valid @RequestBody StockAdjustmentRequest request,
            @AuthenticationPrincipal TenantContext tenant) {

        InventoryTransactionResponse transaction = inventoryTransactionService.adjustStock(request, tenant);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(transaction, "Stock adjusted successfully"));
    }

    @PostMapping("/{id}/reverse")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<InventoryTransactionResponse>> reverseTransaction(
            @PathVariable UUID id,
            @AuthenticationPrincipal TenantContext tenant) {

        InventoryTransactionResponse reversal = inventoryTransactionService.reverseTransaction(id, tenant);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(reversal, "Transaction reversed successfully"));
    }
}
