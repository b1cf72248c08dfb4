package com.retailerp.erp_backend.controller;

import com.retailerp.erp_backend.dto.request.CreditNoteRequest;
import com.retailerp.erp_backend.dto.request.SalePaymentRequest;
import com.retailerp.erp_backend.dto.request.SaleRequest;
import com.retailerp.erp_backend.dto.response.ApiResponse;
import com.retailerp.erp_backend.dto.response.PaymentResponse;
import com.retailerp.erp_backend.dto.response.PaymentResultResponse;
import com.retailerp.erp_backend.dto.response.SaleResponse;
import com.retailerp.erp_backend.enums.PaymentStatus;
import com.retailerp.erp_backend.enums.SaleType;
import com.retailerp.erp_backend.security.TenantContext;
import com.retailerp.erp_backend.service.CreditNoteService;
import com.retailerp.erp_backend.service.PaymentService;
import com.retailerp.erp_backend.service.SaleService;
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
@RequestMapping("/api/sales")
@RequiredArgsConstructor
public class SaleController {

    private final SaleService saleService;
    private final CreditNoteService creditNoteService;
    private final PaymentService paymentService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<SaleResponse>>> getSales(
            @RequestParam(required = false) String saleType,
            @RequestParam(required = false) String paymentStatus,
            @RequestParam(required = false) UUID customerId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate fromDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate toDate,
            @RequestParam(required = false) Integer limit,
            @AuthenticationPrincipal TenantContext tenant) {

        List<SaleResponse> sales = saleService.getSales(SaleType.fromString(saleType),
                PaymentStatus.fromString(paymentStatus), customerId, fromDate, toDate, limit, tenant);
        return ResponseEntity.ok(ApiResponse.success(sales));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<SaleResponse>> getSaleById(
            @PathVariable UUID id,
            @AuthenticationPrincipal TenantContext tenant) {
        return ResponseEntity.ok(ApiResponse.success(saleService.getSaleById(id, tenant)));
    }

    @PostMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'SHOP_ATTENDANT')")
    public ResponseEntity<ApiResponse<SaleResponse>> createSale(
            @Valid @RequestBody SaleRequest request,
            @AuthenticationPrincipal TenantContext tenant) {

        SaleResponse sale = saleService.createSale(request, tenant);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(sale, "Sale created successfully"));
    }

    @PostMapping("/credit-notes")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<SaleResponse>> createCreditNote(
            @Valid @RequestBody CreditNoteRequest request,
            @AuthenticationPrincipal TenantContext tenant) {

        SaleResponse creditNote = creditNoteService.createCreditNote(request, tenant);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(creditNote, "Credit note created successfully"));
    }

    @PostMapping("/payments")
    @PreAuthorize("hasAnyRole('ADMIN', 'SHOP_ATTENDANT')")
    public ResponseEntity<ApiResponse<PaymentResultResponse<SaleResponse>>> recordPayment(
            @Valid @RequestBody SalePaymentRequest request,
            @AuthenticationPrincipal TenantContext tenant) {

        PaymentResultResponse<SaleResponse> result = paymentService.recordSalePayment(request, tenant);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(result, "Payment recorded successfully"));
    }

    @GetMapping("/{id}/payments")
    public ResponseEntity<ApiResponse<List<PaymentResponse>>> getSalePayments(
            @PathVariable UUID id,
            @AuthenticationPrincipal TenantContext tenant) {
        return ResponseEntity.ok(ApiResponse.success(paymentService.getSalePayments(id, tenant)));
    }
}
