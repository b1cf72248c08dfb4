package com.retailerp.erp_backend.service;

import com.retailerp.erp_backend.dto.request.InventoryTransactionRequest;
import com.retailerp.erp_backend.dto.request.StockAdjustmentRequest;
import com.retailerp.erp_backend.dto.response.InventoryTransactionResponse;
import com.retailerp.erp_backend.enums.PaymentStatus;
import com.retailerp.erp_backend.enums.TransactionType;
import com.retailerp.erp_backend.exception.AlreadyReversedException;
import com.retailerp.erp_backend.exception.ExceedsAmountDueException;
import com.retailerp.erp_backend.exception.InvalidOperationException;
import com.retailerp.erp_backend.exception.ResourceNotFoundException;
import com.retailerp.erp_backend.exception.ValidationException;
import com.retailerp.erp_backend.model.Company;
import com.retailerp.erp_backend.model.InventoryTransaction;
import com.retailerp.erp_backend.model.ProductVariant;
import com.retailerp.erp_backend.model.StorageLocation;
import com.retailerp.erp_backend.model.Supplier;
import com.retailerp.erp_backend.repository.InventoryTransactionRepository;
import com.retailerp.erp_backend.security.TenantContext;
import com.retailerp.erp_backend.util.MoneyUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class InventoryTransactionService {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 100;

    private final InventoryTransactionRepository inventoryTransactionRepository;
    private final StockLedgerService stockLedgerService;
    private final ReferenceDataService referenceDataService;

    @Transactional(readOnly = true)
    public InventoryTransactionResponse getTransactionById(UUID id, TenantContext tenant) {
        InventoryTransaction transaction = inventoryTransactionRepository.findByIdAndCompanyId(id, tenant.getCompanyId())
                .orElseThrow(() -> new ResourceNotFoundException("Inventory transaction", "id", id));
        return mapToResponse(transaction);
    }

    @Transactional(readOnly = true)
    public List<InventoryTransactionResponse> getTransactions(UUID variantId, UUID locationId, TransactionType type,
                                                              Integer limit, TenantContext tenant) {
        int pageSize = limit == null ? DEFAULT_LIMIT : Math.max(1, Math.min(limit, MAX_LIMIT));
        return inventoryTransactionRepository.findTransactionsByCriteria(
                        tenant.getCompanyId(), variantId, locationId, type, PageRequest.of(0, pageSize))
                .stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
    }

    /**
     * Records a stock movement and applies it to the stock ledger. The movement and the log entry commit
     * together or not at all.
     */
    @Transactional
    public InventoryTransactionResponse recordTransaction(InventoryTransactionRequest request, TenantContext tenant) {
        if (InventoryTransaction.REFERENCE_REVERSAL.equalsIgnoreCase(request.getReferenceType())) {
            throw new ValidationException("Reversal entries can only be created by reversing a transaction",
                    "referenceType");
        }
        if (InventoryTransaction.REFERENCE_SALE.equalsIgnoreCase(request.getReferenceType())) {
            throw new ValidationException("Sale movements can only be created by recording a sale or credit note",
                    "referenceType");
        }

        ProductVariant variant = referenceDataService.getVariant(request.getProductVariantId(), tenant);
        Supplier supplier = request.getSupplierId() != null
                ? referenceDataService.getSupplier(request.getSupplierId(), tenant)
                : null;

        TransactionType type = request.getTransactionType();
        validateLocations(type, request.getFromLocationId(), request.getToLocationId());
        StorageLocation fromLocation = request.getFromLocationId() != null
                ? referenceDataService.getLocation(request.getFromLocationId(), tenant)
                : null;
        StorageLocation toLocation = request.getToLocationId() != null
                ? referenceDataService.getLocation(request.getToLocationId(), tenant)
                : null;

        int quantity = request.getQuantity();
        BigDecimal amountPaid = MoneyUtil.round(MoneyUtil.orZero(request.getAmountPaid()));
        BigDecimal totalCost = null;
        BigDecimal amountDue = null;
        if (request.getUnitCost() != null) {
            totalCost = MoneyUtil.round(request.getUnitCost().multiply(BigDecimal.valueOf(quantity)));
            if (amountPaid.compareTo(totalCost) > 0) {
                throw new ExceedsAmountDueException(String.format("Amount paid (%s) exceeds total cost (%s)",
                        MoneyUtil.format(amountPaid, tenant.getCurrency()),
                        MoneyUtil.format(totalCost, tenant.getCurrency())));
            }
            amountDue = totalCost.subtract(amountPaid);
        } else if (amountPaid.signum() > 0) {
            throw new ValidationException("Unit cost is required when an amount is paid", "unitCost");
        }

        PaymentStatus paymentStatus = request.getPaymentStatus();
        if (paymentStatus == null) {
            paymentStatus = totalCost != null ? PaymentStatus.derive(amountPaid, amountDue) : PaymentStatus.UNPAID;
        }

        Company company = referenceDataService.getCompany(tenant);
        applyMovement(company, type, variant, quantity, fromLocation, toLocation);

        InventoryTransaction transaction = InventoryTransaction.builder()
                .company(company)
                .transactionType(type)
                .variant(variant)
                .quantity(quantity)
                .fromLocation(fromLocation)
                .toLocation(toLocation)
                .supplier(supplier)
                .unitCost(request.getUnitCost())
                .totalCost(totalCost)
                .paymentStatus(paymentStatus)
                .amountPaid(amountPaid)
                .amountDue(amountDue)
                .referenceType(request.getReferenceType())
                .referenceId(request.getReferenceId())
                .notes(request.getNotes())
                .createdBy(tenant.getUserId())
                .build();

        InventoryTransaction saved = inventoryTransactionRepository.save(transaction);
        log.info("Recorded {} of {} x {} (transaction {})", type.getValue(), quantity, variant.getVariantName(), saved.getId());
        return mapToResponse(saved);
    }

    /**
     * Applies a signed correction at one location and logs it as an adjustment of {@code |delta|}.
     */
    @Transactional
    public InventoryTransactionResponse adjustStock(StockAdjustmentRequest request, TenantContext tenant) {
        int delta = request.getQuantity();
        if (delta == 0) {
            throw new ValidationException("Adjustment quantity cannot be zero", "quantity");
        }

        ProductVariant variant = referenceDataService.getVariant(request.getProductVariantId(), tenant);
        StorageLocation location = referenceDataService.getLocation(request.getLocationId(), tenant);
        Company company = referenceDataService.getCompany(tenant);

        stockLedgerService.applyDelta(company, variant, location, delta);

        InventoryTransaction transaction = InventoryTransaction.builder()
                .company(company)
                .transactionType(TransactionType.ADJUSTMENT)
                .variant(variant)
                .quantity(Math.abs(delta))
                .fromLocation(delta < 0 ? location : null)
                .toLocation(delta > 0 ? location : null)
                .notes(request.getNotes())
                .createdBy(tenant.getUserId())
                .build();

        InventoryTransaction saved = inventoryTransactionRepository.save(transaction);
        log.info("Adjusted {} at {} by {} (transaction {})", variant.getVariantName(), location.getName(), delta, saved.getId());
        return mapToResponse(saved);
    }

    /**
     * Appends the compensating movement for a transaction. History is never edited; a transaction can be
     * reversed once.
     */
    @Transactional
    public InventoryTransactionResponse reverseTransaction(UUID transactionId, TenantContext tenant) {
        // the row lock serializes concurrent reversals of the same transaction
        InventoryTransaction original = inventoryTransactionRepository.findByIdAndCompanyIdForUpdate(transactionId, tenant.getCompanyId())
                .orElseThrow(() -> new ResourceNotFoundException("Inventory transaction", "id", transactionId));

        if (InventoryTransaction.REFERENCE_REVERSAL.equals(original.getReferenceType())) {
            throw new InvalidOperationException("A reversal entry cannot itself be reversed");
        }
        if (InventoryTransaction.REFERENCE_SALE.equals(original.getReferenceType())) {
            throw new InvalidOperationException("Stock moved by a sale is returned through a credit note");
        }
        if (inventoryTransactionRepository.existsByReferenceTypeAndReferenceId(
                InventoryTransaction.REFERENCE_REVERSAL, transactionId)) {
            throw new AlreadyReversedException(transactionId);
        }

        TransactionType reverseType;
        StorageLocation reverseFrom;
        StorageLocation reverseTo;
        switch (original.getTransactionType()) {
            case STOCK_IN -> {
                reverseType = TransactionType.STOCK_OUT;
                reverseFrom = original.getToLocation();
                reverseTo = null;
            }
            case STOCK_OUT -> {
                reverseType = TransactionType.STOCK_IN;
                reverseFrom = null;
                reverseTo = original.getFromLocation();
            }
            case TRANSFER -> {
                reverseType = TransactionType.TRANSFER;
                reverseFrom = original.getToLocation();
                reverseTo = original.getFromLocation();
            }
            // an adjustment is undone by the same adjustment on the opposite side
            case ADJUSTMENT -> {
                reverseType = TransactionType.ADJUSTMENT;
                reverseFrom = original.getToLocation();
                reverseTo = original.getFromLocation();
            }
            default -> throw new IllegalStateException("Unknown transaction type: " + original.getTransactionType());
        }

        Company company = referenceDataService.getCompany(tenant);
        applyMovement(company, reverseType, original.getVariant(), original.getQuantity(), reverseFrom, reverseTo);

        String shortId = transactionId.toString().substring(0, 8);
        InventoryTransaction reversal = InventoryTransaction.builder()
                .company(company)
                .transactionType(reverseType)
                .variant(original.getVariant())
                .quantity(original.getQuantity())
                .fromLocation(reverseFrom)
                .toLocation(reverseTo)
                .supplier(original.getSupplier())
                .referenceType(InventoryTransaction.REFERENCE_REVERSAL)
                .referenceId(transactionId)
                .notes("Reversal of transaction " + shortId + "...")
                .createdBy(tenant.getUserId())
                .build();

        InventoryTransaction saved = inventoryTransactionRepository.save(reversal);
        log.info("Reversed transaction {} with {} (transaction {})", transactionId, reverseType.getValue(), saved.getId());
        return mapToResponse(saved);
    }

    /**
     * Appends a log entry for stock already moved by another ledger operation, such as a sale.
     */
    @Transactional
    public InventoryTransaction logMovement(Company company, TransactionType type, ProductVariant variant, int quantity,
                                           StorageLocation fromLocation, StorageLocation toLocation,
                                           String referenceType, UUID referenceId, String notes, UUID createdBy) {
        InventoryTransaction transaction = InventoryTransaction.builder()
                .company(company)
                .transactionType(type)
                .variant(variant)
                .quantity(quantity)
                .fromLocation(fromLocation)
                .toLocation(toLocation)
                .referenceType(referenceType)
                .referenceId(referenceId)
                .notes(notes)
                .createdBy(createdBy)
                .build();
        return inventoryTransactionRepository.save(transaction);
    }

    private void validateLocations(TransactionType type, UUID fromLocationId, UUID toLocationId) {
        switch (type) {
            case STOCK_IN -> {
                if (toLocationId == null) {
                    throw new ValidationException("toLocationId is required for stock_in", "toLocationId");
                }
            }
            case STOCK_OUT -> {
                if (fromLocationId == null) {
                    throw new ValidationException("fromLocationId is required for stock_out", "fromLocationId");
                }
            }
            case TRANSFER -> {
                if (fromLocationId == null || toLocationId == null) {
                    throw new ValidationException(
                            "Both fromLocationId and toLocationId are required for transfer");
                }
                if (fromLocationId.equals(toLocationId)) {
                    throw new ValidationException("Cannot transfer stock to the same location", "toLocationId");
                }
            }
            case ADJUSTMENT -> {
                if ((fromLocationId == null) == (toLocationId == null)) {
                    throw new ValidationException(
                            "Exactly one of fromLocationId or toLocationId is required for adjustment");
                }
            }
        }
    }

    private void applyMovement(Company company, TransactionType type, ProductVariant variant, int quantity,
                               StorageLocation fromLocation, StorageLocation toLocation) {
        switch (type) {
            case STOCK_IN -> stockLedgerService.applyDelta(company, variant, toLocation, quantity);
            case STOCK_OUT -> stockLedgerService.applyDelta(company, variant, fromLocation, -quantity);
            case TRANSFER -> {
                stockLedgerService.applyDelta(company, variant, fromLocation, -quantity);
                stockLedgerService.applyDelta(company, variant, toLocation, quantity);
            }
            case ADJUSTMENT -> {
                if (toLocation != null) {
                    stockLedgerService.applyDelta(company, variant, toLocation, quantity);
                } else {
                    stockLedgerService.applyDelta(company, variant, fromLocation, -quantity);
                }
            }
        }
    }

    private InventoryTransactionResponse mapToResponse(InventoryTransaction transaction) {
        ProductVariant variant = transaction.getVariant();
        StorageLocation from = transaction.getFromLocation();
        StorageLocation to = transaction.getToLocation();
        Supplier supplier = transaction.getSupplier();

        return InventoryTransactionResponse.builder()
                .id(transaction.getId())
                .transactionType(transaction.getTransactionType())
                .productVariantId(variant.getId())
                .variantName(variant.getVariantName())
                .sku(variant.getSku())
                .quantity(transaction.getQuantity())
                .fromLocationId(from != null ? from.getId() : null)
                .fromLocationName(from != null ? from.getName() : null)
                .toLocationId(to != null ? to.getId() : null)
                .toLocationName(to != null ? to.getName() : null)
                .supplierId(supplier != null ? supplier.getId() : null)
                .supplierName(supplier != null ? supplier.getName() : null)
                .unitCost(transaction.getUnitCost())
                .totalCost(transaction.getTotalCost())
                .paymentStatus(transaction.getPaymentStatus())
                .amountPaid(transaction.getAmountPaid())
                .amountDue(transaction.getAmountDue())
                .referenceType(transaction.getReferenceType())
                .referenceId(transaction.getReferenceId())
                .notes(transaction.getNotes())
                .createdBy(transaction.getCreatedBy())
                .createdAt(transaction.getCreatedAt())
                .build();
    }
}
