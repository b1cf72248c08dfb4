package com.retailerp.erp_backend.service;

import com.retailerp.erp_backend.TestDataBuilder;
import com.retailerp.erp_backend.dto.request.InventoryTransactionRequest;
import com.retailerp.erp_backend.dto.request.StockAdjustmentRequest;
import com.retailerp.erp_backend.dto.response.InventoryTransactionResponse;
import com.retailerp.erp_backend.enums.PaymentStatus;
import com.retailerp.erp_backend.enums.Role;
import com.retailerp.erp_backend.enums.TransactionType;
import com.retailerp.erp_backend.exception.AlreadyReversedException;
import com.retailerp.erp_backend.exception.ExceedsAmountDueException;
import com.retailerp.erp_backend.exception.InvalidOperationException;
import com.retailerp.erp_backend.exception.ValidationException;
import com.retailerp.erp_backend.model.Company;
import com.retailerp.erp_backend.model.InventoryTransaction;
import com.retailerp.erp_backend.model.ProductVariant;
import com.retailerp.erp_backend.model.StorageLocation;
import com.retailerp.erp_backend.repository.InventoryTransactionRepository;
import com.retailerp.erp_backend.security.TenantContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InventoryTransactionServiceTest {

    @Mock
    private InventoryTransactionRepository inventoryTransactionRepository;
    @Mock
    private StockLedgerService stockLedgerService;
    @Mock
    private ReferenceDataService referenceDataService;

    @InjectMocks
    private InventoryTransactionService inventoryTransactionService;

    private Company company;
    private TenantContext tenant;
    private ProductVariant rice;
    private StorageLocation shop;
    private StorageLocation store;

    @BeforeEach
    void setUp() {
        company = TestDataBuilder.company();
        tenant = TestDataBuilder.tenant(company, Role.SHOP_ATTENDANT);
        rice = TestDataBuilder.variant(company, "Rice 2kg");
        shop = TestDataBuilder.location(company, "Main Shop");
        store = TestDataBuilder.location(company, "Back Store");
    }

    private InventoryTransactionRequest stockIn(int quantity) {
        InventoryTransactionRequest request = new InventoryTransactionRequest();
        request.setTransactionType(TransactionType.STOCK_IN);
        request.setProductVariantId(rice.getId());
        request.setQuantity(quantity);
        request.setToLocationId(shop.getId());
        return request;
    }

    @Test
    void recordTransaction_ShouldDeriveCostAndPartialStatusForSupplierDelivery() {
        InventoryTransactionRequest request = stockIn(10);
        request.setUnitCost(new BigDecimal("50.00"));
        request.setAmountPaid(new BigDecimal("200.00"));

        when(referenceDataService.getVariant(rice.getId(), tenant)).thenReturn(rice);
        when(referenceDataService.getLocation(shop.getId(), tenant)).thenReturn(shop);
        when(referenceDataService.getCompany(tenant)).thenReturn(company);
        when(inventoryTransactionRepository.save(any(InventoryTransaction.class))).thenAnswer(i -> i.getArguments()[0]);

        InventoryTransactionResponse response = inventoryTransactionService.recordTransaction(request, tenant);

        assertEquals(0, new BigDecimal("500.00").compareTo(response.getTotalCost()));
        assertEquals(0, new BigDecimal("300.00").compareTo(response.getAmountDue()));
        assertEquals(PaymentStatus.PARTIAL, response.getPaymentStatus());
        assertEquals(shop.getId(), response.getToLocationId());
        verify(stockLedgerService).applyDelta(company, rice, shop, 10);
    }

    @Test
    void recordTransaction_ShouldMoveBothSidesOfTransfer() {
        InventoryTransactionRequest request = new InventoryTransactionRequest();
        request.setTransactionType(TransactionType.TRANSFER);
        request.setProductVariantId(rice.getId());
        request.setQuantity(4);
        request.setFromLocationId(store.getId());
        request.setToLocationId(shop.getId());

        when(referenceDataService.getVariant(rice.getId(), tenant)).thenReturn(rice);
        when(referenceDataService.getLocation(store.getId(), tenant)).thenReturn(store);
        when(referenceDataService.getLocation(shop.getId(), tenant)).thenReturn(shop);
        when(referenceDataService.getCompany(tenant)).thenReturn(company);
        when(inventoryTransactionRepository.save(any(InventoryTransaction.class))).thenAnswer(i -> i.getArguments()[0]);

        InventoryTransactionResponse response = inventoryTransactionService.recordTransaction(request, tenant);

        assertEquals(PaymentStatus.UNPAID, response.getPaymentStatus());
        verify(stockLedgerService).applyDelta(company, rice, store, -4);
        verify(stockLedgerService).applyDelta(company, rice, shop, 4);
    }

    @Test
    void recordTransaction_ShouldRejectTransferToSameLocation() {
        InventoryTransactionRequest request = new InventoryTransactionRequest();
        request.setTransactionType(TransactionType.TRANSFER);
        request.setProductVariantId(rice.getId());
        request.setQuantity(4);
        request.setFromLocationId(shop.getId());
        request.setToLocationId(shop.getId());

        assertThrows(ValidationException.class, () -> inventoryTransactionService.recordTransaction(request, tenant));
        verifyNoInteractions(stockLedgerService);
        verify(inventoryTransactionRepository, never()).save(any());
    }

    @Test
    void recordTransaction_ShouldRejectAdjustmentWithBothLocations() {
        InventoryTransactionRequest request = new InventoryTransactionRequest();
        request.setTransactionType(TransactionType.ADJUSTMENT);
        request.setProductVariantId(rice.getId());
        request.setQuantity(1);
        request.setFromLocationId(store.getId());
        request.setToLocationId(shop.getId());

        assertThrows(ValidationException.class, () -> inventoryTransactionService.recordTransaction(request, tenant));
        verifyNoInteractions(stockLedgerService);
    }

    @Test
    void recordTransaction_ShouldRejectPaymentAboveTotalCost() {
        InventoryTransactionRequest request = stockIn(10);
        request.setUnitCost(new BigDecimal("50.00"));
        request.setAmountPaid(new BigDecimal("600.00"));

        ExceedsAmountDueException ex = assertThrows(ExceedsAmountDueException.class,
                () -> inventoryTransactionService.recordTransaction(request, tenant));

        assertEquals("Amount paid (KES 600.00) exceeds total cost (KES 500.00)", ex.getMessage());
        verifyNoInteractions(stockLedgerService);
    }

    @Test
    void recordTransaction_ShouldRejectClientSuppliedReversalReference() {
        InventoryTransactionRequest request = stockIn(1);
        request.setReferenceType("reversal");
        request.setReferenceId(UUID.randomUUID());

        assertThrows(ValidationException.class, () -> inventoryTransactionService.recordTransaction(request, tenant));
        verifyNoInteractions(referenceDataService, stockLedgerService);
    }

    @Test
    void recordTransaction_ShouldRejectClientSuppliedSaleReference() {
        InventoryTransactionRequest request = stockIn(1);
        request.setReferenceType("Sale");
        request.setReferenceId(UUID.randomUUID());

        ValidationException ex = assertThrows(ValidationException.class,
                () -> inventoryTransactionService.recordTransaction(request, tenant));
        assertEquals("Sale movements can only be created by recording a sale or credit note", ex.getMessage());
        verifyNoInteractions(referenceDataService, stockLedgerService);
    }

    @Test
    void adjustStock_ShouldRejectZeroDelta() {
        StockAdjustmentRequest request = new StockAdjustmentRequest();
        request.setProductVariantId(rice.getId());
        request.setLocationId(shop.getId());
        request.setQuantity(0);

        assertThrows(ValidationException.class, () -> inventoryTransactionService.adjustStock(request, tenant));
        verifyNoInteractions(stockLedgerService);
    }

    @Test
    void adjustStock_ShouldLogNegativeDeltaAsAdjustmentFromLocation() {
        StockAdjustmentRequest request = new StockAdjustmentRequest();
        request.setProductVariantId(rice.getId());
        request.setLocationId(shop.getId());
        request.setQuantity(-4);
        request.setNotes("Damaged bags");

        when(referenceDataService.getVariant(rice.getId(), tenant)).thenReturn(rice);
        when(referenceDataService.getLocation(shop.getId(), tenant)).thenReturn(shop);
        when(referenceDataService.getCompany(tenant)).thenReturn(company);
        when(inventoryTransactionRepository.save(any(InventoryTransaction.class))).thenAnswer(i -> i.getArguments()[0]);

        InventoryTransactionResponse response = inventoryTransactionService.adjustStock(request, tenant);

        assertEquals(TransactionType.ADJUSTMENT, response.getTransactionType());
        assertEquals(4, response.getQuantity());
        assertEquals(shop.getId(), response.getFromLocationId());
        assertNull(response.getToLocationId());
        verify(stockLedgerService).applyDelta(company, rice, shop, -4);
    }

    @Test
    void reverseTransaction_ShouldTakeReceivedStockBackOut() {
        UUID originalId = UUID.randomUUID();
        InventoryTransaction original = InventoryTransaction.builder()
                .id(originalId)
                .company(company)
                .transactionType(TransactionType.STOCK_IN)
                .variant(rice)
                .quantity(5)
                .toLocation(shop)
                .build();

        when(inventoryTransactionRepository.findByIdAndCompanyIdForUpdate(originalId, company.getId())).thenReturn(Optional.of(original));
        when(inventoryTransactionRepository.existsByReferenceTypeAndReferenceId("reversal", originalId)).thenReturn(false);
        when(referenceDataService.getCompany(tenant)).thenReturn(company);
        when(inventoryTransactionRepository.save(any(InventoryTransaction.class))).thenAnswer(i -> i.getArguments()[0]);

        InventoryTransactionResponse reversal = inventoryTransactionService.reverseTransaction(originalId, tenant);

        assertEquals(TransactionType.STOCK_OUT, reversal.getTransactionType());
        assertEquals(5, reversal.getQuantity());
        assertEquals(shop.getId(), reversal.getFromLocationId());
        assertEquals("reversal", reversal.getReferenceType());
        assertEquals(originalId, reversal.getReferenceId());
        assertTrue(reversal.getNotes().startsWith("Reversal of transaction " + originalId.toString().substring(0, 8)));
        verify(stockLedgerService).applyDelta(company, rice, shop, -5);
    }

    @Test
    void reverseTransaction_ShouldUndoAdjustmentOnOppositeSide() {
        UUID originalId = UUID.randomUUID();
        InventoryTransaction original = InventoryTransaction.builder()
                .id(originalId)
                .company(company)
                .transactionType(TransactionType.ADJUSTMENT)
                .variant(rice)
                .quantity(3)
                .toLocation(shop)
                .build();

        when(inventoryTransactionRepository.findByIdAndCompanyIdForUpdate(originalId, company.getId())).thenReturn(Optional.of(original));
        when(inventoryTransactionRepository.existsByReferenceTypeAndReferenceId("reversal", originalId)).thenReturn(false);
        when(referenceDataService.getCompany(tenant)).thenReturn(company);
        when(inventoryTransactionRepository.save(any(InventoryTransaction.class))).thenAnswer(i -> i.getArguments()[0]);

        InventoryTransactionResponse reversal = inventoryTransactionService.reverseTransaction(originalId, tenant);

        assertEquals(TransactionType.ADJUSTMENT, reversal.getTransactionType());
        assertEquals(shop.getId(), reversal.getFromLocationId());
        assertNull(reversal.getToLocationId());
        verify(stockLedgerService).applyDelta(company, rice, shop, -3);
    }

    @Test
    void reverseTransaction_ShouldRejectSecondReversal() {
        UUID originalId = UUID.randomUUID();
        InventoryTransaction original = InventoryTransaction.builder()
                .id(originalId)
                .company(company)
                .transactionType(TransactionType.STOCK_IN)
                .variant(rice)
                .quantity(5)
                .toLocation(shop)
                .build();

        when(inventoryTransactionRepository.findByIdAndCompanyIdForUpdate(originalId, company.getId())).thenReturn(Optional.of(original));
        when(inventoryTransactionRepository.existsByReferenceTypeAndReferenceId("reversal", originalId)).thenReturn(true);

        AlreadyReversedException ex = assertThrows(AlreadyReversedException.class,
                () -> inventoryTransactionService.reverseTransaction(originalId, tenant));

        assertEquals("ALREADY_REVERSED", ex.getErrorCode());
        verify(stockLedgerService, never()).applyDelta(any(), any(), any(), anyInt());
        verify(inventoryTransactionRepository, never()).save(any());
    }

    @Test
    void reverseTransaction_ShouldRejectReversingAReversal() {
        UUID reversalId = UUID.randomUUID();
        InventoryTransaction reversal = InventoryTransaction.builder()
                .id(reversalId)
                .company(company)
                .transactionType(TransactionType.STOCK_OUT)
                .variant(rice)
                .quantity(5)
                .fromLocation(shop)
                .referenceType("reversal")
                .referenceId(UUID.randomUUID())
                .build();

        when(inventoryTransactionRepository.findByIdAndCompanyIdForUpdate(reversalId, company.getId())).thenReturn(Optional.of(reversal));

        assertThrows(InvalidOperationException.class, () -> inventoryTransactionService.reverseTransaction(reversalId, tenant));
        verifyNoInteractions(stockLedgerService);
    }
}
