package com.retailerp.erp_backend.service;

import com.retailerp.erp_backend.TestDataBuilder;
import com.retailerp.erp_backend.dto.request.CreditNoteRequest;
import com.retailerp.erp_backend.enums.CustomerType;
import com.retailerp.erp_backend.enums.PaymentStatus;
import com.retailerp.erp_backend.enums.Role;
import com.retailerp.erp_backend.enums.SaleType;
import com.retailerp.erp_backend.enums.TransactionType;
import com.retailerp.erp_backend.exception.InvalidOperationException;
import com.retailerp.erp_backend.exception.InvalidQuantityException;
import com.retailerp.erp_backend.exception.ResourceNotFoundException;
import com.retailerp.erp_backend.model.*;
import com.retailerp.erp_backend.repository.CustomerRepository;
import com.retailerp.erp_backend.repository.SaleItemRepository;
import com.retailerp.erp_backend.repository.SaleRepository;
import com.retailerp.erp_backend.security.TenantContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CreditNoteServiceTest {

    @Mock
    private SaleRepository saleRepository;
    @Mock
    private SaleItemRepository saleItemRepository;
    @Mock
    private CustomerRepository customerRepository;
    @Mock
    private ReferenceDataService referenceDataService;
    @Mock
    private StockLedgerService stockLedgerService;
    @Mock
    private InventoryTransactionService inventoryTransactionService;
    @Mock
    private SaleNumberService saleNumberService;
    @Mock
    private SaleService saleService;

    @InjectMocks
    private CreditNoteService creditNoteService;

    private Company company;
    private TenantContext tenant;
    private StorageLocation shop;
    private ProductVariant oil;
    private Customer customer;
    private Sale invoice;
    private SaleItem invoiceLine;

    @BeforeEach
    void setUp() {
        company = TestDataBuilder.company();
        tenant = TestDataBuilder.tenant(company, Role.ADMIN);
        shop = TestDataBuilder.location(company, "Main Shop");
        oil = TestDataBuilder.variant(company, "Cooking Oil 1L");
        customer = TestDataBuilder.customer(company, CustomerType.INDIVIDUAL, null, "5000.00");
        customer.setCurrentBalance(new BigDecimal("500.00"));
        invoice = TestDataBuilder.invoice(company, customer, shop, oil, 5, "100.00");
        invoiceLine = invoice.getItems().get(0);
    }

    private CreditNoteRequest returning(UUID saleItemId, int quantity) {
        CreditNoteRequest.ReturnItemRequest item = new CreditNoteRequest.ReturnItemRequest();
        item.setSaleItemId(saleItemId);
        item.setReturnQuantity(quantity);

        CreditNoteRequest request = new CreditNoteRequest();
        request.setOriginalSaleId(invoice.getId());
        request.setItems(List.of(item));
        return request;
    }

    private void stubInvoiceAndCustomer() {
        when(saleRepository.findByIdAndCompanyIdForUpdate(invoice.getId(), company.getId())).thenReturn(Optional.of(invoice));
        when(customerRepository.findByIdAndCompanyIdForUpdate(customer.getId(), company.getId())).thenReturn(Optional.of(customer));
    }

    @Test
    void createCreditNote_ShouldIssueNegativeNoteRestockAndLowerBalance() {
        stubInvoiceAndCustomer();
        when(saleItemRepository.sumQuantityByOriginalSaleItemId(invoiceLine.getId())).thenReturn(0L);
        when(referenceDataService.getCompany(tenant)).thenReturn(company);
        when(saleNumberService.nextSaleNumber(company, SaleType.CREDIT_NOTE)).thenReturn("CN-000001");
        when(saleRepository.save(any(Sale.class))).thenAnswer(i -> i.getArguments()[0]);

        creditNoteService.createCreditNote(returning(invoiceLine.getId(), 2), tenant);

        ArgumentCaptor<Sale> captor = ArgumentCaptor.forClass(Sale.class);
        verify(saleRepository).save(captor.capture());
        Sale creditNote = captor.getValue();

        assertEquals(SaleType.CREDIT_NOTE, creditNote.getSaleType());
        assertEquals("CN-000001", creditNote.getSaleNumber());
        assertSame(invoice, creditNote.getOriginalSale());
        assertEquals(0, new BigDecimal("-200.00").compareTo(creditNote.getTotalAmount()));
        assertEquals(0, new BigDecimal("-200.00").compareTo(creditNote.getAmountDue()));
        assertEquals(PaymentStatus.UNPAID, creditNote.getPaymentStatus());
        assertEquals(-2, creditNote.getItems().get(0).getQuantity());
        assertSame(invoiceLine, creditNote.getItems().get(0).getOriginalSaleItem());
        assertEquals(0, new BigDecimal("300.00").compareTo(customer.getCurrentBalance()));

        verify(stockLedgerService).applyDelta(company, oil, shop, 2);
        verify(inventoryTransactionService).logMovement(eq(company), eq(TransactionType.STOCK_IN), eq(oil), eq(2),
                isNull(), eq(shop), eq("sale"), any(), eq("Return from INV-000001"), eq(tenant.getUserId()));
    }

    @Test
    void createCreditNote_ShouldRejectReturnAboveOriginalQuantity() {
        stubInvoiceAndCustomer();

        InvalidQuantityException ex = assertThrows(InvalidQuantityException.class,
                () -> creditNoteService.createCreditNote(returning(invoiceLine.getId(), 6), tenant));

        assertEquals("Return quantity (6) exceeds original quantity (5)", ex.getMessage());
        verify(saleRepository, never()).save(any());
    }

    @Test
    void createCreditNote_ShouldCountEarlierReturnsAgainstTheLine() {
        stubInvoiceAndCustomer();
        when(saleItemRepository.sumQuantityByOriginalSaleItemId(invoiceLine.getId())).thenReturn(-4L);

        assertThrows(InvalidQuantityException.class,
                () -> creditNoteService.createCreditNote(returning(invoiceLine.getId(), 2), tenant));

        verify(saleRepository, never()).save(any());
        verify(stockLedgerService, never()).applyDelta(any(), any(), any(), anyInt());
        assertEquals(0, new BigDecimal("500.00").compareTo(customer.getCurrentBalance()));
    }

    @Test
    void createCreditNote_ShouldRejectLineFromAnotherSale() {
        stubInvoiceAndCustomer();
        UUID foreignLine = UUID.randomUUID();

        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class,
                () -> creditNoteService.createCreditNote(returning(foreignLine, 1), tenant));

        assertEquals("Sale item " + foreignLine + " not found in original sale", ex.getMessage());
    }

    @Test
    void createCreditNote_ShouldOnlyCreditInvoices() {
        invoice.setSaleType(SaleType.CREDIT_NOTE);
        when(saleRepository.findByIdAndCompanyIdForUpdate(invoice.getId(), company.getId())).thenReturn(Optional.of(invoice));

        InvalidOperationException ex = assertThrows(InvalidOperationException.class,
                () -> creditNoteService.createCreditNote(returning(invoiceLine.getId(), 1), tenant));

        assertEquals("Can only create credit notes for invoices", ex.getMessage());
        verifyNoInteractions(customerRepository);
    }
}
