package com.retailerp.erp_backend.service;

import com.retailerp.erp_backend.dto.request.CreditNoteRequest;
import com.retailerp.erp_backend.dto.response.SaleResponse;
import com.retailerp.erp_backend.enums.PaymentStatus;
import com.retailerp.erp_backend.enums.SaleType;
import com.retailerp.erp_backend.enums.TransactionType;
import com.retailerp.erp_backend.exception.InvalidOperationException;
import com.retailerp.erp_backend.exception.InvalidQuantityException;
import com.retailerp.erp_backend.exception.ResourceNotFoundException;
import com.retailerp.erp_backend.model.Company;
import com.retailerp.erp_backend.model.Customer;
import com.retailerp.erp_backend.model.InventoryTransaction;
import com.retailerp.erp_backend.model.Sale;
import com.retailerp.erp_backend.model.SaleItem;
import com.retailerp.erp_backend.model.StorageLocation;
import com.retailerp.erp_backend.repository.CustomerRepository;
import com.retailerp.erp_backend.repository.SaleItemRepository;
import com.retailerp.erp_backend.repository.SaleRepository;
import com.retailerp.erp_backend.security.TenantContext;
import com.retailerp.erp_backend.util.MoneyUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Issues credit notes: negative sales that return part of an invoice to stock and reduce the customer's balance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CreditNoteService {

    private final SaleRepository saleRepository;
    private final SaleItemRepository saleItemRepository;
    private final CustomerRepository customerRepository;
    private final ReferenceDataService referenceDataService;
    private final StockLedgerService stockLedgerService;
    private final InventoryTransactionService inventoryTransactionService;
    private final SaleNumberService saleNumberService;
    private final SaleService saleService;

    @Transactional
    public SaleResponse createCreditNote(CreditNoteRequest request, TenantContext tenant) {
        Sale original = saleRepository.findByIdAndCompanyIdForUpdate(request.getOriginalSaleId(), tenant.getCompanyId())
                .orElseThrow(() -> new ResourceNotFoundException("Original sale", "id", request.getOriginalSaleId()));

        if (original.getSaleType() != SaleType.INVOICE) {
            throw new InvalidOperationException("Can only create credit notes for invoices");
        }

        Customer customer = customerRepository.findByIdAndCompanyIdForUpdate(original.getCustomer().getId(), tenant.getCompanyId())
                .orElseThrow(() -> new ResourceNotFoundException("Customer", "id", original.getCustomer().getId()));
        // current tier, not the discount the invoice was priced with
        BigDecimal tierDiscount = customer.getTierDiscount();

        Map<UUID, SaleItem> originalItems = original.getItems().stream()
                .collect(Collectors.toMap(SaleItem::getId, Function.identity()));

        List<SaleItem> returnedLines = new ArrayList<>();
        List<Integer> returnQuantities = new ArrayList<>();
        Map<UUID, Integer> requestedPerLine = new HashMap<>();
        for (CreditNoteRequest.ReturnItemRequest returnItem : request.getItems()) {
            SaleItem line = originalItems.get(returnItem.getSaleItemId());
            if (line == null) {
                throw new ResourceNotFoundException(
                        "Sale item " + returnItem.getSaleItemId() + " not found in original sale");
            }

            int returnQuantity = returnItem.getReturnQuantity();
            if (returnQuantity > line.getQuantity()) {
                throw new InvalidQuantityException(String.format(
                        "Return quantity (%d) exceeds original quantity (%d)", returnQuantity, line.getQuantity()));
            }

            int requested = requestedPerLine.merge(line.getId(), returnQuantity, Integer::sum);
            int alreadyReturned = -saleItemRepository.sumQuantityByOriginalSaleItemId(line.getId()).intValue();
            int returnable = line.getQuantity() - alreadyReturned;
            if (requested > returnable) {
                throw new InvalidQuantityException(String.format(
                        "Return quantity (%d) exceeds remaining returnable quantity (%d) for %s",
                        requested, returnable, line.getVariant().getVariantName()));
            }

            returnedLines.add(line);
            returnQuantities.add(returnQuantity);
        }

        BigDecimal subtotal = BigDecimal.ZERO;
        for (int i = 0; i < returnedLines.size(); i++) {
            subtotal = subtotal.subtract(returnedLines.get(i).getUnitPrice().multiply(BigDecimal.valueOf(returnQuantities.get(i))));
        }
        subtotal = MoneyUtil.round(subtotal);
        BigDecimal discountAmount = MoneyUtil.percentageOf(subtotal, tierDiscount);
        BigDecimal totalAmount = subtotal.subtract(discountAmount);

        Company company = referenceDataService.getCompany(tenant);
        String creditNoteNumber = saleNumberService.nextSaleNumber(company, SaleType.CREDIT_NOTE);
        StorageLocation location = original.getLocation();

        Sale creditNote = Sale.builder()
                .company(company)
                .saleNumber(creditNoteNumber)
                .saleType(SaleType.CREDIT_NOTE)
                .originalSale(original)
                .customer(customer)
                .location(location)
                .saleDate(request.getSaleDate() != null ? request.getSaleDate() : LocalDate.now())
                .subtotal(subtotal)
                .discountPercentage(tierDiscount)
                .discountAmount(discountAmount)
                .totalAmount(totalAmount)
                .paymentStatus(PaymentStatus.UNPAID)
                .amountPaid(BigDecimal.ZERO)
                .amountDue(totalAmount)
                .notes(request.getNotes())
                .createdBy(tenant.getUserId())
                .build();

        for (int i = 0; i < returnedLines.size(); i++) {
            SaleItem line = returnedLines.get(i);
            int quantity = -returnQuantities.get(i);
            BigDecimal gross = line.getUnitPrice().multiply(BigDecimal.valueOf(quantity));
            BigDecimal lineDiscount = MoneyUtil.percentageOf(gross, tierDiscount);
            creditNote.addItem(SaleItem.builder()
                    .variant(line.getVariant())
                    .quantity(quantity)
                    .unitPrice(line.getUnitPrice())
                    .discountPercentage(tierDiscount)
                    .discountAmount(lineDiscount)
                    .lineTotal(MoneyUtil.round(gross).subtract(lineDiscount))
                    .originalSaleItem(line)
                    .build());
        }

        Sale saved = saleRepository.save(creditNote);

        for (SaleItem item : saved.getItems()) {
            int restocked = Math.abs(item.getQuantity());
            stockLedgerService.applyDelta(company, item.getVariant(), location, restocked);
            inventoryTransactionService.logMovement(company, TransactionType.STOCK_IN, item.getVariant(), restocked,
                    null, location, InventoryTransaction.REFERENCE_SALE, saved.getId(),
                    "Return from " + original.getSaleNumber(), tenant.getUserId());
        }

        customer.setCurrentBalance(customer.getCurrentBalance().add(totalAmount));
        customerRepository.save(customer);

        log.info("Credit note {} issued against {}: total {}, customer {} balance now {}",
                creditNoteNumber, original.getSaleNumber(), totalAmount, customer.getName(), customer.getCurrentBalance());
        return saleService.mapToSaleResponse(saved, false);
    }
}
