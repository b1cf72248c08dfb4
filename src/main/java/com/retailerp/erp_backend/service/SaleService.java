package com.retailerp.erp_backend.service;

import com.retailerp.erp_backend.dto.request.SaleRequest;
import com.retailerp.erp_backend.dto.response.PaymentResponse;
import com.retailerp.erp_backend.dto.response.SaleItemResponse;
import com.retailerp.erp_backend.dto.response.SaleResponse;
import com.retailerp.erp_backend.enums.CustomerStatus;
import com.retailerp.erp_backend.enums.PaymentStatus;
import com.retailerp.erp_backend.enums.SaleType;
import com.retailerp.erp_backend.enums.TransactionType;
import com.retailerp.erp_backend.exception.CreditLimitExceededException;
import com.retailerp.erp_backend.exception.InsufficientStockException;
import com.retailerp.erp_backend.exception.InvalidOperationException;
import com.retailerp.erp_backend.exception.ResourceNotFoundException;
import com.retailerp.erp_backend.model.Company;
import com.retailerp.erp_backend.model.Customer;
import com.retailerp.erp_backend.model.InventoryTransaction;
import com.retailerp.erp_backend.model.ProductVariant;
import com.retailerp.erp_backend.model.Sale;
import com.retailerp.erp_backend.model.SaleItem;
import com.retailerp.erp_backend.model.StorageLocation;
import com.retailerp.erp_backend.repository.CustomerRepository;
import com.retailerp.erp_backend.repository.SalePaymentRepository;
import com.retailerp.erp_backend.repository.SaleRepository;
import com.retailerp.erp_backend.security.TenantContext;
import com.retailerp.erp_backend.util.MoneyUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class SaleService {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 500;

    private final SaleRepository saleRepository;
    private final SalePaymentRepository salePaymentRepository;
    private final CustomerRepository customerRepository;
    private final ReferenceDataService referenceDataService;
    private final StockLedgerService stockLedgerService;
    private final InventoryTransactionService inventoryTransactionService;
    private final SaleNumberService saleNumberService;

    @Transactional(readOnly = true)
    public SaleResponse getSaleById(UUID id, TenantContext tenant) {
        Sale sale = saleRepository.findByIdAndCompanyId(id, tenant.getCompanyId())
                .orElseThrow(() -> new ResourceNotFoundException("Sale", "id", id));
        return mapToSaleResponse(sale, true);
    }

    @Transactional(readOnly = true)
    public List<SaleResponse> getSales(SaleType saleType, PaymentStatus paymentStatus, UUID customerId,
                                       LocalDate fromDate, LocalDate toDate, Integer limit, TenantContext tenant) {
        int pageSize = limit == null ? DEFAULT_LIMIT : Math.max(1, Math.min(limit, MAX_LIMIT));
        return saleRepository.findSalesByCriteria(tenant.getCompanyId(), saleType, paymentStatus, customerId,
                        fromDate, toDate, PageRequest.of(0, pageSize))
                .stream()
                .map(sale -> mapToSaleResponse(sale, false))
                .collect(Collectors.toList());
    }

    /**
     * Creates an invoice. All checks run before the first write, and the sale, its lines, the stock
     * deductions and the customer balance commit as one unit.
     */
    @Transactional
    public SaleResponse createSale(SaleRequest request, TenantContext tenant) {
        log.info("Creating sale for customer {} with {} items", request.getCustomerId(), request.getItems().size());

        Customer customer = customerRepository.findByIdAndCompanyIdForUpdate(request.getCustomerId(), tenant.getCompanyId())
                .orElseThrow(() -> new ResourceNotFoundException("Customer", "id", request.getCustomerId()));
        if (customer.getStatus() != CustomerStatus.ACTIVE) {
            throw new InvalidOperationException(String.format("Customer %s is %s and cannot be invoiced",
                    customer.getName(), customer.getStatus().getValue()));
        }
        BigDecimal tierDiscount = customer.getTierDiscount();

        StorageLocation location = referenceDataService.getLocation(request.getLocationId(), tenant);

        List<ProductVariant> variants = new ArrayList<>();
        for (SaleRequest.SaleItemRequest item : request.getItems()) {
            ProductVariant variant = referenceDataService.getVariant(item.getProductVariantId(), tenant);
            int available = stockLedgerService.availableQuantity(variant.getId(), location.getId());
            if (available < item.getQuantity()) {
                throw new InsufficientStockException(variant.getVariantName(), available, item.getQuantity());
            }
            variants.add(variant);
        }

        BigDecimal subtotal = BigDecimal.ZERO;
        for (SaleRequest.SaleItemRequest item : request.getItems()) {
            subtotal = subtotal.add(item.getUnitPrice().multiply(BigDecimal.valueOf(item.getQuantity())));
        }
        subtotal = MoneyUtil.round(subtotal);
        BigDecimal discountAmount = MoneyUtil.percentageOf(subtotal, tierDiscount);
        BigDecimal totalAmount = subtotal.subtract(discountAmount);

        if (!customer.isWalkIn()) {
            BigDecimal projectedBalance = customer.getCurrentBalance().add(totalAmount);
            if (projectedBalance.compareTo(customer.getCreditLimit()) > 0) {
                // negative when the balance is already above a lowered limit
                BigDecimal availableCredit = customer.getCreditLimit().subtract(customer.getCurrentBalance());
                throw new CreditLimitExceededException("Credit limit exceeded. Available credit: "
                        + MoneyUtil.format(availableCredit, tenant.getCurrency()));
            }
        }

        Company company = referenceDataService.getCompany(tenant);
        String saleNumber = saleNumberService.nextSaleNumber(company, SaleType.INVOICE);

        Sale sale = Sale.builder()
                .company(company)
                .saleNumber(saleNumber)
                .saleType(SaleType.INVOICE)
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

        for (int i = 0; i < request.getItems().size(); i++) {
            SaleRequest.SaleItemRequest item = request.getItems().get(i);
            BigDecimal gross = item.getUnitPrice().multiply(BigDecimal.valueOf(item.getQuantity()));
            BigDecimal lineDiscount = MoneyUtil.percentageOf(gross, tierDiscount);
            sale.addItem(SaleItem.builder()
                    .variant(variants.get(i))
                    .quantity(item.getQuantity())
                    .unitPrice(item.getUnitPrice())
                    .discountPercentage(tierDiscount)
                    .discountAmount(lineDiscount)
                    .lineTotal(MoneyUtil.round(gross).subtract(lineDiscount))
                    .build());
        }

        Sale savedSale = saleRepository.save(sale);

        for (SaleItem item : savedSale.getItems()) {
            stockLedgerService.applyDelta(company, item.getVariant(), location, -item.getQuantity());
            inventoryTransactionService.logMovement(company, TransactionType.STOCK_OUT, item.getVariant(),
                    item.getQuantity(), location, null, InventoryTransaction.REFERENCE_SALE, savedSale.getId(),
                    "Sale " + saleNumber, tenant.getUserId());
        }

        customer.setCurrentBalance(customer.getCurrentBalance().add(totalAmount));
        customerRepository.save(customer);

        log.info("Sale {} created: total {}, customer {} balance now {}",
                saleNumber, totalAmount, customer.getName(), customer.getCurrentBalance());
        return mapToSaleResponse(savedSale, false);
    }

    public SaleResponse mapToSaleResponse(Sale sale, boolean includePayments) {
        List<SaleItemResponse> items = sale.getItems().stream()
                .map(item -> SaleItemResponse.builder()
                        .id(item.getId())
                        .productVariantId(item.getVariant().getId())
                        .variantName(item.getVariant().getVariantName())
                        .sku(item.getVariant().getSku())
                        .quantity(item.getQuantity())
                        .unitPrice(item.getUnitPrice())
                        .discountPercentage(item.getDiscountPercentage())
                        .discountAmount(item.getDiscountAmount())
                        .lineTotal(item.getLineTotal())
                        .originalSaleItemId(item.getOriginalSaleItem() != null ? item.getOriginalSaleItem().getId() : null)
                        .build())
                .collect(Collectors.toList());

        List<PaymentResponse> payments = null;
        if (includePayments) {
            payments = salePaymentRepository.findBySaleIdOrderByCreatedAtDesc(sale.getId()).stream()
                    .map(PaymentResponse::from)
                    .collect(Collectors.toList());
        }

        Sale original = sale.getOriginalSale();
        return SaleResponse.builder()
                .id(sale.getId())
                .saleNumber(sale.getSaleNumber())
                .saleType(sale.getSaleType())
                .originalSaleId(original != null ? original.getId() : null)
                .originalSaleNumber(original != null ? original.getSaleNumber() : null)
                .customerId(sale.getCustomer().getId())
                .customerName(sale.getCustomer().getName())
                .locationId(sale.getLocation().getId())
                .locationName(sale.getLocation().getName())
                .saleDate(sale.getSaleDate())
                .subtotal(sale.getSubtotal())
                .discountPercentage(sale.getDiscountPercentage())
                .discountAmount(sale.getDiscountAmount())
                .totalAmount(sale.getTotalAmount())
                .paymentStatus(sale.getPaymentStatus())
                .amountPaid(sale.getAmountPaid())
                .amountDue(sale.getAmountDue())
                .notes(sale.getNotes())
                .items(items)
                .payments(payments)
                .createdAt(sale.getCreatedAt())
                .build();
    }
}
