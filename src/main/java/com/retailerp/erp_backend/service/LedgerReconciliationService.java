package com.retailerp.erp_backend.service;

import com.retailerp.erp_backend.dto.response.ReconciliationResponse;
import com.retailerp.erp_backend.dto.response.StockVerificationResponse;
import com.retailerp.erp_backend.enums.PaymentStatus;
import com.retailerp.erp_backend.exception.ResourceNotFoundException;
import com.retailerp.erp_backend.model.Customer;
import com.retailerp.erp_backend.model.InventoryTransaction;
import com.retailerp.erp_backend.model.ProductVariant;
import com.retailerp.erp_backend.model.Sale;
import com.retailerp.erp_backend.model.StorageLocation;
import com.retailerp.erp_backend.repository.CustomerRepository;
import com.retailerp.erp_backend.repository.InventoryTransactionRepository;
import com.retailerp.erp_backend.repository.SalePaymentRepository;
import com.retailerp.erp_backend.repository.SaleRepository;
import com.retailerp.erp_backend.security.TenantContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Recomputes denormalized ledger fields from their source rows to detect drift.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerReconciliationService {

    private final CustomerRepository customerRepository;
    private final SaleRepository saleRepository;
    private final SalePaymentRepository salePaymentRepository;
    private final InventoryTransactionRepository inventoryTransactionRepository;
    private final ReferenceDataService referenceDataService;
    private final StockLedgerService stockLedgerService;

    /**
     * Expected balance is every sale total (credit notes are negative) minus every sale payment. With
     * {@code apply} set, a drifted stored balance is overwritten with the expected one.
     */
    @Transactional
    public ReconciliationResponse reconcileCustomer(UUID customerId, boolean apply, TenantContext tenant) {
        Customer customer = customerRepository.findByIdAndCompanyIdForUpdate(customerId, tenant.getCompanyId())
                .orElseThrow(() -> new ResourceNotFoundException("Customer", "id", customerId));

        BigDecimal invoiced = saleRepository.sumTotalAmountByCustomerId(customerId);
        BigDecimal paid = salePaymentRepository.sumAmountByCustomerId(customerId);
        BigDecimal expected = invoiced.subtract(paid);
        BigDecimal stored = customer.getCurrentBalance();
        BigDecimal drift = stored.subtract(expected);
        boolean consistent = drift.signum() == 0;

        List<String> saleIssues = new ArrayList<>();
        for (Sale sale : saleRepository.findByCustomerIdOrderBySaleDateAscCreatedAtAsc(customerId)) {
            saleIssues.addAll(verifySale(sale));
        }

        boolean corrected = false;
        if (!consistent) {
            log.warn("Customer {} balance drift: stored {}, expected {}", customerId, stored, expected);
            if (apply) {
                customer.setCurrentBalance(expected);
                customerRepository.save(customer);
                corrected = true;
                log.warn("Customer {} balance reset to {}", customerId, expected);
            }
        }

        return ReconciliationResponse.builder()
                .customerId(customerId)
                .storedBalance(stored)
                .expectedBalance(expected)
                .drift(drift)
                .consistent(consistent)
                .corrected(corrected)
                .saleIssues(saleIssues)
                .build();
    }

    public List<String> verifySale(Sale sale) {
        List<String> issues = new ArrayList<>();
        if (sale.getAmountPaid().add(sale.getAmountDue()).compareTo(sale.getTotalAmount()) != 0) {
            issues.add(String.format("%s: paid %s + due %s does not equal total %s", sale.getSaleNumber(),
                    sale.getAmountPaid(), sale.getAmountDue(), sale.getTotalAmount()));
        }
        BigDecimal paymentSum = salePaymentRepository.sumAmountBySaleId(sale.getId());
        if (paymentSum.compareTo(sale.getAmountPaid()) != 0) {
            issues.add(String.format("%s: payments sum to %s but amount paid is %s", sale.getSaleNumber(),
                    paymentSum, sale.getAmountPaid()));
        }
        // credit notes keep the status they were issued with
        if (sale.getAmountPaid().signum() > 0) {
            PaymentStatus derived = PaymentStatus.derive(sale.getAmountPaid(), sale.getAmountDue());
            if (derived != sale.getPaymentStatus()) {
                issues.add(String.format("%s: status is %s but amounts imply %s", sale.getSaleNumber(),
                        sale.getPaymentStatus().toValue(), derived.toValue()));
            }
        }
        return issues;
    }

    /**
     * Replays the movement log for one (variant, location) pair and compares it with the stored quantity.
     */
    @Transactional(readOnly = true)
    public StockVerificationResponse verifyStock(UUID variantId, UUID locationId, TenantContext tenant) {
        ProductVariant variant = referenceDataService.getVariant(variantId, tenant);
        StorageLocation location = referenceDataService.getLocation(locationId, tenant);

        List<InventoryTransaction> movements = inventoryTransactionRepository.findMovementsAt(variantId, locationId);
        int replayed = 0;
        for (InventoryTransaction movement : movements) {
            if (movement.getToLocation() != null && movement.getToLocation().getId().equals(locationId)) {
                replayed += movement.getQuantity();
            }
            if (movement.getFromLocation() != null && movement.getFromLocation().getId().equals(locationId)) {
                replayed -= movement.getQuantity();
            }
        }

        int stored = stockLedgerService.availableQuantity(variantId, locationId);
        if (stored != replayed) {
            log.warn("Stock drift for {} at {}: stored {}, replayed {}",
                    variant.getVariantName(), location.getName(), stored, replayed);
        }

        return StockVerificationResponse.builder()
                .productVariantId(variantId)
                .locationId(locationId)
                .storedQuantity(stored)
                .replayedQuantity(replayed)
                .movementCount(movements.size())
                .consistent(stored == replayed)
                .build();
    }
}
