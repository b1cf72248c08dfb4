package com.retailerp.erp_backend.service;

import com.retailerp.erp_backend.dto.request.PaymentRequest;
import com.retailerp.erp_backend.dto.request.SalePaymentRequest;
import com.retailerp.erp_backend.dto.response.ExpenseResponse;
import com.retailerp.erp_backend.dto.response.PaymentResponse;
import com.retailerp.erp_backend.dto.response.PaymentResultResponse;
import com.retailerp.erp_backend.dto.response.SaleResponse;
import com.retailerp.erp_backend.enums.PaymentMethod;
import com.retailerp.erp_backend.exception.ExceedsAmountDueException;
import com.retailerp.erp_backend.exception.ResourceNotFoundException;
import com.retailerp.erp_backend.exception.ValidationException;
import com.retailerp.erp_backend.model.Company;
import com.retailerp.erp_backend.model.Customer;
import com.retailerp.erp_backend.model.Expense;
import com.retailerp.erp_backend.model.ExpensePayment;
import com.retailerp.erp_backend.model.Sale;
import com.retailerp.erp_backend.model.SalePayment;
import com.retailerp.erp_backend.repository.CustomerRepository;
import com.retailerp.erp_backend.repository.ExpensePaymentRepository;
import com.retailerp.erp_backend.repository.ExpenseRepository;
import com.retailerp.erp_backend.repository.SalePaymentRepository;
import com.retailerp.erp_backend.repository.SaleRepository;
import com.retailerp.erp_backend.security.TenantContext;
import com.retailerp.erp_backend.util.MoneyUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Applies payments to sales and expenses. A payment never exceeds what is still due, and a rejected payment
 * leaves no trace.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentService {

    private final SaleRepository saleRepository;
    private final SalePaymentRepository salePaymentRepository;
    private final ExpenseRepository expenseRepository;
    private final ExpensePaymentRepository expensePaymentRepository;
    private final CustomerRepository customerRepository;
    private final ReferenceDataService referenceDataService;
    private final SaleService saleService;
    private final ExpenseService expenseService;

    @Transactional
    public PaymentResultResponse<SaleResponse> recordSalePayment(SalePaymentRequest request, TenantContext tenant) {
        BigDecimal amount = roundedAmount(request.getAmount());
        validateReference(request.getPaymentMethod(), request.getReferenceNumber());

        Sale sale = saleRepository.findByIdAndCompanyIdForUpdate(request.getSaleId(), tenant.getCompanyId())
                .orElseThrow(() -> new ResourceNotFoundException("Sale", "id", request.getSaleId()));

        checkAgainstAmountDue(amount, sale.getAmountDue(), tenant);

        Customer customer = customerRepository.findByIdAndCompanyIdForUpdate(sale.getCustomer().getId(), tenant.getCompanyId())
                .orElseThrow(() -> new ResourceNotFoundException("Customer", "id", sale.getCustomer().getId()));

        Company company = referenceDataService.getCompany(tenant);
        SalePayment payment = SalePayment.builder()
                .company(company)
                .sale(sale)
                .amount(amount)
                .paymentMethod(request.getPaymentMethod())
                .referenceNumber(trimToNull(request.getReferenceNumber()))
                .paymentDate(request.getPaymentDate() != null ? request.getPaymentDate() : LocalDate.now())
                .notes(request.getNotes())
                .createdBy(tenant.getUserId())
                .build();
        SalePayment savedPayment = salePaymentRepository.save(payment);

        sale.applyPayment(amount);
        saleRepository.save(sale);

        customer.setCurrentBalance(customer.getCurrentBalance().subtract(amount));
        customerRepository.save(customer);

        log.info("Payment of {} via {} recorded on sale {}: due {}, status {}",
                amount, request.getPaymentMethod().toValue(), sale.getSaleNumber(), sale.getAmountDue(),
                sale.getPaymentStatus().toValue());

        return PaymentResultResponse.<SaleResponse>builder()
                .payment(PaymentResponse.from(savedPayment))
                .updated(saleService.mapToSaleResponse(sale, false))
                .build();
    }

    @Transactional
    public PaymentResultResponse<ExpenseResponse> recordExpensePayment(UUID expenseId, PaymentRequest request,
                                                                       TenantContext tenant) {
        BigDecimal amount = roundedAmount(request.getAmount());
        Expense expense = expenseRepository.findByIdAndCompanyIdForUpdate(expenseId, tenant.getCompanyId())
                .orElseThrow(() -> new ResourceNotFoundException("Expense", "id", expenseId));

        checkAgainstAmountDue(amount, expense.getAmountDue(), tenant);
        validateReference(request.getPaymentMethod(), request.getReferenceNumber());

        ExpensePayment payment = ExpensePayment.builder()
                .company(referenceDataService.getCompany(tenant))
                .expense(expense)
                .amount(amount)
                .paymentMethod(request.getPaymentMethod())
                .referenceNumber(trimToNull(request.getReferenceNumber()))
                .paymentDate(request.getPaymentDate() != null ? request.getPaymentDate() : LocalDate.now())
                .notes(request.getNotes())
                .createdBy(tenant.getUserId())
                .build();
        ExpensePayment savedPayment = expensePaymentRepository.save(payment);

        expense.applyPayment(amount);
        expenseRepository.save(expense);

        log.info("Payment of {} via {} recorded on expense {}: due {}, status {}",
                amount, request.getPaymentMethod().toValue(), expense.getId(), expense.getAmountDue(),
                expense.getPaymentStatus().toValue());

        return PaymentResultResponse.<ExpenseResponse>builder()
                .payment(PaymentResponse.from(savedPayment))
                .updated(expenseService.mapToExpenseResponse(expense, null, false))
                .build();
    }

    @Transactional(readOnly = true)
    public List<PaymentResponse> getSalePayments(UUID saleId, TenantContext tenant) {
        saleRepository.findByIdAndCompanyId(saleId, tenant.getCompanyId())
                .orElseThrow(() -> new ResourceNotFoundException("Sale", "id", saleId));
        return salePaymentRepository.findBySaleIdOrderByCreatedAtDesc(saleId).stream()
                .map(PaymentResponse::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<PaymentResponse> getExpensePayments(UUID expenseId, TenantContext tenant) {
        expenseRepository.findByIdAndCompanyId(expenseId, tenant.getCompanyId())
                .orElseThrow(() -> new ResourceNotFoundException("Expense", "id", expenseId));
        return expensePaymentRepository.findByExpenseIdOrderByCreatedAtDesc(expenseId).stream()
                .map(PaymentResponse::from)
                .collect(Collectors.toList());
    }

    // positivity applies to the stored two-decimal amount
    private BigDecimal roundedAmount(BigDecimal requested) {
        BigDecimal amount = MoneyUtil.round(requested);
        if (amount.signum() <= 0) {
            throw new ValidationException("Amount must be greater than 0", "amount");
        }
        return amount;
    }

    private void validateReference(PaymentMethod method, String referenceNumber) {
        boolean hasReference = StringUtils.hasText(referenceNumber);
        if (method.requiresReference() && !hasReference) {
            throw new ValidationException(
                    "Reference number is required for " + method.toValue() + " payments", "referenceNumber");
        }
        if (!method.requiresReference() && hasReference) {
            throw new ValidationException(
                    "Reference number should not be provided for cash payments", "referenceNumber");
        }
    }

    private void checkAgainstAmountDue(BigDecimal amount, BigDecimal amountDue, TenantContext tenant) {
        if (amount.compareTo(amountDue) > 0) {
            throw new ExceedsAmountDueException(String.format("Payment amount (%s) exceeds amount due (%s)",
                    MoneyUtil.format(amount, tenant.getCurrency()),
                    MoneyUtil.format(amountDue, tenant.getCurrency())));
        }
    }

    private String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
