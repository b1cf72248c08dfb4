package com.retailerp.erp_backend.service;

import com.retailerp.erp_backend.dto.request.ExpenseRequest;
import com.retailerp.erp_backend.dto.request.ExpenseUpdateRequest;
import com.retailerp.erp_backend.dto.response.ExpenseResponse;
import com.retailerp.erp_backend.dto.response.PaymentResponse;
import com.retailerp.erp_backend.enums.ExpenseType;
import com.retailerp.erp_backend.enums.PaymentStatus;
import com.retailerp.erp_backend.enums.RecurrenceFrequency;
import com.retailerp.erp_backend.exception.InvalidOperationException;
import com.retailerp.erp_backend.exception.ResourceNotFoundException;
import com.retailerp.erp_backend.exception.ValidationException;
import com.retailerp.erp_backend.model.Expense;
import com.retailerp.erp_backend.model.ExpenseCategory;
import com.retailerp.erp_backend.model.Sale;
import com.retailerp.erp_backend.model.Supplier;
import com.retailerp.erp_backend.repository.ExpenseCategoryRepository;
import com.retailerp.erp_backend.repository.ExpensePaymentRepository;
import com.retailerp.erp_backend.repository.ExpenseRepository;
import com.retailerp.erp_backend.repository.SaleRepository;
import com.retailerp.erp_backend.security.TenantContext;
import com.retailerp.erp_backend.util.MoneyUtil;
import com.retailerp.erp_backend.util.RecurrenceCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class ExpenseService {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 500;

    private final ExpenseRepository expenseRepository;
    private final ExpenseCategoryRepository expenseCategoryRepository;
    private final ExpensePaymentRepository expensePaymentRepository;
    private final SaleRepository saleRepository;
    private final ReferenceDataService referenceDataService;

    @Transactional(readOnly = true)
    public ExpenseResponse getExpenseById(UUID id, TenantContext tenant) {
        Expense expense = expenseRepository.findByIdAndCompanyId(id, tenant.getCompanyId())
                .orElseThrow(() -> new ResourceNotFoundException("Expense", "id", id));

        List<LocalDate> childDates = expenseRepository.findByParentExpenseIdOrderByExpenseDateAsc(id).stream()
                .map(Expense::getExpenseDate)
                .collect(Collectors.toList());
        return mapToExpenseResponse(expense, childDates.isEmpty() ? null : childDates, true);
    }

    @Transactional(readOnly = true)
    public List<ExpenseResponse> getExpenses(ExpenseType expenseType, PaymentStatus paymentStatus, UUID categoryId,
                                             LocalDate fromDate, LocalDate toDate, boolean includeRecurringChildren,
                                             Integer limit, TenantContext tenant) {
        int pageSize = limit == null ? DEFAULT_LIMIT : Math.max(1, Math.min(limit, MAX_LIMIT));
        return expenseRepository.findExpensesByCriteria(tenant.getCompanyId(), expenseType, paymentStatus, categoryId,
                        fromDate, toDate, includeRecurringChildren, PageRequest.of(0, pageSize))
                .stream()
                .map(expense -> mapToExpenseResponse(expense, null, false))
                .collect(Collectors.toList());
    }

    /**
     * Creates an expense and, when recurring, its child occurrences. Children are independent copies linked
     * to the parent only through {@code parentExpense}; they are not regenerated if the parent changes.
     */
    @Transactional
    public ExpenseResponse createExpense(ExpenseRequest request, TenantContext tenant) {
        ExpenseCategory category = expenseCategoryRepository.findByIdAndCompanyIdAndActiveTrue(request.getCategoryId(), tenant.getCompanyId())
                .orElseThrow(() -> new ResourceNotFoundException("Expense category", "id", request.getCategoryId()));

        if (category.getExpenseType() != request.getExpenseType()) {
            throw new ValidationException(String.format("Category is for %s expenses, not %s",
                    category.getExpenseType().getValue(), request.getExpenseType().getValue()), "categoryId");
        }
        if (request.getExpenseType() == ExpenseType.SALES && request.getSaleId() == null) {
            throw new ValidationException("Sales expenses must be linked to a sale", "saleId");
        }

        Supplier supplier = request.getSupplierId() != null
                ? referenceDataService.getSupplier(request.getSupplierId(), tenant)
                : null;
        Sale sale = request.getSaleId() != null ? getSale(request.getSaleId(), tenant) : null;

        LocalDate expenseDate = request.getExpenseDate() != null ? request.getExpenseDate() : LocalDate.now();
        List<LocalDate> occurrences = Collections.emptyList();
        if (request.isRecurring()) {
            validateRecurrence(request, expenseDate);
            occurrences = RecurrenceCalculator.occurrences(expenseDate, request.getRecurrenceFrequency(),
                    request.getRecurrenceDayOfWeek(), request.getRecurrenceDayOfMonth(), request.getRecurrenceEndDate());
        }

        BigDecimal amount = MoneyUtil.round(request.getAmount());
        Expense expense = Expense.builder()
                .company(referenceDataService.getCompany(tenant))
                .category(category)
                .expenseType(request.getExpenseType())
                .title(request.getTitle().trim())
                .description(request.getDescription())
                .amount(amount)
                .expenseDate(expenseDate)
                .supplier(supplier)
                .sale(sale)
                .paymentStatus(PaymentStatus.UNPAID)
                .amountPaid(BigDecimal.ZERO)
                .amountDue(amount)
                .notes(request.getNotes())
                .recurring(request.isRecurring())
                .recurrenceFrequency(request.isRecurring() ? request.getRecurrenceFrequency() : null)
                .recurrenceDayOfWeek(request.isRecurring() ? request.getRecurrenceDayOfWeek() : null)
                .recurrenceDayOfMonth(request.isRecurring() ? request.getRecurrenceDayOfMonth() : null)
                .recurrenceEndDate(request.isRecurring() ? request.getRecurrenceEndDate() : null)
                .createdBy(tenant.getUserId())
                .build();

        Expense savedExpense = expenseRepository.save(expense);

        if (!occurrences.isEmpty()) {
            List<Expense> children = new ArrayList<>();
            for (LocalDate date : occurrences) {
                children.add(savedExpense.toBuilder()
                        .id(null)
                        .expenseDate(date)
                        .recurring(false)
                        .recurrenceFrequency(null)
                        .recurrenceDayOfWeek(null)
                        .recurrenceDayOfMonth(null)
                        .recurrenceEndDate(null)
                        .parentExpense(savedExpense)
                        .createdAt(null)
                        .updatedAt(null)
                        .build());
            }
            expenseRepository.saveAll(children);
        }

        log.info("Expense {} created with {} recurring occurrences", savedExpense.getId(), occurrences.size());
        return mapToExpenseResponse(savedExpense, occurrences.isEmpty() ? null : occurrences, false);
    }

    /**
     * Partial update. Changing the amount re-derives what is still due; it can never drop below what has
     * already been paid.
     */
    @Transactional
    public ExpenseResponse updateExpense(UUID id, ExpenseUpdateRequest request, TenantContext tenant) {
        Expense expense = expenseRepository.findByIdAndCompanyIdForUpdate(id, tenant.getCompanyId())
                .orElseThrow(() -> new ResourceNotFoundException("Expense", "id", id));

        if (request.getTitle() != null) {
            expense.setTitle(request.getTitle().trim());
        }
        if (request.getDescription() != null) {
            expense.setDescription(request.getDescription());
        }
        if (request.getNotes() != null) {
            expense.setNotes(request.getNotes());
        }
        if (request.getExpenseDate() != null) {
            expense.setExpenseDate(request.getExpenseDate());
        }
        if (request.getSupplierId() != null) {
            expense.setSupplier(referenceDataService.getSupplier(request.getSupplierId(), tenant));
        }
        if (request.getSaleId() != null) {
            expense.setSale(getSale(request.getSaleId(), tenant));
        }
        if (request.getAmount() != null) {
            BigDecimal amount = MoneyUtil.round(request.getAmount());
            if (amount.compareTo(expense.getAmountPaid()) < 0) {
                throw new InvalidOperationException("Amount cannot be less than the amount already paid ("
                        + MoneyUtil.format(expense.getAmountPaid(), tenant.getCurrency()) + ")");
            }
            expense.setAmount(amount);
            expense.setAmountDue(amount.subtract(expense.getAmountPaid()));
            expense.setPaymentStatus(PaymentStatus.derive(expense.getAmountPaid(), expense.getAmountDue()));
        }

        Expense updatedExpense = expenseRepository.save(expense);
        log.info("Expense updated with ID: {}", id);
        return mapToExpenseResponse(updatedExpense, null, false);
    }

    private void validateRecurrence(ExpenseRequest request, LocalDate expenseDate) {
        RecurrenceFrequency frequency = request.getRecurrenceFrequency();
        if (frequency == null) {
            throw new ValidationException("Recurrence frequency is required for recurring expenses",
                    "recurrenceFrequency");
        }
        if (frequency == RecurrenceFrequency.WEEKLY && request.getRecurrenceDayOfWeek() == null) {
            throw new ValidationException("Day of week is required for weekly recurrence", "recurrenceDayOfWeek");
        }
        if (frequency == RecurrenceFrequency.MONTHLY && request.getRecurrenceDayOfMonth() == null) {
            throw new ValidationException("Day of month is required for monthly recurrence", "recurrenceDayOfMonth");
        }
        if (request.getRecurrenceEndDate() != null && request.getRecurrenceEndDate().isBefore(expenseDate)) {
            throw new ValidationException("Recurrence end date cannot be before the expense date", "recurrenceEndDate");
        }
    }

    private Sale getSale(UUID saleId, TenantContext tenant) {
        return saleRepository.findByIdAndCompanyId(saleId, tenant.getCompanyId())
                .orElseThrow(() -> new ResourceNotFoundException("Sale", "id", saleId));
    }

    public ExpenseResponse mapToExpenseResponse(Expense expense, List<LocalDate> occurrences, boolean includePayments) {
        List<PaymentResponse> payments = null;
        if (includePayments) {
            payments = expensePaymentRepository.findByExpenseIdOrderByCreatedAtDesc(expense.getId()).stream()
                    .map(PaymentResponse::from)
                    .collect(Collectors.toList());
        }

        Supplier supplier = expense.getSupplier();
        Sale sale = expense.getSale();
        return ExpenseResponse.builder()
                .id(expense.getId())
                .categoryId(expense.getCategory().getId())
                .categoryName(expense.getCategory().getName())
                .expenseType(expense.getExpenseType())
                .title(expense.getTitle())
                .description(expense.getDescription())
                .amount(expense.getAmount())
                .expenseDate(expense.getExpenseDate())
                .supplierId(supplier != null ? supplier.getId() : null)
                .supplierName(supplier != null ? supplier.getName() : null)
                .saleId(sale != null ? sale.getId() : null)
                .saleNumber(sale != null ? sale.getSaleNumber() : null)
                .paymentStatus(expense.getPaymentStatus())
                .amountPaid(expense.getAmountPaid())
                .amountDue(expense.getAmountDue())
                .notes(expense.getNotes())
                .recurring(expense.isRecurring())
                .recurrenceFrequency(expense.getRecurrenceFrequency())
                .recurrenceDayOfWeek(expense.getRecurrenceDayOfWeek())
                .recurrenceDayOfMonth(expense.getRecurrenceDayOfMonth())
                .recurrenceEndDate(expense.getRecurrenceEndDate())
                .parentExpenseId(expense.getParentExpense() != null ? expense.getParentExpense().getId() : null)
                .generatedOccurrences(occurrences)
                .payments(payments)
                .createdBy(expense.getCreatedBy())
                .createdAt(expense.getCreatedAt())
                .updatedAt(expense.getUpdatedAt())
                .build();
    }
}
