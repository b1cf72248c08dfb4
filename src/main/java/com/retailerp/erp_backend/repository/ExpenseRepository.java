package com.retailerp.erp_backend.repository;

import com.retailerp.erp_backend.enums.ExpenseType;
import com.retailerp.erp_backend.enums.PaymentStatus;
import com.retailerp.erp_backend.model.Expense;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ExpenseRepository extends JpaRepository<Expense, UUID> {

    Optional<Expense> findByIdAndCompanyId(UUID id, UUID companyId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM Expense e WHERE e.id = :id AND e.company.id = :companyId")
    Optional<Expense> findByIdAndCompanyIdForUpdate(@Param("id") UUID id, @Param("companyId") UUID companyId);

    List<Expense> findByParentExpenseIdOrderByExpenseDateAsc(UUID parentExpenseId);

    @Query("""
        SELECT e FROM Expense e
        WHERE e.company.id = :companyId
        AND (:expenseType IS NULL OR e.expenseType = :expenseType)
        AND (:paymentStatus IS NULL OR e.paymentStatus = :paymentStatus)
        AND (:categoryId IS NULL OR e.category.id = :categoryId)
        AND (:startDate IS NULL OR e.expenseDate >= :startDate)
        AND (:endDate IS NULL OR e.expenseDate <= :endDate)
        AND (:includeChildren = true OR e.parentExpense IS NULL)
        ORDER BY e.expenseDate DESC, e.createdAt DESC
    """)
    List<Expense> findExpensesByCriteria(
            @Param("companyId") UUID companyId,
            @Param("expenseType") ExpenseType expenseType,
            @Param("paymentStatus") PaymentStatus paymentStatus,
            @Param("categoryId") UUID categoryId,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate,
            @Param("includeChildren") boolean includeChildren,
            Pageable pageable
    );
}
