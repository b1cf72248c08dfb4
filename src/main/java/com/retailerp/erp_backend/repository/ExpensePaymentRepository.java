package com.retailerp.erp_backend.repository;

import com.retailerp.erp_backend.model.ExpensePayment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ExpensePaymentRepository extends JpaRepository<ExpensePayment, UUID> {
    List<ExpensePayment> findByExpenseIdOrderByCreatedAtDesc(UUID expenseId);
}
