package com.retailerp.erp_backend.repository;

import com.retailerp.erp_backend.model.ExpenseCategory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ExpenseCategoryRepository extends JpaRepository<ExpenseCategory, UUID> {
    Optional<ExpenseCategory> findByIdAndCompanyIdAndActiveTrue(UUID id, UUID companyId);
}
