package com.retailerp.erp_backend.repository;

import com.retailerp.erp_backend.enums.CustomerStatus;
import com.retailerp.erp_backend.enums.CustomerType;
import com.retailerp.erp_backend.model.Customer;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface CustomerRepository extends JpaRepository<Customer, UUID> {

    Optional<Customer> findByIdAndCompanyId(UUID id, UUID companyId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Customer c WHERE c.id = :id AND c.company.id = :companyId")
    Optional<Customer> findByIdAndCompanyIdForUpdate(@Param("id") UUID id, @Param("companyId") UUID companyId);

    long countByTierId(UUID tierId);

    @Query("""
        SELECT c FROM Customer c
        WHERE c.company.id = :companyId
        AND (:customerType IS NULL OR c.customerType = :customerType)
        AND (:status IS NULL OR c.status = :status)
        ORDER BY c.name ASC
    """)
    Page<Customer> findCustomersByCriteria(
            @Param("companyId") UUID companyId,
            @Param("customerType") CustomerType customerType,
            @Param("status") CustomerStatus status,
            Pageable pageable
    );
}
