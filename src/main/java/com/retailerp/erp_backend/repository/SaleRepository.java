package com.retailerp.erp_backend.repository;

import com.retailerp.erp_backend.enums.PaymentStatus;
import com.retailerp.erp_backend.enums.SaleType;
import com.retailerp.erp_backend.model.Sale;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SaleRepository extends JpaRepository<Sale, UUID> {

    Optional<Sale> findByIdAndCompanyId(UUID id, UUID companyId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Sale s WHERE s.id = :id AND s.company.id = :companyId")
    Optional<Sale> findByIdAndCompanyIdForUpdate(@Param("id") UUID id, @Param("companyId") UUID companyId);

    @Query("""
        SELECT s FROM Sale s
        WHERE s.company.id = :companyId
        AND (:saleType IS NULL OR s.saleType = :saleType)
        AND (:paymentStatus IS NULL OR s.paymentStatus = :paymentStatus)
        AND (:customerId IS NULL OR s.customer.id = :customerId)
        AND (:startDate IS NULL OR s.saleDate >= :startDate)
        AND (:endDate IS NULL OR s.saleDate <= :endDate)
        ORDER BY s.saleDate DESC, s.createdAt DESC
    """)
    List<Sale> findSalesByCriteria(
            @Param("companyId") UUID companyId,
            @Param("saleType") SaleType saleType,
            @Param("paymentStatus") PaymentStatus paymentStatus,
            @Param("customerId") UUID customerId,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate,
            Pageable pageable
    );

    List<Sale> findByCustomerIdOrderBySaleDateAscCreatedAtAsc(UUID customerId);

    @Query("SELECT COALESCE(SUM(s.totalAmount), 0) FROM Sale s WHERE s.customer.id = :customerId")
    BigDecimal sumTotalAmountByCustomerId(@Param("customerId") UUID customerId);
}
