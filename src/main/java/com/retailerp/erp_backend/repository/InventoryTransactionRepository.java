package com.retailerp.erp_backend.repository;

import com.retailerp.erp_backend.enums.TransactionType;
import com.retailerp.erp_backend.model.InventoryTransaction;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface InventoryTransactionRepository extends JpaRepository<InventoryTransaction, UUID> {

    Optional<InventoryTransaction> findByIdAndCompanyId(UUID id, UUID companyId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM InventoryTransaction t WHERE t.id = :id AND t.company.id = :companyId")
    Optional<InventoryTransaction> findByIdAndCompanyIdForUpdate(@Param("id") UUID id, @Param("companyId") UUID companyId);

    boolean existsByReferenceTypeAndReferenceId(String referenceType, UUID referenceId);

    @Query("""
        SELECT t FROM InventoryTransaction t
        WHERE t.company.id = :companyId
        AND (:variantId IS NULL OR t.variant.id = :variantId)
        AND (:locationId IS NULL OR t.fromLocation.id = :locationId OR t.toLocation.id = :locationId)
        AND (:transactionType IS NULL OR t.transactionType = :transactionType)
        ORDER BY t.createdAt DESC
    """)
    List<InventoryTransaction> findTransactionsByCriteria(
            @Param("companyId") UUID companyId,
            @Param("variantId") UUID variantId,
            @Param("locationId") UUID locationId,
            @Param("transactionType") TransactionType transactionType,
            Pageable pageable
    );

    @Query("""
        SELECT t FROM InventoryTransaction t
        WHERE t.variant.id = :variantId
        AND (t.fromLocation.id = :locationId OR t.toLocation.id = :locationId)
        ORDER BY t.createdAt ASC
    """)
    List<InventoryTransaction> findMovementsAt(@Param("variantId") UUID variantId, @Param("locationId") UUID locationId);
}
