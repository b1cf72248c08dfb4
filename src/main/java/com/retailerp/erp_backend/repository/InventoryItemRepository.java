package com.retailerp.erp_backend.repository;

import com.retailerp.erp_backend.model.InventoryItem;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface InventoryItemRepository extends JpaRepository<InventoryItem, UUID> {

    Optional<InventoryItem> findByVariantIdAndLocationId(UUID variantId, UUID locationId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM InventoryItem i WHERE i.variant.id = :variantId AND i.location.id = :locationId")
    Optional<InventoryItem> findForUpdate(@Param("variantId") UUID variantId, @Param("locationId") UUID locationId);

    @Query("""
        SELECT i FROM InventoryItem i
        JOIN FETCH i.variant v
        JOIN FETCH i.location l
        WHERE i.company.id = :companyId
        AND (:variantId IS NULL OR v.id = :variantId)
        AND (:locationId IS NULL OR l.id = :locationId)
        AND (:lowStockOnly = false OR i.quantity <= v.minStockLevel)
        ORDER BY v.variantName ASC, l.name ASC
    """)
    List<InventoryItem> findItemsByCriteria(
            @Param("companyId") UUID companyId,
            @Param("variantId") UUID variantId,
            @Param("locationId") UUID locationId,
            @Param("lowStockOnly") boolean lowStockOnly
    );
}
