package com.retailerp.erp_backend.repository;

import com.retailerp.erp_backend.model.SaleItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface SaleItemRepository extends JpaRepository<SaleItem, UUID> {

    /**
     * Sum of the (negative) credit-note quantities recorded against an invoice line.
     */
    @Query("SELECT COALESCE(SUM(i.quantity), 0L) FROM SaleItem i WHERE i.originalSaleItem.id = :originalSaleItemId")
    Long sumQuantityByOriginalSaleItemId(@Param("originalSaleItemId") UUID originalSaleItemId);
}
