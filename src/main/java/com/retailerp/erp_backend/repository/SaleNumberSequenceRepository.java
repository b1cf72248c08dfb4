package com.retailerp.erp_backend.repository;

import com.retailerp.erp_backend.enums.SaleType;
import com.retailerp.erp_backend.model.SaleNumberSequence;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface SaleNumberSequenceRepository extends JpaRepository<SaleNumberSequence, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM SaleNumberSequence s WHERE s.company.id = :companyId AND s.saleType = :saleType")
    Optional<SaleNumberSequence> findForUpdate(@Param("companyId") UUID companyId, @Param("saleType") SaleType saleType);
}
