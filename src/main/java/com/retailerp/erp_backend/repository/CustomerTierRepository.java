package com.retailerp.erp_backend.repository;

import com.retailerp.erp_backend.model.CustomerTier;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CustomerTierRepository extends JpaRepository<CustomerTier, UUID> {
    Optional<CustomerTier> findByIdAndCompanyId(UUID id, UUID companyId);
    Optional<CustomerTier> findFirstByCompanyIdAndDefaultTierTrue(UUID companyId);
    List<CustomerTier> findByCompanyIdOrderByNameAsc(UUID companyId);
    boolean existsByCompanyIdAndNameIgnoreCase(UUID companyId, String name);
}
