package com.retailerp.erp_backend.repository;

import com.retailerp.erp_backend.model.StorageLocation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface StorageLocationRepository extends JpaRepository<StorageLocation, UUID> {
    Optional<StorageLocation> findByIdAndCompanyId(UUID id, UUID companyId);
}
