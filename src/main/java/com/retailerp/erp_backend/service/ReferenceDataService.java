package com.retailerp.erp_backend.service;

import com.retailerp.erp_backend.exception.ResourceNotFoundException;
import com.retailerp.erp_backend.model.Company;
import com.retailerp.erp_backend.model.ProductVariant;
import com.retailerp.erp_backend.model.StorageLocation;
import com.retailerp.erp_backend.model.Supplier;
import com.retailerp.erp_backend.repository.CompanyRepository;
import com.retailerp.erp_backend.repository.ProductVariantRepository;
import com.retailerp.erp_backend.repository.StorageLocationRepository;
import com.retailerp.erp_backend.repository.SupplierRepository;
import com.retailerp.erp_backend.security.TenantContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Tenant-scoped existence checks against reference data the ledger only reads.
 */
@Service
@RequiredArgsConstructor
public class ReferenceDataService {

    private final CompanyRepository companyRepository;
    private final ProductVariantRepository productVariantRepository;
    private final StorageLocationRepository storageLocationRepository;
    private final SupplierRepository supplierRepository;

    public Company getCompany(TenantContext tenant) {
        return companyRepository.getReferenceById(tenant.getCompanyId());
    }

    public ProductVariant getVariant(UUID variantId, TenantContext tenant) {
        return productVariantRepository.findByIdAndCompanyId(variantId, tenant.getCompanyId())
                .orElseThrow(() -> new ResourceNotFoundException("Product variant", "id", variantId));
    }

    public StorageLocation getLocation(UUID locationId, TenantContext tenant) {
        return storageLocationRepository.findByIdAndCompanyId(locationId, tenant.getCompanyId())
                .orElseThrow(() -> new ResourceNotFoundException("Storage location", "id", locationId));
    }

    public Supplier getSupplier(UUID supplierId, TenantContext tenant) {
        return supplierRepository.findByIdAndCompanyId(supplierId, tenant.getCompanyId())
                .orElseThrow(() -> new ResourceNotFoundException("Supplier", "id", supplierId));
    }
}
