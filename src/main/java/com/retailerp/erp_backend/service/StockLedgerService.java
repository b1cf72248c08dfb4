package com.retailerp.erp_backend.service;

import com.retailerp.erp_backend.exception.InsufficientStockException;
import com.retailerp.erp_backend.exception.InvalidTransitionException;
import com.retailerp.erp_backend.model.Company;
import com.retailerp.erp_backend.model.InventoryItem;
import com.retailerp.erp_backend.model.ProductVariant;
import com.retailerp.erp_backend.model.StorageLocation;
import com.retailerp.erp_backend.repository.InventoryItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * The only writer of {@link InventoryItem#getQuantity()}. Each delta runs under a row lock on the
 * (variant, location) pair so concurrent movements serialize instead of overwriting each other.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StockLedgerService {

    private final InventoryItemRepository inventoryItemRepository;

    @Transactional
    public InventoryItem applyDelta(Company company, ProductVariant variant, StorageLocation location, int delta) {
        Optional<InventoryItem> existing = inventoryItemRepository.findForUpdate(variant.getId(), location.getId());

        if (existing.isEmpty()) {
            if (delta < 0) {
                throw new InvalidTransitionException(String.format(
                        "Cannot create negative inventory for %s at %s", variant.getVariantName(), location.getName()));
            }
            InventoryItem item = InventoryItem.builder()
                    .company(company)
                    .variant(variant)
                    .location(location)
                    .quantity(delta)
                    .build();
            InventoryItem saved = inventoryItemRepository.save(item);
            log.info("Opened stock for {} at {} with quantity {}", variant.getVariantName(), location.getName(), delta);
            return saved;
        }

        InventoryItem item = existing.get();
        int previousQuantity = item.getQuantity();
        int newQuantity = previousQuantity + delta;
        if (newQuantity < 0) {
            throw new InsufficientStockException(variant.getVariantName(), previousQuantity, -delta);
        }

        item.setQuantity(newQuantity);
        InventoryItem saved = inventoryItemRepository.save(item);
        log.info("Stock for {} at {}: {} -> {}", variant.getVariantName(), location.getName(), previousQuantity, newQuantity);
        return saved;
    }

    @Transactional(readOnly = true)
    public int availableQuantity(UUID variantId, UUID locationId) {
        return inventoryItemRepository.findByVariantIdAndLocationId(variantId, locationId)
                .map(InventoryItem::getQuantity)
                .orElse(0);
    }
}
