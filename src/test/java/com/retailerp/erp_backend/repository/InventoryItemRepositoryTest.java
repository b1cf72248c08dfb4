package com.retailerp.erp_backend.repository;

import com.retailerp.erp_backend.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class InventoryItemRepositoryTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private InventoryItemRepository inventoryItemRepository;

    private Company company;
    private ProductVariant sugar;
    private ProductVariant salt;
    private StorageLocation shop;

    @BeforeEach
    void setUp() {
        company = entityManager.persist(Company.builder().name("Duka Moja").build());
        Product product = entityManager.persist(Product.builder().company(company).name("Groceries").build());
        sugar = entityManager.persist(ProductVariant.builder()
                .company(company).product(product).variantName("Sugar 1kg").minStockLevel(5).build());
        salt = entityManager.persist(ProductVariant.builder()
                .company(company).product(product).variantName("Salt 500g").minStockLevel(5).build());
        shop = entityManager.persist(StorageLocation.builder().company(company).name("Main Shop").build());

        entityManager.persist(InventoryItem.builder().company(company).variant(sugar).location(shop).quantity(3).build());
        entityManager.persist(InventoryItem.builder().company(company).variant(salt).location(shop).quantity(40).build());
        entityManager.flush();
    }

    @Test
    void findForUpdate_ShouldReturnRowForVariantAndLocation() {
        Optional<InventoryItem> result = inventoryItemRepository.findForUpdate(sugar.getId(), shop.getId());

        assertTrue(result.isPresent());
        assertEquals(3, result.get().getQuantity());
    }

    @Test
    void findItemsByCriteria_ShouldListAllItemsWhenUnfiltered() {
        List<InventoryItem> items = inventoryItemRepository.findItemsByCriteria(company.getId(), null, null, false);

        assertEquals(2, items.size());
        assertEquals("Salt 500g", items.get(0).getVariant().getVariantName());
    }

    @Test
    void findItemsByCriteria_ShouldKeepOnlyItemsAtOrBelowMinimum() {
        List<InventoryItem> items = inventoryItemRepository.findItemsByCriteria(company.getId(), null, shop.getId(), true);

        assertEquals(1, items.size());
        assertEquals(sugar.getId(), items.get(0).getVariant().getId());
    }

    @Test
    void findItemsByCriteria_ShouldNotLeakOtherCompaniesStock() {
        Company other = entityManager.persist(Company.builder().name("Other Shop").build());

        List<InventoryItem> items = inventoryItemRepository.findItemsByCriteria(other.getId(), null, null, false);

        assertTrue(items.isEmpty());
    }
}
