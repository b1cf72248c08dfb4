package com.retailerp.erp_backend.config;

import com.retailerp.erp_backend.enums.CustomerType;
import com.retailerp.erp_backend.enums.ExpenseType;
import com.retailerp.erp_backend.enums.Role;
import com.retailerp.erp_backend.model.*;
import com.retailerp.erp_backend.repository.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class DataInitializer {

    private final AppProperties appProperties;
    private final DemoDataConfig demoDataConfig;
    private final CompanyRepository companyRepository;
    private final CompanyUserRepository companyUserRepository;
    private final CustomerTierRepository customerTierRepository;
    private final CustomerRepository customerRepository;
    private final StorageLocationRepository storageLocationRepository;
    private final ProductRepository productRepository;
    private final ProductVariantRepository productVariantRepository;
    private final ExpenseCategoryRepository expenseCategoryRepository;
    private final TransactionTemplate transactionTemplate;

    @Bean
    CommandLineRunner initDatabase() {
        return args -> {
            if (!appProperties.isSeedDemoData()) {
                log.debug("Demo data seeding disabled");
                return;
            }
            transactionTemplate.executeWithoutResult(status -> seedDemoCompany());
        };
    }

    private void seedDemoCompany() {
        String companyName = demoDataConfig.getCompanyName();
        if (companyRepository.findByName(companyName).isPresent()) {
            log.info("Demo company '{}' already exists, skipping seed", companyName);
            return;
        }

        log.info("Seeding demo company '{}'", companyName);
        Company company = companyRepository.save(Company.builder()
                .name(companyName)
                .currency(appProperties.getDefaultCurrency())
                .build());

        CustomerTier standardTier = customerTierRepository.save(CustomerTier.builder()
                .company(company)
                .name("Standard")
                .description("Default pricing")
                .discountPercentage(BigDecimal.ZERO)
                .defaultTier(true)
                .build());

        customerTierRepository.save(CustomerTier.builder()
                .company(company)
                .name("Wholesale")
                .description("Bulk buyers")
                .discountPercentage(new BigDecimal("10.00"))
                .build());

        customerRepository.save(Customer.builder()
                .company(company)
                .customerType(CustomerType.WALK_IN)
                .name("Walk-in Customer")
                .tier(standardTier)
                .systemDefault(true)
                .build());

        storageLocationRepository.save(StorageLocation.builder()
                .company(company)
                .name(demoDataConfig.getLocationName())
                .locationType("shop")
                .build());

        Product product = productRepository.save(Product.builder()
                .company(company)
                .name(demoDataConfig.getProductName())
                .build());

        productVariantRepository.save(ProductVariant.builder()
                .company(company)
                .product(product)
                .variantName(demoDataConfig.getVariantName())
                .sku("SAMPLE-500G")
                .buyingPrice(new BigDecimal("80.00"))
                .sellingPrice(new BigDecimal("120.00"))
                .minStockLevel(5)
                .build());

        expenseCategoryRepository.save(ExpenseCategory.builder()
                .company(company)
                .name("Rent")
                .expenseType(ExpenseType.STANDARD)
                .build());

        expenseCategoryRepository.save(ExpenseCategory.builder()
                .company(company)
                .name("Delivery")
                .expenseType(ExpenseType.SALES)
                .build());

        if (demoDataConfig.getAdminUserId() != null) {
            companyUserRepository.save(CompanyUser.builder()
                    .company(company)
                    .userId(demoDataConfig.getAdminUserId())
                    .role(Role.ADMIN)
                    .build());
            log.info("Granted admin membership in '{}' to user {}", companyName, demoDataConfig.getAdminUserId());
        }

        log.info("Demo company '{}' seeded with id {}", companyName, company.getId());
    }
}
