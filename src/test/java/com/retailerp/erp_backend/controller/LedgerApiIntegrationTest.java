package com.retailerp.erp_backend.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.retailerp.erp_backend.enums.CustomerType;
import com.retailerp.erp_backend.enums.Role;
import com.retailerp.erp_backend.exception.AlreadyReversedException;
import com.retailerp.erp_backend.model.*;
import com.retailerp.erp_backend.repository.*;
import com.retailerp.erp_backend.security.TenantContext;
import com.retailerp.erp_backend.service.InventoryTransactionService;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class LedgerApiIntegrationTest {

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private ObjectMapper objectMapper;
    @Autowired
    private CompanyRepository companyRepository;
    @Autowired
    private CompanyUserRepository companyUserRepository;
    @Autowired
    private CustomerRepository customerRepository;
    @Autowired
    private StorageLocationRepository storageLocationRepository;
    @Autowired
    private ProductRepository productRepository;
    @Autowired
    private ProductVariantRepository productVariantRepository;
    @Autowired
    private InventoryItemRepository inventoryItemRepository;
    @Autowired
    private InventoryTransactionService inventoryTransactionService;

    @Value("${jwt.secret}")
    private String jwtSecret;

    private Company company;
    private UUID adminUserId;
    private UUID attendantUserId;
    private Customer walkIn;
    private Customer business;
    private StorageLocation shop;
    private ProductVariant maize;

    @BeforeEach
    void setUp() {
        company = companyRepository.save(Company.builder().name("Duka " + UUID.randomUUID()).build());
        adminUserId = UUID.randomUUID();
        attendantUserId = UUID.randomUUID();
        companyUserRepository.save(CompanyUser.builder().company(company).userId(adminUserId).role(Role.ADMIN).build());
        companyUserRepository.save(CompanyUser.builder().company(company).userId(attendantUserId).role(Role.SHOP_ATTENDANT).build());

        walkIn = customerRepository.save(Customer.builder()
                .company(company).customerType(CustomerType.WALK_IN).name("Walk-in Customer").systemDefault(true).build());
        business = customerRepository.save(Customer.builder()
                .company(company).customerType(CustomerType.BUSINESS).name("Kamau Hardware")
                .creditLimit(new BigDecimal("5000.00")).build());

        shop = storageLocationRepository.save(StorageLocation.builder().company(company).name("Main Shop").build());
        Product product = productRepository.save(Product.builder().company(company).name("Maize Flour").build());
        maize = productVariantRepository.save(ProductVariant.builder()
                .company(company).product(product).variantName("Maize Flour 2kg").sku("MF-2KG")
                .sellingPrice(new BigDecimal("100.00")).build());
    }

    private String tokenFor(UUID userId) {
        return Jwts.builder()
                .setSubject(userId.toString())
                .setIssuedAt(new Date())
                .setExpiration(new Date(System.currentTimeMillis() + 3_600_000))
                .signWith(Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8)), SignatureAlgorithm.HS256)
                .compact();
    }

    private MockHttpServletRequestBuilder as(UUID userId, MockHttpServletRequestBuilder request) {
        return request
                .header("Authorization", "Bearer " + tokenFor(userId))
                .header("X-Company-ID", company.getId().toString());
    }

    private MockHttpServletRequestBuilder json(MockHttpServletRequestBuilder request, Object body) throws Exception {
        return request.contentType(MediaType.APPLICATION_JSON).content(objectMapper.writeValueAsString(body));
    }

    private JsonNode data(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("data");
    }

    private JsonNode receive(int quantity) throws Exception {
        MvcResult result = mockMvc.perform(json(as(attendantUserId, post("/api/inventory-transactions")), Map.of(
                        "transactionType", "stock_in",
                        "productVariantId", maize.getId(),
                        "quantity", quantity,
                        "toLocationId", shop.getId())))
                .andExpect(status().isCreated())
                .andReturn();
        return data(result);
    }

    private Map<String, Object> saleBody(Customer customer, int quantity) {
        return Map.of(
                "customerId", customer.getId(),
                "locationId", shop.getId(),
                "items", List.of(Map.of(
                        "productVariantId", maize.getId(),
                        "quantity", quantity,
                        "unitPrice", "100.00")));
    }

    private int onHand() {
        return inventoryItemRepository.findByVariantIdAndLocationId(maize.getId(), shop.getId())
                .map(InventoryItem::getQuantity)
                .orElse(0);
    }

    @Test
    void sellingMoreThanOnHand_ShouldFailWithInsufficientStock() throws Exception {
        receive(10);

        mockMvc.perform(json(as(attendantUserId, post("/api/sales")), saleBody(walkIn, 10)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.saleNumber").value("INV-000001"))
                .andExpect(jsonPath("$.data.saleType").value("invoice"))
                .andExpect(jsonPath("$.data.totalAmount").value(1000.0));
        assertEquals(0, onHand());

        mockMvc.perform(json(as(attendantUserId, post("/api/sales")), saleBody(walkIn, 1)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INSUFFICIENT_STOCK"))
                .andExpect(jsonPath("$.message").value("Insufficient stock for Maize Flour 2kg. Available: 0, Requested: 1"));
        assertEquals(0, onHand());
    }

    @Test
    void paymentsBeyondAmountDue_ShouldBeRejectedWithoutChangingTheSale() throws Exception {
        receive(20);
        JsonNode sale = data(mockMvc.perform(json(as(attendantUserId, post("/api/sales")), saleBody(business, 10)))
                .andExpect(status().isCreated())
                .andReturn());
        String saleId = sale.get("id").asText();

        mockMvc.perform(json(as(attendantUserId, post("/api/sales/payments")), Map.of(
                        "saleId", saleId, "amount", "400.00", "paymentMethod", "cash")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.updated.paymentStatus").value("partial"))
                .andExpect(jsonPath("$.data.updated.amountDue").value(600.0));

        mockMvc.perform(json(as(attendantUserId, post("/api/sales/payments")), Map.of(
                        "saleId", saleId, "amount", "600.00", "paymentMethod", "mpesa", "referenceNumber", "QK7XYZ")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.updated.paymentStatus").value("paid"));

        mockMvc.perform(json(as(attendantUserId, post("/api/sales/payments")), Map.of(
                        "saleId", saleId, "amount", "1.00", "paymentMethod", "cash")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("EXCEEDS_AMOUNT_DUE"));

        mockMvc.perform(as(attendantUserId, get("/api/sales/" + saleId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.amountPaid").value(1000.0))
                .andExpect(jsonPath("$.data.amountDue").value(0.0))
                .andExpect(jsonPath("$.data.payments.length()").value(2));

        mockMvc.perform(as(attendantUserId, get("/api/customers/" + business.getId() + "/balance")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.currentBalance").value(0.0));
    }

    @Test
    void reversingTwice_ShouldFailWithAlreadyReversed() throws Exception {
        String transactionId = receive(5).get("id").asText();

        mockMvc.perform(as(adminUserId, post("/api/inventory-transactions/" + transactionId + "/reverse")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.transactionType").value("stock_out"))
                .andExpect(jsonPath("$.data.referenceType").value("reversal"));
        assertEquals(0, onHand());

        mockMvc.perform(as(adminUserId, post("/api/inventory-transactions/" + transactionId + "/reverse")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("ALREADY_REVERSED"));
        assertEquals(0, onHand());
    }

    @Test
    void reversal_ShouldBeAdminOnly() throws Exception {
        String transactionId = receive(5).get("id").asText();

        mockMvc.perform(as(attendantUserId, post("/api/inventory-transactions/" + transactionId + "/reverse")))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value("ACCESS_DENIED"));
        assertEquals(5, onHand());
    }

    @Test
    void userWithoutMembership_ShouldBeUnauthorized() throws Exception {
        mockMvc.perform(as(UUID.randomUUID(), get("/api/sales")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.errorCode").value("UNAUTHORIZED"))
                .andExpect(jsonPath("$.message").value("No company found for user"));
    }

    @Test
    void requestWithoutToken_ShouldBeUnauthorized() throws Exception {
        mockMvc.perform(get("/api/inventory-items"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void creditNote_ShouldRestockAndCreditTheCustomer() throws Exception {
        receive(10);
        JsonNode sale = data(mockMvc.perform(json(as(attendantUserId, post("/api/sales")), saleBody(business, 4)))
                .andExpect(status().isCreated())
                .andReturn());
        String saleItemId = sale.get("items").get(0).get("id").asText();

        mockMvc.perform(json(as(adminUserId, post("/api/sales/credit-notes")), Map.of(
                        "originalSaleId", sale.get("id").asText(),
                        "items", List.of(Map.of("saleItemId", saleItemId, "returnQuantity", 3)))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.saleNumber").value("CN-000001"))
                .andExpect(jsonPath("$.data.saleType").value("credit_note"))
                .andExpect(jsonPath("$.data.totalAmount").value(-300.0))
                .andExpect(jsonPath("$.data.items[0].quantity").value(-3));
        assertEquals(9, onHand());

        mockMvc.perform(json(as(adminUserId, post("/api/sales/credit-notes")), Map.of(
                        "originalSaleId", sale.get("id").asText(),
                        "items", List.of(Map.of("saleItemId", saleItemId, "returnQuantity", 2)))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_QUANTITY"));

        mockMvc.perform(as(adminUserId, get("/api/customers/" + business.getId() + "/balance")))
                .andExpect(jsonPath("$.data.currentBalance").value(100.0));
    }

    @Test
    void saleOverdrawingStockAcrossLines_ShouldRollBackEveryWrite() throws Exception {
        receive(10);
        Map<String, Object> line = Map.of("productVariantId", maize.getId(), "quantity", 6, "unitPrice", "100.00");

        mockMvc.perform(json(as(attendantUserId, post("/api/sales")), Map.of(
                        "customerId", business.getId(),
                        "locationId", shop.getId(),
                        "items", List.of(line, line))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INSUFFICIENT_STOCK"));

        assertEquals(10, onHand());
        mockMvc.perform(as(attendantUserId, get("/api/sales")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(0));
        mockMvc.perform(as(attendantUserId, get("/api/inventory-transactions").param("productVariantId", maize.getId().toString())))
                .andExpect(jsonPath("$.data.length()").value(1))
                .andExpect(jsonPath("$.data[0].transactionType").value("stock_in"));
        mockMvc.perform(as(attendantUserId, get("/api/customers/" + business.getId() + "/balance")))
                .andExpect(jsonPath("$.data.currentBalance").value(0.0));

        // the rolled-back sale did not consume a sale number
        mockMvc.perform(json(as(attendantUserId, post("/api/sales")), saleBody(business, 10)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.saleNumber").value("INV-000001"));
        assertEquals(0, onHand());
    }

    @Test
    void concurrentReversals_ShouldApplyTheInverseMovementOnce() throws Exception {
        receive(100);
        UUID transactionId = UUID.fromString(receive(5).get("id").asText());
        TenantContext admin = TenantContext.builder()
                .userId(adminUserId)
                .companyId(company.getId())
                .companyName(company.getName())
                .role(Role.ADMIN)
                .currency("KES")
                .build();

        int threads = 6;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<Future<Boolean>> outcomes = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                outcomes.add(executor.submit(() -> {
                    start.await();
                    try {
                        inventoryTransactionService.reverseTransaction(transactionId, admin);
                        return true;
                    } catch (AlreadyReversedException e) {
                        return false;
                    }
                }));
            }
            start.countDown();

            int reversed = 0;
            int rejected = 0;
            for (Future<Boolean> outcome : outcomes) {
                try {
                    if (outcome.get(30, TimeUnit.SECONDS)) {
                        reversed++;
                    } else {
                        rejected++;
                    }
                } catch (ExecutionException e) {
                    fail("Unexpected failure while reversing: " + e.getCause());
                }
            }

            assertEquals(1, reversed);
            assertEquals(threads - 1, rejected);
        } finally {
            executor.shutdownNow();
        }
        assertEquals(100, onHand());
    }

    @Test
    void saleAndPaymentDates_ShouldReadBackUnchanged() throws Exception {
        receive(10);
        JsonNode sale = data(mockMvc.perform(json(as(attendantUserId, post("/api/sales")), Map.of(
                        "customerId", business.getId(),
                        "locationId", shop.getId(),
                        "saleDate", "2026-03-10",
                        "items", List.of(Map.of("productVariantId", maize.getId(), "quantity", 5, "unitPrice", "100.00")))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.saleDate").value("2026-03-10"))
                .andReturn());
        String saleId = sale.get("id").asText();

        // each payment saves the sale row again
        for (String amount : List.of("100.00", "150.00")) {
            mockMvc.perform(json(as(attendantUserId, post("/api/sales/payments")), Map.of(
                            "saleId", saleId, "amount", amount, "paymentMethod", "cash", "paymentDate", "2026-03-11")))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.data.payment.saleId").value(saleId))
                    .andExpect(jsonPath("$.data.payment.paymentDate").value("2026-03-11"));
        }

        mockMvc.perform(as(attendantUserId, get("/api/sales/" + saleId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.saleDate").value("2026-03-10"))
                .andExpect(jsonPath("$.data.payments.length()").value(2))
                .andExpect(jsonPath("$.data.payments[0].paymentDate").value("2026-03-11"))
                .andExpect(jsonPath("$.data.payments[1].paymentDate").value("2026-03-11"))
                .andExpect(jsonPath("$.data.payments[0].saleId").value(saleId))
                .andExpect(jsonPath("$.data.payments[0].expenseId").doesNotExist());
    }

    @Test
    void paymentWithSubCentAmount_ShouldFailValidation() throws Exception {
        receive(10);
        String saleId = data(mockMvc.perform(json(as(attendantUserId, post("/api/sales")), saleBody(business, 1)))
                .andExpect(status().isCreated())
                .andReturn()).get("id").asText();

        mockMvc.perform(json(as(attendantUserId, post("/api/sales/payments")), Map.of(
                        "saleId", saleId, "amount", "0.001", "paymentMethod", "cash")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));

        mockMvc.perform(as(attendantUserId, get("/api/sales/" + saleId)))
                .andExpect(jsonPath("$.data.payments.length()").value(0))
                .andExpect(jsonPath("$.data.amountDue").value(100.0));
    }
}
