package com.retailerp.erp_backend.model;

import com.retailerp.erp_backend.enums.SaleType;
import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * Per-company, per-type counter behind sale numbers. Rows are locked while incremented so numbers are
 * never handed out twice and never reused.
 */
@Entity
@Table(name = "sale_number_sequences",
        uniqueConstraints = @UniqueConstraint(columnNames = {"company_id", "sale_type"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SaleNumberSequence {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "company_id", nullable = false)
    private Company company;

    @Enumerated(EnumType.STRING)
    @Column(name = "sale_type", nullable = false)
    private SaleType saleType;

    @Column(nullable = false)
    @Builder.Default
    private long nextValue = 1L;
}
