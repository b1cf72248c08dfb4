package com.retailerp.erp_backend.repository;

import com.retailerp.erp_backend.model.CompanyUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CompanyUserRepository extends JpaRepository<CompanyUser, UUID> {

    @Query("""
        SELECT cu FROM CompanyUser cu JOIN FETCH cu.company c
        WHERE cu.userId = :userId AND c.id = :companyId AND cu.active = true AND c.active = true
    """)
    Optional<CompanyUser> findActiveMembership(@Param("userId") UUID userId, @Param("companyId") UUID companyId);

    @Query("""
        SELECT cu FROM CompanyUser cu JOIN FETCH cu.company c
        WHERE cu.userId = :userId AND cu.active = true AND c.active = true
        ORDER BY cu.createdAt ASC
    """)
    List<CompanyUser> findActiveMemberships(@Param("userId") UUID userId);
}
