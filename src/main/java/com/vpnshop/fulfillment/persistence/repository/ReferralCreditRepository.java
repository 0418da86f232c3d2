package com.vpnshop.fulfillment.persistence.repository;

import com.vpnshop.fulfillment.domain.ReferralCreditKind;
import com.vpnshop.fulfillment.persistence.entity.ReferralCreditEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

@Repository
public interface ReferralCreditRepository extends JpaRepository<ReferralCreditEntity, String> {

    boolean existsBySourceOrderIdAndKind(String sourceOrderId, ReferralCreditKind kind);

    boolean existsBySignupBuyerId(String signupBuyerId);

    List<ReferralCreditEntity> findBySourceOrderId(String sourceOrderId);

    Page<ReferralCreditEntity> findByReferrerIdOrderByCreatedAtDesc(String referrerId, Pageable pageable);

    @Query("SELECT COALESCE(SUM(c.amount), 0) FROM ReferralCreditEntity c WHERE c.referrerId = :referrerId")
    BigDecimal sumByReferrerId(@Param("referrerId") String referrerId);

    long countByReferrerId(String referrerId);
}
