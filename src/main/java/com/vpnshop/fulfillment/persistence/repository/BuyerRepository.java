package com.vpnshop.fulfillment.persistence.repository;

import com.vpnshop.fulfillment.persistence.entity.BuyerEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface BuyerRepository extends JpaRepository<BuyerEntity, String> {

    // Serializes signup-bonus decisions for one referred buyer across concurrent settlements
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM BuyerEntity b WHERE b.buyerId = :buyerId")
    Optional<BuyerEntity> findByIdForUpdate(@Param("buyerId") String buyerId);

    long countByReferrerId(String referrerId);
}
