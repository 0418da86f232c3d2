package com.vpnshop.fulfillment.persistence.repository;

import com.vpnshop.fulfillment.domain.ReviewReason;
import com.vpnshop.fulfillment.persistence.entity.ManualReviewEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ManualReviewRepository extends JpaRepository<ManualReviewEntity, String> {

    Optional<ManualReviewEntity> findByDedupKey(String dedupKey);

    Page<ManualReviewEntity> findByStatusOrderByCreatedAtAsc(ManualReviewEntity.ReviewStatus status, Pageable pageable);

    List<ManualReviewEntity> findByOrderId(String orderId);

    List<ManualReviewEntity> findByReason(ReviewReason reason);
}
