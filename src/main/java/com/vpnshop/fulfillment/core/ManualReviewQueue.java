package com.vpnshop.fulfillment.core;

import com.vpnshop.fulfillment.compliance.AuditLogger;
import com.vpnshop.fulfillment.domain.PaymentProviderType;
import com.vpnshop.fulfillment.domain.ReviewReason;
import com.vpnshop.fulfillment.persistence.entity.ManualReviewEntity;
import com.vpnshop.fulfillment.persistence.repository.ManualReviewRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable operator queue. Items are keyed so the same problem reported twice stays one item.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ManualReviewQueue {

    private final ManualReviewRepository reviewRepository;
    private final AuditLogger auditLogger;
    private final Clock clock;

    /**
     * Opens an item unless one with the same key exists. Joins the caller's transaction so
     * a review is written together with the order change that caused it.
     */
    @Transactional
    public ManualReviewEntity open(ReviewReason reason, String dedupKey, PaymentProviderType provider,
                                   String providerTransactionId, String orderId, String details) {
        Optional<ManualReviewEntity> existing = reviewRepository.findByDedupKey(dedupKey);
        if (existing.isPresent()) {
            log.debug("Review already open for key={}", dedupKey);
            return existing.get();
        }
        ManualReviewEntity item = ManualReviewEntity.builder()
                .reviewId(UUID.randomUUID().toString())
                .reason(reason)
                .dedupKey(dedupKey)
                .provider(provider)
                .providerTransactionId(providerTransactionId)
                .orderId(orderId)
                .details(details != null && details.length() > 2000 ? details.substring(0, 2000) : details)
                .createdAt(clock.instant())
                .build();
        ManualReviewEntity saved = reviewRepository.save(item);
        auditLogger.logReviewOpened(reason, dedupKey, orderId);
        return saved;
    }

    /**
     * Standalone variant for callers outside any transaction; a concurrent insert of the
     * same key is treated as already open.
     */
    public void openDetached(ReviewReason reason, String dedupKey, PaymentProviderType provider,
                             String providerTransactionId, String orderId, String details) {
        try {
            open(reason, dedupKey, provider, providerTransactionId, orderId, details);
        } catch (DataIntegrityViolationException e) {
            log.info("Review for key={} opened concurrently", dedupKey);
        }
    }

    @Transactional(readOnly = true)
    public Page<ManualReviewEntity> listOpen(Pageable pageable) {
        return reviewRepository.findByStatusOrderByCreatedAtAsc(ManualReviewEntity.ReviewStatus.OPEN, pageable);
    }

    @Transactional
    public ManualReviewEntity resolve(String reviewId, String note) {
        ManualReviewEntity item = reviewRepository.findById(reviewId)
                .orElseThrow(() -> new NoSuchElementException("Review not found: " + reviewId));
        if (item.getStatus() == ManualReviewEntity.ReviewStatus.RESOLVED) {
            return item;
        }
        item.setStatus(ManualReviewEntity.ReviewStatus.RESOLVED);
        item.setResolutionNote(note);
        item.setResolvedAt(clock.instant());
        log.info("Review resolved: reviewId={}, reason={}, orderId={}", reviewId, item.getReason(), item.getOrderId());
        return item;
    }
}
