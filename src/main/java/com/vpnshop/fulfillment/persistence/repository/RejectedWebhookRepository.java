package com.vpnshop.fulfillment.persistence.repository;

import com.vpnshop.fulfillment.domain.PaymentProviderType;
import com.vpnshop.fulfillment.persistence.entity.RejectedWebhookEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RejectedWebhookRepository extends JpaRepository<RejectedWebhookEntity, String> {

    long countByProvider(PaymentProviderType provider);
}
