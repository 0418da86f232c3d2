package com.vpnshop.fulfillment.persistence.repository;

import com.vpnshop.fulfillment.persistence.entity.HostHealthEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface HostHealthRepository extends JpaRepository<HostHealthEntity, String> {
}
