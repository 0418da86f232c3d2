package com.vpnshop.fulfillment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the VPN order fulfillment service. Enables:
 * <ul>
 *   <li>Signed payment webhooks from YooKassa, CryptoBot, Heleket and TonAPI</li>
 *   <li>Order state machine and provisioning on 3x-ui and Remnawave hosts</li>
 *   <li>Referral ledger, buyer notifications and the manual review queue</li>
 *   <li>Background sweeps and REST/OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
public class FulfillmentApplication {

    public static void main(String[] args) {
        SpringApplication.run(FulfillmentApplication.class, args);
    }
}
