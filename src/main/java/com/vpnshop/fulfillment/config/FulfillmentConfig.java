package com.vpnshop.fulfillment.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Shared infrastructure beans: the clock every state change is stamped with and the
 * HTTP client used for host panels and the bot API.
 */
@Configuration
@EnableConfigurationProperties(FulfillmentProperties.class)
public class FulfillmentConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, FulfillmentProperties properties) {
        FulfillmentProperties.Provisioning provisioning = properties.getProvisioning();
        return builder
                .setConnectTimeout(provisioning.getConnectTimeout())
                .setReadTimeout(provisioning.getReadTimeout())
                .build();
    }
}
