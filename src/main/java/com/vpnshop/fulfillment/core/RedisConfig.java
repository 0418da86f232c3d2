package com.vpnshop.fulfillment.core;

import com.vpnshop.fulfillment.domain.ProcessedWebhook;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis template for the processed-webhook fast path.
 */
@Configuration
public class RedisConfig {

    @Bean
    public RedisTemplate<String, ProcessedWebhook> processedWebhookRedisTemplate(
            RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, ProcessedWebhook> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(new ProcessedWebhookRedisSerializer());
        template.afterPropertiesSet();
        return template;
    }
}
