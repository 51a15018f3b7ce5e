package com.partsmarket.common.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Slf4j
@Configuration
public class IdempotencyCacheConfig {

    @Bean
    @ConditionalOnProperty(name = "partsmarket.cache.enabled", havingValue = "true", matchIfMissing = true)
    public IdempotencyCache redisIdempotencyCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        return new RedisIdempotencyCache(redisTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "partsmarket.cache.enabled", havingValue = "false")
    public IdempotencyCache noOpIdempotencyCache() {
        log.info("Idempotency cache disabled, every lookup goes to the database");
        return new NoOpIdempotencyCache();
    }
}
