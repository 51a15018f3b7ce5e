package com.partsmarket.common.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * Fills {@code @CreatedDate} / {@code @LastModifiedDate} on parts, orders and payments.
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
