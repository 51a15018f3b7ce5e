package com.partsmarket.common.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Enables {@code @Retryable} on the order and payment workflows.
 *
 * <p>The retry advice is ordered ahead of the transaction advice, so every attempt
 * runs in a fresh transaction and sees the rows committed by the competing writer.</p>
 */
@Configuration
@EnableRetry
public class RetryConfig {
}
