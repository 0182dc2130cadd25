package com.credcore.backend.auth.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Min;

/**
 * 외부 발송(메일/SMS) 호출 제한
 *
 * app:
 *   delivery:
 *     timeout-millis: 5000
 *     pool-size: 4
 *     queue-capacity: 100
 */
@Validated
@ConfigurationProperties(prefix = "app.delivery")
public record DeliveryProperties(
        @Min(1) long timeoutMillis,
        @Min(1) int poolSize,
        @Min(1) int queueCapacity
) {
    public Duration timeout() {
        return Duration.ofMillis(timeoutMillis);
    }
}
