package com.orderstream.ordering.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code orderstream.service.*}:
 *
 * <pre>
 * orderstream:
 *   service:
 *     name: ordering-service
 *     environment: production
 *     description: Event food ordering
 * </pre>
 *
 * @param name service name used for logging and as the {@code service} metric tag. Required.
 * @param environment deployment environment, {@code development} when unset.
 * @param description free text shown on {@code /api/v1/info}.
 */
@ConfigurationProperties(prefix = "orderstream.service")
@Validated
public record OrderingServiceProperties(@NotBlank String name, String environment, String description) {

    public OrderingServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
