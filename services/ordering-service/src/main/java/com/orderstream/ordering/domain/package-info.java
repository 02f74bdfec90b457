/**
 * Domain layer: the change bus, persistence ports, mutation services and the order status
 * aggregator.
 *
 * <p>Domain code depends only on {@code orderstream-sync-model} and {@code orderstream-observability};
 * web, WebSocket and storage adapters live under {@code infrastructure} and depend on the domain,
 * never the reverse.
 */
package com.orderstream.ordering.domain;
