package com.orderstream.ordering;

import com.orderstream.ordering.config.OrderingServiceProperties;
import com.orderstream.ordering.config.SyncProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Ordering service: catalog, cashier orders, kitchen station queues and the live change stream.
 *
 * <p>Every accepted mutation is written to its repository and then published on the in-process
 * change bus. WebSocket sessions on {@code orderstream.sync.websocket-path} receive those
 * envelopes in publication order; clients bootstrap their caches from the REST collections under
 * {@code /api/v1}.
 */
@SpringBootApplication
@EnableConfigurationProperties({OrderingServiceProperties.class, SyncProperties.class})
public class OrderingServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(OrderingServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(OrderingServiceApplication.class, args);
        log.info("Ordering service started");
    }
}
