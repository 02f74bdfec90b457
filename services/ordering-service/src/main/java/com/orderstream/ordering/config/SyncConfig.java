package com.orderstream.ordering.config;

import com.orderstream.observability.MetricFactory;
import com.orderstream.ordering.domain.bus.ChangeEventBus;
import com.orderstream.ordering.domain.bus.InProcessChangeEventBus;
import com.orderstream.ordering.infrastructure.websocket.TransportBridge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

/** Metrics, the change bus and the transport bridge. */
@Configuration
public class SyncConfig {

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, OrderingServiceProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    public ChangeEventBus changeEventBus(MetricFactory metricFactory) {
        return new InProcessChangeEventBus(metricFactory);
    }

    /** One daemon thread per open connection forwards its subscription. */
    @Bean
    public TransportBridge transportBridge(ChangeEventBus changeEventBus, MetricFactory metricFactory) {
        var executor = new SimpleAsyncTaskExecutor("sync-bridge-");
        executor.setDaemon(true);
        return new TransportBridge(changeEventBus, executor, metricFactory);
    }
}
