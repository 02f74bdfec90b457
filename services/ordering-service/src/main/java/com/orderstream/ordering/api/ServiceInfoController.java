package com.orderstream.ordering.api;

import com.orderstream.ordering.config.OrderingServiceProperties;
import com.orderstream.ordering.config.SyncProperties;
import com.orderstream.ordering.domain.bus.ChangeEventBus;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Runtime info: identity, where the change stream lives and how many subscribers it has. */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final OrderingServiceProperties properties;
    private final SyncProperties syncProperties;
    private final ChangeEventBus bus;

    public ServiceInfoController(OrderingServiceProperties properties, SyncProperties syncProperties, ChangeEventBus bus) {
        this.properties = properties;
        this.syncProperties = syncProperties;
        this.bus = bus;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        return Map.of(
                "name", properties.name(),
                "environment", properties.environment(),
                "description", properties.description() != null ? properties.description() : "",
                "status", "running",
                "websocket_path", syncProperties.websocketPath(),
                "subscribers", bus.subscriberCount(),
                "timestamp", Instant.now().toString());
    }
}
