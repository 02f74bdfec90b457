package com.orderstream.ordering;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.orderstream.ordering.config.OrderingServiceProperties;
import com.orderstream.ordering.config.SyncProperties;
import com.orderstream.ordering.domain.bus.ChangeEventBus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Ordering Service Application")
class OrderingServiceApplicationTest {

    @Autowired private ApplicationContext context;
    @Autowired private MockMvc mockMvc;

    @Test
    @DisplayName("Spring context loads with a single change bus")
    void contextLoads() {
        assertThat(context.getBeansOfType(ChangeEventBus.class)).hasSize(1);
    }

    @Test
    @DisplayName("properties are loaded from the test profile")
    void propertiesAreLoaded() {
        var props = context.getBean(OrderingServiceProperties.class);
        assertThat(props.name()).isEqualTo("ordering-service-test");
        assertThat(props.environment()).isEqualTo("test");
        assertThat(context.getBean(SyncProperties.class).websocketPath()).isEqualTo("/ws");
    }

    @Test
    @DisplayName("info endpoint reports the service and its change stream")
    void serviceInfo() throws Exception {
        mockMvc.perform(get("/api/v1/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("ordering-service-test"))
                .andExpect(jsonPath("$.status").value("running"))
                .andExpect(jsonPath("$.websocket_path").value("/ws"));
    }

    @Test
    @DisplayName("actuator health and sync metrics are available")
    void actuatorEndpoints() throws Exception {
        mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
        mockMvc.perform(get("/actuator/metrics/sync.subscribers.active"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("sync.subscribers.active"));
    }

    @Test
    @DisplayName("correlation id header is set on responses")
    void correlationIdHeader() throws Exception {
        mockMvc.perform(get("/api/v1/info").header("X-Correlation-ID", "abc-123"))
                .andExpect(header().string("X-Correlation-ID", "abc-123"));
    }
}
